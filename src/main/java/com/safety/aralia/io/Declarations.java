package com.safety.aralia.io;

import com.safety.aralia.engine.EventTable;

/**
 * Result of reading an Aralia input: the tree name and the declared, not yet
 * populated, events.
 *
 * @param treeName  The fault tree name.
 * @param events    The event table after the declaration pass.
 * @param lineCount Number of lines read, blank lines included.
 */
public record Declarations(String treeName, EventTable events, int lineCount) {
}
