package com.safety.aralia.api;

import java.util.List;

/**
 * Observability interface for monitoring a conversion.
 *
 * Implementations are handed to the converter through
 * {@link com.safety.aralia.ConverterConfig} and receive callbacks as each phase
 * completes. Warnings are delivered here as they are found and are also
 * accumulated on the resulting fault tree.
 *
 * Callbacks run on the converting thread, in phase order. A listener that
 * throws aborts the conversion.
 */
public interface ConversionListener {

    /**
     * Called after all input lines have been interpreted (pass 1).
     *
     * @param treeName  The declared fault tree name.
     * @param lineCount Number of lines consumed, blank lines included.
     */
    void onDeclarationsRead(String treeName, int lineCount);

    /**
     * Called for every non-fatal finding.
     *
     * @param warning The warning.
     */
    void onWarning(ConversionWarning warning);

    /**
     * Called once the root gates are known.
     *
     * @param topGates Names of the top gates in declaration order.
     */
    void onTopGatesDetected(List<String> topGates);

    /**
     * Called when the tree is verified acyclic and topologically ordered.
     *
     * @param treeName  The fault tree name.
     * @param gateCount Number of gates in the tree.
     */
    void onConversionEnd(String treeName, int gateCount);
}
