package com.safety.aralia.io;

import java.io.IOException;
import java.io.UncheckedIOException;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.safety.aralia.engine.FaultTree;

/**
 * Writes a {@link FaultTreeSnapshot} of a compiled tree as pretty-printed JSON.
 */
public final class JsonSnapshotWriter {
    private final ObjectMapper mapper = new ObjectMapper();

    public String write(FaultTree tree) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(FaultTreeSnapshot.from(tree));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize snapshot of " + tree.name(), e);
        }
    }

    /** Reads a snapshot back, for tools that post-process the export. */
    public FaultTreeSnapshot read(String json) throws IOException {
        return mapper.readValue(json, FaultTreeSnapshot.class);
    }
}
