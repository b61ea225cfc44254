package org.gamevibe.cli.commands;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.gamevibe.compiler.api.CompilationException;

/**
 * Serializes command reports as pretty-printed JSON.
 */
final class JsonOutput {

    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private JsonOutput() {}

    static String write(Object report) throws CompilationException {
        try {
            return MAPPER.writeValueAsString(report);
        } catch (JsonProcessingException e) {
            throw new CompilationException("Failed to serialize report: " + e.getMessage(), e);
        }
    }
}
