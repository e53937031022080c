package com.pyast.jackson;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Factory for creating properly configured ObjectMapper instances for tree dumps.
 *
 * Usage:
 * <pre>
 * ObjectMapper mapper = PyastJackson.createObjectMapper();
 * String json = mapper.writeValueAsString(program);
 * </pre>
 */
public final class PyastJackson {

    private PyastJackson() {
        // Utility class
    }

    /**
     * Creates a new ObjectMapper configured for tree serialization.
     *
     * The returned mapper:
     * - Writes each node with a leading "type" and a "loc" object
     * - Leaves out absent optional children
     * - Writes number literals with {@link PythonNumberSerializer}
     *
     * @return A new configured ObjectMapper instance
     */
    public static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();

        // Optional children that are absent are left out
        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);

        mapper.registerModule(new AstModule());

        return mapper;
    }
}
