package com.archlens.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * Shared Jackson mapper for the JSON files the commands read and write.
 */
final class JsonOutput {

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .enable(SerializationFeature.INDENT_OUTPUT);

    private JsonOutput() {
        // Utility class
    }

    static ObjectMapper mapper() {
        return MAPPER;
    }
}
