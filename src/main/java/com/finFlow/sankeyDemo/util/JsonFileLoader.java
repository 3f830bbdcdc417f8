package com.finFlow.sankeyDemo.util;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * Utility class for loading JSON files from the classpath.
 * Used for static configuration tables that are read once at startup.
 */
public class JsonFileLoader {
    
    private static final ObjectMapper objectMapper = new ObjectMapper();
    
    private JsonFileLoader() {}
    
    /**
     * Loads a JSON file from the classpath as a String.
     * 
     * @param resourcePath The path to the JSON file (e.g., "extraction/fallback-patterns.json")
     * @return The JSON content as a String
     * @throws IOException if the file cannot be read or doesn't exist
     */
    public static String loadAsString(String resourcePath) throws IOException {
        try (InputStream inputStream = JsonFileLoader.class.getClassLoader().getResourceAsStream(resourcePath)) {
            if (inputStream == null) {
                throw new IOException("Resource not found: " + resourcePath);
            }
            return new String(inputStream.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
    
    /**
     * Loads a JSON file from the classpath and deserializes it to a generic type.
     * 
     * @param resourcePath The path to the JSON file
     * @param type Type reference describing the target type
     * @param <T> The type to deserialize to
     * @return An instance of the specified type
     * @throws IOException if the file cannot be read, doesn't exist, or cannot be deserialized
     */
    public static <T> T loadAsObject(String resourcePath, TypeReference<T> type) throws IOException {
        return objectMapper.readValue(loadAsString(resourcePath), type);
    }
}
