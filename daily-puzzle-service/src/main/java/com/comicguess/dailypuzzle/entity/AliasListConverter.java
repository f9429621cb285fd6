package com.comicguess.dailypuzzle.entity;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.util.ArrayList;
import java.util.List;

/**
 * Stores a character's alias list as a JSON array in a text column
 */
@Converter
public class AliasListConverter implements AttributeConverter<List<String>, String> {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    @Override
    public String convertToDatabaseColumn(List<String> aliases) {
        return toJson(aliases);
    }

    @Override
    public List<String> convertToEntityAttribute(String json) {
        if (json == null || json.isBlank()) {
            return new ArrayList<>();
        }
        try {
            return OBJECT_MAPPER.readValue(json, new TypeReference<>() {});
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to read alias list", e);
        }
    }

    /**
     * Serialize aliases the same way the converter does, for native inserts
     */
    public static String toJson(List<String> aliases) {
        try {
            return OBJECT_MAPPER.writeValueAsString(aliases == null ? List.of() : aliases);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize alias list", e);
        }
    }
}
