package com.menuzy.restaurant.entity;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Keeps the weekday → hours map as one JSON text column, the way the platform
 * stores it ({@code {"monday": "11:00-22:00", ...}}).
 */
@Converter
public class OpeningHoursConverter implements AttributeConverter<Map<String, String>, String> {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<LinkedHashMap<String, String>> MAP_TYPE = new TypeReference<>() {};

    @Override
    public String convertToDatabaseColumn(Map<String, String> openingHours) {
        if (openingHours == null || openingHours.isEmpty()) {
            return null;
        }
        try {
            return MAPPER.writeValueAsString(openingHours);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Opening hours cannot be written as JSON", e);
        }
    }

    @Override
    public Map<String, String> convertToEntityAttribute(String json) {
        if (json == null || json.isBlank()) {
            return new LinkedHashMap<>();
        }
        try {
            return MAPPER.readValue(json, MAP_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored opening hours are not valid JSON: " + json, e);
        }
    }
}
