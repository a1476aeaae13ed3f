package com.autocoder.features.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.util.ArrayList;
import java.util.List;

/**
 * Maps a feature's step list to a JSON array string and back.
 *
 * JPA instantiates converters itself, so this one keeps its own ObjectMapper
 * rather than taking the Spring bean.
 */
@Converter
public class StepListConverter implements AttributeConverter<List<String>, String> {

    private static final ObjectMapper JSON = new ObjectMapper();
    private static final TypeReference<List<String>> STEP_LIST_TYPE = new TypeReference<>() {};

    @Override
    public String convertToDatabaseColumn(List<String> steps) {
        try {
            return JSON.writeValueAsString(steps == null ? List.of() : steps);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialise feature steps", e);
        }
    }

    @Override
    public List<String> convertToEntityAttribute(String column) {
        if (column == null || column.isBlank()) return new ArrayList<>();
        try {
            return new ArrayList<>(JSON.readValue(column, STEP_LIST_TYPE));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt steps column: " + column, e);
        }
    }
}
