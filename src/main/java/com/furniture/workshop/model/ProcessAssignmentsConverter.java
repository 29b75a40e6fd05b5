package com.furniture.workshop.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.util.ArrayList;
import java.util.List;

/** Stores per-step assignments of a work order item as a JSON column. */
@Converter
public class ProcessAssignmentsConverter implements AttributeConverter<List<ProcessAssignment>, String> {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<List<ProcessAssignment>> TYPE = new TypeReference<>() {
    };

    @Override
    public String convertToDatabaseColumn(List<ProcessAssignment> attribute) {
        try {
            return MAPPER.writeValueAsString(attribute != null ? attribute : List.of());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize process assignments", e);
        }
    }

    @Override
    public List<ProcessAssignment> convertToEntityAttribute(String dbData) {
        if (dbData == null || dbData.isBlank())
            return new ArrayList<>();
        try {
            return MAPPER.readValue(dbData, TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot read process assignments", e);
        }
    }
}
