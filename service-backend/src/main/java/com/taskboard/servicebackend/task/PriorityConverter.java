package com.taskboard.servicebackend.task;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter
public class PriorityConverter implements AttributeConverter<Priority, String> {

    @Override
    public String convertToDatabaseColumn(Priority priority) {
        return priority == null ? null : priority.code();
    }

    @Override
    public Priority convertToEntityAttribute(String code) {
        if (code == null) {
            return null;
        }
        return Priority.fromCode(code)
                .orElseThrow(() -> new IllegalStateException("Unknown priority in tasks table: " + code));
    }
}
