package ru.javaboys.huntymatch.dto;

import java.util.Map;

public record VectorRecord(String id, float[] values, Map<String, Object> metadata) {
}
