package com.moosivp.analyzer.dto;

import com.moosivp.analyzer.model.FileType;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.Map;

public record AnalysisRequest(
        @NotNull(message = "Source code cannot be null")
        @Size(max = 1_048_576, message = "Source code cannot exceed 1MB")
        String sourceCode,
        FileType fileType,
        Map<String, String> environment) {

    public AnalysisRequest {
        fileType = fileType == null ? FileType.TEMPLATE : fileType;
        environment = environment == null ? Map.of() : Map.copyOf(environment);
    }

    public static AnalysisRequest of(String sourceCode, FileType fileType) {
        return new AnalysisRequest(sourceCode, fileType, Map.of());
    }

    public static AnalysisRequest forPath(String path, String sourceCode) {
        return new AnalysisRequest(sourceCode, FileType.fromPath(path), Map.of());
    }
}
