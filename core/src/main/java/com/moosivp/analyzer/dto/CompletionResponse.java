package com.moosivp.analyzer.dto;

import java.util.List;

public record CompletionResponse(
        CompletionContext context,
        String prefix,
        List<String> candidates) {

    public CompletionResponse {
        candidates = List.copyOf(candidates);
    }

    public static CompletionResponse none() {
        return new CompletionResponse(CompletionContext.NONE, "", List.of());
    }
}
