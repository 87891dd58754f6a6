package com.moosivp.analyzer.dto;

public record InlayHint(int line, int column, String label) {
}
