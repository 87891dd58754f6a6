package com.moosivp.analyzer.diagnostic;

public enum Severity {
    ERROR,
    WARNING
}
