package com.moosivp.analyzer.tree;

public enum ValueKind {
    INTEGER,
    FLOAT,
    BOOLEAN,
    STRING,
    QUOTED,
    VECTOR
}
