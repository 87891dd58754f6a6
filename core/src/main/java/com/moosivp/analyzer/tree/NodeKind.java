package com.moosivp.analyzer.tree;

public enum NodeKind {
    ASSIGNMENT,
    DEFINE,
    PROCESS_CONFIG,
    BEHAVIOR,
    INITIALIZE,
    MODE_DECLARATION,
    INCLUDE
}
