package com.moosivp.analyzer.model;

import java.util.Locale;

public enum FileType {
    MISSION,
    BEHAVIOR,
    TEMPLATE;

    public static FileType fromPath(String path) {
        if (path == null) {
            return TEMPLATE;
        }
        String lower = path.toLowerCase(Locale.ROOT);
        if (lower.endsWith(".moos")) {
            return MISSION;
        }
        if (lower.endsWith(".bhv")) {
            return BEHAVIOR;
        }
        return TEMPLATE;
    }

    public boolean allowsMissionConstructs() {
        return this != BEHAVIOR;
    }

    public boolean allowsBehaviorConstructs() {
        return this != MISSION;
    }
}
