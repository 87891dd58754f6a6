package com.moosivp.analyzer.preprocess;

import java.util.Arrays;
import java.util.Optional;

public enum DirectiveKind {
    DEFINE("define"),
    INCLUDE("include"),
    IFDEF("ifdef"),
    IFNDEF("ifndef"),
    ELSEIFDEF("elseifdef"),
    ENDIF("endif");

    private final String keyword;

    DirectiveKind(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }

    public static Optional<DirectiveKind> fromKeyword(String keyword) {
        return Arrays.stream(values()).filter(kind -> kind.keyword.equals(keyword)).findFirst();
    }
}
