package com.moosivp.analyzer.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.Positive;

/**
 * Settings under {@code moos.analyzer}.
 *
 * @param substituteInQuotes whether variable references inside quoted strings are expanded
 * @param maxIncludeDepth    nesting limit for includes; deeper includes are reported as cycles
 * @param useEnvironment     whether the process environment backs unresolved variables
 * @param maxSourceLength    longest accepted document, in characters
 */
@ConfigurationProperties(prefix = "moos.analyzer")
@Validated
public record AnalyzerProperties(
    @DefaultValue("true")
    boolean substituteInQuotes,

    @Positive
    @DefaultValue("32")
    int maxIncludeDepth,

    @DefaultValue("true")
    boolean useEnvironment,

    @Positive
    @DefaultValue("1048576")
    int maxSourceLength
) {

    @ConstructorBinding
    public AnalyzerProperties {
    }

    public AnalyzerProperties() {
        this(
            true,
            32,
            true,
            1_048_576
        );
    }
}
