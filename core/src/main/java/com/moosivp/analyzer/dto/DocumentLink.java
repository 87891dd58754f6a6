package com.moosivp.analyzer.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * An include path in the source and the target it resolved to.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DocumentLink(
        int startLine,
        int startColumn,
        int endLine,
        int endColumn,
        String target,
        String tag) {
}
