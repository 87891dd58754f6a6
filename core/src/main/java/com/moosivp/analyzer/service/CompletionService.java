package com.moosivp.analyzer.service;

import com.moosivp.analyzer.dto.CompletionContext;
import com.moosivp.analyzer.dto.CompletionResponse;
import com.moosivp.analyzer.model.AnalysisResult;
import com.moosivp.analyzer.preprocess.DirectiveKind;
import com.moosivp.analyzer.preprocess.IncludeResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Classifies the text before a cursor and offers the matching candidates: directive names after
 * {@code #}, include targets after {@code #include}, and defined variables inside a reference.
 */
@Service
public class CompletionService {

    private static final Logger logger = LoggerFactory.getLogger(CompletionService.class);

    private static final Pattern DIRECTIVE_PATTERN = Pattern.compile("^\\s*#\\s*(\\w*)$");
    private static final Pattern INCLUDE_PATTERN = Pattern.compile("^\\s*#\\s*include\\s+\"?([^\\s\"<]*)$");
    private static final Pattern OPEN_REFERENCE_PATTERN = Pattern.compile("(?:[$%]\\(|\\$\\{)([^)}\\s]*)$");

    public CompletionResponse complete(AnalysisResult result, int offset, IncludeResolver resolver) {
        String source = result.source();
        int cursor = Math.max(0, Math.min(offset, source.length()));
        int lineStart = source.lastIndexOf('\n', cursor - 1) + 1;
        String before = source.substring(lineStart, cursor);

        Matcher reference = OPEN_REFERENCE_PATTERN.matcher(before);
        if (reference.find()) {
            String prefix = reference.group(1);
            return respond(CompletionContext.VARIABLE, prefix, result.symbols().keySet());
        }

        Matcher include = INCLUDE_PATTERN.matcher(before);
        if (include.matches()) {
            String prefix = include.group(1);
            return respond(CompletionContext.INCLUDE_PATH, prefix, resolver.candidates(prefix));
        }

        Matcher directive = DIRECTIVE_PATTERN.matcher(before);
        if (directive.matches()) {
            List<String> keywords = Arrays.stream(DirectiveKind.values())
                    .map(DirectiveKind::keyword)
                    .collect(Collectors.toList());
            return respond(CompletionContext.DIRECTIVE, directive.group(1), keywords);
        }

        return CompletionResponse.none();
    }

    private static CompletionResponse respond(CompletionContext context, String prefix, Collection<String> options) {
        List<String> candidates = options.stream()
                .filter(option -> option.startsWith(prefix))
                .distinct()
                .sorted()
                .collect(Collectors.toList());
        logger.debug("Completion {} for '{}': {} candidates", context, prefix, candidates.size());
        return new CompletionResponse(context, prefix, candidates);
    }
}
