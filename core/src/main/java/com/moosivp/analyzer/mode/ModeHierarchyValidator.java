package com.moosivp.analyzer.mode;

import com.moosivp.analyzer.diagnostic.DiagnosticCode;
import com.moosivp.analyzer.diagnostic.DiagnosticCollector;
import com.moosivp.analyzer.lexer.SourceRange;
import com.moosivp.analyzer.tree.ModeDeclaration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Builds the {@link ModeTree} from the {@code Set} declarations of a behavior file and reports
 * references to parents that cannot be placed.
 *
 * <p>Declarations are processed per mode variable in source order, so a parent has to be declared
 * before it is referenced; a child whose parent cannot be placed is left out of the tree. A parent
 * named by a bare value that only matches deeper nodes is accepted only when exactly one realizable
 * node carries that value.
 */
public final class ModeHierarchyValidator {

    private static final Logger logger = LoggerFactory.getLogger(ModeHierarchyValidator.class);

    private final DiagnosticCollector diagnostics;

    public ModeHierarchyValidator(DiagnosticCollector diagnostics) {
        this.diagnostics = diagnostics;
    }

    public ModeTree validate(List<ModeDeclaration> declarations) {
        Map<String, List<ModeDeclaration>> byVariable = declarations.stream()
                .collect(Collectors.groupingBy(ModeDeclaration::modeVariable, LinkedHashMap::new, Collectors.toList()));

        Map<String, List<ModeNode>> roots = new LinkedHashMap<>();
        byVariable.forEach((variable, group) -> roots.put(variable, build(variable, group)));
        logger.debug("Mode tree built for {} variable(s) from {} declaration(s)", roots.size(), declarations.size());
        return new ModeTree(roots);
    }

    private List<ModeNode> build(String variable, List<ModeDeclaration> group) {
        Builder forest = new Builder(variable, "", "", null);
        List<Builder> declared = new ArrayList<>();

        for (int i = 0; i < group.size(); i++) {
            ModeDeclaration declaration = group.get(i);
            Builder parent;
            if (declaration.parentValue() == null) {
                parent = forest;
            } else {
                Optional<Builder> resolved = resolveParent(declaration, declared, group.subList(i + 1, group.size()));
                if (resolved.isEmpty()) {
                    continue;
                }
                parent = resolved.get();
            }
            parent.declarations.add(declaration);
            declared.add(parent.child(declaration.value(), declaration.headerRange()));
            declaration.elseBranch()
                    .ifPresent(elseValue -> declared.add(parent.child(elseValue, declaration.range())));
        }
        return forest.children.stream().map(Builder::freeze).collect(Collectors.toList());
    }

    private Optional<Builder> resolveParent(ModeDeclaration declaration, List<Builder> declared,
            List<ModeDeclaration> later) {
        String parentValue = declaration.parentValue();
        SourceRange range = declaration.parentRange() == null ? declaration.headerRange() : declaration.parentRange();

        Optional<Builder> exact = declared.stream().filter(node -> node.path.equals(parentValue)).findFirst();
        if (exact.isPresent()) {
            return exact;
        }

        List<Builder> bySegment = declared.stream()
                .filter(node -> node.value.equals(parentValue))
                .distinct()
                .collect(Collectors.toList());
        if (bySegment.size() == 1 && bySegment.get(0).isRealizable()) {
            return Optional.of(bySegment.get(0));
        }
        if (!bySegment.isEmpty()) {
            String candidates = bySegment.stream().map(node -> node.path).collect(Collectors.joining(", "));
            String reason = bySegment.size() > 1
                    ? "matches " + candidates
                    : "only matches " + candidates + ", which is never realized";
            diagnostics.report(DiagnosticCode.AMBIGUOUS_MODE_REFERENCE, range,
                    "Parent mode '" + parentValue + "' of " + declaration.modeVariable() + " is ambiguous: " + reason);
            return Optional.empty();
        }

        String lastSegment = parentValue.substring(parentValue.lastIndexOf(':') + 1);
        boolean declaredLater = later.stream().anyMatch(next -> next.value().equals(lastSegment)
                || lastSegment.equals(next.elseValue()));
        diagnostics.report(DiagnosticCode.MODE_DECLARED_BEFORE_PARENT, range,
                "Mode '" + declaration.value() + "' is declared before its parent '" + parentValue + "'"
                        + (declaredLater ? "" : ", which is never declared"));
        return Optional.empty();
    }

    private static final class Builder {

        private final String variable;
        private final String value;
        private final String path;
        private final SourceRange range;
        private final List<Builder> children = new ArrayList<>();
        private final List<ModeDeclaration> declarations = new ArrayList<>();

        Builder(String variable, String value, String path, SourceRange range) {
            this.variable = variable;
            this.value = value;
            this.path = path;
            this.range = range;
        }

        Builder child(String childValue, SourceRange childRange) {
            for (Builder child : children) {
                if (child.value.equals(childValue)) {
                    return child;
                }
            }
            Builder child = new Builder(variable, childValue, path.isEmpty() ? childValue : path + ":" + childValue,
                    childRange);
            children.add(child);
            return child;
        }

        boolean isRealizable() {
            return children.isEmpty() || declarations.stream().anyMatch(d -> d.elseValue() == null);
        }

        ModeNode freeze() {
            List<ModeNode> frozen = children.stream().map(Builder::freeze).collect(Collectors.toList());
            return new ModeNode(variable, value, path, frozen, isRealizable(), range);
        }
    }
}
