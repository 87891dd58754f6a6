package com.moosivp.analyzer.preprocess;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Cuts the lines between a {@code <TAG>} marker line and the next marker line out of an include
 * target.
 */
public final class TagSlicer {

    private static final Pattern MARKER_PATTERN = Pattern.compile("<[^<>\\s]+>");

    private TagSlicer() {
    }

    /**
     * @param firstLine zero-based line of the target where {@code content} starts
     */
    public record Slice(String content, int firstLine) {
    }

    public static Optional<Slice> slice(String content, String tag) {
        String marker = "<" + tag + ">";
        String[] lines = content.split("\r?\n", -1);
        int start = -1;
        for (int i = 0; i < lines.length; i++) {
            if (lines[i].trim().equals(marker)) {
                start = i + 1;
                break;
            }
        }
        if (start < 0) {
            return Optional.empty();
        }
        List<String> kept = new ArrayList<>();
        for (int i = start; i < lines.length && !isMarker(lines[i]); i++) {
            kept.add(lines[i]);
        }
        return Optional.of(new Slice(String.join("\n", kept), start));
    }

    public static boolean isMarker(String line) {
        return MARKER_PATTERN.matcher(line.trim()).matches();
    }
}
