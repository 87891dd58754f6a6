package com.moosivp.analyzer.preprocess;

import com.moosivp.analyzer.exception.IncludeResolutionException;

import java.util.List;
import java.util.Optional;

/**
 * Looks up the content behind an include path. Implementations own the search roots; the analyzer
 * never touches the file system itself.
 */
@FunctionalInterface
public interface IncludeResolver {

    IncludeResolver NONE = (path, tag) -> Optional.empty();

    /**
     * @param path the include path after substitution, without quotes
     * @param tag  the requested tag, or {@code null}. Slicing by tag is done by the caller.
     * @return the full content of the include target, or empty when it does not exist
     */
    Optional<String> resolve(String path, String tag) throws IncludeResolutionException;

    /** Include targets starting with {@code prefix}, for completion. */
    default List<String> candidates(String prefix) {
        return List.of();
    }
}
