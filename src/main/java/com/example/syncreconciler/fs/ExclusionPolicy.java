package com.example.syncreconciler.fs;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.PatternSyntaxException;

/**
 * Rejects paths whose leaf name matches one of a set of glob patterns, in the syntax of
 * {@link java.nio.file.FileSystem#getPathMatcher}.
 */
public final class ExclusionPolicy implements SyncablePolicy {
    private static final Logger LOGGER = LoggerFactory.getLogger(ExclusionPolicy.class);

    private final List<PathMatcher> matchers;
    private final char separator;

    public ExclusionPolicy(List<String> globs, char separator) {
        List<PathMatcher> compiled = new ArrayList<>();
        for (String glob : globs) {
            if (glob == null || glob.isBlank()) {
                continue;
            }
            try {
                compiled.add(FileSystems.getDefault().getPathMatcher("glob:" + glob));
            } catch (PatternSyntaxException ex) {
                LOGGER.warn("Ignoring malformed exclusion pattern {}: {}", glob, ex.getDescription());
            }
        }
        this.matchers = List.copyOf(compiled);
        this.separator = separator;
    }

    @Override
    public boolean isSyncable(String path) {
        Path name = Path.of(leafName(path));
        for (PathMatcher matcher : matchers) {
            if (matcher.matches(name)) {
                return false;
            }
        }
        return true;
    }

    public int size() {
        return matchers.size();
    }

    private String leafName(String path) {
        int end = path.length();
        while (end > 0 && path.charAt(end - 1) == separator) {
            end--;
        }
        int start = path.lastIndexOf(separator, end - 1);
        return path.substring(start + 1, end);
    }
}
