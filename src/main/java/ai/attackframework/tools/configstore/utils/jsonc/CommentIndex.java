package ai.attackframework.tools.configstore.utils.jsonc;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Comments carried between parse and serialize, keyed by dotted property path
 * (for example {@code "section.field"}). A value may span several lines separated by
 * {@code '\n'}. Immutable; iteration follows the order comments were found.
 */
public final class CommentIndex {

    private static final CommentIndex EMPTY = new CommentIndex(Map.of());

    private final Map<String, String> byPath;

    public CommentIndex(Map<String, String> byPath) {
        this.byPath = byPath == null || byPath.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(byPath));
    }

    public static CommentIndex empty() {
        return EMPTY;
    }

    /** Comment for {@code path}, or {@code null}. */
    public String get(String path) {
        return byPath.get(path);
    }

    public Set<String> paths() {
        return byPath.keySet();
    }

    public int size() {
        return byPath.size();
    }

    public boolean isEmpty() {
        return byPath.isEmpty();
    }

    public Map<String, String> asMap() {
        return byPath;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CommentIndex other)) return false;
        return byPath.equals(other.byPath);
    }

    @Override
    public int hashCode() {
        return byPath.hashCode();
    }

    @Override
    public String toString() {
        return "CommentIndex" + byPath;
    }
}
