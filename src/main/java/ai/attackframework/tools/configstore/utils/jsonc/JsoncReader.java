package ai.attackframework.tools.configstore.utils.jsonc;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Single-pass JSONC stripper. Removes {@code //} and {@code /* *\/} comments outside
 * string literals, drops trailing commas, and records line comments against the dotted
 * path of the property they annotate.
 *
 * <p>A comment trailing a property on the same line belongs to that property. Comment
 * lines standing alone belong to the next property key; any line equal to the
 * configured section comment for that key is skipped, since the writer emits section
 * comments itself. Comments ahead of brackets or array values are discarded.</p>
 */
final class JsoncReader {

    private final Map<String, String> sectionComments;

    JsoncReader(Map<String, String> sectionComments) {
        this.sectionComments = sectionComments == null ? Map.of() : sectionComments;
    }

    ParsedJsonc read(String content) {
        if (content == null || content.isEmpty()) {
            return new ParsedJsonc("", CommentIndex.empty());
        }
        Pass pass = new Pass(content);
        pass.run();
        String json = removeTrailingCommas(pass.out.toString()).trim();
        return new ParsedJsonc(json, new CommentIndex(pass.comments));
    }

    /** Removes commas followed (after whitespace) by a closing bracket; string-aware. */
    static String removeTrailingCommas(String json) {
        StringBuilder sb = new StringBuilder(json.length());
        boolean inString = false;
        int n = json.length();
        for (int i = 0; i < n; i++) {
            char c = json.charAt(i);
            if (inString) {
                sb.append(c);
                if (c == '\\' && i + 1 < n) {
                    sb.append(json.charAt(++i));
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            if (c == '"') {
                inString = true;
            } else if (c == ',') {
                int j = i + 1;
                while (j < n && Character.isWhitespace(json.charAt(j))) j++;
                if (j < n && (json.charAt(j) == '}' || json.charAt(j) == ']')) {
                    continue;
                }
            }
            sb.append(c);
        }
        return sb.toString();
    }

    static String join(String path, String key) {
        return path.isEmpty() ? key : path + "." + key;
    }

    /** Container being scanned. Object frames track the most recent key. */
    private static final class Frame {
        final boolean object;
        final String path;
        String lastKey;
        boolean expectKey;

        Frame(boolean object, String path) {
            this.object = object;
            this.path = path;
            this.expectKey = object;
        }
    }

    private final class Pass {
        final String src;
        final int n;
        final StringBuilder out;
        final Map<String, String> comments = new LinkedHashMap<>();
        final Deque<Frame> frames = new ArrayDeque<>();
        final List<String> pending = new ArrayList<>();
        int pos;
        boolean lineHasCode;
        String linePath;

        Pass(String src) {
            this.src = src;
            this.n = src.length();
            this.out = new StringBuilder(n);
        }

        void run() {
            while (pos < n) {
                char c = src.charAt(pos);
                char next = pos + 1 < n ? src.charAt(pos + 1) : '\0';
                if (c == '"') {
                    readString();
                } else if (c == '/' && next == '/') {
                    lineComment();
                } else if (c == '/' && next == '*') {
                    blockComment();
                } else {
                    if (c == '\n') {
                        newLine();
                    } else if (!Character.isWhitespace(c)) {
                        code(c);
                    }
                    out.append(c);
                    pos++;
                }
            }
        }

        private void code(char c) {
            lineHasCode = true;
            switch (c) {
                case '{' -> {
                    pending.clear();
                    frames.push(new Frame(true, childPath()));
                }
                case '[' -> {
                    pending.clear();
                    frames.push(new Frame(false, childPath()));
                }
                case '}', ']' -> {
                    pending.clear();
                    if (!frames.isEmpty()) frames.pop();
                }
                case ',' -> {
                    Frame top = frames.peek();
                    if (top != null && top.object) top.expectKey = true;
                }
                case ':' -> { /* separator between key and value */ }
                default -> pending.clear();
            }
        }

        private String childPath() {
            Frame top = frames.peek();
            if (top == null) return "";
            if (top.object && top.lastKey != null) return join(top.path, top.lastKey);
            return top.path;
        }

        private void readString() {
            int start = pos;
            StringBuilder raw = new StringBuilder();
            pos++;
            while (pos < n) {
                char ch = src.charAt(pos);
                if (ch == '\\' && pos + 1 < n) {
                    raw.append(ch).append(src.charAt(pos + 1));
                    pos += 2;
                    continue;
                }
                if (ch == '\n') {
                    break; // unterminated; leave the newline to the main loop
                }
                pos++;
                if (ch == '"') {
                    break;
                }
                raw.append(ch);
            }
            out.append(src, start, pos);
            lineHasCode = true;

            Frame top = frames.peek();
            if (top != null && top.object && top.expectKey) {
                top.lastKey = raw.toString();
                top.expectKey = false;
                linePath = join(top.path, top.lastKey);
                attachPending(linePath);
            } else {
                pending.clear();
            }
        }

        private void lineComment() {
            int end = src.indexOf('\n', pos);
            if (end < 0) end = n;
            String text = src.substring(pos + 2, end).trim();
            if (!text.isEmpty()) {
                if (!lineHasCode) {
                    pending.add(text);
                } else if (linePath != null) {
                    comments.merge(linePath, text, (above, trailing) -> above + "\n" + trailing);
                }
            }
            pos = end;
        }

        private void blockComment() {
            int close = src.indexOf("*/", pos + 2);
            int stop = close < 0 ? n : close + 2;
            for (int i = pos; i < stop; i++) {
                if (src.charAt(i) == '\n') {
                    // keep line numbers stable for parser error messages
                    out.append('\n');
                    newLine();
                }
            }
            pos = stop;
        }

        private void newLine() {
            lineHasCode = false;
            linePath = null;
        }

        private void attachPending(String path) {
            if (pending.isEmpty()) return;
            String section = sectionComments.get(path);
            Set<String> sectionLines = section == null
                    ? Set.of()
                    : section.lines().map(String::trim).collect(Collectors.toSet());
            List<String> kept = new ArrayList<>();
            for (String line : pending) {
                if (!sectionLines.contains(line)) kept.add(line);
            }
            pending.clear();
            if (!kept.isEmpty()) {
                comments.put(path, String.join("\n", kept));
            }
        }
    }
}
