package ai.attackframework.tools.configstore.utils.jsonc;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import ai.attackframework.tools.configstore.utils.config.ConfigKeys;
import ai.attackframework.tools.configstore.utils.config.ConfigMetadata;

/**
 * Renders a config tree as a commented JSONC document: header block, 2-space indented
 * object with section and carried comments ahead of each key, footer block.
 */
final class JsoncWriter {

    private static final String INDENT = "  ";

    private final ObjectMapper mapper;
    private final ConfigMetadata metadata;
    private final String currentVersion;
    private final Clock clock;

    JsoncWriter(ObjectMapper mapper, ConfigMetadata metadata, String currentVersion, Clock clock) {
        this.mapper = mapper;
        this.metadata = metadata;
        this.currentVersion = currentVersion;
        this.clock = clock;
    }

    String write(ObjectNode root, CommentIndex comments) throws JsonProcessingException {
        StringBuilder sb = new StringBuilder();
        appendHeader(sb);
        appendValue(sb, root, "", 0, comments, true);
        sb.append('\n');
        appendFooter(sb);
        return sb.toString();
    }

    /* ----------------------- banners ----------------------- */

    private void appendHeader(StringBuilder sb) {
        sb.append("/* ").append(ConfigKeys.SECTION_START_MARKER).append('\n');
        appendBlockLines(sb, metadata.headerComments());
        if (metadata.includeVersion()) {
            sb.append(" * Version: ").append(sanitize(currentVersion)).append('\n');
        }
        if (metadata.includeTimestamp()) {
            String ts = LocalDateTime.now(clock).truncatedTo(ChronoUnit.SECONDS)
                    .format(DateTimeFormatter.ISO_LOCAL_DATE_TIME);
            sb.append(" * Last updated: ").append(ts).append('\n');
        }
        sb.append(" */\n");
    }

    private void appendFooter(StringBuilder sb) {
        sb.append("/*\n");
        appendBlockLines(sb, metadata.footerComments());
        sb.append(" * ").append(ConfigKeys.SECTION_END_MARKER).append('\n');
        sb.append(" */\n");
    }

    private static void appendBlockLines(StringBuilder sb, List<String> lines) {
        for (String line : lines) {
            sb.append(" * ").append(sanitize(line)).append('\n');
        }
    }

    // A "*/" inside a banner line would end the block comment early.
    private static String sanitize(String line) {
        return line == null ? "" : line.replace("*/", "* /");
    }

    /* ----------------------- body ----------------------- */

    private void appendValue(StringBuilder sb, JsonNode node, String path, int depth,
                             CommentIndex comments, boolean withComments) throws JsonProcessingException {
        if (node.isObject()) {
            if (node.isEmpty()) {
                sb.append("{}");
                return;
            }
            sb.append('{');
            appendEntries(sb, (ObjectNode) node, path, depth + 1, comments, withComments);
            sb.append('\n').append(INDENT.repeat(depth)).append('}');
        } else if (node.isArray()) {
            if (node.isEmpty()) {
                sb.append("[]");
                return;
            }
            sb.append("[\n");
            for (int i = 0; i < node.size(); i++) {
                sb.append(INDENT.repeat(depth + 1));
                // no comment slots inside arrays
                appendValue(sb, node.get(i), path, depth + 1, comments, false);
                if (i < node.size() - 1) sb.append(',');
                sb.append('\n');
            }
            sb.append(INDENT.repeat(depth)).append(']');
        } else {
            sb.append(mapper.writeValueAsString(node));
        }
    }

    private void appendEntries(StringBuilder sb, ObjectNode obj, String path, int depth,
                               CommentIndex comments, boolean withComments) throws JsonProcessingException {
        String indent = INDENT.repeat(depth);
        Iterator<Map.Entry<String, JsonNode>> it = obj.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            String keyPath = JsoncReader.join(path, e.getKey());
            sb.append('\n');
            if (withComments) {
                appendCommentLines(sb, indent, metadata.sectionComment(keyPath));
                appendCommentLines(sb, indent, comments.get(keyPath));
            }
            sb.append(indent).append(mapper.writeValueAsString(e.getKey())).append(": ");
            appendValue(sb, e.getValue(), keyPath, depth, comments, withComments);
            if (it.hasNext()) sb.append(',');
        }
    }

    private static void appendCommentLines(StringBuilder sb, String indent, String text) {
        if (text == null || text.isBlank()) return;
        text.lines()
                .map(String::strip)
                .filter(line -> !line.isEmpty())
                .forEach(line -> sb.append(indent).append("// ").append(line).append('\n'));
    }
}
