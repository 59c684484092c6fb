package ai.attackframework.tools.configstore.utils.jsonc;

import java.time.Clock;
import java.util.Objects;
import java.util.Optional;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import ai.attackframework.tools.configstore.ConfigLoadException;
import ai.attackframework.tools.configstore.FailureReason;
import ai.attackframework.tools.configstore.utils.ContentHash;
import ai.attackframework.tools.configstore.utils.config.ConfigKeys;
import ai.attackframework.tools.configstore.utils.config.ConfigMetadata;

/**
 * JSONC marshaling for config files.
 *
 * <p>Reading strips comments and trailing commas ({@link #parse(String)}) and binds the
 * remaining JSON to the config type, classifying failures as {@link FailureReason}s.
 * Writing produces a commented, deterministic document ({@link #serialize(Object, CommentIndex)})
 * whose key order follows the config type's declared field order.</p>
 */
public final class JsoncCodec {

    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES) // old files may carry removed keys
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
            .build();

    private final String currentVersion;
    private final JsoncReader reader;
    private final JsoncWriter writer;

    /** Dedicated runtime exception for values that cannot be rendered as JSON. */
    public static final class JsoncException extends RuntimeException {
        public JsoncException(String message, Throwable cause) { super(message, cause); }
    }

    public JsoncCodec(String currentVersion, ConfigMetadata metadata) {
        this(currentVersion, metadata, Clock.systemDefaultZone());
    }

    public JsoncCodec(String currentVersion, ConfigMetadata metadata, Clock clock) {
        this.currentVersion = Objects.requireNonNull(currentVersion, "currentVersion");
        Objects.requireNonNull(metadata, "metadata");
        this.reader = new JsoncReader(metadata.sectionComments());
        this.writer = new JsoncWriter(MAPPER, metadata, currentVersion, Objects.requireNonNull(clock, "clock"));
    }

    public String currentVersion() {
        return currentVersion;
    }

    /* ======================== READ ======================== */

    /**
     * Strips comments and trailing commas and collects property comments.
     *
     * @param content raw file content (nullable)
     * @return payload and comments; payload empty when only comments/whitespace remained
     */
    public ParsedJsonc parse(String content) {
        return reader.read(content);
    }

    /**
     * Returns the text between the {@code CONFIG_SECTION} banner and the
     * {@code END_CONFIG_SECTION} banner (or end of input), trimmed.
     *
     * @param content raw file content
     * @return section text, or empty when there is no start marker
     */
    public Optional<String> extractSection(String content) {
        if (content == null) return Optional.empty();

        int marker = indexOfStartMarker(content);
        if (marker < 0) return Optional.empty();
        int close = content.indexOf("*/", marker);
        if (close < 0) return Optional.empty();
        int bodyStart = close + 2;

        int bodyEnd = content.length();
        int end = content.indexOf(ConfigKeys.SECTION_END_MARKER, bodyStart);
        if (end >= 0) {
            int open = content.lastIndexOf("/*", end);
            bodyEnd = open >= bodyStart ? open : end;
        }
        return Optional.of(content.substring(bodyStart, bodyEnd).trim());
    }

    // "END_CONFIG_SECTION" contains the start marker; skip those occurrences.
    private static int indexOfStartMarker(String content) {
        String start = ConfigKeys.SECTION_START_MARKER;
        String endPrefix = ConfigKeys.SECTION_END_MARKER.substring(
                0, ConfigKeys.SECTION_END_MARKER.length() - start.length());
        int from = 0;
        while (true) {
            int i = content.indexOf(start, from);
            if (i < 0) return -1;
            if (!content.startsWith(endPrefix, i - endPrefix.length())) return i;
            from = i + start.length();
        }
    }

    /**
     * Reads the stripped payload as a JSON object.
     *
     * @throws ConfigLoadException {@code EMPTY_FILE} for an empty payload, {@code JSON_ERROR}
     *                             for malformed syntax, {@code PARSE_ERROR} for a non-object root
     */
    public ObjectNode readObject(ParsedJsonc parsed) throws ConfigLoadException {
        if (parsed == null || parsed.isEmpty()) {
            throw new ConfigLoadException(FailureReason.EMPTY_FILE, "No JSON content after stripping comments");
        }
        JsonNode node;
        try {
            node = MAPPER.readTree(parsed.jsonPayload());
        } catch (JsonProcessingException e) {
            throw new ConfigLoadException(FailureReason.JSON_ERROR, "Malformed JSON: " + e.getOriginalMessage(), e);
        }
        if (node == null || !node.isObject()) {
            throw new ConfigLoadException(FailureReason.PARSE_ERROR, "Root element is not a JSON object");
        }
        return (ObjectNode) node;
    }

    /**
     * Binds a JSON object to the config type.
     *
     * @throws ConfigLoadException {@code PARSE_ERROR} when the tree does not fit the type
     */
    public <T> T toConfig(ObjectNode tree, Class<T> type) throws ConfigLoadException {
        try {
            T value = MAPPER.treeToValue(tree, type);
            if (value == null) {
                throw new ConfigLoadException(FailureReason.PARSE_ERROR, "Content bound to null");
            }
            return value;
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new ConfigLoadException(FailureReason.PARSE_ERROR,
                    "Content does not match " + type.getSimpleName() + ": " + e.getMessage(), e);
        }
    }

    /** Parse, read and bind in one step. */
    public <T> T decode(String content, Class<T> type) throws ConfigLoadException {
        return toConfig(readObject(parse(content)), type);
    }

    /* ======================== WRITE ======================== */

    /**
     * Renders {@code config} as a commented JSONC document.
     *
     * @param config   value to write
     * @param comments carried property comments (nullable)
     * @return full file content
     */
    public String serialize(Object config, CommentIndex comments) {
        ObjectNode tree = toTree(config);
        try {
            return writer.write(tree, comments == null ? CommentIndex.empty() : comments);
        } catch (JsonProcessingException e) {
            throw new JsoncException("JSONC serialization error", e);
        }
    }

    /* ======================== TREES / HASHING ======================== */

    public ObjectNode toTree(Object config) {
        JsonNode node = MAPPER.valueToTree(config);
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("Config must serialize to a JSON object: "
                    + (config == null ? "null" : config.getClass().getName()));
        }
        return (ObjectNode) node;
    }

    /** Deep copy through the JSON form; the copy shares no mutable state with the input. */
    public <T> T copy(T config, Class<T> type) {
        try {
            return MAPPER.treeToValue(toTree(config), type);
        } catch (JsonProcessingException e) {
            throw new JsoncException("Config type " + type.getName() + " does not round-trip", e);
        }
    }

    /** Copy of {@code config} whose {@code version} is the current schema version. */
    public <T> T withCurrentVersion(T config, Class<T> type) {
        ObjectNode tree = toTree(config);
        tree.put(ConfigKeys.FIELD_VERSION, currentVersion);
        try {
            return MAPPER.treeToValue(tree, type);
        } catch (JsonProcessingException e) {
            throw new JsoncException("Config type " + type.getName() + " does not round-trip", e);
        }
    }

    /** Compact JSON form used for hashing and equality. */
    public String canonicalJson(Object config) {
        try {
            return MAPPER.writeValueAsString(config);
        } catch (JsonProcessingException e) {
            throw new JsoncException("JSON serialization error", e);
        }
    }

    public String hash(Object config) {
        return ContentHash.sha256(canonicalJson(config));
    }
}
