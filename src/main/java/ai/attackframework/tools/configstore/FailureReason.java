package ai.attackframework.tools.configstore;

/**
 * Why a config file could not be loaded. The tag names the backup snapshot taken of
 * the offending file.
 */
public enum FailureReason {
    /** File exists but nothing is left after comment stripping. */
    EMPTY_FILE("empty_file"),
    /** Well-formed JSON that does not bind to the config type. */
    PARSE_ERROR("parse_error"),
    /** Malformed JSON syntax. */
    JSON_ERROR("json_error"),
    /** I/O or any other unexpected failure during reload. */
    RELOAD_ERROR("reload_error");

    private final String tag;

    FailureReason(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }
}
