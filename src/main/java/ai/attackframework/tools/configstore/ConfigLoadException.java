package ai.attackframework.tools.configstore;

import java.util.Objects;

/**
 * Raised inside the load pipeline when config content cannot be turned into a valid
 * value. Never escapes the store's public operations; the store resolves it through
 * the self-heal chain.
 */
public final class ConfigLoadException extends Exception {

    private final FailureReason reason;

    public ConfigLoadException(FailureReason reason, String message) {
        this(reason, message, null);
    }

    public ConfigLoadException(FailureReason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = Objects.requireNonNull(reason, "reason");
    }

    public FailureReason reason() {
        return reason;
    }
}
