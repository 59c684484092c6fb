package ai.attackframework.tools.configstore.utils;

import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.classic.spi.IThrowableProxy;
import ch.qos.logback.core.AppenderBase;

/**
 * Static logging facade for the config store.
 *
 * <p>Every message goes to one SLF4J logger, so levels and appenders come from the host's
 * Logback setup, and is mirrored to registered {@link LogListener}s. Hosts use the listener
 * bus to surface store events (recoveries, migrations) to users; tests use it to assert on
 * them. Messages about a particular config start with {@link #prefix(String)}.</p>
 *
 * <p>{@link ListenerAppender} closes the loop for events logged through other SLF4J
 * loggers when a Logback configuration wires it in.</p>
 */
public final class Logger {

    /** Receives mirrored log lines. Level is the SLF4J level name. */
    public interface LogListener { void onLog(String level, String message); }

    private static final String STORE_LOGGER = "ai.attackframework.tools.configstore";
    private static final org.slf4j.Logger LOG = LoggerFactory.getLogger(STORE_LOGGER);
    private static final CopyOnWriteArrayList<LogListener> LISTENERS = new CopyOnWriteArrayList<>();

    private Logger() {}

    /** {@code "[config:<id>] "}, the prefix of every message about one config. */
    public static String prefix(String configId) {
        return "[config:" + configId + "] ";
    }

    /** Adds a listener; null and already-registered listeners are ignored. */
    public static void registerListener(LogListener listener) {
        if (listener != null) LISTENERS.addIfAbsent(listener);
    }

    public static void unregisterListener(LogListener listener) {
        LISTENERS.remove(listener);
    }

    public static void logInfo(String msg)  { dispatch("INFO", msg, null); }

    public static void logWarn(String msg)  { dispatch("WARN", msg, null); }

    /** WARN with cause; listeners see the cause's type and message appended. */
    public static void logWarn(String msg, Throwable t) { dispatch("WARN", msg, t); }

    /** DEBUG goes to SLF4J only when enabled but always reaches listeners. */
    public static void logDebug(String msg) { dispatch("DEBUG", msg, null); }

    public static void logError(String msg) { dispatch("ERROR", msg, null); }

    /** ERROR with cause; the stack trace is left to the backend. */
    public static void logError(String msg, Throwable t) { dispatch("ERROR", msg, t); }

    /** Entry point for backends (see {@link ListenerAppender}) feeding the bus. */
    public static void emitToListeners(String level, String message) {
        notifyListeners(level, Objects.toString(message, ""));
    }

    // Routine detail that listeners do not need to see.

    public static void internalInfo(String msg)  { LOG.info(Objects.toString(msg, "")); }

    public static void internalDebug(String msg) {
        if (LOG.isDebugEnabled()) LOG.debug(Objects.toString(msg, ""));
    }

    private static void dispatch(String level, String msg, Throwable t) {
        String text = Objects.toString(msg, "");
        switch (level) {
            case "ERROR" -> LOG.error(text, t);
            case "WARN" -> LOG.warn(text, t);
            case "DEBUG" -> {
                if (LOG.isDebugEnabled()) LOG.debug(text, t);
            }
            default -> LOG.info(text, t);
        }
        notifyListeners(level, t == null ? text : text + " :: " + t.getClass().getSimpleName()
                + ": " + Objects.toString(t.getMessage(), ""));
    }

    private static void notifyListeners(String level, String message) {
        for (LogListener l : LISTENERS) {
            try {
                l.onLog(level, message);
            } catch (RuntimeException ex) {
                // must not recurse into the bus
                LOG.debug("Log listener {} failed: {}", l, ex.toString());
            }
        }
    }

    /**
     * Logback appender forwarding events of other loggers to the listener bus. Events of the
     * store's own logger are skipped; {@link Logger} already delivered them.
     *
     * <pre>{@code
     * <appender name="LISTENERS" class="ai.attackframework.tools.configstore.utils.Logger$ListenerAppender"/>
     * }</pre>
     */
    public static final class ListenerAppender extends AppenderBase<ILoggingEvent> {
        @Override
        protected void append(ILoggingEvent event) {
            if (event == null || STORE_LOGGER.equals(event.getLoggerName())) return;

            String level = event.getLevel() == null ? "INFO" : event.getLevel().toString();
            String message = Objects.toString(event.getFormattedMessage(), "");
            emitToListeners(level, message + describe(event.getThrowableProxy()));
        }

        private static String describe(IThrowableProxy tp) {
            if (tp == null) return "";
            String type = tp.getClassName() == null ? "Exception" : tp.getClassName();
            return " :: " + type + (tp.getMessage() == null ? "" : ": " + tp.getMessage());
        }
    }
}
