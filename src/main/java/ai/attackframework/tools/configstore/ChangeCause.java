package ai.attackframework.tools.configstore;

/** Why a store adopted a new current value. */
public enum ChangeCause {
    /** Read from an edited file. */
    RELOAD,
    /** Reconciled from a file written under an older version. */
    MIGRATION,
    /** Recovered after the file turned out to be invalid. */
    SELF_HEAL,
    /** Written by {@code save} or auto-save. */
    SAVE,
    /** Replaced by the default because the file was missing. */
    RESET
}
