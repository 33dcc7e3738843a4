package de.bsommerfeld.provisioner.execution;

/**
 * Lifecycle transitions reported to a {@link ProgressCallback}. Each stage
 * event is emitted right before the stage runs.
 */
public enum ModuleEvent {

    STARTED("started"),
    VALIDATING("validating"),
    PRE_CONFIGURE("pre_configure"),
    CONFIGURING("configuring"),
    POST_CONFIGURE("post_configure"),
    VERIFYING("verifying"),
    COMPLETED("completed"),
    FAILED("failed");

    private final String wireName;

    ModuleEvent(String wireName) {
        this.wireName = wireName;
    }

    /** Name used in logs, persisted state and published events. */
    public String wireName() {
        return wireName;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    @Override
    public String toString() {
        return wireName;
    }
}
