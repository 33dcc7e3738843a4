package de.bsommerfeld.provisioner.core.module;

/**
 * Explicit outcome of a single lifecycle stage. Expected failures are
 * reported through {@link #failed(String)} rather than by throwing; an
 * exception escaping a stage is treated by the execution layer as an
 * unexpected failure and converted into the same shape.
 *
 * @param success whether the stage completed successfully
 * @param error   human-readable failure reason, {@code null} on success
 */
public record StageResult(boolean success, String error) {

    private static final StageResult OK = new StageResult(true, null);

    public static StageResult ok() {
        return OK;
    }

    public static StageResult failed(String error) {
        return new StageResult(false, error);
    }

    /**
     * Maps a plain boolean answer onto a result, using {@code error} as the
     * failure message.
     */
    public static StageResult of(boolean success, String error) {
        return success ? OK : failed(error);
    }
}
