package de.bsommerfeld.provisioner.rollback;

/**
 * Exit status and combined output of a shell command.
 *
 * @param timedOut the command was killed after exceeding its timeout; the
 *                 exit code is then {@code -1}
 */
public record CommandResult(int exitCode, String output, boolean timedOut) {

    public boolean isSuccess() {
        return exitCode == 0 && !timedOut;
    }
}
