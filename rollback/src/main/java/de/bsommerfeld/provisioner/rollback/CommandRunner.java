package de.bsommerfeld.provisioner.rollback;

import java.io.IOException;

/**
 * Runs undo commands. Swapped for a mock in tests so rollback logic can be
 * verified without touching the system.
 */
public interface CommandRunner {

    /**
     * @throws IOException          if the command cannot be started
     * @throws InterruptedException if the caller is interrupted while waiting
     */
    CommandResult run(String command) throws IOException, InterruptedException;
}
