package de.bsommerfeld.provisioner.execution;

import java.util.List;
import java.util.Map;

/**
 * Runs one batch of mutually independent modules.
 *
 * <p>
 * Implementations never throw for a module failure: every context in the
 * batch gets an {@link ExecutionResult}, failed or cancelled ones included.
 */
public interface ExecutionStrategy {

    /**
     * @return one result per context, keyed by module name, in the order the
     *         results became available
     */
    Map<String, ExecutionResult> execute(List<ExecutionContext> contexts, ExecutionSession session,
            ProgressCallback callback);

    /** Whether this strategy is a good fit for the given batch. */
    boolean canHandle(List<ExecutionContext> contexts);

    String getName();
}
