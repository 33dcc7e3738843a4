package de.bsommerfeld.provisioner.core.module;

/**
 * The only two facts about a module the scheduler reads besides its
 * dependencies.
 *
 * @param forceSequential module must run alone in its batch
 * @param largeModule     module is heavy enough to be routed through the
 *                        pipeline strategy
 */
public record SchedulingHints(boolean forceSequential, boolean largeModule) {

    public static final SchedulingHints DEFAULT = new SchedulingHints(false, false);

    public boolean prefersPipeline() {
        return forceSequential || largeModule;
    }
}
