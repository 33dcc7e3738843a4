package de.bsommerfeld.provisioner.core.module;

/**
 * One step of a module's lifecycle (validate, pre-configure, configure,
 * post-configure, verify). Implementations may block on arbitrary I/O; the
 * engine imposes no timeout of its own.
 */
@FunctionalInterface
public interface LifecycleStage {

    StageResult run(StageContext context);
}
