package de.bsommerfeld.provisioner.core.module;

/**
 * Records a named checkpoint for the module currently executing.
 */
@FunctionalInterface
public interface CheckpointRecorder {

    CheckpointRecorder NONE = name -> {
    };

    void checkpoint(String checkpointName);
}
