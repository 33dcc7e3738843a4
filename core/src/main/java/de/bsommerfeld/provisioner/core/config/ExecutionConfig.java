package de.bsommerfeld.provisioner.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public class ExecutionConfig {

    @JsonProperty("max-workers")
    private int maxWorkers = 4;

    // Undo registered actions as soon as a run fails
    @JsonProperty("auto-rollback")
    private boolean autoRollback = false;

    @JsonProperty("dry-run")
    private boolean dryRun = false;

    public int getMaxWorkers() {
        return maxWorkers;
    }

    public void setMaxWorkers(int maxWorkers) {
        this.maxWorkers = maxWorkers;
    }

    public boolean isAutoRollback() {
        return autoRollback;
    }

    public void setAutoRollback(boolean autoRollback) {
        this.autoRollback = autoRollback;
    }

    public boolean isDryRun() {
        return dryRun;
    }

    public void setDryRun(boolean dryRun) {
        this.dryRun = dryRun;
    }
}
