package de.bsommerfeld.provisioner.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public class RollbackConfig {

    // Blank resolves to <state dir>/rollback-state.json
    @JsonProperty("state-file")
    private String stateFile = "";

    @JsonProperty("command-timeout-seconds")
    private long commandTimeoutSeconds = 600;

    public String getStateFile() {
        return stateFile;
    }

    public void setStateFile(String stateFile) {
        this.stateFile = stateFile;
    }

    public long getCommandTimeoutSeconds() {
        return commandTimeoutSeconds;
    }

    public void setCommandTimeoutSeconds(long commandTimeoutSeconds) {
        this.commandTimeoutSeconds = commandTimeoutSeconds;
    }
}
