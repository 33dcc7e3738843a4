package de.bsommerfeld.provisioner.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Root of {@code config.toml}. Loaded by {@link ConfigLoader}; every field
 * has a default so a missing or partial file still yields a usable config.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({ "profile", "debug-mode", "enabled-modules", "execution", "state", "rollback", "modules" })
public class ProvisionerConfig {

    @JsonProperty("profile")
    private String profile = "default";

    @JsonProperty("debug-mode")
    private boolean debugMode = false;

    // Empty means every registered module
    @JsonProperty("enabled-modules")
    private List<String> enabledModules = new ArrayList<>();

    @JsonProperty("execution")
    private ExecutionConfig execution = new ExecutionConfig();

    @JsonProperty("state")
    private StateConfig state = new StateConfig();

    @JsonProperty("rollback")
    private RollbackConfig rollback = new RollbackConfig();

    @JsonProperty("modules")
    private Map<String, Map<String, Object>> modules = new LinkedHashMap<>();

    public String getProfile() {
        return profile;
    }

    public void setProfile(String profile) {
        this.profile = profile;
    }

    public boolean isDebugMode() {
        return debugMode;
    }

    public List<String> getEnabledModules() {
        return enabledModules;
    }

    public void setEnabledModules(List<String> enabledModules) {
        this.enabledModules = enabledModules;
    }

    public ExecutionConfig getExecution() {
        return execution;
    }

    public StateConfig getState() {
        return state;
    }

    public RollbackConfig getRollback() {
        return rollback;
    }

    /**
     * Per-module settings from the {@code [modules.<name>]} tables. Returns an
     * empty map for modules without a table.
     */
    public Map<String, Object> getModuleConfig(String moduleName) {
        Map<String, Object> moduleConfig = modules.get(moduleName);
        return moduleConfig == null ? Map.of() : moduleConfig;
    }

    public void setModuleConfig(String moduleName, Map<String, Object> moduleConfig) {
        modules.put(moduleName, new LinkedHashMap<>(moduleConfig));
    }
}
