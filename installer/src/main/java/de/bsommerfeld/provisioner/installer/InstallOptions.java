package de.bsommerfeld.provisioner.installer;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-run options of {@link Installer#install(InstallOptions)}.
 *
 * @param resume        continue the most recent interrupted installation if
 *                      there is one; otherwise a new one is started
 * @param modules       modules to install; empty means the configured
 *                      {@code enabled-modules}, or every registered module
 * @param moduleConfig  per-module settings, overriding the configuration file
 */
public record InstallOptions(
        String profile,
        boolean dryRun,
        boolean resume,
        List<String> modules,
        Map<String, Object> metadata,
        Map<String, Map<String, Object>> moduleConfig) {

    public InstallOptions {
        profile = profile == null || profile.isBlank() ? "default" : profile;
        modules = modules == null ? List.of() : List.copyOf(modules);
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
        moduleConfig = moduleConfig == null ? Map.of() : Map.copyOf(moduleConfig);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {

        private String profile;
        private boolean dryRun;
        private boolean resume;
        private List<String> modules = List.of();
        private final Map<String, Object> metadata = new LinkedHashMap<>();
        private final Map<String, Map<String, Object>> moduleConfig = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder profile(String profile) {
            this.profile = profile;
            return this;
        }

        public Builder dryRun(boolean dryRun) {
            this.dryRun = dryRun;
            return this;
        }

        public Builder resume(boolean resume) {
            this.resume = resume;
            return this;
        }

        public Builder modules(List<String> modules) {
            this.modules = modules;
            return this;
        }

        public Builder metadata(String key, Object value) {
            this.metadata.put(key, value);
            return this;
        }

        public Builder moduleConfig(String module, Map<String, Object> config) {
            this.moduleConfig.put(module, config);
            return this;
        }

        public InstallOptions build() {
            return new InstallOptions(profile, dryRun, resume, modules, metadata, moduleConfig);
        }
    }
}
