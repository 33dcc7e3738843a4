package de.bsommerfeld.provisioner.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Running mode of the provisioner. {@link #PROD} persists installation state
 * to SQLite, {@link #TEST} keeps it in memory so nothing survives the JVM.
 */
public enum ApplicationMode {

    PROD,
    TEST;

    private static final Logger LOG = LoggerFactory.getLogger(ApplicationMode.class);

    static final String PROPERTY = "provisioner.mode";
    static final String ENV = "PROVISIONER_MODE";

    /**
     * Resolves the mode from the {@code provisioner.mode} system property,
     * then the {@code PROVISIONER_MODE} environment variable. Defaults to
     * {@link #PROD}.
     */
    public static ApplicationMode get() {
        String mode = System.getProperty(PROPERTY);
        if (mode == null || mode.isBlank()) {
            mode = System.getenv(ENV);
        }
        return parse(mode);
    }

    static ApplicationMode parse(String mode) {
        if (mode == null || mode.isBlank()) {
            return PROD;
        }
        try {
            return ApplicationMode.valueOf(mode.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            LOG.warn("Unknown provisioner mode '{}', falling back to PROD", mode);
            return PROD;
        }
    }

    public boolean isPersistent() {
        return this == PROD;
    }
}
