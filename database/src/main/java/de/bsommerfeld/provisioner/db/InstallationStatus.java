package de.bsommerfeld.provisioner.db;

import java.util.Arrays;

public enum InstallationStatus {

    IN_PROGRESS("in_progress"),
    SUCCESS("success"),
    FAILED("failed");

    private final String value;

    InstallationStatus(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static InstallationStatus fromValue(String value) {
        return Arrays.stream(values())
                .filter(status -> status.value.equals(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown installation status: " + value));
    }
}
