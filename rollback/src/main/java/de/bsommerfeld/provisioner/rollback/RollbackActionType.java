package de.bsommerfeld.provisioner.rollback;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum RollbackActionType {

    COMMAND("command"),
    FILE_RESTORE("file_restore"),
    PACKAGE_REMOVE("package_remove"),
    SERVICE_STOP("service_stop");

    private final String value;

    RollbackActionType(String value) {
        this.value = value;
    }

    /** Name used in the state file and in summaries. */
    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static RollbackActionType fromValue(String value) {
        return Arrays.stream(values())
                .filter(type -> type.value.equals(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown rollback action type: " + value));
    }
}
