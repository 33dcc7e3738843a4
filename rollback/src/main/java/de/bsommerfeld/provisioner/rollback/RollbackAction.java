package de.bsommerfeld.provisioner.rollback;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One registered undo step. {@code data} holds the type-specific payload:
 * {@code command}, {@code backup_path}/{@code original_path},
 * {@code packages} or {@code service}.
 */
public record RollbackAction(
        @JsonProperty("action_type") RollbackActionType actionType,
        @JsonProperty("description") String description,
        @JsonProperty("data") Map<String, Object> data,
        @JsonProperty("timestamp") Instant timestamp) {

    public RollbackAction {
        Objects.requireNonNull(actionType, "actionType");
        description = description == null ? "" : description;
        data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
        timestamp = timestamp == null ? Instant.now() : timestamp;
    }

    public static RollbackAction command(String command, String description, Instant at) {
        return new RollbackAction(RollbackActionType.COMMAND,
                orDefault(description, "Run: " + command),
                Map.of("command", command), at);
    }

    public static RollbackAction fileRestore(String backupPath, String originalPath, String description,
            Instant at) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("backup_path", backupPath);
        data.put("original_path", originalPath);
        return new RollbackAction(RollbackActionType.FILE_RESTORE,
                orDefault(description, "Restore: " + originalPath), data, at);
    }

    public static RollbackAction packageRemove(List<String> packages, String description, Instant at) {
        return new RollbackAction(RollbackActionType.PACKAGE_REMOVE,
                orDefault(description, "Remove packages: " + String.join(", ", packages)),
                Map.of("packages", List.copyOf(packages)), at);
    }

    public static RollbackAction serviceStop(String service, String description, Instant at) {
        return new RollbackAction(RollbackActionType.SERVICE_STOP,
                orDefault(description, "Stop service: " + service),
                Map.of("service", service), at);
    }

    String stringData(String key) throws RollbackException {
        Object value = data.get(key);
        if (!(value instanceof String s) || s.isBlank()) {
            throw new RollbackException(actionType.value() + " action is missing '" + key + "'");
        }
        return s;
    }

    List<String> packages() throws RollbackException {
        Object value = data.get("packages");
        if (!(value instanceof List<?> list) || list.isEmpty()) {
            throw new RollbackException("package_remove action has no packages");
        }
        List<String> packages = new ArrayList<>(list.size());
        for (Object element : list) {
            if (!(element instanceof String name) || name.isBlank()) {
                throw new RollbackException("package_remove action has an invalid package entry: " + element);
            }
            packages.add(name);
        }
        return packages;
    }

    private static String orDefault(String description, String fallback) {
        return description == null || description.isBlank() ? fallback : description;
    }
}
