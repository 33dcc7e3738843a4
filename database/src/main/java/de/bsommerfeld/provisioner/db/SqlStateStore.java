package de.bsommerfeld.provisioner.db;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import de.bsommerfeld.provisioner.core.config.StateConfig;
import de.bsommerfeld.provisioner.core.util.StorageUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * SQLite-backed {@link StateStore}.
 *
 * <p>
 * All SQL lives in {@code sql/*.sql} files loaded through {@link SqlLoader}.
 * {@code schema.sql} is applied on every startup; every DDL statement is
 * {@code IF NOT EXISTS}, so re-running it is harmless.
 *
 * <h3>Connection strategy</h3>
 * A new {@link Connection} is opened per operation and closed right after.
 * SQLite serializes writes at the file level, and {@link StateManager}
 * serializes calls on the Java side, so there is nothing to pool.
 *
 * <h3>Timestamps</h3>
 * Stored as UTC strings with a fixed microsecond width so that
 * {@code ORDER BY started_at} is chronological.
 */
public class SqlStateStore implements StateStore {

    private static final Logger LOG = LoggerFactory.getLogger(SqlStateStore.class);

    public static final String DATABASE_FILE = "state.db";

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter
            .ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSSSSS'Z'")
            .withZone(ZoneOffset.UTC);

    private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {
    };
    private static final TypeReference<List<String>> ACTIONS_TYPE = new TypeReference<>() {
    };

    private final String dbUrl;
    private final ObjectMapper mapper = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();

    public SqlStateStore(Path databaseFile) {
        Path parent = databaseFile.toAbsolutePath().getParent();
        try {
            if (parent != null && !Files.exists(parent)) {
                Files.createDirectories(parent);
            }
        } catch (IOException e) {
            LOG.error("Failed to create state directory {}", parent, e);
        }
        this.dbUrl = "jdbc:sqlite:" + databaseFile.toAbsolutePath();
        initialize();
    }

    /**
     * Resolves the database file from the configured path. A blank path means
     * {@code state.db} in the system state directory, or in the per-user data
     * directory when the system one is not writable.
     */
    public static Path resolveDatabasePath(StateConfig config) {
        String configured = config.getDatabasePath();
        if (configured != null && !configured.isBlank()) {
            return Paths.get(configured);
        }
        return StorageUtils.resolveStateDir(StorageUtils.APP_NAME).resolve(DATABASE_FILE);
    }

    Connection getConnection() throws SQLException {
        return DriverManager.getConnection(dbUrl);
    }

    private void initialize() {
        LOG.info("Initializing state database at {}", dbUrl);
        try (Connection conn = getConnection()) {
            applySchema(conn);
        } catch (SQLException e) {
            throw new StateStoreException("State database initialization failed", e);
        }
    }

    private void applySchema(Connection conn) throws SQLException {
        try (InputStream schemaStream = getClass().getClassLoader().getResourceAsStream("schema.sql");
                Statement stmt = conn.createStatement()) {

            if (schemaStream == null) {
                throw new SQLException("schema.sql not found on classpath");
            }

            String schemaSql = new String(schemaStream.readAllBytes(), StandardCharsets.UTF_8);
            conn.setAutoCommit(false);
            for (String sql : schemaSql.split(";\\s*(\\r?\\n|$)")) {
                if (sql.trim().isEmpty()) {
                    continue;
                }
                stmt.execute(sql.trim());
            }
            conn.commit();
            LOG.debug("State schema applied");
        } catch (IOException | SQLException e) {
            if (!conn.getAutoCommit()) {
                conn.rollback();
            }
            throw new SQLException("Schema application failed", e);
        }
    }

    // =====================================================================
    // Writes
    // =====================================================================

    @Override
    public void insertInstallation(InstallationState installation) {
        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("insert-installation"))) {
            ps.setString(1, installation.installationId());
            ps.setString(2, format(installation.startedAt()));
            ps.setString(3, installation.profile());
            ps.setString(4, format(installation.completedAt()));
            ps.setString(5, installation.status().value());
            ps.setString(6, toJson(installation.metadata()));
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new StateStoreException("Failed to insert installation " + installation.installationId(), e);
        }
    }

    @Override
    public void upsertModule(String installationId, ModuleState module) {
        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("upsert-module"))) {
            ps.setString(1, installationId);
            ps.setString(2, module.name());
            ps.setString(3, module.status().value());
            ps.setString(4, format(module.startedAt()));
            ps.setString(5, format(module.completedAt()));
            if (module.durationSeconds() != null) {
                ps.setDouble(6, module.durationSeconds());
            } else {
                ps.setNull(6, Types.REAL);
            }
            ps.setInt(7, module.progressPercent());
            ps.setString(8, module.currentStep());
            ps.setString(9, module.errorMessage());
            ps.setString(10, module.checkpoint());
            ps.setString(11, toJson(module.rollbackActions()));
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new StateStoreException("Failed to persist module " + module.name(), e);
        }
    }

    @Override
    public void insertCheckpoint(CheckpointSnapshot checkpoint) {
        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("insert-checkpoint"))) {
            ps.setString(1, checkpoint.installationId());
            ps.setString(2, checkpoint.moduleName());
            ps.setString(3, checkpoint.checkpointName());
            ps.setString(4, toJson(checkpoint.snapshot()));
            ps.setString(5, format(checkpoint.createdAt()));
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new StateStoreException("Failed to insert checkpoint " + checkpoint.checkpointName(), e);
        }
    }

    @Override
    public void completeInstallation(String installationId, InstallationStatus status, Instant completedAt) {
        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("complete-installation"))) {
            ps.setString(1, format(completedAt));
            ps.setString(2, status.value());
            ps.setString(3, installationId);
            if (ps.executeUpdate() == 0) {
                LOG.warn("Completed unknown installation {}", installationId);
            }
        } catch (SQLException e) {
            throw new StateStoreException("Failed to complete installation " + installationId, e);
        }
    }

    // =====================================================================
    // Reads
    // =====================================================================

    @Override
    public boolean hasResumableInstallation() {
        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("count-resumable-installations"));
                ResultSet rs = ps.executeQuery()) {
            return rs.next() && rs.getInt(1) > 0;
        } catch (SQLException e) {
            throw new StateStoreException("Failed to query resumable installations", e);
        }
    }

    @Override
    public Optional<InstallationState> findResumableInstallation() {
        try (Connection conn = getConnection()) {
            InstallationState installation;
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-resumable-installation"));
                    ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                installation = mapInstallation(rs);
            }
            return Optional.of(installation.withModules(loadModules(conn, installation.installationId())));
        } catch (SQLException e) {
            throw new StateStoreException("Failed to load resumable installation", e);
        }
    }

    private Map<String, ModuleState> loadModules(Connection conn, String installationId) throws SQLException {
        Map<String, ModuleState> modules = new LinkedHashMap<>();
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-modules-for-installation"))) {
            ps.setString(1, installationId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    ModuleState module = mapModule(rs);
                    modules.put(module.name(), module);
                }
            }
        }
        return modules;
    }

    @Override
    public List<InstallationState> findRecentInstallations(int limit) {
        List<InstallationState> history = new ArrayList<>();
        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-recent-installations"))) {
            ps.setInt(1, limit);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    history.add(mapInstallation(rs));
                }
            }
        } catch (SQLException e) {
            throw new StateStoreException("Failed to load installation history", e);
        }
        return history;
    }

    @Override
    public List<CheckpointSnapshot> findCheckpoints(String installationId, String moduleName) {
        List<CheckpointSnapshot> checkpoints = new ArrayList<>();
        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-checkpoints"))) {
            ps.setString(1, installationId);
            ps.setString(2, moduleName);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    checkpoints.add(new CheckpointSnapshot(
                            rs.getString("installation_id"),
                            rs.getString("module_name"),
                            rs.getString("checkpoint_name"),
                            fromJson(rs.getString("state_snapshot_json"), ModuleState.class),
                            parse(rs.getString("created_at"))));
                }
            }
        } catch (SQLException e) {
            throw new StateStoreException("Failed to load checkpoints for " + moduleName, e);
        }
        return checkpoints;
    }

    // =====================================================================
    // Mapping
    // =====================================================================

    private InstallationState mapInstallation(ResultSet rs) throws SQLException {
        String metadata = rs.getString("metadata_json");
        return new InstallationState(
                rs.getString("installation_id"),
                parse(rs.getString("started_at")),
                rs.getString("profile"),
                InstallationStatus.fromValue(rs.getString("overall_status")),
                parse(rs.getString("completed_at")),
                metadata == null ? Map.of() : readValue(metadata, METADATA_TYPE),
                Map.of());
    }

    private ModuleState mapModule(ResultSet rs) throws SQLException {
        double duration = rs.getDouble("duration_seconds");
        Double durationSeconds = rs.wasNull() ? null : duration;
        String actions = rs.getString("rollback_actions_json");
        return new ModuleState(
                rs.getString("module_name"),
                ModuleStatus.fromValue(rs.getString("status")),
                parse(rs.getString("started_at")),
                parse(rs.getString("completed_at")),
                durationSeconds,
                rs.getInt("progress_percent"),
                rs.getString("current_step"),
                rs.getString("error_message"),
                rs.getString("checkpoint"),
                actions == null ? List.of() : readValue(actions, ACTIONS_TYPE));
    }

    static String format(Instant instant) {
        return instant == null ? null : TIMESTAMP.format(instant);
    }

    static Instant parse(String value) {
        return value == null ? null : Instant.parse(value);
    }

    private String toJson(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new StateStoreException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private <T> T fromJson(String json, Class<T> type) {
        try {
            return mapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new StateStoreException("Failed to deserialize " + type.getSimpleName(), e);
        }
    }

    private <T> T readValue(String json, TypeReference<T> type) {
        try {
            return mapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new StateStoreException("Corrupt JSON column: " + json, e);
        }
    }
}
