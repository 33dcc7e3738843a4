package de.bsommerfeld.provisioner.db;

import com.google.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory {@link StateStore} for TEST mode: no SQLite, no disk I/O, nothing
 * survives the JVM. Bound by Guice when the provisioner runs with
 * {@code provisioner.mode=test}, and used by unit tests.
 */
@Singleton
public class InMemoryStateStore implements StateStore {

    private static final Logger LOG = LoggerFactory.getLogger(InMemoryStateStore.class);

    private final Map<String, InstallationState> installations = new LinkedHashMap<>();
    private final Map<String, Map<String, ModuleState>> modules = new LinkedHashMap<>();
    private final List<CheckpointSnapshot> checkpoints = new ArrayList<>();

    public InMemoryStateStore() {
        LOG.warn("#########################################################");
        LOG.warn("#  TEST MODE ENABLED: Installation state is NOT PERSISTED #");
        LOG.warn("#########################################################");
    }

    @Override
    public synchronized void insertInstallation(InstallationState installation) {
        installations.put(installation.installationId(), installation.withModules(Map.of()));
        modules.put(installation.installationId(), new LinkedHashMap<>());
    }

    @Override
    public synchronized void upsertModule(String installationId, ModuleState module) {
        modules.computeIfAbsent(installationId, id -> new LinkedHashMap<>()).put(module.name(), module);
    }

    @Override
    public synchronized void insertCheckpoint(CheckpointSnapshot checkpoint) {
        checkpoints.add(checkpoint);
    }

    @Override
    public synchronized void completeInstallation(String installationId, InstallationStatus status,
            Instant completedAt) {
        InstallationState installation = installations.get(installationId);
        if (installation == null) {
            LOG.warn("Completed unknown installation {}", installationId);
            return;
        }
        installations.put(installationId, new InstallationState(installationId, installation.startedAt(),
                installation.profile(), status, completedAt, installation.metadata(), Map.of()));
    }

    @Override
    public synchronized boolean hasResumableInstallation() {
        return installations.values().stream().anyMatch(InstallationState::isResumable);
    }

    @Override
    public synchronized Optional<InstallationState> findResumableInstallation() {
        return newestFirst().stream()
                .filter(InstallationState::isResumable)
                .findFirst()
                .map(installation -> installation.withModules(
                        modules.getOrDefault(installation.installationId(), Map.of())));
    }

    @Override
    public synchronized List<InstallationState> findRecentInstallations(int limit) {
        List<InstallationState> recent = newestFirst();
        return List.copyOf(recent.subList(0, Math.min(limit, recent.size())));
    }

    @Override
    public synchronized List<CheckpointSnapshot> findCheckpoints(String installationId, String moduleName) {
        return checkpoints.stream()
                .filter(c -> c.installationId().equals(installationId) && c.moduleName().equals(moduleName))
                .toList();
    }

    // Stable sort keeps insertion order for equal start times; reversed afterwards
    private List<InstallationState> newestFirst() {
        List<InstallationState> all = new ArrayList<>(installations.values());
        all.sort(Comparator.comparing(InstallationState::startedAt));
        Collections.reverse(all);
        return all;
    }
}
