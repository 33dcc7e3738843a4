package de.bsommerfeld.provisioner.installer;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.provisioner.core.config.ProvisionerConfig;
import de.bsommerfeld.provisioner.core.event.ApplicationEventBus;
import de.bsommerfeld.provisioner.core.event.ProvisioningEvents;
import de.bsommerfeld.provisioner.core.graph.DependencyGraph;
import de.bsommerfeld.provisioner.core.graph.DependencyGraphException;
import de.bsommerfeld.provisioner.core.module.ModuleDescriptor;
import de.bsommerfeld.provisioner.db.InstallationState;
import de.bsommerfeld.provisioner.db.ModuleState;
import de.bsommerfeld.provisioner.db.ModuleStatus;
import de.bsommerfeld.provisioner.db.StateManager;
import de.bsommerfeld.provisioner.execution.ExecutionContext;
import de.bsommerfeld.provisioner.execution.ExecutionResult;
import de.bsommerfeld.provisioner.execution.ExecutionSession;
import de.bsommerfeld.provisioner.execution.ExecutionStrategy;
import de.bsommerfeld.provisioner.execution.ModuleEvent;
import de.bsommerfeld.provisioner.execution.ProgressCallback;
import de.bsommerfeld.provisioner.rollback.RollbackManager;
import de.bsommerfeld.provisioner.rollback.RollbackOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Runs an installation end to end.
 *
 * <ol>
 * <li>Validates the manifest and builds the dependency graph of the selected
 * modules. Graph errors abort before any state is written.</li>
 * <li>Starts a new installation, or resumes the last interrupted one. A
 * resumed run skips modules already completed and reloads the pending
 * rollback actions.</li>
 * <li>Runs the batches one after another through the
 * {@link ExecutionStrategy}, sharing one {@link ExecutionSession}. The first
 * batch containing a failure is the last one run.</li>
 * <li>Stamps the outcome and, when {@code execution.auto-rollback} is set,
 * undoes the registered actions of a failed run.</li>
 * </ol>
 */
@Singleton
public class Installer {

    private static final Logger LOG = LoggerFactory.getLogger(Installer.class);

    // Rough progress per lifecycle stage, for the persisted module rows
    private static final Map<ModuleEvent, Integer> STAGE_PROGRESS = Map.of(
            ModuleEvent.STARTED, 0,
            ModuleEvent.VALIDATING, 10,
            ModuleEvent.PRE_CONFIGURE, 25,
            ModuleEvent.CONFIGURING, 40,
            ModuleEvent.POST_CONFIGURE, 75,
            ModuleEvent.VERIFYING, 90);

    private final ModuleRegistry registry;
    private final StateManager stateManager;
    private final RollbackManager rollbackManager;
    private final ExecutionStrategy strategy;
    private final ApplicationEventBus eventBus;
    private final ProvisionerConfig config;

    @Inject
    public Installer(ModuleRegistry registry, StateManager stateManager, RollbackManager rollbackManager,
            ExecutionStrategy strategy, ApplicationEventBus eventBus, ProvisionerConfig config) {
        this.registry = registry;
        this.stateManager = stateManager;
        this.rollbackManager = rollbackManager;
        this.strategy = strategy;
        this.eventBus = eventBus;
        this.config = config;
    }

    /**
     * @throws DependencyGraphException if the manifest or the module graph is
     *                                  invalid; nothing has been executed or
     *                                  persisted in that case
     */
    public InstallationReport install(InstallOptions options) throws DependencyGraphException {
        registry.getManifest().validate();

        List<String> selection = options.modules().isEmpty() ? config.getEnabledModules() : options.modules();
        List<ModuleDescriptor> descriptors = registry.resolve(selection);
        DependencyGraph graph = new DependencyGraph();
        for (ModuleDescriptor descriptor : descriptors) {
            graph.addModule(descriptor.name(), descriptor.dependsOn(), descriptor.forceSequential());
        }
        graph.validate();
        List<Set<String>> batches = graph.getParallelBatches();

        boolean dryRun = options.dryRun() || config.getExecution().isDryRun();
        Set<String> completed = new LinkedHashSet<>();
        Optional<InstallationState> resumedState = options.resume() ? resume(completed) : Optional.empty();
        boolean resumed = resumedState.isPresent();
        InstallationState installation = resumedState
                .orElseGet(() -> stateManager.startInstallation(options.profile(), options.metadata()));

        LOG.info("Installing {} module(s) in {} batch(es){}", descriptors.size(), batches.size(),
                dryRun ? " (dry run)" : "");
        eventBus.post(new ProvisioningEvents.InstallationStartedEvent(installation.installationId(),
                installation.profile(), resumed));

        ExecutionSession session = new ExecutionSession();
        ProgressCallback callback = this::onModuleEvent;
        Map<String, ExecutionResult> results = new LinkedHashMap<>();
        boolean failed = false;

        for (int i = 0; i < batches.size(); i++) {
            Set<String> batch = batches.get(i);
            List<ExecutionContext> contexts = new ArrayList<>();
            for (String name : batch) {
                if (completed.contains(name)) {
                    LOG.info("Skipping {}: already completed", name);
                    continue;
                }
                contexts.add(contextFor(registry.get(name).orElseThrow(), options, dryRun));
            }
            if (contexts.isEmpty()) {
                continue;
            }

            LOG.info("Batch {}/{}: {}", i + 1, batches.size(), String.join(", ", batch));
            eventBus.post(new ProvisioningEvents.BatchStartedEvent(i + 1, batches.size(), batch));

            Map<String, ExecutionResult> batchResults = strategy.execute(contexts, session, callback);
            results.putAll(batchResults);

            if (batchResults.values().stream().anyMatch(result -> !result.success())) {
                LOG.error("Batch {} failed, stopping installation", i + 1);
                failed = true;
                break;
            }
        }

        boolean success = !failed;
        stateManager.completeInstallation(success);
        eventBus.post(new ProvisioningEvents.InstallationFinishedEvent(installation.installationId(), success));

        String rollbackSummary = null;
        RollbackOutcome rollback = null;
        if (!success && config.getExecution().isAutoRollback()) {
            rollbackSummary = rollbackManager.getSummary();
            LOG.warn("Installation failed, rolling back. {}", rollbackSummary);
            rollback = rollbackManager.rollback(dryRun);
            eventBus.post(new ProvisioningEvents.RollbackFinishedEvent(rollback.success(), rollbackSummary));
        }

        return new InstallationReport(installation.installationId(), success, resumed, batches, completed,
                results, session.getExecutionStats(), rollbackSummary, rollback);
    }

    /**
     * Undoes every pending rollback action, including those left over from a
     * previous run.
     */
    public RollbackOutcome rollback(boolean dryRun) {
        if (!rollbackManager.hasPendingActions()) {
            rollbackManager.loadState();
        }
        String summary = rollbackManager.getSummary();
        LOG.info("Explicit rollback requested. {}", summary);
        RollbackOutcome outcome = rollbackManager.rollback(dryRun);
        eventBus.post(new ProvisioningEvents.RollbackFinishedEvent(outcome.success(), summary));
        return outcome;
    }

    // Collects the modules the interrupted run already finished into completed
    private Optional<InstallationState> resume(Set<String> completed) {
        if (!stateManager.canResume()) {
            LOG.info("Nothing to resume, starting a new installation");
            return Optional.empty();
        }
        Optional<InstallationState> resumed = stateManager.resumeInstallation();
        resumed.ifPresent(installation -> {
            for (ModuleState module : installation.modules().values()) {
                if (module.status() == ModuleStatus.COMPLETED) {
                    completed.add(module.name());
                }
            }
            rollbackManager.loadState();
            LOG.info("Resuming installation {}: {} module(s) already completed",
                    installation.installationId(), completed.size());
        });
        return resumed;
    }

    private ExecutionContext contextFor(ModuleDescriptor descriptor, InstallOptions options, boolean dryRun) {
        String name = descriptor.name();
        Map<String, Object> moduleConfig = new LinkedHashMap<>(config.getModuleConfig(name));
        moduleConfig.putAll(options.moduleConfig().getOrDefault(name, Map.of()));

        return ExecutionContext.of(descriptor, moduleConfig, dryRun)
                .withRollback(new ModuleRollbackLog(name, rollbackManager, stateManager))
                .withCheckpoints(checkpoint -> stateManager.createCheckpoint(name, checkpoint));
    }

    private void onModuleEvent(String module, ModuleEvent event, Map<String, Object> data) {
        switch (event) {
            case STARTED -> stateManager.updateModule(module, ModuleStatus.RUNNING, 0, event.wireName(), null);
            case COMPLETED -> stateManager.updateModule(module, ModuleStatus.COMPLETED, 100,
                    event.wireName(), null);
            case FAILED -> stateManager.updateModule(module, ModuleStatus.FAILED, null, event.wireName(),
                    String.valueOf(data.getOrDefault("error", "unknown error")));
            default -> stateManager.updateModule(module, null, STAGE_PROGRESS.get(event), event.wireName(),
                    null);
        }
        eventBus.post(new ProvisioningEvents.ModuleProgressEvent(module, event.wireName(), data));
    }
}
