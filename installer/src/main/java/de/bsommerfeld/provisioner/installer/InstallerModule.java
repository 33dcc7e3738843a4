package de.bsommerfeld.provisioner.installer;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import de.bsommerfeld.provisioner.core.config.ApplicationMode;
import de.bsommerfeld.provisioner.core.config.ConfigLoader;
import de.bsommerfeld.provisioner.core.config.ExecutionConfig;
import de.bsommerfeld.provisioner.core.config.ProvisionerConfig;
import de.bsommerfeld.provisioner.core.graph.ModuleManifest;
import de.bsommerfeld.provisioner.core.util.StorageUtils;
import de.bsommerfeld.provisioner.db.InMemoryStateStore;
import de.bsommerfeld.provisioner.db.SqlStateStore;
import de.bsommerfeld.provisioner.db.StateStore;
import de.bsommerfeld.provisioner.execution.ExecutionStrategy;
import de.bsommerfeld.provisioner.execution.HybridStrategy;
import de.bsommerfeld.provisioner.rollback.ProcessCommandRunner;
import de.bsommerfeld.provisioner.rollback.RollbackManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Guice wiring for the installer.
 */
public class InstallerModule extends AbstractModule {

    private static final Logger LOG = LoggerFactory.getLogger(InstallerModule.class);

    private final ProvisionerConfig config;
    private final ApplicationMode mode;

    public InstallerModule(ProvisionerConfig config, ApplicationMode mode) {
        this.config = config;
        this.mode = mode;
    }

    /**
     * Loads {@code config.toml} from the application data directory and
     * picks the mode from the environment.
     */
    public static InstallerModule fromEnvironment() {
        Path configPath = StorageUtils.getAppDataDir(StorageUtils.APP_NAME).resolve("config.toml");
        return new InstallerModule(ConfigLoader.load(configPath), ApplicationMode.get());
    }

    @Override
    protected void configure() {
        LOG.info("Application Mode initialized: {}", mode);

        bind(ProvisionerConfig.class).toInstance(config);
        bind(ExecutionConfig.class).toInstance(config.getExecution());
        bind(ModuleManifest.class).toInstance(ModuleManifest.defaults());

        if (!mode.isPersistent()) {
            // Nothing is written to the state database in test mode
            bind(StateStore.class).to(InMemoryStateStore.class);
        } else {
            bind(StateStore.class).to(SqlStateStore.class);
        }
    }

    @Provides
    @Singleton
    SqlStateStore provideSqlStateStore() {
        return new SqlStateStore(SqlStateStore.resolveDatabasePath(config.getState()));
    }

    @Provides
    @Singleton
    RollbackManager provideRollbackManager() {
        Path stateFile;
        String configured = config.getRollback().getStateFile();
        if (!mode.isPersistent() && (configured == null || configured.isBlank())) {
            try {
                stateFile = Files.createTempDirectory("provisioner-test").resolve(RollbackManager.STATE_FILE);
            } catch (IOException e) {
                throw new UncheckedIOException("Could not create a temporary rollback directory", e);
            }
        } else {
            stateFile = RollbackManager.resolveStateFile(config.getRollback());
        }
        Duration timeout = Duration.ofSeconds(config.getRollback().getCommandTimeoutSeconds());
        return new RollbackManager(stateFile, new ProcessCommandRunner(timeout));
    }

    @Provides
    @Singleton
    ExecutionStrategy provideExecutionStrategy() {
        return new HybridStrategy(config.getExecution().getMaxWorkers());
    }
}
