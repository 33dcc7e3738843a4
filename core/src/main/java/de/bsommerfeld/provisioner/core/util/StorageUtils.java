package de.bsommerfeld.provisioner.core.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;

/**
 * Resolves where the provisioner keeps its state, configuration and logs.
 *
 * <p>
 * Installation state prefers the system location
 * {@code /var/lib/vps-provisioner}, which requires root. When that directory
 * cannot be created or written, the per-user data directory is used:
 * <ul>
 * <li><strong>Linux</strong>: {@code $XDG_DATA_HOME/vps-provisioner}
 * (fallback: {@code ~/.local/share/vps-provisioner})</li>
 * <li><strong>macOS</strong>:
 * {@code ~/Library/Application Support/vps-provisioner}</li>
 * <li><strong>Windows</strong>: {@code %APPDATA%\vps-provisioner}</li>
 * </ul>
 */
public final class StorageUtils {

    private static final Logger LOG = LoggerFactory.getLogger(StorageUtils.class);

    public static final String APP_NAME = "vps-provisioner";

    private static final Path SYSTEM_STATE_ROOT = Paths.get("/var/lib");

    private StorageUtils() {
    }

    /**
     * Returns the per-user data directory for {@code appName}. The directory
     * is not created.
     */
    public static Path getAppDataDir(String appName) {
        String os = System.getProperty("os.name", "generic").toLowerCase(Locale.ENGLISH);

        if (os.contains("mac") || os.contains("darwin")) {
            return Paths.get(System.getProperty("user.home"), "Library", "Application Support", appName);
        }
        if (os.contains("win")) {
            String appData = System.getenv("APPDATA");
            return appData != null
                    ? Paths.get(appData, appName)
                    : Paths.get(System.getProperty("user.home"), "AppData", "Roaming", appName);
        }
        String xdgData = System.getenv("XDG_DATA_HOME");
        if (xdgData != null && !xdgData.isEmpty()) {
            return Paths.get(xdgData, appName);
        }
        return Paths.get(System.getProperty("user.home"), ".local", "share", appName);
    }

    public static Path getLogsDir(String appName) {
        return getAppDataDir(appName).resolve("logs");
    }

    /**
     * Returns the directory for the state database and the rollback file,
     * creating it if needed. Tries {@code /var/lib/<appName>} first and falls
     * back to {@link #getAppDataDir(String)}.
     */
    public static Path resolveStateDir(String appName) {
        return resolveStateDir(SYSTEM_STATE_ROOT.resolve(appName), getAppDataDir(appName));
    }

    static Path resolveStateDir(Path preferred, Path fallback) {
        if (isUsableDirectory(preferred)) {
            return preferred;
        }
        LOG.info("Cannot write to {}, using fallback: {}", preferred, fallback);
        try {
            Files.createDirectories(fallback);
        } catch (IOException e) {
            LOG.error("Failed to create state directory {}", fallback, e);
        }
        return fallback;
    }

    private static boolean isUsableDirectory(Path dir) {
        try {
            Files.createDirectories(dir);
            return Files.isWritable(dir);
        } catch (IOException | SecurityException e) {
            return false;
        }
    }
}
