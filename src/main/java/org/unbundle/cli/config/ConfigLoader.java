package org.unbundle.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.io.File;
import java.net.URISyntaxException;
import java.nio.file.FileSystemNotFoundException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.CodeSource;
import java.util.Optional;

/**
 * Loads the HOCON configuration of the command line tool.
 * <p>
 * Layers, highest precedence first:
 * <ol>
 *   <li>Java system properties ({@code -Dunbundle.output.directory=out})</li>
 *   <li>Environment variables</li>
 *   <li>The user configuration file found by {@link #resolve(File, ConfigMessageHandler)}</li>
 *   <li>{@code reference.conf} on the classpath</li>
 * </ol>
 * Substitutions are resolved after all layers are merged, so a user override of a value that
 * {@code reference.conf} refers to propagates to every reference.
 */
public final class ConfigLoader {

    static final String CONFIG_DIR = "config";
    static final String CONFIG_FILE_NAME = "unbundle.conf";

    private ConfigLoader() {
    }

    /**
     * Severity of a resolution message.
     */
    public enum MessageLevel {
        INFO,
        WARN
    }

    /**
     * Receives messages describing which configuration source was picked.
     */
    @FunctionalInterface
    public interface ConfigMessageHandler {
        void log(MessageLevel level, String message);
    }

    /**
     * Finds and loads the user configuration. The first existing candidate wins:
     * <ol>
     *   <li>the file given with {@code --config}</li>
     *   <li>the file named by {@code -Dconfig.file}</li>
     *   <li>{@code config/unbundle.conf} in the working directory</li>
     *   <li>{@code config/unbundle.conf} in the installation directory (parent of the jar's directory)</li>
     *   <li>none: classpath defaults only</li>
     * </ol>
     *
     * @param explicitConfigFile The {@code --config} file, or null.
     * @param handler            Receives a message naming the chosen source.
     * @return The resolved configuration.
     * @throws IllegalArgumentException            If an explicitly named file does not exist.
     * @throws com.typesafe.config.ConfigException If a file cannot be parsed or resolved.
     */
    public static Config resolve(File explicitConfigFile, ConfigMessageHandler handler) {
        if (explicitConfigFile != null) {
            Path explicit = explicitConfigFile.toPath().toAbsolutePath();
            if (!Files.exists(explicit)) {
                throw new IllegalArgumentException("Configuration file not found: " + explicit);
            }
            handler.log(MessageLevel.INFO, "Using configuration file specified via --config: " + explicit);
            return loadFromFile(explicit.toFile());
        }

        String systemConfigPath = System.getProperty("config.file");
        if (systemConfigPath != null && !systemConfigPath.isBlank()) {
            Path systemConfig = Path.of(systemConfigPath).toAbsolutePath();
            if (!Files.exists(systemConfig)) {
                throw new IllegalArgumentException(
                        "Configuration file specified via -Dconfig.file not found: " + systemConfig);
            }
            handler.log(MessageLevel.INFO, "Using configuration file specified via -Dconfig.file: " + systemConfig);
            return loadFromFile(systemConfig.toFile());
        }

        Path workingDirConfig = Path.of(CONFIG_DIR, CONFIG_FILE_NAME);
        if (Files.exists(workingDirConfig)) {
            handler.log(MessageLevel.INFO,
                    "Using configuration file found in current directory: " + workingDirConfig.toAbsolutePath());
            return loadFromFile(workingDirConfig.toFile());
        }

        Optional<Path> installationConfig = installationConfigFile();
        if (installationConfig.isPresent()) {
            handler.log(MessageLevel.INFO,
                    "Using configuration file from installation directory: " + installationConfig.get());
            return loadFromFile(installationConfig.get().toFile());
        }

        handler.log(MessageLevel.WARN, "No '" + CONFIG_DIR + "/" + CONFIG_FILE_NAME
                + "' found, using default configuration from classpath");
        return loadDefaults();
    }

    static Config loadFromFile(File configFile) {
        return ConfigFactory.systemProperties()
                .withFallback(ConfigFactory.systemEnvironment())
                .withFallback(ConfigFactory.parseFile(configFile))
                .withFallback(ConfigFactory.defaultReferenceUnresolved())
                .resolve();
    }

    static Config loadDefaults() {
        return ConfigFactory.systemProperties()
                .withFallback(ConfigFactory.systemEnvironment())
                .withFallback(ConfigFactory.defaultReferenceUnresolved())
                .resolve();
    }

    // APP_HOME/lib/unbundle.jar -> APP_HOME/config/unbundle.conf
    private static Optional<Path> installationConfigFile() {
        CodeSource codeSource = ConfigLoader.class.getProtectionDomain().getCodeSource();
        if (codeSource == null || codeSource.getLocation() == null) {
            return Optional.empty();
        }
        Path location;
        try {
            location = Path.of(codeSource.getLocation().toURI());
        } catch (URISyntaxException | IllegalArgumentException | FileSystemNotFoundException e) {
            return Optional.empty();
        }
        Path appHome = Files.isRegularFile(location) ? parentOf(location.getParent()) : location;
        if (appHome == null) {
            return Optional.empty();
        }
        Path candidate = appHome.resolve(CONFIG_DIR).resolve(CONFIG_FILE_NAME);
        return Files.exists(candidate) ? Optional.of(candidate) : Optional.empty();
    }

    private static Path parentOf(Path path) {
        return path == null ? null : path.getParent();
    }
}
