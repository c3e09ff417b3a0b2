package org.unbundle.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigObject;
import com.typesafe.config.ConfigValue;
import com.typesafe.config.ConfigValueType;
import org.unbundle.splitter.SplitterOptions;
import org.unbundle.splitter.api.ModuleTransformation;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Maps the {@code unbundle} configuration block to {@link SplitterOptions}.
 *
 * <pre>
 * unbundle {
 *   esm-default-exports = true
 *   comments { variable-declarations = false, variable-references = false }
 *   module-transformations {
 *     "4711" { rename-module = "react", rename-variables { "0" = "createElement" } }
 *   }
 *   output { directory = "out", graph-file = "out/graph.json" }
 * }
 * </pre>
 */
public final class SplitterConfig {

    public static final String ROOT = "unbundle";

    private static final String ESM_DEFAULT_EXPORTS = ROOT + ".esm-default-exports";
    private static final String DECLARATION_COMMENTS = ROOT + ".comments.variable-declarations";
    private static final String REFERENCE_COMMENTS = ROOT + ".comments.variable-references";
    private static final String MODULE_TRANSFORMATIONS = ROOT + ".module-transformations";
    private static final String OUTPUT_DIRECTORY = ROOT + ".output.directory";
    private static final String GRAPH_FILE = ROOT + ".output.graph-file";

    private static final String RENAME_MODULE = "rename-module";
    private static final String RENAME_VARIABLES = "rename-variables";

    private SplitterConfig() {
    }

    /**
     * Builds splitter options from the resolved configuration. The graph sink is left unset.
     *
     * @throws ConfigException If a value has the wrong type.
     */
    public static SplitterOptions toOptions(Config config) {
        return SplitterOptions.defaults()
                .withEsmDefaultExports(getBoolean(config, ESM_DEFAULT_EXPORTS, true))
                .withVariableComments(
                        getBoolean(config, DECLARATION_COMMENTS, false),
                        getBoolean(config, REFERENCE_COMMENTS, false))
                .withModuleTransformations(moduleTransformations(config))
                .withOutputDirectory(outputDirectory(config).orElse(null));
    }

    public static Optional<Path> outputDirectory(Config config) {
        return optionalPath(config, OUTPUT_DIRECTORY);
    }

    public static Optional<Path> graphFile(Config config) {
        return optionalPath(config, GRAPH_FILE);
    }

    /**
     * Reads the rename table, keyed by module id as written in the bundle.
     *
     * @throws ConfigException If an entry is not an object or a variable index is not a number.
     */
    public static Map<String, ModuleTransformation> moduleTransformations(Config config) {
        if (!config.hasPath(MODULE_TRANSFORMATIONS)) {
            return Map.of();
        }
        Map<String, ModuleTransformation> transformations = new LinkedHashMap<>();
        for (Map.Entry<String, ConfigValue> entry : config.getObject(MODULE_TRANSFORMATIONS).entrySet()) {
            ConfigValue value = entry.getValue();
            if (value.valueType() != ConfigValueType.OBJECT) {
                throw new ConfigException.WrongType(value.origin(),
                        MODULE_TRANSFORMATIONS + "." + entry.getKey(), "object", value.valueType().name());
            }
            Config transformation = ((ConfigObject) value).toConfig();
            String renameModule = transformation.hasPath(RENAME_MODULE) ? transformation.getString(RENAME_MODULE) : null;
            transformations.put(entry.getKey(), new ModuleTransformation(renameModule,
                    variableRenames(transformation, entry.getKey())));
        }
        return transformations;
    }

    private static Map<Integer, String> variableRenames(Config transformation, String moduleKey) {
        if (!transformation.hasPath(RENAME_VARIABLES)) {
            return Map.of();
        }
        Map<Integer, String> renames = new LinkedHashMap<>();
        for (Map.Entry<String, ConfigValue> entry : transformation.getObject(RENAME_VARIABLES).entrySet()) {
            int index;
            try {
                index = Integer.parseInt(entry.getKey());
            } catch (NumberFormatException e) {
                throw new ConfigException.BadValue(entry.getValue().origin(),
                        MODULE_TRANSFORMATIONS + "." + moduleKey + "." + RENAME_VARIABLES,
                        "variable index must be a number, got '" + entry.getKey() + "'");
            }
            renames.put(index, String.valueOf(entry.getValue().unwrapped()));
        }
        return renames;
    }

    private static boolean getBoolean(Config config, String path, boolean fallback) {
        return config.hasPath(path) ? config.getBoolean(path) : fallback;
    }

    private static Optional<Path> optionalPath(Config config, String path) {
        if (!config.hasPath(path) || config.getString(path).isBlank()) {
            return Optional.empty();
        }
        return Optional.of(Path.of(config.getString(path)));
    }
}
