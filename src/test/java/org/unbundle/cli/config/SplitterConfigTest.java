package org.unbundle.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.unbundle.splitter.SplitterOptions;
import org.unbundle.splitter.api.ModuleTransformation;

import java.io.File;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class SplitterConfigTest {

    @BeforeEach
    void setUp() {
        ConfigFactory.invalidateCaches();
    }

    @Test
    void mapsFileSettingsToOptions() throws URISyntaxException {
        Config config = ConfigLoader.loadFromFile(
                new File(SplitterConfigTest.class.getClassLoader().getResource("test-config.conf").toURI()));

        SplitterOptions options = SplitterConfig.toOptions(config);

        assertThat(options.esmDefaultExports()).isFalse();
        assertThat(options.includeVariableDeclarationComments()).isTrue();
        assertThat(options.includeVariableReferenceComments()).isFalse();
        assertThat(options.graph()).isNull();
        assertThat(options.outputDirectory()).isEqualTo(Path.of("build/split"));
        assertThat(options.moduleTransformations()).containsOnlyKeys("2002", "3004");
        assertThat(options.moduleTransformations().get("2002"))
                .isEqualTo(new ModuleTransformation("react", Map.of(0, "createElement")));
        assertThat(options.moduleTransformations().get("3004").renameModule()).isNull();
        assertThat(options.moduleTransformations().get("3004").renameVariables()).containsEntry(1, "delete");
        assertThat(SplitterConfig.graphFile(config)).contains(Path.of("build/split/graph.json"));
    }

    @Test
    void missingKeysFallBackToDefaults() {
        Config config = ConfigFactory.empty();

        SplitterOptions options = SplitterConfig.toOptions(config);

        assertThat(options.esmDefaultExports()).isTrue();
        assertThat(options.includeVariableDeclarationComments()).isFalse();
        assertThat(options.moduleTransformations()).isEmpty();
        assertThat(options.output()).isEmpty();
        assertThat(SplitterConfig.graphFile(config)).isEmpty();
    }

    @Test
    void blankPathsDisableOutput() {
        Config config = ConfigFactory.parseString("unbundle.output { directory = \"\", graph-file = \" \" }");

        assertThat(SplitterConfig.outputDirectory(config)).isEmpty();
        assertThat(SplitterConfig.graphFile(config)).isEmpty();
    }

    @Test
    void transformationMustBeAnObject() {
        Config config = ConfigFactory.parseString("unbundle.module-transformations { \"1\" = 5 }");

        assertThatThrownBy(() -> SplitterConfig.moduleTransformations(config))
                .isInstanceOf(ConfigException.WrongType.class);
    }

    @Test
    void variableIndexMustBeNumeric() {
        Config config = ConfigFactory.parseString(
                "unbundle.module-transformations { \"1\" { rename-variables { first = \"a\" } } }");

        assertThatThrownBy(() -> SplitterConfig.moduleTransformations(config))
                .isInstanceOf(ConfigException.BadValue.class)
                .hasMessageContaining("first");
    }
}
