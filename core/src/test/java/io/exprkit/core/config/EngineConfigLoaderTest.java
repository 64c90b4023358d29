package io.exprkit.core.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.exprkit.core.engine.ExpressionOption;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

/** Tests for {@link EngineConfigLoader}: YAML mapping, defaults and the environment overlay. */
class EngineConfigLoaderTest {

    @TempDir
    Path tempDir;

    private final Map<String, String> env = new HashMap<>();

    private Path writeConfig(String yaml) throws IOException {
        Path path = tempDir.resolve("exprkit.yaml");
        Files.writeString(path, yaml);
        return path;
    }

    private EngineConfig load(String yaml) throws IOException {
        return EngineConfigLoader.load(writeConfig(yaml), env::get);
    }

    @Nested
    @DisplayName("YAML mapping")
    class YamlMapping {

        @Test
        @DisplayName("Full configuration maps every key")
        void fullConfiguration() throws IOException {
            EngineConfig config = load("""
                    engine:
                      options: [bool-symbols, pure-symbols]
                      cache-enabled: false
                    parser:
                      max-nesting-depth: 32
                      max-tree-depth: 64
                      max-source-length: 1024
                    constants:
                      e: 2.5
                      gutter: 8
                    arrays:
                      a: [10, 20, 30]
                    """);

            assertThat(config.options()).containsExactlyInAnyOrder(
                    ExpressionOption.BOOL_SYMBOLS, ExpressionOption.PURE_SYMBOLS);
            assertThat(config.cacheEnabled()).isFalse();
            assertThat(config.maxNestingDepth()).isEqualTo(32);
            assertThat(config.maxTreeDepth()).isEqualTo(64);
            assertThat(config.maxSourceLength()).isEqualTo(1024);
            assertThat(config.constants()).containsEntry("e", 2.5).containsEntry("gutter", 8.0);
            assertThat(config.arrays()).containsEntry("a", List.of(10.0, 20.0, 30.0));
        }

        @Test
        @DisplayName("Missing keys keep the defaults")
        void defaults() throws IOException {
            EngineConfig config = load("""
                    engine: {}
                    """);

            assertThat(config).isEqualTo(EngineConfig.DEFAULT);
        }

        @Test
        @DisplayName("Option names are case-insensitive")
        void optionNamesCaseInsensitive() throws IOException {
            EngineConfig config = load("""
                    engine:
                      options: [NO-OPTIMIZE]
                    """);

            assertThat(config.options()).containsExactly(ExpressionOption.NO_OPTIMIZE);
        }
    }

    @Nested
    @DisplayName("Environment overlay")
    class EnvironmentOverlay {

        private static final String YAML = """
                engine:
                  options: [bool-symbols]
                  cache-enabled: true
                parser:
                  max-nesting-depth: 32
                  max-source-length: 1024
                """;

        @Test
        @DisplayName("Set variables override YAML values")
        void overridesYaml() throws IOException {
            env.put("EXPRKIT_OPTIONS", "no-optimize, pure-symbols");
            env.put("EXPRKIT_CACHE_ENABLED", "false");
            env.put("EXPRKIT_MAX_NESTING_DEPTH", "12");
            env.put("EXPRKIT_MAX_TREE_DEPTH", "200");
            env.put("EXPRKIT_MAX_SOURCE_LENGTH", " 64 ");

            EngineConfig config = load(YAML);

            assertThat(config.options())
                    .isEqualTo(EnumSet.of(ExpressionOption.NO_OPTIMIZE, ExpressionOption.PURE_SYMBOLS));
            assertThat(config.cacheEnabled()).isFalse();
            assertThat(config.maxNestingDepth()).isEqualTo(12);
            assertThat(config.maxTreeDepth()).isEqualTo(200);
            assertThat(config.maxSourceLength()).isEqualTo(64);
        }

        @Test
        @DisplayName("Blank variables count as unset")
        void blankIsUnset() throws IOException {
            env.put("EXPRKIT_OPTIONS", "   ");
            env.put("EXPRKIT_MAX_NESTING_DEPTH", "");

            EngineConfig config = load(YAML);

            assertThat(config.options()).containsExactly(ExpressionOption.BOOL_SYMBOLS);
            assertThat(config.maxNestingDepth()).isEqualTo(32);
        }

        @Test
        @DisplayName("Non-numeric limit is rejected")
        void invalidNumber() {
            env.put("EXPRKIT_MAX_NESTING_DEPTH", "deep");

            assertThatThrownBy(() -> load(YAML))
                    .isInstanceOf(EngineConfigException.class)
                    .hasMessageContaining("Invalid configuration");
        }
    }

    @Nested
    @DisplayName("Errors")
    class Errors {

        @Test
        void missingFile() {
            Path missing = tempDir.resolve("absent.yaml");

            assertThatThrownBy(() -> EngineConfigLoader.load(missing, env::get))
                    .isInstanceOf(EngineConfigException.class)
                    .hasMessage("Configuration file not found: " + missing);
        }

        @Test
        void malformedYaml() {
            assertThatThrownBy(() -> load("engine: [unclosed\n"))
                    .isInstanceOf(EngineConfigException.class)
                    .hasMessageStartingWith("Failed to parse YAML configuration")
                    .hasCauseInstanceOf(IOException.class);
        }

        @Test
        void unknownOption() {
            assertThatThrownBy(() -> load("""
                    engine:
                      options: [turbo]
                    """))
                    .isInstanceOf(EngineConfigException.class)
                    .hasMessageContaining("Unknown expression option: 'turbo'");
        }

        @Test
        void optionsMustBeAList() {
            assertThatThrownBy(() -> load("""
                    engine:
                      options: bool-symbols
                    """))
                    .isInstanceOf(EngineConfigException.class)
                    .hasMessage("'engine.options' must be a list of option names");
        }

        @Test
        void invalidConstantName() {
            assertThatThrownBy(() -> load("""
                    constants:
                      1x: 3
                    """))
                    .isInstanceOf(EngineConfigException.class)
                    .hasMessageContaining("Invalid constant name: '1x'");
        }

        @Test
        void nonNumericConstant() {
            assertThatThrownBy(() -> load("""
                    constants:
                      e: abc
                    """))
                    .isInstanceOf(EngineConfigException.class)
                    .hasMessageStartingWith("'constants.e' must be a number");
        }

        @Test
        void nonNumericArrayElement() {
            assertThatThrownBy(() -> load("""
                    arrays:
                      a: [1, two]
                    """))
                    .isInstanceOf(EngineConfigException.class)
                    .hasMessageStartingWith("'arrays.a' must be a number");
        }

        @Test
        void fractionalLimit() {
            assertThatThrownBy(() -> load("""
                    parser:
                      max-nesting-depth: 2.5
                    """))
                    .isInstanceOf(EngineConfigException.class)
                    .hasMessageStartingWith("'parser.max-nesting-depth' must be an integer");
        }

        @Test
        void nonPositiveLimit() {
            assertThatThrownBy(() -> load("""
                    parser:
                      max-source-length: 0
                    """))
                    .isInstanceOf(EngineConfigException.class)
                    .hasMessageContaining("maxSourceLength must be positive");
        }
    }

    @Test
    @DisplayName("Successful load is logged at INFO")
    void logsLoadedConfiguration() throws IOException {
        Logger logger = (Logger) LoggerFactory.getLogger(EngineConfigLoader.class);
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
        try {
            Path path = writeConfig("""
                    constants:
                      e: 2.5
                    """);

            EngineConfigLoader.load(path, env::get);

            assertThat(appender.list)
                    .filteredOn(event -> event.getLevel() == Level.INFO)
                    .extracting(ILoggingEvent::getFormattedMessage)
                    .containsExactly("Loaded engine configuration from " + path
                            + " (options=[], constants=1, arrays=0, cacheEnabled=true)");
        } finally {
            logger.detachAppender(appender);
            appender.stop();
        }
    }
}
