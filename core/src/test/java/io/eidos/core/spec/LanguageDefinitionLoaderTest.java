package io.eidos.core.spec;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.eidos.core.error.ConfigLoadException;
import io.eidos.core.error.TranspileException;
import io.eidos.core.model.BlockRule;
import io.eidos.core.model.LanguageDefinition;
import io.eidos.core.model.OperatorRule;
import io.eidos.core.model.StatementRule;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Tests for {@link LanguageDefinitionLoader}. Valid YAML and JSON documents load into the expected
 * rules; every kind of broken document fails with a {@link ConfigLoadException} naming its source.
 */
class LanguageDefinitionLoaderTest {

    private final LanguageDefinitionLoader loader = new LanguageDefinitionLoader();

    @Nested
    @DisplayName("Valid documents")
    class Valid {

        @Test
        void yamlFixtureLoadsAllThreeMappings() {
            LanguageDefinition definition = loader.load(fixturePath("c-like.yaml"));

            assertThat(definition.statements()).containsOnlyKeys("assignment", "increment", "print");
            assertThat(definition.statement("print"))
                    .hasValue(new StatementRule("print ", "printf(\"%d\\n\", {0});"));
            assertThat(definition.block("loop")).hasValue(new BlockRule("while", "end", "while (1) {\n{body}}"));
            assertThat(definition.blocks()).containsOnlyKeys("if", "loop");
            assertThat(definition.operators()).containsEntry("add", new OperatorRule("+", "({0} + {1})"));
            assertThat(definition.hasDefaultStatement()).isTrue();
        }

        @Test
        void jsonFixtureWithSyntaxAliasLoads() {
            LanguageDefinition definition = loader.load(fixturePath("python-like.json"));

            assertThat(definition.statement("assignment")).hasValue(new StatementRule("let ", "{0} = {2}"));
            assertThat(definition.block("loop")).hasValue(new BlockRule("while", "end", "while True:\n{body}"));
            assertThat(definition.operators()).isEmpty();
        }

        @Test
        void emptyMappingsAreAllowed() {
            LanguageDefinition definition = loader.parse("statements: {}\nblocks: {}\noperators: {}\n", "empty.yaml");

            assertThat(definition.statements()).isEmpty();
            assertThat(definition.blocks()).isEmpty();
            assertThat(definition.hasDefaultStatement()).isFalse();
        }

        @Test
        void prefixesKeepTrailingWhitespace() {
            LanguageDefinition definition = loader.parse("""
                    statements:
                      call: { pattern: "call  ", template: "{0}()" }
                    blocks:
                      group: { start: "begin ", end: " end", template: "{body}" }
                    operators: {}
                    """, "ws.yaml");

            assertThat(definition.statement("call").orElseThrow().pattern()).isEqualTo("call  ");
            assertThat(definition.block("group").orElseThrow().end()).isEqualTo(" end");
        }

        @Test
        void loadsFromFileSystem(@TempDir Path tempDir) throws IOException {
            Path file = tempDir.resolve("lang.yml");
            Files.writeString(file, """
                    statements:
                      print: { pattern: "say ", template: "output({0});" }
                    blocks:
                      loop: { start: "repeat", end: "until", template: "while(1){{body}}" }
                    operators: {}
                    """);

            LanguageDefinition definition = loader.load(file);

            assertThat(definition.statementMatchOrder()).containsExactly("print");
            assertThat(definition.blockStartMatchOrder()).containsExactly("loop");
        }

        @Test
        void tabIndentedJsonLoads() {
            LanguageDefinition definition = loader.load(fixturePath("tab-indented.json"));

            assertThat(definition.statement("print")).hasValue(new StatementRule("echo ", "echo {0};"));
            assertThat(definition.block("loop")).hasValue(new BlockRule("repeat", "done", "loop {\n{body}}"));
            assertThat(definition.operators()).containsEntry("sub", new OperatorRule("-", "({0} - {1})"));
        }

        @Test
        void inlineJsonRecognisedByLeadingBrace() {
            LanguageDefinition definition = loader.parse(
                    "{\n\t\"statements\": {},\n\t\"blocks\": {},\n\t\"operators\": {}\n}", "inline");

            assertThat(definition.statements()).isEmpty();
            assertThat(definition.operators()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Invalid documents")
    class Invalid {

        @Test
        void missingFileFails() {
            Path missing = Path.of("src/test/resources/definitions/does-not-exist.yaml");

            assertThatThrownBy(() -> loader.load(missing))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("not found")
                    .satisfies(ex -> {
                        ConfigLoadException cle = (ConfigLoadException) ex;
                        assertThat(cle.phase()).isEqualTo(TranspileException.Phase.LOAD);
                        assertThat(cle.source()).isEqualTo(missing.toString());
                    });
        }

        @Test
        void directoryIsNotADefinition(@TempDir Path tempDir) {
            assertThatThrownBy(() -> loader.load(tempDir)).isInstanceOf(ConfigLoadException.class);
        }

        @Test
        void unknownKeyRejectedBySchema() {
            assertThatThrownBy(() -> loader.load(invalidFixturePath("unknown-key.yaml")))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageStartingWith("Invalid language definition")
                    .hasMessageContaining("priority");
        }

        @Test
        void missingBlocksRejectedBySchema() {
            assertThatThrownBy(() -> loader.load(invalidFixturePath("missing-blocks.yaml")))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("blocks");
        }

        @Test
        void missingOperatorsRejectedBySchema() {
            assertThatThrownBy(() -> loader.parse("statements: {}\nblocks: {}\n", "no-ops.yaml"))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageStartingWith("Invalid language definition")
                    .hasMessageContaining("operators");
        }

        @Test
        void duplicateJsonKeyRejected() {
            String json = "{\"statements\": {}, \"blocks\": {}, \"blocks\": {}, \"operators\": {}}";

            assertThatThrownBy(() -> loader.parse(json, "dup.json"))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageStartingWith("Failed to parse language definition")
                    .hasMessageContaining("blocks");
        }

        @Test
        void emptyPrefixRejected() {
            assertThatThrownBy(() -> loader.load(invalidFixturePath("empty-prefix.yaml")))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("blocks.loop.start")
                    .hasMessageContaining("must not be empty");
        }

        @Test
        void duplicateRuleNameRejected() {
            assertThatThrownBy(() -> loader.load(invalidFixturePath("duplicate-rule.yaml")))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("print");
        }

        @Test
        void malformedYamlRejected() {
            Path path = invalidFixturePath("syntax-error.yaml");

            assertThatThrownBy(() -> loader.load(path))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageStartingWith("Failed to parse language definition")
                    .satisfies(ex -> assertThat(((ConfigLoadException) ex).source()).isEqualTo(path.toString()));
        }

        @Test
        void scalarRootRejected() {
            assertThatThrownBy(() -> loader.parse("just a string", "scalar.yaml"))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("mapping");
        }

        @Test
        void emptyDocumentRejected() {
            assertThatThrownBy(() -> loader.parse("", "empty.yaml")).isInstanceOf(ConfigLoadException.class);
        }

        @Test
        void statementWithoutPatternRejected() {
            assertThatThrownBy(() -> loader.parse("""
                            statements:
                              print: { template: "print({0})" }
                            blocks: {}
                            """, "nopattern.yaml"))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageStartingWith("Invalid language definition");
        }

        @Test
        void mistypedTemplateRejected() {
            assertThatThrownBy(() -> loader.parse("""
                            statements: {}
                            blocks:
                              loop: { start: "while", end: "end", template: [1, 2] }
                            """, "typed.yaml"))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageStartingWith("Invalid language definition");
        }

        @Test
        void operatorWithoutSymbolRejected() {
            assertThatThrownBy(() -> loader.parse("""
                            statements: {}
                            blocks: {}
                            operators:
                              add: { template: "({0} + {1})" }
                            """, "op.yaml"))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("symbol");
        }
    }

    private static Path fixturePath(String filename) {
        return Path.of("src/test/resources/definitions/" + filename);
    }

    private static Path invalidFixturePath(String filename) {
        return Path.of("src/test/resources/definitions/invalid/" + filename);
    }
}
