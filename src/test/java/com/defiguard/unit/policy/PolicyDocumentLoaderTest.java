package com.defiguard.unit.policy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.defiguard.exception.ConfigurationException;
import com.defiguard.policy.PolicyDocument;
import com.defiguard.policy.PolicyDocumentLoader;
import com.defiguard.policy.PolicyMode;
import com.defiguard.policy.PolicyRule;
import com.defiguard.tool.ToolName;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;

/**
 * Unit tests for PolicyDocumentLoader: the accepted document shape and every defect that
 * must be rejected as a fatal configuration error.
 */
class PolicyDocumentLoaderTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private PolicyDocument parse(String json) {
        return new PolicyDocumentLoader(
                        objectMapper,
                        new ByteArrayResource(json.getBytes(StandardCharsets.UTF_8), "inline policy"),
                        true,
                        PolicyMode.DEFAULT_DENY)
                .load();
    }

    // ==============================
    // VALID DOCUMENTS
    // ==============================

    @Nested
    @DisplayName("Valid Documents")
    class Valid {

        @Test
        @DisplayName("Rules are read from a classpath document in file order")
        void loadsClasspathDocument() {
            PolicyDocument document = new PolicyDocumentLoader(
                            objectMapper,
                            new ClassPathResource("policy/deny-sign-tx.json"),
                            true,
                            PolicyMode.DEFAULT_DENY)
                    .load();

            assertThat(document.getMode()).isEqualTo(PolicyMode.DEFAULT_ALLOW);
            assertThat(document.getRules())
                    .extracting(PolicyRule::getToolName)
                    .containsExactly(ToolName.WALLET_SIGN_TX, ToolName.ODOS_SWAP);
            PolicyRule deny = document.findRule(ToolName.WALLET_SIGN_TX).orElseThrow();
            assertThat(deny.isAllowed()).isFalse();
            assertThat(deny.getRuleId()).isEqualTo("deny:wallet_sign_tx");
            assertThat(deny.getReason()).isEqualTo("raw transaction signing disabled");
        }

        @Test
        @DisplayName("A rule without a reason gets the default reason")
        void missingReason_defaulted() {
            PolicyDocument document =
                    parse("{\"mode\":\"default-deny\",\"rules\":[{\"tool\":\"odos_swap\",\"allowed\":true}]}");

            PolicyRule rule = document.findRule(ToolName.ODOS_SWAP).orElseThrow();
            assertThat(rule.getReason()).isEqualTo("policy rule");
            assertThat(rule.getRuleId()).isNull();
        }

        @Test
        @DisplayName("tool_name is accepted as an alias for tool")
        void toolNameAlias_accepted() {
            PolicyDocument document = parse(
                    "{\"mode\":\"default-deny\",\"rules\":[{\"tool_name\":\"wallet_derive_address\",\"allowed\":true}]}");

            assertThat(document.findRule(ToolName.WALLET_DERIVE_ADDRESS)).isPresent();
        }

        @Test
        @DisplayName("A document without rules applies its mode to every tool")
        void modeOnly() {
            assertThat(parse("{\"mode\":\"default-allow\"}").getRules()).isEmpty();
        }
    }

    // ==============================
    // MISSING FILE
    // ==============================

    @Nested
    @DisplayName("Missing File")
    class MissingFile {

        @Test
        @DisplayName("A required file that does not exist is fatal")
        void required_fatal(@TempDir Path dir) {
            PolicyDocumentLoader loader = new PolicyDocumentLoader(
                    objectMapper, new FileSystemResource(dir.resolve("absent.json")), true, PolicyMode.DEFAULT_DENY);

            assertThatThrownBy(loader::load)
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageStartingWith("Policy file not found");
        }

        @Test
        @DisplayName("An optional file that does not exist falls back to the configured mode")
        void optional_fallsBack(@TempDir Path dir) {
            PolicyDocumentLoader loader = new PolicyDocumentLoader(
                    objectMapper, new FileSystemResource(dir.resolve("absent.json")), false, PolicyMode.DEFAULT_DENY);

            PolicyDocument document = loader.load();

            assertThat(document.getMode()).isEqualTo(PolicyMode.DEFAULT_DENY);
            assertThat(document.getSource()).isEqualTo("fallback");
            assertThat(document.getRules()).isEmpty();
        }
    }

    // ==============================
    // INVALID DOCUMENTS
    // ==============================

    @Nested
    @DisplayName("Invalid Documents")
    class Invalid {

        @Test
        @DisplayName("Malformed JSON is fatal")
        void malformed() {
            assertThatThrownBy(() -> parse("{\"mode\": "))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("Malformed policy document");
        }

        @Test
        @DisplayName("A non-object root is fatal")
        void nonObjectRoot() {
            assertThatThrownBy(() -> parse("[]")).hasMessageContaining("must be a JSON object");
        }

        @Test
        @DisplayName("An unknown mode is fatal")
        void unknownMode() {
            assertThatThrownBy(() -> parse("{\"mode\":\"allow-everything\"}"))
                    .hasMessageContaining("Unknown policy mode 'allow-everything'");
        }

        @Test
        @DisplayName("A missing mode is fatal")
        void missingMode() {
            assertThatThrownBy(() -> parse("{\"rules\":[]}")).hasMessageContaining("is missing 'mode'");
        }

        @Test
        @DisplayName("Unknown keys at document and rule level are fatal")
        void unknownKeys() {
            assertThatThrownBy(() -> parse("{\"mode\":\"default-deny\",\"version\":2}"))
                    .hasMessageContaining("Unknown key 'version'");
            assertThatThrownBy(() -> parse(
                            "{\"mode\":\"default-deny\",\"rules\":[{\"tool\":\"odos_swap\",\"allowed\":true,\"limit\":5}]}"))
                    .hasMessageContaining("Unknown key 'limit'");
        }

        @Test
        @DisplayName("A rule for a tool outside the closed set is fatal")
        void unknownTool() {
            PolicyDocumentLoader loader = new PolicyDocumentLoader(
                    objectMapper, new ClassPathResource("policy/unknown-tool.json"), true, PolicyMode.DEFAULT_DENY);

            assertThatThrownBy(loader::load)
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("references unknown tool wallet_export_key");
        }

        @Test
        @DisplayName("A malformed tool name is fatal")
        void malformedToolName() {
            assertThatThrownBy(() -> parse(
                            "{\"mode\":\"default-deny\",\"rules\":[{\"tool\":\"Odos Swap\",\"allowed\":true}]}"))
                    .hasMessageContaining("has an invalid tool name");
        }

        @Test
        @DisplayName("A rule without a boolean allowed is fatal")
        void nonBooleanAllowed() {
            assertThatThrownBy(() -> parse(
                            "{\"mode\":\"default-deny\",\"rules\":[{\"tool\":\"odos_swap\",\"allowed\":\"yes\"}]}"))
                    .hasMessageContaining("requires a boolean 'allowed'");
        }

        @Test
        @DisplayName("Two rules for one tool are fatal")
        void duplicateRule() {
            assertThatThrownBy(() -> parse("{\"mode\":\"default-deny\",\"rules\":["
                            + "{\"tool\":\"odos_swap\",\"allowed\":true},"
                            + "{\"tool\":\"odos_swap\",\"allowed\":false}]}"))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("Duplicate policy rule for tool odos_swap");
        }
    }
}
