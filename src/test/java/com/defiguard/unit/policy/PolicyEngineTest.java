package com.defiguard.unit.policy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.defiguard.exception.ConfigurationException;
import com.defiguard.policy.PolicyDocument;
import com.defiguard.policy.PolicyDocumentLoader;
import com.defiguard.policy.PolicyEngine;
import com.defiguard.policy.PolicyEvaluation;
import com.defiguard.policy.PolicyMode;
import com.defiguard.policy.PolicyRule;
import com.defiguard.tool.ToolName;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.core.io.FileSystemResource;

class PolicyEngineTest {

    private static PolicyEngine engine(PolicyMode mode, PolicyRule... rules) {
        return new PolicyEngine(PolicyDocument.of(mode, List.of(rules), "test"));
    }

    @Test
    @DisplayName("Default-allow permits a tool with no rule")
    void defaultAllow() {
        PolicyEvaluation evaluation = engine(PolicyMode.DEFAULT_ALLOW).evaluate(ToolName.ODOS_SWAP);

        assertThat(evaluation.isAllowed()).isTrue();
        assertThat(evaluation.getReason()).isEqualTo("allowed by default policy");
        assertThat(evaluation.getRuleId()).isNull();
    }

    @Test
    @DisplayName("Default-deny refuses a tool with no rule")
    void defaultDeny() {
        PolicyEvaluation evaluation = engine(PolicyMode.DEFAULT_DENY).evaluate(ToolName.ODOS_SWAP);

        assertThat(evaluation.isAllowed()).isFalse();
        assertThat(evaluation.describeDenial("odos_swap"))
                .isEqualTo("Policy denied tool odos_swap: denied by default policy");
    }

    @Test
    @DisplayName("An exact rule overrides the mode and carries its rule id")
    void ruleOverridesMode() {
        PolicyEngine engine = engine(
                PolicyMode.DEFAULT_ALLOW,
                PolicyRule.builder()
                        .toolName(ToolName.WALLET_SIGN_TX)
                        .allowed(false)
                        .ruleId("deny:wallet_sign_tx")
                        .reason("raw signing disabled")
                        .build());

        PolicyEvaluation evaluation = engine.evaluate(ToolName.WALLET_SIGN_TX);

        assertThat(evaluation.isAllowed()).isFalse();
        assertThat(evaluation.describeDenial("wallet_sign_tx"))
                .isEqualTo("Policy denied tool wallet_sign_tx: raw signing disabled rule_id=deny:wallet_sign_tx");
        assertThat(engine.evaluate(ToolName.WALLET_SIGN_MESSAGE).isAllowed()).isTrue();
    }

    @Test
    @DisplayName("Unknown and malformed names are denied even under default-allow")
    void unknownNames_denied() {
        PolicyEngine engine = engine(PolicyMode.DEFAULT_ALLOW);

        assertThat(engine.evaluate("wallet_export_key").isAllowed()).isFalse();
        assertThat(engine.evaluate("wallet_export_key").getReason()).isEqualTo("unknown tool");
        assertThat(engine.evaluate("../etc/passwd").getReason()).isEqualTo("invalid tool name");
        assertThat(engine.evaluate((String) null).isAllowed()).isFalse();
    }

    @Test
    @DisplayName("Evaluation is deterministic for the same document")
    void deterministic() {
        PolicyEngine engine = engine(PolicyMode.DEFAULT_DENY);

        for (int i = 0; i < 3; i++) {
            assertThat(engine.evaluate("odos_swap").getReason()).isEqualTo("denied by default policy");
        }
    }

    @Test
    @DisplayName("Reload installs a new valid document and keeps the old one when the file is invalid")
    void reload(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("policy.json");
        Files.writeString(file, "{\"mode\":\"default-deny\"}", StandardCharsets.UTF_8);
        PolicyEngine engine = new PolicyEngine(new PolicyDocumentLoader(
                new ObjectMapper(), new FileSystemResource(file), true, PolicyMode.DEFAULT_DENY));
        assertThat(engine.evaluate(ToolName.ODOS_SWAP).isAllowed()).isFalse();

        Files.writeString(file, "{\"mode\":\"default-allow\"}", StandardCharsets.UTF_8);
        engine.reload();
        assertThat(engine.evaluate(ToolName.ODOS_SWAP).isAllowed()).isTrue();

        Files.writeString(file, "{\"mode\":\"sometimes\"}", StandardCharsets.UTF_8);
        assertThatThrownBy(engine::reload).isInstanceOf(ConfigurationException.class);
        assertThat(engine.getDocument().getMode()).isEqualTo(PolicyMode.DEFAULT_ALLOW);
    }

    @Test
    @DisplayName("Reload without a loader is refused")
    void reloadWithoutLoader() {
        assertThatThrownBy(() -> engine(PolicyMode.DEFAULT_DENY).reload()).isInstanceOf(IllegalStateException.class);
    }
}
