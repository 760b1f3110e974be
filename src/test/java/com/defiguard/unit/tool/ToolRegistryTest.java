package com.defiguard.unit.tool;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.defiguard.exception.ConfigurationException;
import com.defiguard.support.GovernanceHarness;
import com.defiguard.tool.ToolHandler;
import com.defiguard.tool.ToolName;
import com.defiguard.tool.ToolRegistry;
import com.defiguard.tool.wallet.WalletDeriveAddressTool;
import com.defiguard.tool.wallet.WalletSignMessageTool;
import com.defiguard.wallet.SecureWallet;
import com.defiguard.wallet.WalletSigningService;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ToolRegistryTest {

    @Test
    @DisplayName("Every tool in the closed set has a handler")
    void allToolsRegistered() {
        try (GovernanceHarness harness = GovernanceHarness.builder().build()) {
            ToolRegistry registry = harness.toolRegistry;

            assertThat(registry.getToolNames()).containsExactlyInAnyOrder(ToolName.values());
            assertThat(registry.find("odos_swap")).isPresent();
            assertThat(registry.find("wallet_export_key")).isEmpty();
            assertThat(registry.find("ODOS_SWAP")).isEmpty();
        }
    }

    @Test
    @DisplayName("A registry missing a tool refuses to start")
    void missingHandler_rejected() {
        WalletSigningService signing =
                new WalletSigningService(SecureWallet.fromHex(GovernanceHarness.TEST_KEY));
        List<ToolHandler<?>> handlers = List.of(
                new WalletDeriveAddressTool(signing, new ObjectMapper()),
                new WalletSignMessageTool(signing, new ObjectMapper()));

        assertThatThrownBy(() -> new ToolRegistry(handlers))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("No handler registered for tools");
    }

    @Test
    @DisplayName("Two handlers for one tool refuse to start")
    void duplicateHandler_rejected() {
        WalletSigningService signing =
                new WalletSigningService(SecureWallet.fromHex(GovernanceHarness.TEST_KEY));
        List<ToolHandler<?>> handlers = List.of(
                new WalletDeriveAddressTool(signing, new ObjectMapper()),
                new WalletDeriveAddressTool(signing, new ObjectMapper()));

        assertThatThrownBy(() -> new ToolRegistry(handlers))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("Duplicate handler for tool wallet_derive_address");
    }
}
