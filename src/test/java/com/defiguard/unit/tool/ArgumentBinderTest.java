package com.defiguard.unit.tool;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.defiguard.exception.ErrorCode;
import com.defiguard.exception.SchemaViolationException;
import com.defiguard.tool.ArgumentBinder;
import com.defiguard.tool.ToolName;
import com.defiguard.tool.swap.SwapAction;
import com.defiguard.tool.swap.SwapArguments;
import com.defiguard.tool.wallet.EmptyArguments;
import com.defiguard.tool.wallet.SignTxArguments;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.Validation;
import java.math.BigDecimal;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ArgumentBinderTest {

    private static final String USDC = "0xA0b86991c6218b36c1d19D4a2e9Eb0cE3606eB48";
    private static final String WETH = "0xC02aaA39b223FE8D0A0e5C4F27eAD9083C756Cc2";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ArgumentBinder binder =
            new ArgumentBinder(objectMapper, Validation.buildDefaultValidatorFactory().getValidator());

    private JsonNode json(String raw) throws Exception {
        return objectMapper.readTree(raw);
    }

    private String swapJson(String extra) {
        return "{\"action\":\"prepare_swap\",\"input_token\":\"" + USDC + "\",\"output_token\":\"" + WETH
                + "\",\"amount\":\"250000000\"" + extra + "}";
    }

    // ==============================
    // SWAP ARGUMENTS
    // ==============================

    @Nested
    @DisplayName("Swap Arguments")
    class Swap {

        @Test
        @DisplayName("Valid arguments bind to the typed DTO")
        void validArguments_bind() throws Exception {
            SwapArguments arguments = binder.bind(
                    ToolName.ODOS_SWAP,
                    json(swapJson(",\"slippage_percent\":0.5,\"amount_usd\":250,\"network\":\"base\"")),
                    SwapArguments.class);

            assertThat(arguments.getAction()).isEqualTo(SwapAction.PREPARE_SWAP);
            assertThat(arguments.getAmount()).isEqualTo("250000000");
            assertThat(arguments.getSlippagePercent()).isEqualByComparingTo(new BigDecimal("0.5"));
            assertThat(arguments.getAmountUsd()).isEqualByComparingTo(new BigDecimal("250"));
            assertThat(arguments.getNetwork()).isEqualTo("base");
        }

        @Test
        @DisplayName("Unknown argument keys are rejected")
        void unknownKey_rejected() {
            assertThatThrownBy(() -> binder.bind(
                            ToolName.ODOS_SWAP, json(swapJson(",\"private_key\":\"0xdead\"")), SwapArguments.class))
                    .isInstanceOf(SchemaViolationException.class)
                    .hasMessage("Unknown argument 'private_key' for odos_swap");
        }

        @Test
        @DisplayName("Missing required fields are listed by name")
        void missingFields_listed() {
            assertThatThrownBy(() -> binder.bind(
                            ToolName.ODOS_SWAP, json("{\"action\":\"quote\"}"), SwapArguments.class))
                    .isInstanceOf(SchemaViolationException.class)
                    .hasMessageContaining("amount is required")
                    .hasMessageContaining("input_token")
                    .satisfies(e -> assertThat(((SchemaViolationException) e).getErrorCode())
                            .isEqualTo(ErrorCode.SCHEMA_VIOLATION));
        }

        @Test
        @DisplayName("An unknown action is a type error on the action field")
        void unknownAction_rejected() {
            assertThatThrownBy(() -> binder.bind(
                            ToolName.ODOS_SWAP,
                            json(swapJson("").replace("prepare_swap", "execute_swap")),
                            SwapArguments.class))
                    .isInstanceOf(SchemaViolationException.class)
                    .hasMessageContaining("'action'");
        }

        @Test
        @DisplayName("Slippage outside (0, 50] is rejected")
        void slippageRange() {
            assertThatThrownBy(() -> binder.bind(
                            ToolName.ODOS_SWAP, json(swapJson(",\"slippage_percent\":0")), SwapArguments.class))
                    .hasMessageContaining("must be greater than 0");
            assertThatThrownBy(() -> binder.bind(
                            ToolName.ODOS_SWAP, json(swapJson(",\"slippage_percent\":75")), SwapArguments.class))
                    .hasMessageContaining("must be at most 50");
        }

        @Test
        @DisplayName("Unsupported networks and identical token pairs are rejected")
        void crossFieldRules() {
            assertThatThrownBy(() -> binder.bind(
                            ToolName.ODOS_SWAP, json(swapJson(",\"network\":\"solana\"")), SwapArguments.class))
                    .hasMessageContaining("network must be one of");
            assertThatThrownBy(() -> binder.bind(
                            ToolName.ODOS_SWAP, json(swapJson("").replace(WETH, USDC)), SwapArguments.class))
                    .hasMessageContaining("must differ");
        }

        @Test
        @DisplayName("Messages never echo submitted values")
        void valuesNotEchoed() {
            assertThatThrownBy(() -> binder.bind(
                            ToolName.ODOS_SWAP,
                            json(swapJson("").replace("250000000", "not-a-number-secret")),
                            SwapArguments.class))
                    .isInstanceOf(SchemaViolationException.class)
                    .hasMessageNotContaining("not-a-number-secret");
        }
    }

    // ==============================
    // OTHER SHAPES
    // ==============================

    @Test
    @DisplayName("Exactly one of tx_hash or tx_bytes must be supplied")
    void signTx_singleSource() {
        assertThatThrownBy(() -> binder.bind(ToolName.WALLET_SIGN_TX, json("{}"), SignTxArguments.class))
                .isInstanceOf(SchemaViolationException.class)
                .hasMessageContaining("exactly one of tx_hash or tx_bytes is required");
    }

    @Test
    @DisplayName("Null arguments bind to an empty object")
    void nullArguments_empty() {
        assertThat(binder.bind(ToolName.WALLET_DERIVE_ADDRESS, null, EmptyArguments.class)).isNotNull();
    }

    @Test
    @DisplayName("Non-object arguments are rejected")
    void nonObject_rejected() {
        assertThatThrownBy(() -> binder.bind(ToolName.WALLET_DERIVE_ADDRESS, json("[1,2]"), EmptyArguments.class))
                .isInstanceOf(SchemaViolationException.class)
                .hasMessage("Arguments for wallet_derive_address must be a JSON object");
    }
}
