package com.defiguard.unit.tool;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.defiguard.exception.ToolExecutionException;
import com.defiguard.governance.SlippageGuard;
import com.defiguard.support.GovernanceHarness;
import com.defiguard.tool.ActionKind;
import com.defiguard.tool.Network;
import com.defiguard.tool.ToolCallContext;
import com.defiguard.tool.ToolCallStatus;
import com.defiguard.tool.ToolExchange;
import com.defiguard.tool.ToolName;
import com.defiguard.tool.ToolStep;
import com.defiguard.tool.TradeValueEstimator;
import com.defiguard.tool.swap.PaperSwapClient;
import com.defiguard.tool.swap.SwapAction;
import com.defiguard.tool.swap.SwapArguments;
import com.defiguard.tool.swap.SwapClient;
import com.defiguard.tool.swap.SwapQuote;
import com.defiguard.tool.swap.SwapTool;
import com.defiguard.wallet.SecureWallet;
import com.defiguard.wallet.WalletSigningService;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.math.BigDecimal;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * Unit tests for SwapTool covering governance metadata, the one-step quote exchange and
 * the two-step prepare_swap exchange.
 */
@ExtendWith(MockitoExtension.class)
class SwapToolTest {

    private static final String USDC = "0xA0b86991c6218b36c1d19D4a2e9Eb0cE3606eB48";
    private static final String WETH = "0xC02aaA39b223FE8D0A0e5C4F27eAD9083C756Cc2";

    @Mock
    private SwapClient stubClient;

    private final SlippageGuard slippageGuard = new SlippageGuard(new BigDecimal("1.0"), new BigDecimal("3.0"));
    private WalletSigningService signingService;
    private SwapTool swapTool;

    @BeforeEach
    void setUp() {
        signingService = new WalletSigningService(SecureWallet.fromHex(GovernanceHarness.TEST_KEY));
        swapTool = new SwapTool(
                new PaperSwapClient(), new TradeValueEstimator(), slippageGuard, signingService, new ObjectMapper());
    }

    private static SwapArguments arguments(SwapAction action) {
        SwapArguments arguments = new SwapArguments();
        arguments.setAction(action);
        arguments.setInputToken(USDC);
        arguments.setOutputToken(WETH);
        arguments.setAmount("250000000");
        return arguments;
    }

    private ToolCallContext describe(SwapArguments arguments) {
        ToolCallContext.ToolCallContextBuilder builder =
                ToolCallContext.builder().callId("c1").toolName(ToolName.ODOS_SWAP);
        swapTool.describe(arguments, builder);
        return builder.build();
    }

    // ==============================
    // DESCRIBE
    // ==============================

    @Nested
    @DisplayName("Governance Metadata")
    class Describe {

        @Test
        @DisplayName("prepare_swap is capital-committing and valued from the stablecoin amount")
        void prepare_isCapital() {
            ToolCallContext context = describe(arguments(SwapAction.PREPARE_SWAP));

            assertThat(context.getActionKind()).isEqualTo(ActionKind.CAPITAL_COMMITTING);
            assertThat(context.getTradeValue()).hasValueSatisfying(v -> assertThat(v).isEqualByComparingTo("250"));
            assertThat(context.getSlippagePercent())
                    .hasValueSatisfying(v -> assertThat(v).isEqualByComparingTo("0.5"));
            assertThat(context.getSymbol()).isEqualTo(USDC.toLowerCase() + "->" + WETH.toLowerCase());
        }

        @Test
        @DisplayName("quote is read-only")
        void quote_isReadOnly() {
            assertThat(describe(arguments(SwapAction.QUOTE)).getActionKind()).isEqualTo(ActionKind.READ_ONLY);
        }

        @Test
        @DisplayName("Explicit amount_usd, slippage, impact and network are carried into the context")
        void explicitValues() {
            SwapArguments arguments = arguments(SwapAction.PREPARE_SWAP);
            arguments.setInputToken(WETH);
            arguments.setOutputToken(USDC);
            arguments.setAmountUsd(new BigDecimal("320"));
            arguments.setSlippagePercent(new BigDecimal("0.8"));
            arguments.setPriceImpactPercent(new BigDecimal("0.2"));
            arguments.setNetwork("arbitrum");

            ToolCallContext context = describe(arguments);

            assertThat(context.getTradeValue()).hasValueSatisfying(v -> assertThat(v).isEqualByComparingTo("320"));
            assertThat(context.getSlippagePercent())
                    .hasValueSatisfying(v -> assertThat(v).isEqualByComparingTo("0.8"));
            assertThat(context.getPriceImpactPercent())
                    .hasValueSatisfying(v -> assertThat(v).isEqualByComparingTo("0.2"));
            assertThat(context.getNetwork()).isEqualTo(Network.ARBITRUM);
        }

        @Test
        @DisplayName("A non-stablecoin without amount_usd has no trade value")
        void unpriced() {
            SwapArguments arguments = arguments(SwapAction.PREPARE_SWAP);
            arguments.setInputToken(WETH);
            arguments.setOutputToken(USDC);

            assertThat(describe(arguments).getTradeValue()).isEmpty();
        }
    }

    // ==============================
    // EXCHANGES
    // ==============================

    @Nested
    @DisplayName("Exchanges")
    class Exchanges {

        @Test
        @DisplayName("quote completes in a single step")
        void quote_singleStep() {
            SwapArguments arguments = arguments(SwapAction.QUOTE);
            ToolExchange exchange = swapTool.open(arguments, describe(arguments));

            ToolStep step = exchange.advance();

            assertThat(step.getStatus()).isEqualTo(ToolCallStatus.DONE);
            JsonNode output = step.getOutput();
            assertThat(output.get("action").asText()).isEqualTo("quote");
            assertThat(output.get("input_amount").asText()).isEqualTo("250000000");
            assertThat(output.get("chain_id").asLong()).isEqualTo(1L);
            assertThat(output.get("output_amount").asText()).isNotBlank();
        }

        @Test
        @DisplayName("prepare_swap streams the quote, then returns the unsigned transaction")
        void prepare_twoSteps() {
            SwapArguments arguments = arguments(SwapAction.PREPARE_SWAP);
            arguments.setNetwork("base");
            ToolExchange exchange = swapTool.open(arguments, describe(arguments));

            ToolStep first = exchange.advance();
            ToolStep second = exchange.advance();

            assertThat(first.getStatus()).isEqualTo(ToolCallStatus.STREAMING);
            assertThat(second.getStatus()).isEqualTo(ToolCallStatus.DONE);
            JsonNode output = second.getOutput();
            assertThat(output.get("action").asText()).isEqualTo("prepare_swap");
            assertThat(output.get("status").asText()).isEqualTo("prepared_pending_signature");
            assertThat(output.get("transaction").get("chain_id").asLong()).isEqualTo(8453L);
            assertThat(output.get("transaction").get("value").asText()).isEqualTo("0");
            assertThat(output.get("quote_details").get("path_id").asText())
                    .isEqualTo(output.get("transaction").get("path_id").asText());
            assertThatThrownBy(exchange::advance).isInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("Quotes are deterministic for the same request")
        void quote_deterministic() {
            SwapArguments arguments = arguments(SwapAction.QUOTE);

            JsonNode first = swapTool.open(arguments, describe(arguments)).advance().getOutput();
            JsonNode second = swapTool.open(arguments, describe(arguments)).advance().getOutput();

            assertThat(first).isEqualTo(second);
        }

        @Test
        @DisplayName("A client failure on the quote step surfaces and nothing is prepared")
        void clientFailure_propagates() {
            when(stubClient.quote(any())).thenThrow(new ToolExecutionException("aggregator unavailable"));
            SwapTool tool = new SwapTool(
                    stubClient, new TradeValueEstimator(), slippageGuard, signingService, new ObjectMapper());
            SwapArguments arguments = arguments(SwapAction.PREPARE_SWAP);
            ToolExchange exchange = tool.open(arguments, describe(arguments));

            assertThatThrownBy(exchange::advance)
                    .isInstanceOf(ToolExecutionException.class)
                    .hasMessage("aggregator unavailable");
            verify(stubClient, never()).prepare(any(), any());
        }

        @Test
        @DisplayName("A quote over the price impact ceiling ends the exchange before anything is prepared")
        void quotedImpactOverCeiling_errors() {
            when(stubClient.quote(any())).thenReturn(SwapQuote.builder()
                    .inputToken(USDC)
                    .outputToken(WETH)
                    .inputAmount("250000000")
                    .outputAmount("1")
                    .priceImpactPercent(new BigDecimal("40"))
                    .pathId("thin-pool")
                    .chainId(1L)
                    .build());
            SwapTool tool = new SwapTool(
                    stubClient, new TradeValueEstimator(), slippageGuard, signingService, new ObjectMapper());
            SwapArguments arguments = arguments(SwapAction.PREPARE_SWAP);
            ToolExchange exchange = tool.open(arguments, describe(arguments));

            ToolStep step = exchange.advance();

            assertThat(step.getStatus()).isEqualTo(ToolCallStatus.ERROR);
            assertThat(step.getErrorMessage()).isEqualTo("Quoted price impact 40% exceeds maximum allowed 3%");
            assertThatThrownBy(exchange::advance).isInstanceOf(IllegalStateException.class);
            verify(stubClient, never()).prepare(any(), any());
        }
    }
}
