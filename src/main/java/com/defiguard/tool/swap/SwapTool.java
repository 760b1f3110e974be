package com.defiguard.tool.swap;

import com.defiguard.governance.SlippageGuard;
import com.defiguard.tool.Network;
import com.defiguard.tool.ToolCallContext;
import com.defiguard.tool.ToolExchange;
import com.defiguard.tool.ToolHandler;
import com.defiguard.tool.ToolName;
import com.defiguard.tool.ToolStep;
import com.defiguard.tool.TradeValueEstimator;
import com.defiguard.wallet.WalletSigningService;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Locale;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * {@code odos_swap}: quote a swap (read-only) or prepare an unsigned swap transaction
 * (capital-committing).
 *
 * <p>{@code prepare_swap} is a two-step exchange: the first step streams the quote,
 * the second returns the prepared transaction. The gateway drains both before the
 * script sees anything. A quote whose price impact is over the configured ceiling ends
 * the exchange with an error before anything is prepared.
 */
@Component
public class SwapTool implements ToolHandler<SwapArguments> {

    private static final Logger log = LoggerFactory.getLogger(SwapTool.class);

    static final BigDecimal DEFAULT_SLIPPAGE_PERCENT = new BigDecimal("0.5");

    private final SwapClient swapClient;
    private final TradeValueEstimator tradeValueEstimator;
    private final SlippageGuard slippageGuard;
    private final WalletSigningService signingService;
    private final ObjectMapper objectMapper;

    public SwapTool(
            SwapClient swapClient,
            TradeValueEstimator tradeValueEstimator,
            SlippageGuard slippageGuard,
            WalletSigningService signingService,
            ObjectMapper objectMapper) {
        this.swapClient = swapClient;
        this.tradeValueEstimator = tradeValueEstimator;
        this.slippageGuard = slippageGuard;
        this.signingService = signingService;
        this.objectMapper = objectMapper;
    }

    @Override
    public ToolName toolName() {
        return ToolName.ODOS_SWAP;
    }

    @Override
    public Class<SwapArguments> argumentsType() {
        return SwapArguments.class;
    }

    @Override
    public void describe(SwapArguments arguments, ToolCallContext.ToolCallContextBuilder context) {
        context.actionKind(arguments.getAction().getActionKind())
                .slippagePercent(slippageOf(arguments))
                .priceImpactPercent(arguments.getPriceImpactPercent())
                .symbol(arguments.getInputToken().toLowerCase(Locale.ROOT) + "->"
                        + arguments.getOutputToken().toLowerCase(Locale.ROOT));
        tradeValueEstimator
                .estimateUsd(arguments.getAmountUsd(), arguments.getInputToken(), arguments.getAmount())
                .ifPresent(context::tradeValue);
        Network.fromWireName(arguments.getNetwork()).ifPresent(context::network);
    }

    @Override
    public ToolExchange open(SwapArguments arguments, ToolCallContext context) {
        SwapRequest request = SwapRequest.builder()
                .network(context.getNetwork() != null ? context.getNetwork() : Network.ETHEREUM)
                .inputToken(arguments.getInputToken())
                .outputToken(arguments.getOutputToken())
                .amount(new BigInteger(arguments.getAmount()))
                .slippagePercent(slippageOf(arguments))
                .signer(signingService.deriveAddress())
                .build();

        if (arguments.getAction() == SwapAction.QUOTE) {
            return ToolExchange.completed(() -> {
                ObjectNode output = objectMapper.valueToTree(swapClient.quote(request));
                return output.put("action", SwapAction.QUOTE.getWireValue());
            });
        }
        return new PrepareSwapExchange(request);
    }

    private static BigDecimal slippageOf(SwapArguments arguments) {
        return arguments.getSlippagePercent() != null ? arguments.getSlippagePercent() : DEFAULT_SLIPPAGE_PERCENT;
    }

    /** Quote first, then the prepared transaction. */
    private final class PrepareSwapExchange implements ToolExchange {

        private final SwapRequest request;
        private SwapQuote quote;
        private boolean finished;

        private PrepareSwapExchange(SwapRequest request) {
            this.request = request;
        }

        @Override
        public ToolStep advance() {
            if (finished) {
                throw new IllegalStateException("Exchange already completed");
            }
            if (quote == null) {
                quote = swapClient.quote(request);
                Optional<String> violation = slippageGuard.checkQuotedPriceImpact(quote.getPriceImpactPercent());
                if (violation.isPresent()) {
                    finished = true;
                    log.warn("Swap not prepared [pathId={}]: {}", quote.getPathId(), violation.get());
                    return ToolStep.error(violation.get());
                }
                return ToolStep.streaming(objectMapper.valueToTree(quote));
            }

            PreparedSwap prepared = swapClient.prepare(request, quote);
            finished = true;
            ObjectNode output = objectMapper.createObjectNode();
            output.put("action", SwapAction.PREPARE_SWAP.getWireValue());
            output.put("status", "prepared_pending_signature");
            output.set("transaction", objectMapper.valueToTree(prepared));
            output.set("quote_details", objectMapper.valueToTree(quote));
            return ToolStep.done(output);
        }
    }
}
