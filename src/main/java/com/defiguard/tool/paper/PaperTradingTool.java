package com.defiguard.tool.paper;

import com.defiguard.tool.Network;
import com.defiguard.tool.ToolCallContext;
import com.defiguard.tool.ToolExchange;
import com.defiguard.tool.ToolHandler;
import com.defiguard.tool.ToolName;
import com.defiguard.tool.TradeValueEstimator;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Locale;
import org.springframework.stereotype.Component;

/**
 * {@code paper_trading}: simulated swaps against {@link PaperPortfolio}, plus read-only
 * balance, metrics and trade-history queries.
 *
 * <p>{@code execute_swap} is capital-committing so it is governed exactly like a real
 * swap. Its USD value comes from {@link TradeValueEstimator}: stablecoins are valued
 * from the amount, other known tokens from {@code input_price_usd}.
 */
@Component
public class PaperTradingTool implements ToolHandler<PaperTradingArguments> {

    private final PaperPortfolio portfolio;
    private final TradeValueEstimator tradeValueEstimator;
    private final ObjectMapper objectMapper;

    public PaperTradingTool(
            PaperPortfolio portfolio, TradeValueEstimator tradeValueEstimator, ObjectMapper objectMapper) {
        this.portfolio = portfolio;
        this.tradeValueEstimator = tradeValueEstimator;
        this.objectMapper = objectMapper;
    }

    @Override
    public ToolName toolName() {
        return ToolName.PAPER_TRADING;
    }

    @Override
    public Class<PaperTradingArguments> argumentsType() {
        return PaperTradingArguments.class;
    }

    @Override
    public void describe(PaperTradingArguments arguments, ToolCallContext.ToolCallContextBuilder context) {
        context.actionKind(arguments.getAction().getActionKind());
        Network.fromWireName(arguments.getNetwork()).ifPresent(context::network);
        if (arguments.getAction() != PaperTradingAction.EXECUTE_SWAP) {
            return;
        }
        context.symbol(arguments.getInputToken().toLowerCase(Locale.ROOT) + "->"
                + arguments.getOutputToken().toLowerCase(Locale.ROOT));
        tradeValueEstimator
                .estimateUsd(declaredValue(arguments), arguments.getInputToken(), arguments.getInputAmount())
                .ifPresent(context::tradeValue);
    }

    @Override
    public ToolExchange open(PaperTradingArguments arguments, ToolCallContext context) {
        return switch (arguments.getAction()) {
            case EXECUTE_SWAP -> ToolExchange.completed(() -> executeSwap(arguments, context));
            case GET_BALANCES -> ToolExchange.completed(() -> {
                ObjectNode output = action(PaperTradingAction.GET_BALANCES);
                output.set("balances", objectMapper.valueToTree(portfolio.balances()));
                return output.put("note", "Paper trading balances (simulated)");
            });
            case GET_METRICS -> ToolExchange.completed(() -> {
                ObjectNode output = action(PaperTradingAction.GET_METRICS);
                output.setAll((ObjectNode) objectMapper.valueToTree(portfolio.metrics()));
                return output;
            });
            case GET_TRADES -> ToolExchange.completed(() -> {
                List<PaperTrade> trades = portfolio.trades(arguments.getLimit());
                ObjectNode output = action(PaperTradingAction.GET_TRADES);
                output.set("trades", objectMapper.valueToTree(trades));
                return output.put("total_count", trades.size());
            });
        };
    }

    private JsonNode executeSwap(PaperTradingArguments arguments, ToolCallContext context) {
        PaperTrade trade = portfolio.executeSwap(
                arguments.getInputToken(),
                arguments.getOutputToken(),
                new BigInteger(arguments.getInputAmount()),
                new BigInteger(arguments.getExpectedOutput()),
                arguments.getInputPriceUsd(),
                arguments.getOutputPriceUsd(),
                context.getTradeValue().orElse(null),
                context.getNetwork() != null ? context.getNetwork() : Network.ETHEREUM);

        ObjectNode output = action(PaperTradingAction.EXECUTE_SWAP);
        output.put("status", "executed_on_paper");
        output.set("trade", objectMapper.valueToTree(trade));
        output.set("portfolio_metrics", objectMapper.valueToTree(portfolio.metrics()));
        return output;
    }

    /** {@code input_amount} at {@code input_price_usd}, when the input token's decimals are known. */
    private BigDecimal declaredValue(PaperTradingArguments arguments) {
        return tradeValueEstimator.decimalsOf(arguments.getInputToken())
                .map(decimals -> new BigDecimal(new BigInteger(arguments.getInputAmount()), decimals)
                        .multiply(arguments.getInputPriceUsd())
                        .stripTrailingZeros())
                .orElse(null);
    }

    private ObjectNode action(PaperTradingAction action) {
        return objectMapper.createObjectNode().put("action", action.getWireValue());
    }
}
