package com.defiguard.tool.data;

import com.defiguard.tool.ActionKind;
import com.defiguard.tool.Network;
import com.defiguard.tool.ToolCallContext;
import com.defiguard.tool.ToolExchange;
import com.defiguard.tool.ToolHandler;
import com.defiguard.tool.ToolName;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * {@code query_subgraph}: read-only Uniswap v3 pool and token data. Never commits
 * capital, so governance only applies policy to it.
 */
@Component
public class SubgraphQueryTool implements ToolHandler<SubgraphQueryArguments> {

    static final int DEFAULT_LIMIT = 10;

    private final SubgraphClient subgraphClient;
    private final ObjectMapper objectMapper;

    public SubgraphQueryTool(SubgraphClient subgraphClient, ObjectMapper objectMapper) {
        this.subgraphClient = subgraphClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public ToolName toolName() {
        return ToolName.QUERY_SUBGRAPH;
    }

    @Override
    public Class<SubgraphQueryArguments> argumentsType() {
        return SubgraphQueryArguments.class;
    }

    @Override
    public void describe(SubgraphQueryArguments arguments, ToolCallContext.ToolCallContextBuilder context) {
        context.actionKind(ActionKind.READ_ONLY);
        Network.fromWireName(arguments.getNetwork()).ifPresent(context::network);
    }

    @Override
    public ToolExchange open(SubgraphQueryArguments arguments, ToolCallContext context) {
        Network network = Network.fromWireName(arguments.getNetwork()).orElseThrow();
        return ToolExchange.completed(() -> query(arguments, network));
    }

    private JsonNode query(SubgraphQueryArguments arguments, Network network) {
        SubgraphQueryParams params = arguments.getParams() != null ? arguments.getParams() : new SubgraphQueryParams();
        ObjectNode output = objectMapper.createObjectNode()
                .put("protocol", SubgraphQueryArguments.UNISWAP_V3)
                .put("network", network.getWireName())
                .put("query_type", arguments.getQueryType().getWireValue());

        switch (arguments.getQueryType()) {
            case TOP_POOLS -> {
                int limit = params.getLimit() != null ? params.getLimit() : DEFAULT_LIMIT;
                output.set("pools", objectMapper.valueToTree(subgraphClient.topPools(network, limit)));
            }
            case POOL_INFO -> output.set("pool", objectMapper.valueToTree(
                    subgraphClient.pool(network, params.getPoolId()).orElse(null)));
            case TOKEN_PRICE -> {
                Optional<TokenPrice> price = subgraphClient.tokenPrice(network, params.getTokenAddress());
                output.set("token", objectMapper.valueToTree(price.map(TokenPrice::getToken).orElse(null)));
                output.set("price_usd", objectMapper.valueToTree(price.map(TokenPrice::getPriceUsd).orElse(null)));
                output.set("eth_price_usd", objectMapper.valueToTree(subgraphClient.ethPriceUsd(network)));
            }
        }
        return output;
    }
}
