package com.defiguard.tool.wallet;

import com.defiguard.tool.ActionKind;
import com.defiguard.tool.ToolCallContext;
import com.defiguard.tool.ToolExchange;
import com.defiguard.tool.ToolHandler;
import com.defiguard.tool.ToolName;
import com.defiguard.wallet.WalletSigningService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

/** Rung 1: returns the wallet's public address. */
@Component
public class WalletDeriveAddressTool implements ToolHandler<EmptyArguments> {

    private final WalletSigningService signingService;
    private final ObjectMapper objectMapper;

    public WalletDeriveAddressTool(WalletSigningService signingService, ObjectMapper objectMapper) {
        this.signingService = signingService;
        this.objectMapper = objectMapper;
    }

    @Override
    public ToolName toolName() {
        return ToolName.WALLET_DERIVE_ADDRESS;
    }

    @Override
    public Class<EmptyArguments> argumentsType() {
        return EmptyArguments.class;
    }

    @Override
    public void describe(EmptyArguments arguments, ToolCallContext.ToolCallContextBuilder context) {
        context.actionKind(ActionKind.READ_ONLY);
    }

    @Override
    public ToolExchange open(EmptyArguments arguments, ToolCallContext context) {
        return ToolExchange.completed(() ->
                objectMapper.createObjectNode().put("address", signingService.deriveAddress()));
    }
}
