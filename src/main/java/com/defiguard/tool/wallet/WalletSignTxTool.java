package com.defiguard.tool.wallet;

import com.defiguard.tool.ActionKind;
import com.defiguard.tool.ToolCallContext;
import com.defiguard.tool.ToolExchange;
import com.defiguard.tool.ToolHandler;
import com.defiguard.tool.ToolName;
import com.defiguard.wallet.WalletSigningService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

/** Rung 3: signs a transaction hash or raw transaction bytes. */
@Component
public class WalletSignTxTool implements ToolHandler<SignTxArguments> {

    private final WalletSigningService signingService;
    private final ObjectMapper objectMapper;

    public WalletSignTxTool(WalletSigningService signingService, ObjectMapper objectMapper) {
        this.signingService = signingService;
        this.objectMapper = objectMapper;
    }

    @Override
    public ToolName toolName() {
        return ToolName.WALLET_SIGN_TX;
    }

    @Override
    public Class<SignTxArguments> argumentsType() {
        return SignTxArguments.class;
    }

    @Override
    public void describe(SignTxArguments arguments, ToolCallContext.ToolCallContextBuilder context) {
        context.actionKind(ActionKind.SIGNING);
    }

    @Override
    public ToolExchange open(SignTxArguments arguments, ToolCallContext context) {
        return ToolExchange.completed(() -> objectMapper.valueToTree(
                signingService.signTransaction(arguments.getTxHash(), arguments.getTxBytes())));
    }
}
