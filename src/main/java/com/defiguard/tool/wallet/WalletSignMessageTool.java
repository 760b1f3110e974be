package com.defiguard.tool.wallet;

import com.defiguard.tool.ActionKind;
import com.defiguard.tool.ToolCallContext;
import com.defiguard.tool.ToolExchange;
import com.defiguard.tool.ToolHandler;
import com.defiguard.tool.ToolName;
import com.defiguard.wallet.WalletSigningService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

/** Rung 2: EIP-191 personal message signing. */
@Component
public class WalletSignMessageTool implements ToolHandler<SignMessageArguments> {

    private final WalletSigningService signingService;
    private final ObjectMapper objectMapper;

    public WalletSignMessageTool(WalletSigningService signingService, ObjectMapper objectMapper) {
        this.signingService = signingService;
        this.objectMapper = objectMapper;
    }

    @Override
    public ToolName toolName() {
        return ToolName.WALLET_SIGN_MESSAGE;
    }

    @Override
    public Class<SignMessageArguments> argumentsType() {
        return SignMessageArguments.class;
    }

    @Override
    public void describe(SignMessageArguments arguments, ToolCallContext.ToolCallContextBuilder context) {
        context.actionKind(ActionKind.SIGNING);
    }

    @Override
    public ToolExchange open(SignMessageArguments arguments, ToolCallContext context) {
        return ToolExchange.completed(() ->
                objectMapper.valueToTree(signingService.signMessage(arguments.getMessage())));
    }
}
