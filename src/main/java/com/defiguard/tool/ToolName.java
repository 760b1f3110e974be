package com.defiguard.tool;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import lombok.Getter;

/**
 * Closed set of tools the sandboxed script may invoke.
 *
 * <p>Wire names are what the script sends and what policy documents reference. A name
 * outside this set is never dispatched: the gateway rejects it and the policy loader
 * refuses rules that mention it.
 *
 * <p>{@code sensitiveArguments} lists argument keys that are masked in audit records.
 */
@Getter
public enum ToolName {
    WALLET_DERIVE_ADDRESS("wallet_derive_address", Set.of()),
    WALLET_SIGN_MESSAGE("wallet_sign_message", Set.of("message")),
    WALLET_SIGN_TX("wallet_sign_tx", Set.of("tx_bytes")),
    ODOS_SWAP("odos_swap", Set.of()),
    PAPER_TRADING("paper_trading", Set.of()),
    QUERY_SUBGRAPH("query_subgraph", Set.of());

    /** Lowercase snake case, optionally namespaced with a single slash. */
    private static final Pattern WIRE_NAME = Pattern.compile("^[a-z][a-z0-9_]*(/[a-z][a-z0-9_]*)?$");

    private final String wireName;
    private final Set<String> sensitiveArguments;

    ToolName(String wireName, Set<String> sensitiveArguments) {
        this.wireName = wireName;
        this.sensitiveArguments = sensitiveArguments;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public static Optional<ToolName> fromWireName(String name) {
        if (!isWellFormed(name)) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(tool -> tool.wireName.equals(name))
                .findFirst();
    }

    public static boolean isWellFormed(String name) {
        return name != null && WIRE_NAME.matcher(name).matches();
    }

    @Override
    public String toString() {
        return wireName;
    }
}
