package com.defiguard.tool;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** Supported chains, keyed by their lowercase wire name. */
@Getter
@RequiredArgsConstructor
public enum Network {
    ETHEREUM("ethereum", 1L),
    ARBITRUM("arbitrum", 42161L),
    OPTIMISM("optimism", 10L),
    BASE("base", 8453L);

    private final String wireName;
    private final long chainId;

    public static Optional<Network> fromWireName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(network -> network.wireName.equals(normalized))
                .findFirst();
    }
}
