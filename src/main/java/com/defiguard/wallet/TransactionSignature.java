package com.defiguard.wallet;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/** Result of signing a transaction hash (given directly or derived from raw bytes). */
@Getter
@Builder
@ToString
public class TransactionSignature {

    private final String address;

    private final String hash;

    @JsonProperty("hash_source")
    private final HashSource hashSource;

    private final String signature;
}
