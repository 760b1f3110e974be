package com.defiguard.wallet;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/** Result of signing an EIP-191 personal message. */
@Getter
@Builder
@ToString
public class MessageSignature {

    private final String address;

    @JsonProperty("message_hash")
    private final String messageHash;

    private final String signature;
}
