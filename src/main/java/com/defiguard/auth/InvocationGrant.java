package com.defiguard.auth;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/** Issued when a script evaluation starts; the token is handed to the sandbox. */
@Getter
@Builder
public class InvocationGrant {

    @JsonProperty("evaluation_id")
    private final String evaluationId;

    @JsonProperty("invocation_token")
    private final String invocationToken;

    @JsonProperty("expires_at")
    private final Instant expiresAt;
}
