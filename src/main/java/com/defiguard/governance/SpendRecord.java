package com.defiguard.governance;

import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/** One confirmed capital-committing call. */
@Getter
@Builder
@ToString
public class SpendRecord {

    private final String callId;
    private final String tool;
    private final BigDecimal amountUsd;
    private final Instant recordedAt;
}
