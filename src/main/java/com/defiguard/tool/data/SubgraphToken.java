package com.defiguard.tool.data;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

@Getter
@Builder
@ToString
public class SubgraphToken {

    private final String id;
    private final String symbol;
    private final String name;
    private final int decimals;
}
