package com.defiguard.unit.tool;

import static org.assertj.core.api.Assertions.assertThat;

import com.defiguard.tool.TradeValueEstimator;
import java.math.BigDecimal;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class TradeValueEstimatorTest {

    private static final String USDC = "0xA0b86991c6218b36c1d19D4a2e9Eb0cE3606eB48";
    private static final String DAI = "0x6B175474E89094C44Da98b954EedeAC495271d0F";
    private static final String WETH = "0xC02aaA39b223FE8D0A0e5C4F27eAD9083C756Cc2";
    private static final String UNLISTED = "0x1111111111111111111111111111111111111111";

    private final TradeValueEstimator estimator = new TradeValueEstimator();

    @Test
    @DisplayName("A stablecoin is valued from its amount even when amount_usd says otherwise")
    void stablecoin_ignoresDeclaredValue() {
        assertThat(estimator.estimateUsd(new BigDecimal("1"), USDC, "5000000000"))
                .hasValueSatisfying(v -> assertThat(v).isEqualByComparingTo("5000"));
        assertThat(estimator.estimateUsd(new BigDecimal("42"), USDC, "1000000000"))
                .hasValueSatisfying(v -> assertThat(v).isEqualByComparingTo("1000"));
    }

    @Test
    @DisplayName("Stablecoin base units are valued 1:1 using the token's decimals")
    void stablecoinValuedAtPar() {
        assertThat(estimator.estimateUsd(null, USDC, "250000000"))
                .hasValueSatisfying(v -> assertThat(v).isEqualByComparingTo("250"));
        assertThat(estimator.estimateUsd(null, DAI, "1500000000000000000"))
                .hasValueSatisfying(v -> assertThat(v).isEqualByComparingTo("1.5"));
    }

    @Test
    @DisplayName("A non-stablecoin uses the declared amount_usd")
    void nonStablecoin_usesDeclaredValue() {
        assertThat(estimator.estimateUsd(new BigDecimal("320"), WETH, "100000000000000000"))
                .hasValueSatisfying(v -> assertThat(v).isEqualByComparingTo("320"));
    }

    @Test
    @DisplayName("Non-stablecoins have no estimate without amount_usd")
    void unknownToken_empty() {
        assertThat(estimator.estimateUsd(null, WETH, "1000000000000000000")).isEmpty();
        assertThat(estimator.estimateUsd(null, UNLISTED, "1000")).isEmpty();
    }

    @Test
    @DisplayName("Decimals are known for stablecoins and wrapped ether, case-insensitively")
    void decimalsOf() {
        assertThat(estimator.decimalsOf(USDC)).contains(6);
        assertThat(estimator.decimalsOf(DAI.toLowerCase())).contains(18);
        assertThat(estimator.decimalsOf(WETH)).contains(18);
        assertThat(estimator.decimalsOf(UNLISTED)).isEmpty();
        assertThat(estimator.decimalsOf(null)).isEmpty();
    }
}
