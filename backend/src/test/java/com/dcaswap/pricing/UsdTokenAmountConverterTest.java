package com.dcaswap.pricing;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class UsdTokenAmountConverterTest {

    private final UsdTokenAmountConverter converter = new UsdTokenAmountConverter();

    @Test
    @DisplayName("$25 of a $1.00 six-decimal stablecoin is 25,000,000 base units")
    void stablecoinAtParity() {
        assertThat(converter.toBaseUnits(new BigDecimal("25"), "1.0000", 6, "USDC"))
                .isEqualTo(BigInteger.valueOf(25_000_000L));
    }

    @Test
    void eighteenDecimalToken() {
        // $100 at $2500.00 = 0.04 WETH
        assertThat(converter.toBaseUnits(new BigDecimal("100"), "2500.0000", 18, "WETH"))
                .isEqualTo(new BigInteger("40000000000000000"));
    }

    @Test
    @DisplayName("division truncates toward zero")
    void truncates() {
        // 10 / 3 at 6 decimals = 3.333333...
        assertThat(converter.toBaseUnits(new BigDecimal("10"), "3", 6, "X"))
                .isEqualTo(BigInteger.valueOf(3_333_333L));
    }

    @Test
    @DisplayName("price is rounded to six decimals before scaling")
    void priceRoundedToSixDecimals() {
        // 0.0000004 rounds to 0.000000 -> no usable price
        assertThat(converter.toBaseUnits(BigDecimal.ONE, "0.0000004", 6, "DUST"))
                .isEqualTo(BigInteger.valueOf(1_000_000L));
        // 0.0000015 rounds half up to 0.000002
        assertThat(converter.toBaseUnits(BigDecimal.ONE, "0.0000015", 0, "MEME"))
                .isEqualTo(BigInteger.valueOf(500_000L));
    }

    @Test
    void zeroInZeroOut() {
        assertThat(converter.toBaseUnits(BigDecimal.ZERO, "1.2345", 18, "X")).isEqualTo(BigInteger.ZERO);
    }

    @Test
    void deterministic() {
        BigInteger first = converter.toBaseUnits(new BigDecimal("12.34"), "0.9998", 6, "USDC");
        assertThat(converter.toBaseUnits(new BigDecimal("12.34"), "0.9998", 6, "USDC")).isEqualTo(first);
    }

    @Test
    @DisplayName("missing, unparsable or zero price falls back to the USD amount as a token amount")
    void fallbackWithoutPrice() {
        BigInteger expected = BigInteger.valueOf(25_000_000L);
        assertThat(converter.toBaseUnits(new BigDecimal("25"), null, 6, "USDC")).isEqualTo(expected);
        assertThat(converter.toBaseUnits(new BigDecimal("25"), "n/a", 6, "USDC")).isEqualTo(expected);
        assertThat(converter.toBaseUnits(new BigDecimal("25"), "0.0000", 6, "USDC")).isEqualTo(expected);
    }

    @Test
    void negativeAmount_rejected() {
        assertThatThrownBy(() -> converter.toBaseUnits(new BigDecimal("-1"), "1", 6, "USDC"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void formatUnits_stripsTrailingZeros() {
        assertThat(UsdTokenAmountConverter.formatUnits(BigInteger.valueOf(25_000_000L), 6)).isEqualTo("25");
        assertThat(UsdTokenAmountConverter.formatUnits(BigInteger.valueOf(1_500_000L), 6)).isEqualTo("1.5");
        assertThat(UsdTokenAmountConverter.formatUnits(BigInteger.ZERO, 18)).isEqualTo("0");
    }
}
