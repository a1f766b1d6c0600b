package com.dcaswap.pricing;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;

/**
 * Converts a USD budget into token base units using integer arithmetic only:
 * {@code usd * 10^6 * 10^decimals / (price * 10^6)}, truncated toward zero.
 * Without a usable price the USD amount is taken as a token amount (degraded, logged at WARN).
 */
@Component
@Slf4j
public class UsdTokenAmountConverter {

    /** Fixed-point scale applied to both the USD amount and the unit price. */
    static final int FIXED_POINT_DECIMALS = 6;

    public BigInteger toBaseUnits(BigDecimal usdAmount, String unitPriceUsd, int tokenDecimals, String tokenSymbol) {
        if (usdAmount == null || usdAmount.signum() < 0) {
            throw new IllegalArgumentException("USD amount must be non-negative");
        }
        if (tokenDecimals < 0) {
            throw new IllegalArgumentException("Token decimals must be non-negative");
        }
        BigInteger priceScaled = scalePrice(unitPriceUsd);
        if (priceScaled.signum() <= 0) {
            log.warn("Token price not available for {}, treating ${} as a token amount", tokenSymbol, usdAmount);
            return usdAmount.setScale(tokenDecimals, RoundingMode.HALF_UP).movePointRight(tokenDecimals).toBigInteger();
        }
        BigInteger usdScaled = usdAmount.movePointRight(FIXED_POINT_DECIMALS).setScale(0, RoundingMode.DOWN).toBigInteger();
        BigInteger amount = usdScaled.multiply(BigInteger.TEN.pow(tokenDecimals)).divide(priceScaled);
        log.debug("Converting ${} USD to {} {} at price ${}",
                usdAmount, formatUnits(amount, tokenDecimals), tokenSymbol, unitPriceUsd);
        return amount;
    }

    /** Base units to a plain decimal string, e.g. (25000000, 6) -> "25". */
    public static String formatUnits(BigInteger amount, int decimals) {
        return new BigDecimal(amount, decimals).stripTrailingZeros().toPlainString();
    }

    private static BigInteger scalePrice(String unitPriceUsd) {
        if (unitPriceUsd == null || unitPriceUsd.isBlank()) {
            return BigInteger.ZERO;
        }
        try {
            return new BigDecimal(unitPriceUsd.trim())
                    .setScale(FIXED_POINT_DECIMALS, RoundingMode.HALF_UP)
                    .movePointRight(FIXED_POINT_DECIMALS)
                    .toBigInteger();
        } catch (NumberFormatException e) {
            log.warn("Unparsable token price '{}'", unitPriceUsd);
            return BigInteger.ZERO;
        }
    }
}
