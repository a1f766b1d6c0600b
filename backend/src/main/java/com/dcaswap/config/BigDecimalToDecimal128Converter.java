package com.dcaswap.config;

import org.bson.types.Decimal128;
import org.springframework.core.convert.converter.Converter;
import org.springframework.data.convert.WritingConverter;

import java.math.BigDecimal;
import java.math.MathContext;

/**
 * Writes {@code schedules.purchaseAmount} (and any other BigDecimal field) as Decimal128.
 * Values are rounded to Decimal128's 34 significant digits; a USD amount with two decimals never is.
 */
@WritingConverter
enum BigDecimalToDecimal128Converter implements Converter<BigDecimal, Decimal128> {

    INSTANCE;

    @Override
    public Decimal128 convert(BigDecimal source) {
        return new Decimal128(source.round(MathContext.DECIMAL128));
    }
}
