package com.dcaswap.config;

import org.bson.types.Decimal128;
import org.springframework.core.convert.converter.Converter;
import org.springframework.data.convert.ReadingConverter;

import java.math.BigDecimal;

/**
 * Reads Decimal128 back into BigDecimal with its stored scale, so "25.50" stays "25.50".
 */
@ReadingConverter
enum Decimal128ToBigDecimalConverter implements Converter<Decimal128, BigDecimal> {

    INSTANCE;

    @Override
    public BigDecimal convert(Decimal128 source) {
        return source.bigDecimalValue();
    }
}
