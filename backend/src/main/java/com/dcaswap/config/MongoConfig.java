package com.dcaswap.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.core.convert.MongoCustomConversions;

import java.util.List;

/**
 * Mongo mapping for the schedules and purchased_coins collections. {@code Schedule.purchaseAmount} is a
 * BigDecimal stored as Decimal128; the purchase record keeps its amount as the formatted "25.00" string.
 * Claim and owner indexes come from the annotations on the documents (auto-index-creation).
 */
@Configuration
public class MongoConfig {

    @Bean
    public MongoCustomConversions customConversions() {
        return new MongoCustomConversions(List.of(
                BigDecimalToDecimal128Converter.INSTANCE,
                Decimal128ToBigDecimalConverter.INSTANCE));
    }
}
