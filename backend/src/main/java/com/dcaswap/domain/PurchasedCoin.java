package com.dcaswap.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Outcome record of one successful scheduled purchase. Append-only: written once by DcaSwapPipeline, never updated.
 */
@Document(collection = "purchased_coins")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class PurchasedCoin {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    @Indexed
    private String ethAddress;
    /** Receive-token contract address. */
    private String coinAddress;
    private String name;
    private String symbol;
    /** USD spent, two-decimal display form (e.g. "25.00"). */
    private String purchaseAmount;
    @Indexed
    private String scheduleId;
    @Indexed(unique = true)
    private String txHash;
    private Instant createdAt;
}
