package com.dcaswap.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

/**
 * Persistence for purchased_coins. Writers use insert() only.
 */
public interface PurchasedCoinRepository extends MongoRepository<PurchasedCoin, String> {

    List<PurchasedCoin> findByEthAddressOrderByCreatedAtDesc(String ethAddress);

    List<PurchasedCoin> findByScheduleIdOrderByCreatedAtDesc(String scheduleId);
}
