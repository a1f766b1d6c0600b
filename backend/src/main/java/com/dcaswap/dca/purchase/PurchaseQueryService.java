package com.dcaswap.dca.purchase;

import com.dcaswap.domain.PurchasedCoin;
import com.dcaswap.domain.PurchasedCoinRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Read access to purchase records, newest first.
 */
@Service
@RequiredArgsConstructor
public class PurchaseQueryService {

    private final PurchasedCoinRepository purchasedCoinRepository;

    public List<PurchasedCoin> findByOwner(String ethAddress) {
        return purchasedCoinRepository.findByEthAddressOrderByCreatedAtDesc(ethAddress);
    }

    public List<PurchasedCoin> findBySchedule(String scheduleId) {
        return purchasedCoinRepository.findByScheduleIdOrderByCreatedAtDesc(scheduleId);
    }
}
