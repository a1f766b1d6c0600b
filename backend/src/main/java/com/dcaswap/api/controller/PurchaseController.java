package com.dcaswap.api.controller;

import com.dcaswap.api.dto.ApiResponse;
import com.dcaswap.api.dto.ErrorBody;
import com.dcaswap.api.dto.PurchaseResponse;
import com.dcaswap.api.validation.EvmAddressValidator;
import com.dcaswap.dca.purchase.PurchaseQueryService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * GET /purchases?ethAddress=: completed purchases of a wallet, newest first.
 */
@RestController
@RequestMapping("/api/v1/purchases")
@RequiredArgsConstructor
public class PurchaseController {

    private final PurchaseQueryService purchaseQueryService;

    @GetMapping
    public ResponseEntity<?> list(@RequestParam(required = false) String ethAddress) {
        if (!EvmAddressValidator.isEvmAddress(ethAddress)) {
            return ResponseEntity.badRequest().body(ErrorBody.of("INVALID_ADDRESS", "Invalid Ethereum address"));
        }
        List<PurchaseResponse> purchases = purchaseQueryService.findByOwner(ethAddress).stream()
                .map(PurchaseResponse::from)
                .toList();
        return ResponseEntity.ok(ApiResponse.ok(purchases));
    }
}
