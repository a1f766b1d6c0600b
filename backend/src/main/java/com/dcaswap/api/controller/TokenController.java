package com.dcaswap.api.controller;

import com.dcaswap.api.dto.ApiResponse;
import com.dcaswap.api.dto.ErrorBody;
import com.dcaswap.pricing.TokenQuote;
import com.dcaswap.pricing.TokenService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * GET /tokens: listed tokens with USD prices, from the registry cache.
 */
@RestController
@RequestMapping("/api/v1/tokens")
@RequiredArgsConstructor
public class TokenController {

    private final TokenService tokenService;

    @GetMapping
    public ResponseEntity<?> listTokens() {
        List<TokenQuote> tokens = tokenService.listTokens();
        if (tokens.isEmpty()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(ErrorBody.of("NO_TOKENS", "No tokens available from Aerodrome"));
        }
        return ResponseEntity.ok(ApiResponse.ok(tokens));
    }
}
