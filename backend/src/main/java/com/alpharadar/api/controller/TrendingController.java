package com.alpharadar.api.controller;

import com.alpharadar.api.dto.ErrorBody;
import com.alpharadar.api.dto.TrendingTokenResponse;
import com.alpharadar.domain.Chain;
import com.alpharadar.trending.TrendingEngine;
import com.alpharadar.trending.TrendingToken;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only view of what the engine currently ranks as trending. Does not touch cooldowns.
 */
@RestController
@RequestMapping("/api/v1/trending")
@RequiredArgsConstructor
public class TrendingController {

    private final TrendingEngine trendingEngine;

    @GetMapping
    public ResponseEntity<?> trending(@RequestParam(required = false) String chain) {
        Chain filter = null;
        if (chain != null && !chain.isBlank()) {
            Optional<Chain> parsed = Chain.fromKey(chain);
            if (parsed.isEmpty()) {
                return ResponseEntity.badRequest().body(ErrorBody.of("INVALID_CHAIN", "Unsupported chain: " + chain));
            }
            filter = parsed.get();
        }
        return ResponseEntity.ok(toResponse(trendingEngine.detect(filter)));
    }

    @GetMapping("/by-chain")
    public ResponseEntity<Map<String, List<TrendingTokenResponse>>> trendingByChain() {
        Map<String, List<TrendingTokenResponse>> body = new LinkedHashMap<>();
        trendingEngine.detectByChain().forEach((chain, tokens) -> body.put(chain.key(), toResponse(tokens)));
        return ResponseEntity.ok(body);
    }

    private static List<TrendingTokenResponse> toResponse(List<TrendingToken> tokens) {
        return tokens.stream().map(TrendingTokenResponse::from).toList();
    }
}
