package com.alpharadar.api.controller;

import com.alpharadar.domain.Chain;
import com.alpharadar.trending.TrendingEngine;
import com.alpharadar.trending.TrendingToken;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.util.List;
import java.util.Map;

import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@WebFluxTest(controllers = TrendingController.class)
class TrendingControllerTest {

    @Autowired
    WebTestClient webTestClient;

    @MockBean
    TrendingEngine trendingEngine;

    @Test
    @DisplayName("global ranking is returned in engine order")
    void trending_global() {
        TrendingToken newcomer = new TrendingToken("B", Chain.SOLANA, 3, 2, 3.0, 27.0);
        newcomer.setNewThisWindow(true);
        when(trendingEngine.detect(null)).thenReturn(List.of(
                newcomer,
                new TrendingToken("A", Chain.SOLANA, 4, 3, 1.0, 22.0)));

        webTestClient.get().uri("/api/v1/trending")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.length()").isEqualTo(2)
                .jsonPath("$[0].contract").isEqualTo("B")
                .jsonPath("$[0].chain").isEqualTo("solana")
                .jsonPath("$[0].score").isEqualTo(27.0)
                .jsonPath("$[0].newThisWindow").isEqualTo(true)
                .jsonPath("$[1].contract").isEqualTo("A")
                .jsonPath("$[1].newThisWindow").isEqualTo(false);
    }

    @Test
    @DisplayName("chain parameter filters detection")
    void trending_chainFilter() {
        when(trendingEngine.detect(Chain.EVM)).thenReturn(List.of());

        webTestClient.get().uri("/api/v1/trending?chain=evm")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.length()").isEqualTo(0);
    }

    @Test
    @DisplayName("unknown chain parameter is a 400")
    void trending_unknownChain() {
        webTestClient.get().uri("/api/v1/trending?chain=tron")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("INVALID_CHAIN");
        verifyNoInteractions(trendingEngine);
    }

    @Test
    @DisplayName("by-chain view keys results by chain key")
    void trendingByChain() {
        when(trendingEngine.detectByChain()).thenReturn(Map.of(Chain.EVM,
                List.of(new TrendingToken("0xabc", Chain.EVM, 3, 2, 3.0, 27.0))));

        webTestClient.get().uri("/api/v1/trending/by-chain")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.evm[0].contract").isEqualTo("0xabc")
                .jsonPath("$.solana").doesNotExist();
    }
}
