package com.alpharadar.api.dto;

import com.alpharadar.api.validation.SupportedChain;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.time.Instant;

/**
 * POST /api/v1/mentions request body. observedAt defaults to server time when absent.
 */
public record RecordMentionRequest(
        @NotBlank(message = "INVALID_ADDRESS")
        String contract,

        @NotBlank(message = "INVALID_CHAIN")
        @SupportedChain
        String chain,

        @NotNull(message = "INVALID_SOURCE")
        Long sourceId,

        @NotNull(message = "INVALID_OCCURRENCE")
        Long occurrenceId,

        Instant observedAt
) {
}
