package com.alpharadar.api.dto;

/**
 * inserted=false means the same (contract, source, occurrence) was already recorded.
 */
public record RecordMentionResponse(boolean inserted, String contract, String chain) {
}
