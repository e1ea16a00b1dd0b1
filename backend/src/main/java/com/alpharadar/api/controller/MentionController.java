package com.alpharadar.api.controller;

import com.alpharadar.api.dto.ErrorBody;
import com.alpharadar.api.dto.RecordMentionRequest;
import com.alpharadar.api.dto.RecordMentionResponse;
import com.alpharadar.api.validation.ContractAddressValidator;
import com.alpharadar.domain.Chain;
import com.alpharadar.ingestion.MentionIngestionService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * POST /api/v1/mentions: one extracted contract address from one message. 201 when new, 200 when already seen.
 */
@RestController
@RequestMapping("/api/v1/mentions")
@RequiredArgsConstructor
public class MentionController {

    private final MentionIngestionService mentionIngestionService;
    private final ContractAddressValidator contractAddressValidator;

    @PostMapping
    public ResponseEntity<?> record(@Valid @RequestBody RecordMentionRequest request) {
        Chain chain = Chain.fromKey(request.chain()).orElseThrow();
        if (!contractAddressValidator.isValidAddress(request.contract(), chain)) {
            return ResponseEntity.badRequest()
                    .body(ErrorBody.of("INVALID_ADDRESS", "Invalid " + chain.key() + " contract address"));
        }
        String contract = chain.normalize(request.contract());
        boolean inserted = mentionIngestionService.record(contract, chain, request.sourceId(),
                request.occurrenceId(), request.observedAt());
        return ResponseEntity.status(inserted ? HttpStatus.CREATED : HttpStatus.OK)
                .body(new RecordMentionResponse(inserted, contract, chain.key()));
    }
}
