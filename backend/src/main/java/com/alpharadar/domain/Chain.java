package com.alpharadar.domain;

import java.util.Locale;
import java.util.Optional;

/**
 * Supported chain families. Each family has its own contract address format and its own trending ranking.
 * New chains are added here; per-chain detection iterates {@link #values()}.
 */
public enum Chain {
    SOLANA("solana", false),
    EVM("evm", true);

    private final String key;
    private final boolean caseInsensitiveAddresses;

    Chain(String key, boolean caseInsensitiveAddresses) {
        this.key = key;
        this.caseInsensitiveAddresses = caseInsensitiveAddresses;
    }

    /** Lowercase external identifier ("solana", "evm") used in API payloads and logs. */
    public String key() {
        return key;
    }

    /**
     * Canonical form of a contract address on this chain. EVM hex addresses are case-insensitive
     * (checksum casing is cosmetic), so they are lowercased; base58 Solana addresses are kept verbatim.
     */
    public String normalize(String contract) {
        if (contract == null) {
            return null;
        }
        String trimmed = contract.strip();
        return caseInsensitiveAddresses ? trimmed.toLowerCase(Locale.ROOT) : trimmed;
    }

    /** Resolves "solana" / "SOLANA" / "evm"; empty for unknown or blank input. */
    public static Optional<Chain> fromKey(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String v = value.strip();
        for (Chain chain : values()) {
            if (chain.key.equalsIgnoreCase(v)) {
                return Optional.of(chain);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return key;
    }
}
