package com.alpharadar.api.validation;

import com.alpharadar.domain.Chain;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ContractAddressValidatorTest {

    private final ContractAddressValidator validator = new ContractAddressValidator();

    @Test
    @DisplayName("Valid EVM address accepted only for EVM")
    void validEvmAddress() {
        assertThat(validator.isValidAddress("0x742d35Cc6634C0532925a3b844Bc454e4438f44e", Chain.EVM)).isTrue();
        assertThat(validator.isValidAddress("0x0000000000000000000000000000000000000000", Chain.EVM)).isTrue();
        assertThat(validator.isValidAddress("0x742d35Cc6634C0532925a3b844Bc454e4438f44e", Chain.SOLANA)).isFalse();
    }

    @Test
    @DisplayName("Valid Solana address accepted only for Solana")
    void validSolanaAddress() {
        assertThat(validator.isValidAddress("DezXAZ8z7PnrnRJjz3wXBoRgixCa6xjnB7YaB1pPB263", Chain.SOLANA)).isTrue();
        assertThat(validator.isValidAddress("So11111111111111111111111111111111111111112", Chain.SOLANA)).isTrue();
        assertThat(validator.isValidAddress("DezXAZ8z7PnrnRJjz3wXBoRgixCa6xjnB7YaB1pPB263", Chain.EVM)).isFalse();
    }

    @Test
    @DisplayName("Invalid address rejected")
    void invalidAddress() {
        assertThat(validator.isValidAddress(null, Chain.EVM)).isFalse();
        assertThat(validator.isValidAddress("", Chain.SOLANA)).isFalse();
        assertThat(validator.isValidAddress("0x123", Chain.EVM)).isFalse();
        // base58 excludes 0, O, I and l
        assertThat(validator.isValidAddress("0OIl0OIl0OIl0OIl0OIl0OIl0OIl0OIl", Chain.SOLANA)).isFalse();
        assertThat(validator.isValidAddress("0x742d35Cc6634C0532925a3b844Bc454e4438f44e", null)).isFalse();
    }

    @Test
    @DisplayName("SupportedChain constraint accepts known keys and null")
    void supportedChainConstraint() {
        SupportedChainValidator constraint = new SupportedChainValidator();
        assertThat(constraint.isValid("solana", null)).isTrue();
        assertThat(constraint.isValid("EVM", null)).isTrue();
        assertThat(constraint.isValid(null, null)).isTrue();
        assertThat(constraint.isValid("tron", null)).isFalse();
    }
}
