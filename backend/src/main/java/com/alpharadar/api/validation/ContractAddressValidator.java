package com.alpharadar.api.validation;

import com.alpharadar.domain.Chain;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Validates a contract address against the format of its chain.
 */
@Component
public class ContractAddressValidator {

    private static final Pattern EVM_ADDRESS = Pattern.compile("^0x[0-9a-fA-F]{40}$");
    /** Solana Base58: 32-44 chars. */
    private static final Pattern SOLANA_ADDRESS = Pattern.compile("^[1-9A-HJ-NP-Za-km-z]{32,44}$");

    public boolean isValidAddress(String address, Chain chain) {
        if (address == null || address.isBlank() || chain == null) return false;
        String a = address.strip();
        return switch (chain) {
            case EVM -> EVM_ADDRESS.matcher(a).matches();
            case SOLANA -> SOLANA_ADDRESS.matcher(a).matches();
        };
    }
}
