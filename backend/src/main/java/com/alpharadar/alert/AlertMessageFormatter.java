package com.alpharadar.alert;

import com.alpharadar.domain.Chain;
import com.alpharadar.trending.TrendingToken;

import java.util.Locale;

/**
 * Plain-text alert body shared by dispatchers.
 */
public final class AlertMessageFormatter {

    private AlertMessageFormatter() {
    }

    /**
     * @param tokenName display name from {@code TokenMetadataResolver}; blank omits the Token line
     */
    public static String format(TrendingToken token, int windowMinutes, String tokenName) {
        StringBuilder sb = new StringBuilder("TRENDING TOKEN DETECTED\n");
        sb.append("Chain: ").append(token.getChain().key().toUpperCase(Locale.ROOT)).append('\n');
        if (tokenName != null && !tokenName.isBlank()) {
            sb.append("Token: ").append(tokenName).append('\n');
        }
        sb.append("Contract: ").append(token.getContract()).append('\n')
                .append("Mentions (").append(windowMinutes).append("m): ").append(token.getMentionCount()).append('\n')
                .append("Unique sources: ").append(token.getUniqueSources()).append('\n')
                .append("Velocity: ").append(formatVelocity(token.getVelocity(), token.isNewThisWindow())).append('\n')
                .append("Score: ").append(String.format(Locale.ROOT, "%.1f", token.getScore())).append('\n')
                .append(links(token.getChain(), token.getContract()));
        return sb.toString();
    }

    /** NEW when the previous window was empty, otherwise signed whole percent (+100%, -50%, +0%). */
    public static String formatVelocity(double velocity, boolean newThisWindow) {
        if (newThisWindow) {
            return "NEW";
        }
        return String.format(Locale.ROOT, "%+.0f%%", velocity * 100);
    }

    static String links(Chain chain, String contract) {
        return switch (chain) {
            case SOLANA -> "DS: https://dexscreener.com/solana/" + contract
                    + " | GMGN: https://gmgn.ai/sol/token/" + contract
                    + " | Photon: https://photon-sol.tinyastro.io/en/lp/" + contract
                    + " | Axiom: https://axiom.trade/t/" + contract
                    + " | BullX: https://bullx.io/terminal?chainId=1399811149&address=" + contract;
            // EVM links assume Ethereum mainnet
            case EVM -> "DS: https://dexscreener.com/ethereum/" + contract
                    + " | GMGN: https://gmgn.ai/eth/token/" + contract
                    + " | DexTools: https://www.dextools.io/app/en/ether/pair-explorer/" + contract
                    + " | Etherscan: https://etherscan.io/token/" + contract;
        };
    }
}
