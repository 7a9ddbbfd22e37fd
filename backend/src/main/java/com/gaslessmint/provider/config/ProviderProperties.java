package com.gaslessmint.provider.config;

import com.gaslessmint.domain.WalletAccountType;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Wallet and sponsorship provider settings (gaslessmint.provider.*).
 */
@ConfigurationProperties(prefix = "gaslessmint.provider")
@NoArgsConstructor
@Getter
@Setter
public class ProviderProperties {

    private String baseUrl = "https://api-sandbox.circle.com";
    private String apiKey;
    /** Wallet set new user wallets are created in. */
    private String walletSetId;
    /**
     * Pre-encrypted entity secret sent with every write call. Optional; only providers in developer-controlled
     * mode require it.
     */
    private String entitySecretCiphertext;
    /** Per-request timeout for provider calls. */
    private long requestTimeoutMs = 30_000;
    private String feeLevel = "MEDIUM";
    /** Gas ceiling for a single mint. */
    private String mintGasLimit = "500000";
    /** Gas ceiling for a collection (batchMint) call. */
    private String batchMintGasLimit = "2000000";
    /** Gas price reported when the estimate call fails (gas limit falls back to mintGasLimit). */
    private String fallbackGasPrice = "1000000000";
    /** Estimated cost, in native units, reported when the estimate call fails. */
    private String fallbackEstimatedCost = "0.005";
    /** Account type requested for new wallets. Only SCA wallets can receive sponsored gas. */
    private WalletAccountType accountType = WalletAccountType.SCA;

    public boolean hasEntitySecretCiphertext() {
        return entitySecretCiphertext != null && !entitySecretCiphertext.isBlank();
    }
}
