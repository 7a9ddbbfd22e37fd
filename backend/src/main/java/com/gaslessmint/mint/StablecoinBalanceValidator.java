package com.gaslessmint.mint;

import com.gaslessmint.chain.ChainSettings;
import com.gaslessmint.chain.UnsupportedChainException;
import com.gaslessmint.domain.TokenBalance;
import com.gaslessmint.domain.Wallet;
import com.gaslessmint.mint.config.MintProperties;
import com.gaslessmint.wallet.WalletProvisioningService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Checks the wallet can pay the metadata storage fee in the chain's stablecoin. Runs before submission.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class StablecoinBalanceValidator {

    private final WalletProvisioningService walletProvisioningService;
    private final MintProperties mintProperties;

    /**
     * @throws InsufficientStablecoinBalanceException when the balance is missing or below the storage cost
     * @throws UnsupportedChainException              when the chain has no stablecoin configured
     */
    public BigDecimal validate(Wallet wallet, ChainSettings chain) {
        if (!chain.hasStablecoin()) {
            throw new UnsupportedChainException(chain.blockchain(),
                    "No stablecoin configured for " + chain.blockchain().getProviderCode());
        }
        BigDecimal required = mintProperties.getStablecoinStorageCost();
        BigDecimal available = walletProvisioningService.getBalances(wallet.id()).stream()
                .filter(b -> b.tokenAddress() != null && b.tokenAddress().equalsIgnoreCase(chain.stablecoinContractAddress()))
                .map(TokenBalance::amount)
                .findFirst()
                .orElse(BigDecimal.ZERO);
        if (available.compareTo(required) < 0) {
            throw new InsufficientStablecoinBalanceException(wallet.id(), required, available);
        }
        log.info("Wallet {} stablecoin balance {} covers storage cost {}", wallet.id(), available, required);
        return available;
    }
}
