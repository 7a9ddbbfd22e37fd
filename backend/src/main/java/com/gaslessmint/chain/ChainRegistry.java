package com.gaslessmint.chain;

import com.gaslessmint.chain.abi.NftContractInterface;
import com.gaslessmint.chain.config.ChainProperties;
import com.gaslessmint.common.Hex;
import com.gaslessmint.domain.Blockchain;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Lookup table from {@link Blockchain} to its mint configuration. Chains differ only in data (addresses, ids,
 * names); every chain shares the same mint workflow.
 */
@Component
@Slf4j
public class ChainRegistry {

    private final Map<Blockchain, ChainSettings> settingsByChain;

    public ChainRegistry(ChainProperties properties) {
        Map<Blockchain, ChainSettings> byChain = new EnumMap<>(Blockchain.class);
        ChainProperties.Abi abi = properties.getAbi();
        properties.getNetworks().forEach((key, entry) -> {
            Optional<Blockchain> chain = Blockchain.fromProviderCode(key);
            if (chain.isEmpty()) {
                log.warn("Ignoring chain config for unknown chain {}", key);
                return;
            }
            if (entry == null || Hex.isZeroAddress(entry.getNftContractAddress())) {
                log.info("Chain {} has no NFT contract configured; minting disabled on it", key);
                return;
            }
            String stablecoin = Hex.isZeroAddress(entry.getStablecoinContractAddress())
                    ? null : entry.getStablecoinContractAddress();
            NftContractInterface contract = new NftContractInterface(
                    entry.getNftContractAddress(), abi.getMintEvent(), abi.getBatchMintEvent());
            String displayName = entry.getDisplayName() != null ? entry.getDisplayName() : chain.get().getProviderCode();
            byChain.put(chain.get(), new ChainSettings(chain.get(), displayName, entry.getChainId(),
                    entry.getNftContractAddress(), stablecoin, contract));
        });
        this.settingsByChain = Collections.unmodifiableMap(byChain);
    }

    public Optional<ChainSettings> find(Blockchain blockchain) {
        return Optional.ofNullable(settingsByChain.get(blockchain));
    }

    /**
     * @throws UnsupportedChainException if the chain has no NFT contract configured
     */
    public ChainSettings require(Blockchain blockchain) {
        if (blockchain == null) {
            throw new UnsupportedChainException(null, "No blockchain given");
        }
        return find(blockchain).orElseThrow(() -> new UnsupportedChainException(blockchain,
                "No NFT contract configured for " + blockchain.getProviderCode()));
    }

    public Set<Blockchain> supportedChains() {
        return settingsByChain.keySet();
    }
}
