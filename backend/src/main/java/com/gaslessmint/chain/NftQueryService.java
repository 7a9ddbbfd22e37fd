package com.gaslessmint.chain;

import com.gaslessmint.chain.abi.AbiDecoder;
import com.gaslessmint.chain.abi.AbiSignatures;
import com.gaslessmint.common.Hex;
import com.gaslessmint.config.CaffeineConfig;
import com.gaslessmint.domain.Blockchain;
import com.gaslessmint.domain.NftStats;
import com.gaslessmint.domain.UserNfts;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;

/**
 * Read-only queries against the configured NFT contract of a chain (ERC-721 views).
 * Reverts (e.g. nonexistent token) surface as {@link JsonRpcErrorException}.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class NftQueryService {

    private static final String OWNER_OF_SELECTOR = AbiSignatures.selector("ownerOf(uint256)");
    private static final String TOKEN_URI_SELECTOR = AbiSignatures.selector("tokenURI(uint256)");
    private static final String TOTAL_SUPPLY_SELECTOR = AbiSignatures.selector("totalSupply()");
    private static final String BALANCE_OF_SELECTOR = AbiSignatures.selector("balanceOf(address)");
    private static final String GET_STATS_SELECTOR = AbiSignatures.selector("getStats()");
    private static final String GET_REMAINING_SUPPLY_SELECTOR = AbiSignatures.selector("getRemainingSupply()");
    private static final String MAX_SUPPLY_SELECTOR = AbiSignatures.selector("maxSupply()");
    private static final String NAME_SELECTOR = AbiSignatures.selector("name()");
    private static final String SYMBOL_SELECTOR = AbiSignatures.selector("symbol()");
    private static final String GET_USER_TOKENS_SELECTOR = AbiSignatures.selector("getUserTokens(address)");
    private static final String USER_MINT_COUNT_SELECTOR = AbiSignatures.selector("userMintCount(address)");
    static final String TOKEN_URI_UNAVAILABLE = "Failed to load metadata";

    private final ChainRegistry chainRegistry;
    private final ChainReader chainReader;
    private final CacheManager cacheManager;

    public String getOwner(Blockchain chain, BigInteger tokenId) {
        String result = call(chain, OWNER_OF_SELECTOR + Hex.padWord(tokenId));
        return decode("ownerOf", result, r -> AbiDecoder.readAddress(r, 0));
    }

    /**
     * tokenURI is fixed at mint, so results are cached per (chain, contract, tokenId).
     */
    public String getTokenUri(Blockchain chain, BigInteger tokenId) {
        ChainSettings settings = chainRegistry.require(chain);
        Cache cache = cacheManager.getCache(CaffeineConfig.TOKEN_URI_CACHE);
        if (cache == null) {
            return fetchTokenUri(settings, tokenId);
        }
        String key = chain.name() + ":" + settings.nftContractAddress().toLowerCase(Locale.ROOT) + ":" + tokenId;
        try {
            return cache.get(key, () -> fetchTokenUri(settings, tokenId));
        } catch (Cache.ValueRetrievalException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw e;
        }
    }

    public BigInteger getTotalSupply(Blockchain chain) {
        String result = call(chain, TOTAL_SUPPLY_SELECTOR);
        return decode("totalSupply", result, r -> AbiDecoder.readUint(r, 0));
    }

    public BigInteger getNftBalance(Blockchain chain, String owner) {
        String result = call(chain, BALANCE_OF_SELECTOR + Hex.padWord(owner));
        return decode("balanceOf", result, r -> AbiDecoder.readUint(r, 0));
    }

    public BigInteger getRemainingSupply(Blockchain chain) {
        String result = call(chain, GET_REMAINING_SUPPLY_SELECTOR);
        return decode("getRemainingSupply", result, r -> AbiDecoder.readUint(r, 0));
    }

    /**
     * getStats() returns (totalMinted, remainingSupply, currentPrice); maxSupply, name and symbol are separate calls.
     */
    public NftStats getNftStats(Blockchain chain) {
        ChainSettings settings = chainRegistry.require(chain);
        String stats = call(chain, GET_STATS_SELECTOR);
        String maxSupply = call(chain, MAX_SUPPLY_SELECTOR);
        String name = call(chain, NAME_SELECTOR);
        String symbol = call(chain, SYMBOL_SELECTOR);
        return new NftStats(
                chain,
                settings.nftContractAddress(),
                decode("name", name, r -> AbiDecoder.readString(r, 0)),
                decode("symbol", symbol, r -> AbiDecoder.readString(r, 0)),
                decode("getStats", stats, r -> AbiDecoder.readUint(r, 0)),
                decode("getStats", stats, r -> AbiDecoder.readUint(r, 1)),
                decode("maxSupply", maxSupply, r -> AbiDecoder.readUint(r, 0)),
                decode("getStats", stats, r -> AbiDecoder.readUint(r, 2)));
    }

    /**
     * Tokens of {@code owner} with their URIs. A token whose tokenURI cannot be read is still listed, with an
     * empty URI and an error, and the lookup goes on with the next one.
     *
     * @throws IllegalArgumentException if owner is not a 0x address
     */
    public UserNfts getUserNfts(Blockchain chain, String owner) {
        if (!Hex.isAddress(owner)) {
            throw new IllegalArgumentException("Invalid owner address: " + owner);
        }
        String tokens = call(chain, GET_USER_TOKENS_SELECTOR + Hex.padWord(owner));
        List<BigInteger> tokenIds = decode("getUserTokens", tokens, r -> AbiDecoder.readUintArray(r, 0));
        BigInteger balance = getNftBalance(chain, owner);
        String mintCount = call(chain, USER_MINT_COUNT_SELECTOR + Hex.padWord(owner));
        List<UserNfts.OwnedNft> nfts = new ArrayList<>(tokenIds.size());
        for (BigInteger tokenId : tokenIds) {
            try {
                nfts.add(new UserNfts.OwnedNft(tokenId.toString(), getTokenUri(chain, tokenId), null));
            } catch (RuntimeException e) {
                log.warn("tokenURI of {} on {} unavailable: {}", tokenId, chain, e.getMessage());
                nfts.add(new UserNfts.OwnedNft(tokenId.toString(), "", TOKEN_URI_UNAVAILABLE));
            }
        }
        return new UserNfts(chain, owner, balance,
                decode("userMintCount", mintCount, r -> AbiDecoder.readUint(r, 0)), nfts);
    }

    private String fetchTokenUri(ChainSettings settings, BigInteger tokenId) {
        String result = chainReader.ethCall(settings.blockchain(), settings.nftContractAddress(),
                TOKEN_URI_SELECTOR + Hex.padWord(tokenId));
        return decode("tokenURI", result, r -> AbiDecoder.readString(r, 0));
    }

    private String call(Blockchain chain, String data) {
        ChainSettings settings = chainRegistry.require(chain);
        return chainReader.ethCall(chain, settings.nftContractAddress(), data);
    }

    private static <T> T decode(String function, String result, Function<String, T> decoder) {
        try {
            return decoder.apply(result);
        } catch (IllegalArgumentException | IndexOutOfBoundsException | ArithmeticException e) {
            throw new NftQueryException(function + " returned undecodable data: " + result, e);
        }
    }
}
