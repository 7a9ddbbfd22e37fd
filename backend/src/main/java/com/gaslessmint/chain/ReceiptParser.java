package com.gaslessmint.chain;

import com.gaslessmint.chain.abi.DecodedEvent;
import com.gaslessmint.chain.abi.NftContractInterface;
import com.gaslessmint.common.Hex;
import com.gaslessmint.domain.Blockchain;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Recovers minted token ids from a confirmed transaction's receipt. Best effort: never throws, degrades to
 * {@link #PENDING_TOKEN_ID} (single mint) or an empty list (batch).
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ReceiptParser {

    /** Mint succeeded on-chain but the token id could not be determined. */
    public static final String PENDING_TOKEN_ID = "pending";

    private final ChainReader chainReader;

    /**
     * Token id from the configured mint event, falling back to an ERC-721 Transfer from the zero address.
     *
     * @return decimal token id, or {@link #PENDING_TOKEN_ID}
     */
    public String extractTokenId(String txHash, NftContractInterface contract, Blockchain chain) {
        try {
            Optional<TransactionReceipt> receipt = chainReader.getTransactionReceipt(chain, txHash);
            if (receipt.isEmpty()) {
                log.warn("No receipt yet for {} on {}; token id pending", txHash, chain);
                return PENDING_TOKEN_ID;
            }
            List<DecodedEvent> events = decodeAll(receipt.get(), contract);
            Optional<BigInteger> tokenId = events.stream()
                    .filter(e -> e.name().equals(contract.getMintEventName()))
                    .filter(e -> e.arg("tokenId") instanceof BigInteger)
                    .filter(e -> !NftContractInterface.TRANSFER.equals(e.name()) || isMint(e))
                    .map(e -> (BigInteger) e.arg("tokenId"))
                    .findFirst()
                    .or(() -> events.stream()
                            .filter(e -> NftContractInterface.TRANSFER.equals(e.name()) && isMint(e))
                            .map(e -> (BigInteger) e.arg("tokenId"))
                            .findFirst());
            if (tokenId.isEmpty()) {
                log.warn("No {} event in receipt of {} ({} logs, {} decoded); token id pending",
                        contract.getMintEventName(), txHash, receipt.get().logs().size(), events.size());
                return PENDING_TOKEN_ID;
            }
            return tokenId.get().toString();
        } catch (RuntimeException e) {
            log.warn("Token id extraction failed for {} on {}: {}", txHash, chain, e.getMessage());
            return PENDING_TOKEN_ID;
        }
    }

    /**
     * Token ids from the configured batch-mint event.
     *
     * @return decimal token ids in emission order, or an empty list
     */
    public List<String> extractBatchTokenIds(String txHash, NftContractInterface contract, Blockchain chain) {
        try {
            Optional<TransactionReceipt> receipt = chainReader.getTransactionReceipt(chain, txHash);
            if (receipt.isEmpty()) {
                log.warn("No receipt yet for batch {} on {}", txHash, chain);
                return List.of();
            }
            for (DecodedEvent event : decodeAll(receipt.get(), contract)) {
                if (event.name().equals(contract.getBatchMintEventName()) && event.arg("tokenIds") instanceof List<?> ids) {
                    return ids.stream().map(String::valueOf).toList();
                }
            }
            log.warn("No {} event in receipt of {}", contract.getBatchMintEventName(), txHash);
            return List.of();
        } catch (RuntimeException e) {
            log.warn("Batch token id extraction failed for {} on {}: {}", txHash, chain, e.getMessage());
            return List.of();
        }
    }

    private static List<DecodedEvent> decodeAll(TransactionReceipt receipt, NftContractInterface contract) {
        List<DecodedEvent> decoded = new ArrayList<>();
        for (ReceiptLog entry : receipt.logs()) {
            try {
                decoded.add(contract.decode(entry));
            } catch (ReceiptParseException e) {
                log.debug("Skipping log of {}: {}", receipt.transactionHash(), e.getMessage());
            }
        }
        return decoded;
    }

    private static boolean isMint(DecodedEvent transfer) {
        return Hex.isZeroAddress((String) transfer.arg("from"));
    }
}
