package com.gaslessmint.mint;

import com.gaslessmint.chain.ChainRegistry;
import com.gaslessmint.chain.ChainSettings;
import com.gaslessmint.chain.NftQueryService;
import com.gaslessmint.chain.ReceiptParser;
import com.gaslessmint.chain.config.ChainProperties;
import com.gaslessmint.common.Hex;
import com.gaslessmint.config.AsyncConfig;
import com.gaslessmint.domain.BatchMintResult;
import com.gaslessmint.domain.Blockchain;
import com.gaslessmint.domain.CollectionMintItem;
import com.gaslessmint.domain.CollectionMintResult;
import com.gaslessmint.domain.MintRequest;
import com.gaslessmint.domain.MintResult;
import com.gaslessmint.domain.MintStage;
import com.gaslessmint.domain.NftMetadata;
import com.gaslessmint.domain.PendingTransaction;
import com.gaslessmint.domain.TransactionResult;
import com.gaslessmint.domain.User;
import com.gaslessmint.domain.Wallet;
import com.gaslessmint.ledger.UserStore;
import com.gaslessmint.metadata.MetadataPublisher;
import com.gaslessmint.mint.config.MintProperties;
import com.gaslessmint.provider.config.ProviderProperties;
import com.gaslessmint.transaction.TransactionPoller;
import com.gaslessmint.transaction.TransactionSubmitter;
import com.gaslessmint.wallet.WalletProvisioningService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Future;
import java.util.function.Supplier;

/**
 * End-to-end gasless mint:
 * RESOLVE_CHAIN → RESOLVE_USER → ENSURE_WALLET → PUBLISH_METADATA → (VALIDATE_STABLECOIN_BALANCE) →
 * SUBMIT_TRANSACTION → POLL_TRANSACTION → EXTRACT_TOKEN_ID.
 * <p>
 * Stages run sequentially on the calling thread. The first failing stage aborts the mint with
 * {@link MintFailedException}; nothing already done is rolled back. Batches run item by item with a fixed
 * delay, and one failed item does not stop the rest.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class MintOrchestrator {

    private final ChainRegistry chainRegistry;
    private final UserStore userStore;
    private final WalletProvisioningService walletProvisioningService;
    private final MetadataPublisher metadataPublisher;
    private final StablecoinBalanceValidator stablecoinBalanceValidator;
    private final TransactionSubmitter transactionSubmitter;
    private final TransactionPoller transactionPoller;
    private final ReceiptParser receiptParser;
    private final NftQueryService nftQueryService;
    private final ChainProperties chainProperties;
    private final MintProperties mintProperties;
    private final ProviderProperties providerProperties;
    @Qualifier(AsyncConfig.MINT_EXECUTOR)
    private final AsyncTaskExecutor mintExecutor;

    /**
     * @throws IllegalArgumentException if the request has no email or metadata name
     * @throws MintFailedException      if any stage fails
     */
    public MintResult mintNft(MintRequest request) {
        validate(request);
        String email = normalizeEmail(request.email());
        try {
            ChainSettings chain = stage(MintStage.RESOLVE_CHAIN, () -> chainRegistry.require(request.blockchain()));
            User user = stage(MintStage.RESOLVE_USER, () -> userStore.findOrCreate(email));
            Wallet wallet = stage(MintStage.ENSURE_WALLET,
                    () -> walletProvisioningService.ensureWallet(user.getId(), chain.blockchain()));
            warnOnChainMismatch(wallet, chain.blockchain());
            String metadataUri = stage(MintStage.PUBLISH_METADATA, () -> metadataPublisher.publish(request.metadata()));
            if (request.payWithStablecoin()) {
                stage(MintStage.VALIDATE_STABLECOIN_BALANCE, () -> stablecoinBalanceValidator.validate(wallet, chain));
            }
            PendingTransaction pending = stage(MintStage.SUBMIT_TRANSACTION, () -> transactionSubmitter.submit(
                    wallet.id(),
                    chain.nftContractAddress(),
                    chainProperties.getAbi().getMintFunction(),
                    List.of(wallet.address(), metadataUri),
                    chain.blockchain()));
            TransactionResult confirmed = stage(MintStage.POLL_TRANSACTION,
                    () -> transactionPoller.await(pending.transactionId()));
            String tokenId = stage(MintStage.EXTRACT_TOKEN_ID,
                    () -> receiptParser.extractTokenId(confirmed.txHash(), chain.contractInterface(), chain.blockchain()));
            log.info("Minted token {} for {} on {} (tx {})", tokenId, email, chain.displayName(), confirmed.txHash());
            return new MintResult(
                    tokenId,
                    confirmed.txHash(),
                    confirmed.transactionId(),
                    chain.nftContractAddress(),
                    wallet.address(),
                    wallet.accountType(),
                    chain.blockchain(),
                    metadataUri,
                    confirmed.blockHash(),
                    confirmed.blockHeight(),
                    confirmed.gasUsed());
        } catch (MintFailedException e) {
            log.error("Mint for {} failed at {}: {}", email, e.getStage(), e.getCause().getMessage());
            throw e;
        }
    }

    /**
     * Runs {@link #mintNft} on the mint executor. Cancelling the future with interruption stops polling.
     */
    public Future<MintResult> submitMint(MintRequest request) {
        return mintExecutor.submit(() -> mintNft(request));
    }

    /**
     * Mints each item as its own transaction, serially, pausing between items. The stablecoin check, if
     * requested, runs on every item until one passes it; no item is submitted before a passing check. An
     * interrupted batch reports the remaining items as failed.
     *
     * @throws IllegalArgumentException if the batch is empty or larger than the configured maximum
     */
    public BatchMintResult batchMint(String email, List<NftMetadata> items, Blockchain blockchain,
                                     boolean payWithStablecoin) {
        requireBatchSize(items);
        List<MintResult> successful = new ArrayList<>();
        List<BatchMintResult.ItemError> errors = new ArrayList<>();
        boolean balanceValidated = false;
        for (int i = 0; i < items.size(); i++) {
            NftMetadata item = items.get(i);
            if (Thread.currentThread().isInterrupted()) {
                cancelRemaining(items, i, errors);
                break;
            }
            boolean validateBalance = payWithStablecoin && !balanceValidated;
            MintRequest request = new MintRequest(email, item, blockchain, validateBalance);
            try {
                successful.add(mintNft(request));
                balanceValidated |= validateBalance;
            } catch (MintFailedException e) {
                balanceValidated |= validateBalance && passedBalanceCheck(e.getStage());
                errors.add(new BatchMintResult.ItemError(i, nameOf(item), e.getStage(), e.getCause().getMessage()));
            } catch (IllegalArgumentException e) {
                errors.add(new BatchMintResult.ItemError(i, nameOf(item), null, e.getMessage()));
            }
            if (i < items.size() - 1 && !pause()) {
                cancelRemaining(items, i + 1, errors);
                break;
            }
        }
        log.info("Batch for {} on {}: {}/{} minted", email, blockchain, successful.size(), items.size());
        return BatchMintResult.of(successful, errors, items.size());
    }

    /**
     * Mints all items to the user's wallet in one batchMint transaction.
     *
     * @see #mintCollectionTo(String, List, Blockchain)
     */
    public CollectionMintResult mintCollection(String email, List<NftMetadata> items, Blockchain blockchain) {
        requireBatchSize(items);
        return mintCollectionTo(email, items.stream().map(CollectionMintItem::toMinter).toList(), blockchain);
    }

    /**
     * Mints all items in one batchMint transaction, each to its own recipient (the user's wallet when none is
     * given). The contract must have supply left for every item.
     *
     * @throws IllegalArgumentException if the batch size is out of range, an item has no name or a recipient is
     *                                  not an address
     * @throws MintFailedException      if any stage fails; too little supply fails at CHECK_SUPPLY
     */
    public CollectionMintResult mintCollectionTo(String email, List<CollectionMintItem> items, Blockchain blockchain) {
        requireBatchSize(items);
        for (CollectionMintItem item : items) {
            validate(new MintRequest(email, item != null ? item.metadata() : null, blockchain, false));
            if (item.hasRecipient() && !Hex.isAddress(item.recipient())) {
                throw new IllegalArgumentException("Invalid recipient address: " + item.recipient());
            }
        }
        String normalizedEmail = normalizeEmail(email);
        try {
            ChainSettings chain = stage(MintStage.RESOLVE_CHAIN, () -> chainRegistry.require(blockchain));
            stage(MintStage.CHECK_SUPPLY, () -> requireSupply(chain, items.size()));
            User user = stage(MintStage.RESOLVE_USER, () -> userStore.findOrCreate(normalizedEmail));
            Wallet wallet = stage(MintStage.ENSURE_WALLET,
                    () -> walletProvisioningService.ensureWallet(user.getId(), chain.blockchain()));
            warnOnChainMismatch(wallet, chain.blockchain());
            List<String> metadataUris = stage(MintStage.PUBLISH_METADATA,
                    () -> items.stream().map(item -> metadataPublisher.publish(item.metadata())).toList());
            List<String> recipients = items.stream()
                    .map(item -> item.hasRecipient() ? item.recipient() : wallet.address())
                    .toList();
            PendingTransaction pending = stage(MintStage.SUBMIT_TRANSACTION, () -> transactionSubmitter.submit(
                    wallet.id(),
                    chain.nftContractAddress(),
                    chainProperties.getAbi().getBatchMintFunction(),
                    List.of(recipients, metadataUris),
                    chain.blockchain(),
                    "0",
                    providerProperties.getBatchMintGasLimit()));
            TransactionResult confirmed = stage(MintStage.POLL_TRANSACTION,
                    () -> transactionPoller.await(pending.transactionId()));
            List<String> tokenIds = stage(MintStage.EXTRACT_TOKEN_ID, () -> receiptParser.extractBatchTokenIds(
                    confirmed.txHash(), chain.contractInterface(), chain.blockchain()));
            log.info("Collection of {} minted for {} on {} (tx {}, {} ids decoded)", items.size(), normalizedEmail,
                    chain.displayName(), confirmed.txHash(), tokenIds.size());
            return new CollectionMintResult(tokenIds, confirmed.txHash(), confirmed.transactionId(),
                    chain.nftContractAddress(), wallet.address(), chain.blockchain(), recipients, metadataUris);
        } catch (MintFailedException e) {
            log.error("Collection mint for {} failed at {}: {}", normalizedEmail, e.getStage(), e.getCause().getMessage());
            throw e;
        }
    }

    private BigInteger requireSupply(ChainSettings chain, int requested) {
        BigInteger remaining = nftQueryService.getRemainingSupply(chain.blockchain());
        if (remaining.compareTo(BigInteger.valueOf(requested)) < 0) {
            throw new InsufficientSupplyException(remaining, requested);
        }
        return remaining;
    }

    private static <T> T stage(MintStage stage, Supplier<T> step) {
        log.debug("Stage {}", stage);
        try {
            return step.get();
        } catch (MintFailedException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new MintFailedException(stage, e);
        }
    }

    private static boolean passedBalanceCheck(MintStage failedAt) {
        return failedAt.compareTo(MintStage.VALIDATE_STABLECOIN_BALANCE) > 0;
    }

    private boolean pause() {
        try {
            Thread.sleep(mintProperties.getBatchItemDelayMs());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static void cancelRemaining(List<NftMetadata> items, int from, List<BatchMintResult.ItemError> errors) {
        log.warn("Batch interrupted; {} item(s) not attempted", items.size() - from);
        for (int i = from; i < items.size(); i++) {
            errors.add(new BatchMintResult.ItemError(i, nameOf(items.get(i)), null, "Batch cancelled"));
        }
    }

    private void requireBatchSize(List<?> items) {
        int max = mintProperties.getMaxBatchSize();
        if (items == null || items.isEmpty() || items.size() > max) {
            throw new IllegalArgumentException("Batch must contain between 1 and " + max + " items");
        }
    }

    private static void validate(MintRequest request) {
        if (request.email() == null || request.email().isBlank()) {
            throw new IllegalArgumentException("Email is required");
        }
        if (request.metadata() == null || request.metadata().name() == null || request.metadata().name().isBlank()) {
            throw new IllegalArgumentException("Metadata name is required");
        }
    }

    private static void warnOnChainMismatch(Wallet wallet, Blockchain requested) {
        if (wallet.blockchain() != null && wallet.blockchain() != requested) {
            log.warn("Reusing wallet {} on {} for a mint on {}", wallet.id(), wallet.blockchain(), requested);
        }
    }

    private static String nameOf(NftMetadata item) {
        return item != null ? item.name() : null;
    }

    private static String normalizeEmail(String email) {
        return email.trim().toLowerCase(Locale.ROOT);
    }
}
