package com.gaslessmint.chain.abi;

import com.gaslessmint.chain.ReceiptLog;
import com.gaslessmint.chain.ReceiptParseException;
import com.gaslessmint.common.Hex;
import lombok.Getter;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Fixed event ABI of the gasless NFT contract at one address:
 * <ul>
 *   <li>{@code NFTMinted(address indexed to, uint256 indexed tokenId, string tokenURI, uint256 timestamp)}</li>
 *   <li>{@code BatchMinted(address indexed to, uint256[] tokenIds, uint256 timestamp)}</li>
 *   <li>{@code Transfer(address indexed from, address indexed to, uint256 indexed tokenId)} (ERC-721)</li>
 * </ul>
 * Which of the first two counts as "the" mint / batch-mint event is configurable by name.
 */
@Getter
public class NftContractInterface {

    public static final String NFT_MINTED = "NFTMinted";
    public static final String BATCH_MINTED = "BatchMinted";
    public static final String TRANSFER = "Transfer";

    private static final Map<String, String> EVENT_SIGNATURES = Map.of(
            NFT_MINTED, "NFTMinted(address,uint256,string,uint256)",
            BATCH_MINTED, "BatchMinted(address,uint256[],uint256)",
            TRANSFER, "Transfer(address,address,uint256)"
    );

    private final String contractAddress;
    private final String mintEventName;
    private final String batchMintEventName;
    private final Map<String, String> eventNamesByTopic;

    public NftContractInterface(String contractAddress, String mintEventName, String batchMintEventName) {
        if (!EVENT_SIGNATURES.containsKey(mintEventName)) {
            throw new IllegalArgumentException("Unknown mint event: " + mintEventName);
        }
        if (!EVENT_SIGNATURES.containsKey(batchMintEventName)) {
            throw new IllegalArgumentException("Unknown batch mint event: " + batchMintEventName);
        }
        this.contractAddress = contractAddress.toLowerCase(Locale.ROOT);
        this.mintEventName = mintEventName;
        this.batchMintEventName = batchMintEventName;
        Map<String, String> byTopic = new HashMap<>();
        EVENT_SIGNATURES.forEach((name, signature) -> byTopic.put(AbiSignatures.topic(signature), name));
        this.eventNamesByTopic = Map.copyOf(byTopic);
    }

    public static String eventTopic(String eventName) {
        String signature = EVENT_SIGNATURES.get(eventName);
        if (signature == null) {
            throw new IllegalArgumentException("Unknown event: " + eventName);
        }
        return AbiSignatures.topic(signature);
    }

    /**
     * Decodes a log emitted by this contract.
     *
     * @throws ReceiptParseException when the log comes from another address, has an unknown topic or does not
     *                               fit the event layout (e.g. an ERC-20 Transfer with the tokenId in data)
     */
    public DecodedEvent decode(ReceiptLog log) {
        if (log.address() == null || !contractAddress.equals(log.address().toLowerCase(Locale.ROOT))) {
            throw new ReceiptParseException("Log from foreign address " + log.address());
        }
        if (log.topics().isEmpty()) {
            throw new ReceiptParseException("Anonymous log");
        }
        String name = eventNamesByTopic.get(log.topics().get(0).toLowerCase(Locale.ROOT));
        if (name == null) {
            throw new ReceiptParseException("Unknown event topic " + log.topics().get(0));
        }
        try {
            return switch (name) {
                case NFT_MINTED -> decodeNftMinted(log);
                case BATCH_MINTED -> decodeBatchMinted(log);
                default -> decodeTransfer(log);
            };
        } catch (IllegalArgumentException | IndexOutOfBoundsException | ArithmeticException e) {
            throw new ReceiptParseException("Malformed " + name + " log: " + e.getMessage(), e);
        }
    }

    private DecodedEvent decodeNftMinted(ReceiptLog log) {
        requireTopics(log, 3);
        String data = log.data();
        Map<String, Object> args = new HashMap<>();
        args.put("to", Hex.wordToAddress(log.topics().get(1)));
        args.put("tokenId", Hex.toBigInteger(log.topics().get(2)));
        args.put("tokenURI", AbiDecoder.readString(data, 0));
        args.put("timestamp", AbiDecoder.readUint(data, 1));
        return new DecodedEvent(NFT_MINTED, args);
    }

    private DecodedEvent decodeBatchMinted(ReceiptLog log) {
        requireTopics(log, 2);
        String data = log.data();
        Map<String, Object> args = new HashMap<>();
        args.put("to", Hex.wordToAddress(log.topics().get(1)));
        args.put("tokenIds", AbiDecoder.readUintArray(data, 0));
        args.put("timestamp", AbiDecoder.readUint(data, 1));
        return new DecodedEvent(BATCH_MINTED, args);
    }

    private DecodedEvent decodeTransfer(ReceiptLog log) {
        // ERC-20 Transfer shares topic0 but carries the amount in data: only 3 topics
        requireTopics(log, 4);
        Map<String, Object> args = new HashMap<>();
        args.put("from", Hex.wordToAddress(log.topics().get(1)));
        args.put("to", Hex.wordToAddress(log.topics().get(2)));
        args.put("tokenId", Hex.toBigInteger(log.topics().get(3)));
        return new DecodedEvent(TRANSFER, args);
    }

    private static void requireTopics(ReceiptLog log, int expected) {
        if (log.topics().size() != expected) {
            throw new ReceiptParseException("Expected " + expected + " topics, got " + log.topics().size());
        }
    }
}
