package com.gaslessmint.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gaslessmint.domain.Blockchain;
import com.gaslessmint.domain.GasEstimate;
import com.gaslessmint.domain.TokenBalance;
import com.gaslessmint.domain.TransactionResult;
import com.gaslessmint.domain.TransactionState;
import com.gaslessmint.domain.Wallet;
import com.gaslessmint.domain.WalletAccountType;
import com.gaslessmint.domain.WalletState;
import lombok.RequiredArgsConstructor;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Parses provider bodies ({@code {"data": {...}}} envelope) into explicit records. Anything that does not fit
 * raises {@link MalformedProviderResponseException}.
 */
@RequiredArgsConstructor
class ProviderResponses {

    private final ObjectMapper objectMapper;

    JsonNode data(String body) {
        if (body == null || body.isBlank()) {
            throw new MalformedProviderResponseException("Empty provider response");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new MalformedProviderResponseException("Provider response is not JSON", e);
        }
        JsonNode data = root.path("data");
        if (!data.isObject()) {
            throw new MalformedProviderResponseException("Provider response has no data object");
        }
        return data;
    }

    List<Wallet> wallets(String body) {
        JsonNode wallets = data(body).path("wallets");
        if (!wallets.isArray()) {
            throw new MalformedProviderResponseException("Provider response has no wallets array");
        }
        List<Wallet> out = new ArrayList<>();
        for (JsonNode node : wallets) {
            out.add(wallet(node));
        }
        return out;
    }

    Wallet singleWallet(String body) {
        JsonNode node = data(body).path("wallet");
        if (!node.isObject()) {
            throw new MalformedProviderResponseException("Provider response has no wallet object");
        }
        return wallet(node);
    }

    List<TokenBalance> balances(String body) {
        JsonNode balances = data(body).path("tokenBalances");
        if (balances.isMissingNode() || balances.isNull()) {
            return List.of();
        }
        if (!balances.isArray()) {
            throw new MalformedProviderResponseException("tokenBalances is not an array");
        }
        List<TokenBalance> out = new ArrayList<>();
        for (JsonNode node : balances) {
            JsonNode token = node.path("token");
            String amountText = node.path("amount").asText(null);
            BigDecimal amount;
            try {
                amount = amountText != null ? new BigDecimal(amountText) : BigDecimal.ZERO;
            } catch (NumberFormatException e) {
                throw new MalformedProviderResponseException("Invalid balance amount: " + amountText, e);
            }
            Integer decimals = token.path("decimals").isNumber() ? token.path("decimals").asInt() : null;
            out.add(new TokenBalance(
                    textOrNull(token, "tokenAddress"),
                    textOrNull(token, "symbol"),
                    decimals,
                    amount));
        }
        return out;
    }

    /**
     * Transaction object from either {@code data.transaction} (status query) or {@code data} itself (create call).
     */
    TransactionResult transaction(String body) {
        JsonNode data = data(body);
        return transaction(data.path("transaction").isObject() ? data.path("transaction") : data);
    }

    /** Transaction list from {@code data.transactions}; a missing list is empty. */
    List<TransactionResult> transactions(String body) {
        JsonNode transactions = data(body).path("transactions");
        if (transactions.isMissingNode() || transactions.isNull()) {
            return List.of();
        }
        if (!transactions.isArray()) {
            throw new MalformedProviderResponseException("transactions is not an array");
        }
        List<TransactionResult> out = new ArrayList<>();
        for (JsonNode node : transactions) {
            out.add(transaction(node));
        }
        return out;
    }

    GasEstimate gasEstimate(String body, Blockchain blockchain) {
        JsonNode data = data(body);
        String gasLimit = textOrNull(data, "gasLimit");
        if (gasLimit == null) {
            throw new MalformedProviderResponseException("Gas estimate has no gasLimit");
        }
        return new GasEstimate(blockchain, gasLimit, textOrNull(data, "gasPrice"), textOrNull(data, "estimatedCost"),
                true, null);
    }

    private static TransactionResult transaction(JsonNode tx) {
        String id = textOrNull(tx, "id");
        if (id == null) {
            throw new MalformedProviderResponseException("Transaction response has no id");
        }
        TransactionState state = TransactionState.fromProviderValue(textOrNull(tx, "state"));
        String txHash = textOrNull(tx, "txHash");
        if (state == TransactionState.CONFIRMED && txHash == null) {
            throw new MalformedProviderResponseException("Transaction " + id + " is CONFIRMED without txHash");
        }
        return new TransactionResult(
                id,
                state,
                txHash,
                textOrNull(tx, "blockHash"),
                blockHeight(tx.path("blockHeight")),
                textOrNull(tx, "gasUsed"),
                textOrNull(tx, "errorReason"));
    }

    /** Provider error body is {@code {"code": ..., "message": "..."}}; falls back to the raw body. */
    String errorMessage(String body) {
        if (body == null || body.isBlank()) {
            return "(empty body)";
        }
        try {
            JsonNode message = objectMapper.readTree(body).path("message");
            return message.isTextual() ? message.asText() : body;
        } catch (JsonProcessingException e) {
            return body;
        }
    }

    private static Wallet wallet(JsonNode node) {
        String id = textOrNull(node, "id");
        String address = textOrNull(node, "address");
        if (id == null || address == null) {
            throw new MalformedProviderResponseException("Wallet entry without id or address");
        }
        String chainCode = textOrNull(node, "blockchain");
        Blockchain blockchain = Blockchain.fromProviderCode(chainCode)
                .orElseThrow(() -> new MalformedProviderResponseException("Unknown wallet blockchain: " + chainCode));
        String type = textOrNull(node, "accountType");
        WalletAccountType accountType = WalletAccountType.fromProviderValue(type)
                .orElseThrow(() -> new MalformedProviderResponseException("Unknown wallet account type: " + type));
        WalletState state = WalletState.fromProviderValue(textOrNull(node, "state")).orElse(null);
        return new Wallet(id, address, blockchain, accountType, state);
    }

    private static Long blockHeight(JsonNode node) {
        if (node.isNumber()) {
            return node.asLong();
        }
        if (node.isTextual() && !node.asText().isBlank()) {
            try {
                return Long.parseLong(node.asText().trim());
            } catch (NumberFormatException e) {
                throw new MalformedProviderResponseException("Invalid blockHeight: " + node.asText(), e);
            }
        }
        return null;
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (value.isMissingNode() || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }
}
