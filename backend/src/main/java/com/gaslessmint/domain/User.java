package com.gaslessmint.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Minting user keyed by email. Wallet fields are set once, when the first wallet is attached, and never replaced.
 */
@Document(collection = "users")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class User {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    @Indexed(unique = true)
    private String email;
    private String walletId;
    private String walletAddress;
    private Blockchain walletBlockchain;
    private WalletAccountType walletAccountType;
    private Instant createdAt;
    private Instant updatedAt;

    public boolean hasWallet() {
        return walletId != null && !walletId.isBlank() && walletAddress != null && !walletAddress.isBlank();
    }

    /** Wallet as recorded on this user; state is unknown without asking the provider. */
    public Wallet toWallet() {
        return new Wallet(walletId, walletAddress, walletBlockchain, walletAccountType, null);
    }

    public User copy() {
        User copy = new User();
        copy.setId(id);
        copy.setEmail(email);
        copy.setWalletId(walletId);
        copy.setWalletAddress(walletAddress);
        copy.setWalletBlockchain(walletBlockchain);
        copy.setWalletAccountType(walletAccountType);
        copy.setCreatedAt(createdAt);
        copy.setUpdatedAt(updatedAt);
        return copy;
    }
}
