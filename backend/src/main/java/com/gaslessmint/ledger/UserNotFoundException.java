package com.gaslessmint.ledger;

import lombok.Getter;

/**
 * Thrown when a ledger operation names a user id that was never created.
 */
@Getter
public class UserNotFoundException extends RuntimeException {

    private final String userId;

    public UserNotFoundException(String userId) {
        super("User not found: " + userId);
        this.userId = userId;
    }
}
