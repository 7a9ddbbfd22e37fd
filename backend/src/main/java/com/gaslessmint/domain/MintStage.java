package com.gaslessmint.domain;

/**
 * Orchestration stages of a mint, in execution order.
 */
public enum MintStage {
    RESOLVE_CHAIN,
    /** Collection mints only: enough contract supply left for every item. */
    CHECK_SUPPLY,
    RESOLVE_USER,
    ENSURE_WALLET,
    PUBLISH_METADATA,
    VALIDATE_STABLECOIN_BALANCE,
    SUBMIT_TRANSACTION,
    POLL_TRANSACTION,
    EXTRACT_TOKEN_ID
}
