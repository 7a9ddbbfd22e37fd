package com.gaslessmint.domain;

/**
 * Input of a single gasless mint. Not persisted.
 */
public record MintRequest(String email, NftMetadata metadata, Blockchain blockchain, boolean payWithStablecoin) {}
