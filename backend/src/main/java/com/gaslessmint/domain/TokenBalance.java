package com.gaslessmint.domain;

import java.math.BigDecimal;

/**
 * One token balance of a custodial wallet. Amount is in token units (already scaled by decimals).
 */
public record TokenBalance(String tokenAddress, String symbol, Integer decimals, BigDecimal amount) {}
