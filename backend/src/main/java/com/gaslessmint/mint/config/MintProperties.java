package com.gaslessmint.mint.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;

/**
 * Mint workflow settings (gaslessmint.mint.*).
 */
@ConfigurationProperties(prefix = "gaslessmint.mint")
@NoArgsConstructor
@Getter
@Setter
public class MintProperties {

    /** Metadata storage fee in stablecoin token units; the wallet must hold at least this much. */
    private BigDecimal stablecoinStorageCost = BigDecimal.ONE;
    /** Pause between items of a serial batch (throughput throttle). */
    private long batchItemDelayMs = 1_000;
    private int maxBatchSize = 10;
}
