package com.gaslessmint.transaction.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Transaction confirmation polling defaults (gaslessmint.polling.*); overridable per call.
 */
@ConfigurationProperties(prefix = "gaslessmint.polling")
@NoArgsConstructor
@Getter
@Setter
public class PollingProperties {

    /** Total budget for reaching a terminal state. Transient query errors consume it too. */
    private long maxWaitMs = 120_000;
    private long pollIntervalMs = 3_000;
}
