package io.invoicedesk.backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Worker pool sizing.
 *
 * @param corePoolSize core threads of the invoice pool (issuance, rendering)
 * @param maxPoolSize max threads of the invoice pool
 * @param queueCapacity queued tasks per pool before new submissions are rejected
 * @param signingPoolSize threads of the signing pool; keep at 1 for a single hardware token
 */
@ConfigurationProperties(prefix = "invoicedesk.async")
public record AsyncProperties(
    @DefaultValue("4") int corePoolSize,
    @DefaultValue("8") int maxPoolSize,
    @DefaultValue("100") int queueCapacity,
    @DefaultValue("1") int signingPoolSize) {}
