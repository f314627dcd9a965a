package io.invoicedesk.backend.company;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * @param defaultCompany create a company on startup when the store has none
 */
@ConfigurationProperties(prefix = "invoicedesk.seed")
public record SeedProperties(@DefaultValue("true") boolean defaultCompany) {}
