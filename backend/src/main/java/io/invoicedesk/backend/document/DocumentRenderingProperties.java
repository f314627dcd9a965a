package io.invoicedesk.backend.document;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * @param fontPath optional TrueType font embedded into rendered documents. The built-in PDF fonts
 *     only cover Latin-1, so Cyrillic names and labels need one.
 */
@ConfigurationProperties(prefix = "invoicedesk.rendering")
public record DocumentRenderingProperties(String fontPath) {}
