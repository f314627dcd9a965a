package io.invoicedesk.backend.document;

import com.openhtmltopdf.pdfboxout.PdfRendererBuilder;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.thymeleaf.context.Context;
import org.thymeleaf.spring6.SpringTemplateEngine;
import org.thymeleaf.templatemode.TemplateMode;
import org.thymeleaf.templateresolver.ClassLoaderTemplateResolver;

/**
 * Renders invoices to PDF: Thymeleaf fills {@code templates/invoice.html} (labels come from the
 * {@code invoice*.properties} bundles next to it, chosen by the invoice language) and OpenHTMLToPDF
 * converts the resulting XHTML.
 *
 * <p>Uses its own SpEL-backed template engine so the invoice layout does not depend on Spring MVC
 * view configuration.
 */
@Component
public class PdfInvoiceRenderer implements InvoiceRenderer {

  private static final Logger log = LoggerFactory.getLogger(PdfInvoiceRenderer.class);
  private static final String TEMPLATE = "invoice";
  private static final String FONT_FAMILY = "InvoiceFont";

  private final SpringTemplateEngine templateEngine;
  private final CurrencyDisplay currencyDisplay;
  private final File font;

  public PdfInvoiceRenderer(
      CurrencyDisplay currencyDisplay, DocumentRenderingProperties renderingProperties) {
    this.currencyDisplay = currencyDisplay;
    this.templateEngine = createTemplateEngine();
    this.font = resolveFont(renderingProperties.fontPath());
  }

  @Override
  public byte[] render(InvoiceSnapshot snapshot) {
    String html;
    try {
      html = templateEngine.process(TEMPLATE, buildContext(snapshot));
    } catch (RuntimeException e) {
      throw new DocumentRenderingException(
          "Failed to render invoice " + snapshot.invoiceNumber() + " to HTML", e);
    }
    byte[] pdf = htmlToPdf(html, snapshot.invoiceNumber());
    log.debug("Rendered invoice {} ({} bytes)", snapshot.invoiceNumber(), pdf.length);
    return pdf;
  }

  Context buildContext(InvoiceSnapshot snapshot) {
    var ctx = new Context(Locale.forLanguageTag(snapshot.language()));
    ctx.setVariable("invoice", snapshot);
    ctx.setVariable("issueDate", snapshot.issueDate().format(DateTimeFormatter.ISO_LOCAL_DATE));
    ctx.setVariable("fontFamily", font != null ? FONT_FAMILY : "sans-serif");

    boolean dual = currencyDisplay.showDualCurrency(snapshot.currency());
    ctx.setVariable("dualCurrency", dual);
    if (dual) {
      ctx.setVariable("eurSubTotal", CurrencyDisplay.toEur(snapshot.subTotal()));
      ctx.setVariable("eurTaxTotal", CurrencyDisplay.toEur(snapshot.taxTotal()));
      ctx.setVariable("eurTotal", CurrencyDisplay.toEur(snapshot.total()));
      ctx.setVariable("eurRate", CurrencyDisplay.BGN_PER_EUR.toPlainString());
    }
    return ctx;
  }

  private byte[] htmlToPdf(String html, String invoiceNumber) {
    try (var outputStream = new ByteArrayOutputStream()) {
      var builder = new PdfRendererBuilder();
      builder.useFastMode();
      if (font != null) {
        builder.useFont(font, FONT_FAMILY);
      }
      builder.withHtmlContent(html, null);
      builder.toStream(outputStream);
      builder.run();
      return outputStream.toByteArray();
    } catch (IOException | RuntimeException e) {
      throw new DocumentRenderingException(
          "Failed to convert invoice " + invoiceNumber + " to PDF", e);
    }
  }

  private static File resolveFont(String fontPath) {
    if (fontPath == null || fontPath.isBlank()) {
      return null;
    }
    var file = new File(fontPath);
    if (!file.isFile()) {
      log.warn("Configured font {} not found, falling back to built-in fonts", fontPath);
      return null;
    }
    return file;
  }

  private static SpringTemplateEngine createTemplateEngine() {
    var resolver = new ClassLoaderTemplateResolver();
    resolver.setPrefix("templates/");
    resolver.setSuffix(".html");
    resolver.setTemplateMode(TemplateMode.HTML);
    resolver.setCharacterEncoding("UTF-8");
    resolver.setCacheable(true);
    var engine = new SpringTemplateEngine();
    engine.setTemplateResolver(resolver);
    return engine;
  }
}
