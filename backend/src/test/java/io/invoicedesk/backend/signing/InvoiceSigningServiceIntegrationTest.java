package io.invoicedesk.backend.signing;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

import io.invoicedesk.backend.TestFixtures;
import io.invoicedesk.backend.TestcontainersConfiguration;
import io.invoicedesk.backend.company.CompanyService;
import io.invoicedesk.backend.customer.CustomerService;
import io.invoicedesk.backend.document.InvoiceDocumentService;
import io.invoicedesk.backend.exception.ErrorKind;
import io.invoicedesk.backend.exception.InvalidStateException;
import io.invoicedesk.backend.exception.OperationCancelledException;
import io.invoicedesk.backend.exception.ResourceNotFoundException;
import io.invoicedesk.backend.invoice.DocumentArtifact;
import io.invoicedesk.backend.invoice.InvoiceService;
import io.invoicedesk.backend.invoice.dto.InvoiceResponse;
import io.invoicedesk.backend.multitenancy.TenantContext;
import io.invoicedesk.backend.operations.CancellationToken;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

@SpringBootTest
@Import(TestcontainersConfiguration.class)
@ActiveProfiles("test")
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class InvoiceSigningServiceIntegrationTest {

  @Autowired private InvoiceSigningService signingService;
  @Autowired private InvoiceDocumentService documentService;
  @Autowired private InvoiceService invoiceService;
  @Autowired private CompanyService companyService;
  @Autowired private CustomerService customerService;
  @MockitoBean private SigningKeySelector keySelector;

  private UUID companyId;
  private UUID customerId;

  @BeforeAll
  void setup() throws Exception {
    companyId = TestFixtures.company(companyService, "SIG").getId();
    customerId = TestFixtures.customer(customerService, companyId, "Sig Customer").getId();
  }

  @Test
  void signsWithRsaAndKeepsUnsignedDocument() throws Exception {
    when(keySelector.selectSigningKey()).thenReturn(Optional.of(TestKeys.rsa()));
    UUID invoiceId = issuedInvoice();
    var unsigned = export(invoiceId);

    var signed = sign(invoiceId, CancellationToken.none());

    assertThat(signed.getFileName()).isEqualTo(baseName(unsigned) + "-signed.pdf");
    assertThat(signed.getSha256()).isNotEqualTo(unsigned.getSha256());
    var reloaded = find(invoiceId);
    assertThat(reloaded.unsignedDocument().sha256()).isEqualTo(unsigned.getSha256());
    assertThat(reloaded.signedDocument().sha256()).isEqualTo(signed.getSha256());
    assertThat(reloaded.signedDocument().createdAt()).isEqualTo(signed.getCreatedAt());
  }

  @Test
  void signingRendersTheDocumentWhenAbsent() throws Exception {
    when(keySelector.selectSigningKey()).thenReturn(Optional.of(TestKeys.ec()));
    UUID invoiceId = issuedInvoice();

    var signed = sign(invoiceId, CancellationToken.none());

    var reloaded = find(invoiceId);
    assertThat(reloaded.unsignedDocument()).isNotNull();
    assertThat(reloaded.signedDocument().sha256()).isEqualTo(signed.getSha256());
  }

  @Test
  void storedSignatureVerifiesAsCertified() throws Exception {
    when(keySelector.selectSigningKey()).thenReturn(Optional.of(TestKeys.rsa()));
    UUID invoiceId = issuedInvoice();
    sign(invoiceId, CancellationToken.none());

    var verification = TenantContext.callAs(companyId, () -> signingService.verify(invoiceId));

    assertThat(verification.valid()).isTrue();
    assertThat(verification.signatures())
        .singleElement()
        .satisfies(check -> assertThat(check.certifiedNoChanges()).isTrue());
  }

  @Test
  void reSigningReplacesTheSignedDocument() throws Exception {
    when(keySelector.selectSigningKey()).thenReturn(Optional.of(TestKeys.rsa()));
    UUID invoiceId = issuedInvoice();
    var first = sign(invoiceId, CancellationToken.none());

    var second = sign(invoiceId, CancellationToken.none());

    assertThat(second.getSha256()).isNotEqualTo(first.getSha256());
    assertThat(find(invoiceId).signedDocument().sha256()).isEqualTo(second.getSha256());
  }

  @Test
  void draftCannotBeSigned() throws Exception {
    var draft = TestFixtures.draft(invoiceService, companyId, customerId);

    assertThatThrownBy(() -> sign(draft.id(), CancellationToken.none()))
        .isInstanceOf(InvalidStateException.class)
        .satisfies(e -> assertThat(ErrorKind.of(e)).isEqualTo(ErrorKind.INVALID_STATE));
  }

  @Test
  void noSelectedKeyCancelsAndStoresNothing() throws Exception {
    when(keySelector.selectSigningKey()).thenReturn(Optional.empty());
    UUID invoiceId = issuedInvoice();

    assertThatThrownBy(() -> sign(invoiceId, CancellationToken.none()))
        .isInstanceOf(OperationCancelledException.class)
        .satisfies(e -> assertThat(ErrorKind.of(e)).isEqualTo(ErrorKind.CANCELLED));
    assertThat(find(invoiceId).signedDocument()).isNull();
  }

  @Test
  void unsupportedKeyIsASigningError() throws Exception {
    var rsa = TestKeys.rsa();
    when(keySelector.selectSigningKey())
        .thenReturn(Optional.of(new SigningCapability(null, rsa.certificate())));
    UUID invoiceId = issuedInvoice();

    assertThatThrownBy(() -> sign(invoiceId, CancellationToken.none()))
        .isInstanceOf(SigningException.class)
        .satisfies(e -> assertThat(ErrorKind.of(e)).isEqualTo(ErrorKind.SIGNING_ERROR));
    assertThat(find(invoiceId).signedDocument()).isNull();
  }

  @Test
  void keySelectorFailureIsASigningError() throws Exception {
    when(keySelector.selectSigningKey()).thenThrow(new IllegalStateException("token removed"));
    UUID invoiceId = issuedInvoice();

    assertThatThrownBy(() -> sign(invoiceId, CancellationToken.none()))
        .isInstanceOfSatisfying(
            SigningException.class,
            e -> {
              assertThat(ErrorKind.of(e)).isEqualTo(ErrorKind.SIGNING_ERROR);
              assertThat(e.getBody().getDetail()).doesNotContain("token removed");
            });
    assertThat(find(invoiceId).signedDocument()).isNull();
  }

  @Test
  void unsignedInvoiceHasNoSignedDocument() throws Exception {
    UUID invoiceId = issuedInvoice();

    assertThatThrownBy(
            () ->
                TenantContext.callAs(companyId, () -> signingService.getSignedDocument(invoiceId)))
        .isInstanceOf(ResourceNotFoundException.class);
  }

  @Test
  void signedFileNameDerivesFromUnsignedName() {
    assertThat(InvoiceSigningService.signedFileName("invoice-inv1.pdf"))
        .isEqualTo("invoice-inv1-signed.pdf");
    assertThat(InvoiceSigningService.signedFileName("invoice")).isEqualTo("invoice-signed.pdf");
  }

  private UUID issuedInvoice() throws Exception {
    var draft = TestFixtures.draft(invoiceService, companyId, customerId);
    TenantContext.callAs(
        companyId, () -> invoiceService.issue(draft.id(), CancellationToken.none()));
    return draft.id();
  }

  private DocumentArtifact export(UUID invoiceId) throws Exception {
    return TenantContext.callAs(
        companyId,
        () -> documentService.getOrRenderUnsigned(invoiceId, false, CancellationToken.none()));
  }

  private DocumentArtifact sign(UUID invoiceId, CancellationToken token) throws Exception {
    return TenantContext.callAs(companyId, () -> signingService.sign(invoiceId, token));
  }

  private InvoiceResponse find(UUID invoiceId) throws Exception {
    return TenantContext.callAs(companyId, () -> invoiceService.findById(invoiceId));
  }

  private static String baseName(DocumentArtifact artifact) {
    String name = artifact.getFileName();
    return name.substring(0, name.lastIndexOf('.'));
  }
}
