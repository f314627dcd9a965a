package io.invoicedesk.backend.signing;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.cert.X509Certificate;
import java.util.Calendar;
import org.apache.pdfbox.cos.COSArray;
import org.apache.pdfbox.cos.COSDictionary;
import org.apache.pdfbox.cos.COSName;
import org.apache.pdfbox.io.IOUtils;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.interactive.digitalsignature.PDSignature;
import org.apache.pdfbox.pdmodel.interactive.digitalsignature.SignatureOptions;
import org.apache.pdfbox.pdmodel.interactive.form.PDSignatureField;
import org.bouncycastle.asn1.ASN1EncodableVector;
import org.bouncycastle.asn1.DERSet;
import org.bouncycastle.asn1.cms.Attribute;
import org.bouncycastle.asn1.cms.AttributeTable;
import org.bouncycastle.asn1.ess.ESSCertIDv2;
import org.bouncycastle.asn1.ess.SigningCertificateV2;
import org.bouncycastle.asn1.pkcs.PKCSObjectIdentifiers;
import org.bouncycastle.asn1.x509.GeneralName;
import org.bouncycastle.asn1.x509.GeneralNames;
import org.bouncycastle.asn1.x509.IssuerSerial;
import org.bouncycastle.cert.jcajce.JcaCertStore;
import org.bouncycastle.cert.jcajce.JcaX509CertificateHolder;
import org.bouncycastle.cms.CMSException;
import org.bouncycastle.cms.CMSProcessableByteArray;
import org.bouncycastle.cms.CMSSignedDataGenerator;
import org.bouncycastle.cms.DefaultSignedAttributeTableGenerator;
import org.bouncycastle.cms.jcajce.JcaSignerInfoGeneratorBuilder;
import org.bouncycastle.operator.ContentSigner;
import org.bouncycastle.operator.OperatorCreationException;
import org.bouncycastle.operator.jcajce.JcaContentSignerBuilder;
import org.bouncycastle.operator.jcajce.JcaDigestCalculatorProviderBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Embeds a CAdES detached signature into a PDF (PDFBox for the document, BouncyCastle for CMS).
 *
 * <ul>
 *   <li>The signature is appended as an incremental update; the input bytes are never modified.
 *   <li>The signature certifies the document with DocMDP P=1: no further changes allowed.
 *   <li>The CMS carries the signing-certificate-v2 attribute that CAdES requires.
 *   <li>The signature field is named {@code Sig<epoch millis>}.
 * </ul>
 */
@Component
public class PdfDocumentSigner {

  private static final Logger log = LoggerFactory.getLogger(PdfDocumentSigner.class);

  /** Reserved CMS size; room for a certificate chain of a few certificates. */
  static final int SIGNATURE_SIZE = SignatureOptions.DEFAULT_SIGNATURE_SIZE * 2;

  static final String FIELD_NAME_PREFIX = "Sig";

  /** DocMDP access permission: no changes to the document are permitted. */
  static final int NO_CHANGES_PERMITTED = 1;

  /**
   * Signs the document.
   *
   * @param pdf the unsigned document
   * @param capability key and certificate chain
   * @param family signature scheme for the key
   * @param reason reason recorded in the signature, may be null
   * @param location location recorded in the signature, may be null
   * @return a new document: the input followed by the signature revision
   * @throws SigningException on PDF, key or CMS errors
   */
  public byte[] sign(
      byte[] pdf,
      SigningCapability capability,
      KeyAlgorithmFamily family,
      String reason,
      String location) {
    try (PDDocument document = PDDocument.load(pdf);
        SignatureOptions options = new SignatureOptions()) {
      var signature = new PDSignature();
      signature.setFilter(PDSignature.FILTER_ADOBE_PPKLITE);
      signature.setSubFilter(PDSignature.SUBFILTER_ETSI_CADES_DETACHED);
      signature.setName(capability.subject());
      signature.setReason(reason);
      signature.setLocation(location);
      signature.setSignDate(Calendar.getInstance());
      certifyNoChanges(document, signature);

      options.setPreferredSignatureSize(SIGNATURE_SIZE);
      document.addSignature(signature, content -> cms(content, capability, family), options);
      String fieldName = nameSignatureField(document, signature);

      var output = new ByteArrayOutputStream(pdf.length + SIGNATURE_SIZE * 2 + 4096);
      document.saveIncremental(output);
      log.debug(
          "Signed document with {} as field {} ({})", capability.subject(), fieldName, family);
      return output.toByteArray();
    } catch (IOException e) {
      throw new SigningException("signing.pdf_failed", "The document could not be signed", e);
    }
  }

  /** Builds the detached CMS signature over the byte ranges PDFBox hands in. */
  byte[] cms(InputStream content, SigningCapability capability, KeyAlgorithmFamily family)
      throws IOException {
    try {
      X509Certificate certificate = capability.certificate();
      var signerBuilder = new JcaContentSignerBuilder(family.signatureAlgorithm());
      if (capability.provider() != null) {
        signerBuilder.setProvider(capability.provider());
      }
      ContentSigner contentSigner = signerBuilder.build(capability.privateKey());

      var generator = new CMSSignedDataGenerator();
      generator.addSignerInfoGenerator(
          new JcaSignerInfoGeneratorBuilder(new JcaDigestCalculatorProviderBuilder().build())
              .setSignedAttributeGenerator(
                  new DefaultSignedAttributeTableGenerator(signingCertificateV2(certificate)))
              .build(contentSigner, certificate));
      generator.addCertificates(new JcaCertStore(capability.chain()));

      var signed = generator.generate(new CMSProcessableByteArray(IOUtils.toByteArray(content)));
      return signed.getEncoded();
    } catch (OperatorCreationException | CMSException | GeneralSecurityException e) {
      // Rethrown as IOException so PDFBox aborts the save; unwrapped by sign().
      throw new IOException("CMS signature creation failed: " + e.getMessage(), e);
    }
  }

  /** signing-certificate-v2 (RFC 5035): SHA-256 of the signer certificate plus issuer/serial. */
  static AttributeTable signingCertificateV2(X509Certificate certificate)
      throws GeneralSecurityException {
    var holder = new JcaX509CertificateHolder(certificate);
    byte[] certHash = MessageDigest.getInstance("SHA-256").digest(certificate.getEncoded());
    var issuerSerial =
        new IssuerSerial(
            new GeneralNames(new GeneralName(holder.getIssuer())), holder.getSerialNumber());
    var essCertId = new ESSCertIDv2(certHash, issuerSerial);
    var attribute =
        new Attribute(
            PKCSObjectIdentifiers.id_aa_signingCertificateV2,
            new DERSet(new SigningCertificateV2(new ESSCertIDv2[] {essCertId})));
    var attributes = new ASN1EncodableVector();
    attributes.add(attribute);
    return new AttributeTable(attributes);
  }

  /**
   * Marks the signature as a certification signature with DocMDP permission P=1 and registers it
   * in the catalog's Perms dictionary.
   */
  static void certifyNoChanges(PDDocument document, PDSignature signature) {
    var transformParameters = new COSDictionary();
    transformParameters.setItem(COSName.TYPE, COSName.getPDFName("TransformParams"));
    transformParameters.setInt(COSName.P, NO_CHANGES_PERMITTED);
    transformParameters.setName(COSName.V, "1.2");
    transformParameters.setNeedToBeUpdated(true);

    var reference = new COSDictionary();
    reference.setItem(COSName.TYPE, COSName.getPDFName("SigRef"));
    reference.setItem("TransformMethod", COSName.DOCMDP);
    reference.setItem("DigestMethod", COSName.getPDFName("SHA256"));
    reference.setItem("TransformParams", transformParameters);
    reference.setNeedToBeUpdated(true);

    var references = new COSArray();
    references.add(reference);
    references.setNeedToBeUpdated(true);
    signature.getCOSObject().setItem("Reference", references);

    COSDictionary catalog = document.getDocumentCatalog().getCOSObject();
    var permissions = new COSDictionary();
    permissions.setItem(COSName.DOCMDP, signature);
    permissions.setNeedToBeUpdated(true);
    catalog.setItem(COSName.PERMS, permissions);
    catalog.setNeedToBeUpdated(true);
  }

  private static String nameSignatureField(PDDocument document, PDSignature signature)
      throws IOException {
    String fieldName = FIELD_NAME_PREFIX + System.currentTimeMillis();
    for (PDSignatureField field : document.getSignatureFields()) {
      if (field.getCOSObject().getDictionaryObject(COSName.V) == signature.getCOSObject()) {
        field.setPartialName(fieldName);
        field.getCOSObject().setNeedToBeUpdated(true);
        return fieldName;
      }
    }
    throw new IOException("Signature field for the new signature not found");
  }
}
