package io.invoicedesk.backend.signing;

import io.invoicedesk.backend.document.ContentHashes;
import io.invoicedesk.backend.invoice.DocumentArtifact;
import io.invoicedesk.backend.signing.SignatureVerification.SignatureCheck;
import java.io.IOException;
import java.security.cert.CertificateException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import org.apache.pdfbox.cos.COSArray;
import org.apache.pdfbox.cos.COSBase;
import org.apache.pdfbox.cos.COSDictionary;
import org.apache.pdfbox.cos.COSName;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.interactive.digitalsignature.PDSignature;
import org.apache.pdfbox.pdmodel.interactive.form.PDSignatureField;
import org.bouncycastle.cert.X509CertificateHolder;
import org.bouncycastle.cms.CMSException;
import org.bouncycastle.cms.CMSProcessableByteArray;
import org.bouncycastle.cms.CMSSignedData;
import org.bouncycastle.cms.SignerInformation;
import org.bouncycastle.cms.jcajce.JcaSimpleSignerInfoVerifierBuilder;
import org.bouncycastle.operator.OperatorCreationException;
import org.bouncycastle.util.Store;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Checks a signed document: the stored hash against the bytes, and each embedded CMS signature
 * against the byte ranges it covers and the certificate it carries. Trust in the certificate chain
 * is out of scope.
 */
@Component
public class SignedDocumentVerifier {

  private static final Logger log = LoggerFactory.getLogger(SignedDocumentVerifier.class);

  private static final int NO_CHANGES_PERMITTED = 1;
  private static final COSName REFERENCE = COSName.getPDFName("Reference");
  private static final COSName TRANSFORM_METHOD = COSName.getPDFName("TransformMethod");
  private static final COSName TRANSFORM_PARAMS = COSName.getPDFName("TransformParams");

  public SignatureVerification verify(DocumentArtifact artifact) {
    byte[] pdf = artifact.getContent();
    String actualSha256 = ContentHashes.sha256Hex(pdf);
    boolean hashMatches = actualSha256.equals(artifact.getSha256());
    if (!hashMatches) {
      log.warn(
          "Stored hash {} of {} does not match its content ({})",
          artifact.getSha256(),
          artifact.getFileName(),
          actualSha256);
    }
    return new SignatureVerification(
        artifact.getFileName(), artifact.getSha256(), actualSha256, hashMatches, checkAll(pdf));
  }

  List<SignatureCheck> checkAll(byte[] pdf) {
    try (PDDocument document = PDDocument.load(pdf)) {
      PDSignature certifying = certifyingSignature(document);
      var checks = new ArrayList<SignatureCheck>();
      for (PDSignatureField field : document.getSignatureFields()) {
        PDSignature signature = field.getSignature();
        if (signature != null) {
          checks.add(check(field.getPartialName(), signature, pdf, certifying));
        }
      }
      return checks;
    } catch (IOException e) {
      throw new SigningException(
          "signing.verification_failed", "The signed document cannot be read", e);
    }
  }

  private SignatureCheck check(
      String fieldName, PDSignature signature, byte[] pdf, PDSignature certifying)
      throws IOException {
    int[] byteRange = signature.getByteRange();
    boolean coversWholeDocument =
        byteRange.length == 4 && byteRange[2] + byteRange[3] == pdf.length;
    boolean certified =
        certifying != null
            && Arrays.equals(certifying.getByteRange(), byteRange)
            && docMdpPermission(signature) == NO_CHANGES_PERMITTED;
    Instant signedAt =
        signature.getSignDate() != null ? signature.getSignDate().toInstant() : null;

    String signer = null;
    String problem = null;
    boolean valid = false;
    try {
      var cms =
          new CMSSignedData(
              new CMSProcessableByteArray(signature.getSignedContent(pdf)),
              signature.getContents(pdf));
      Store<X509CertificateHolder> certificates = cms.getCertificates();
      Collection<SignerInformation> signers = cms.getSignerInfos().getSigners();
      if (signers.size() != 1) {
        problem = "Expected exactly one signer, found " + signers.size();
      } else {
        SignerInformation signerInfo = signers.iterator().next();
        @SuppressWarnings("unchecked")
        Collection<X509CertificateHolder> matches = certificates.getMatches(signerInfo.getSID());
        if (matches.isEmpty()) {
          problem = "Signer certificate not embedded";
        } else {
          X509CertificateHolder holder = matches.iterator().next();
          signer = holder.getSubject().toString();
          valid = signerInfo.verify(new JcaSimpleSignerInfoVerifierBuilder().build(holder));
          if (!valid) {
            problem = "Signature does not match the signed content";
          }
        }
      }
    } catch (CMSException | OperatorCreationException | CertificateException e) {
      log.debug("CMS signature in field {} cannot be parsed", fieldName, e);
      problem = "Invalid CMS signature";
    }
    return new SignatureCheck(
        fieldName,
        signature.getSubFilter(),
        signer,
        signedAt,
        coversWholeDocument,
        certified,
        valid,
        problem);
  }

  private static PDSignature certifyingSignature(PDDocument document) {
    COSBase perms = document.getDocumentCatalog().getCOSObject().getDictionaryObject(COSName.PERMS);
    if (perms instanceof COSDictionary permsDictionary
        && permsDictionary.getDictionaryObject(COSName.DOCMDP) instanceof COSDictionary docMdp) {
      return new PDSignature(docMdp);
    }
    return null;
  }

  private static int docMdpPermission(PDSignature signature) {
    COSBase references = signature.getCOSObject().getDictionaryObject(REFERENCE);
    if (!(references instanceof COSArray array)) {
      return -1;
    }
    for (int i = 0; i < array.size(); i++) {
      if (array.getObject(i) instanceof COSDictionary reference
          && COSName.DOCMDP.equals(reference.getDictionaryObject(TRANSFORM_METHOD))
          && reference.getDictionaryObject(TRANSFORM_PARAMS) instanceof COSDictionary params) {
        // P defaults to 2 when absent
        return params.getInt(COSName.P, 2);
      }
    }
    return -1;
  }
}
