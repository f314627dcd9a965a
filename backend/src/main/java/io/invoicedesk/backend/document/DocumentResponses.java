package io.invoicedesk.backend.document;

import io.invoicedesk.backend.invoice.DocumentArtifact;
import java.nio.charset.StandardCharsets;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;

/** PDF download responses keyed by the document's content hash. */
public final class DocumentResponses {

  private DocumentResponses() {}

  public static ResponseEntity<byte[]> pdf(DocumentArtifact artifact, String ifNoneMatch) {
    String etag = "\"" + artifact.getSha256() + "\"";
    if (etag.equals(ifNoneMatch)) {
      return ResponseEntity.status(HttpStatus.NOT_MODIFIED).eTag(etag).build();
    }
    ContentDisposition disposition =
        ContentDisposition.attachment()
            .filename(artifact.getFileName(), StandardCharsets.UTF_8)
            .build();
    return ResponseEntity.ok()
        .contentType(MediaType.APPLICATION_PDF)
        .eTag(etag)
        .header(HttpHeaders.CONTENT_DISPOSITION, disposition.toString())
        .body(artifact.getContent());
  }
}
