package io.invoicedesk.backend.invoice;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import java.time.Instant;

/**
 * A rendered or signed document stored with the invoice: bytes, download file name, SHA-256 hex
 * digest of the bytes and creation time (UTC). Immutable; a new render or signature replaces the
 * whole value.
 */
@Embeddable
public class DocumentArtifact {

  @Column(name = "content")
  private byte[] content;

  @Column(name = "file_name", length = 255)
  private String fileName;

  @Column(name = "sha256", length = 64)
  private String sha256;

  @Column(name = "created_at")
  private Instant createdAt;

  protected DocumentArtifact() {}

  public DocumentArtifact(byte[] content, String fileName, String sha256, Instant createdAt) {
    this.content = content.clone();
    this.fileName = fileName;
    this.sha256 = sha256;
    this.createdAt = createdAt;
  }

  public byte[] getContent() {
    return content.clone();
  }

  public int getSize() {
    return content.length;
  }

  public String getFileName() {
    return fileName;
  }

  public String getSha256() {
    return sha256;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
