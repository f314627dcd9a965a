package io.invoicedesk.backend.document;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/** SHA-256 content addressing for stored documents. */
public final class ContentHashes {

  private ContentHashes() {}

  /** Lowercase hex SHA-256 of the given bytes (64 characters). */
  public static String sha256Hex(byte[] data) {
    try {
      var digest = MessageDigest.getInstance("SHA-256");
      return HexFormat.of().formatHex(digest.digest(data));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }
}
