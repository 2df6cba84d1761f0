package com.aiadvent.mcp.context.change;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

public final class ContentHashes {

  private ContentHashes() {}

  /** Collision-resistant digest used for persisted comparisons. */
  public static String sha256(String content) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      byte[] hash =
          digest.digest((content != null ? content : "").getBytes(StandardCharsets.UTF_8));
      return bytesToHex(hash);
    } catch (NoSuchAlgorithmException ex) {
      throw new IllegalStateException("SHA-256 algorithm not available", ex);
    }
  }

  /**
   * Cheap 32-bit FNV-1a hash for short-lived, in-memory deduplication only. Never persist it as
   * a change marker.
   */
  public static String quickHash(String content) {
    int hash = 0x811c9dc5;
    String value = content != null ? content : "";
    for (int i = 0; i < value.length(); i++) {
      hash ^= value.charAt(i);
      hash *= 0x01000193;
    }
    return Integer.toHexString(hash);
  }

  private static String bytesToHex(byte[] bytes) {
    StringBuilder builder = new StringBuilder(bytes.length * 2);
    for (byte b : bytes) {
      builder.append(Character.forDigit((b >> 4) & 0xF, 16));
      builder.append(Character.forDigit(b & 0xF, 16));
    }
    return builder.toString();
  }
}
