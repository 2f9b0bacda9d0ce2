/*
 * どこで: 共通ユーティリティ
 * 何を: 複数の識別子から 64-bit advisory lock のキーを生成する
 * なぜ: hashtext(32-bit) の衝突による不要な直列化を避けるため
 */
package com.example.common;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

public final class AdvisoryLockKeys {

  // SHA-256 の先頭 8byte を 64-bit 値として使う。
  static final int LOCK_KEY_BYTES = 8;

  // 区切り文字は識別子に現れない制御文字を使い、("a:b","c") と ("a","b:c") を区別する。
  private static final char SEPARATOR = '\u001f';

  private AdvisoryLockKeys() {}

  public static long forParts(String namespace, String... parts) {
    if (namespace == null || namespace.isBlank()) {
      throw new IllegalArgumentException("namespace is required");
    }
    final StringBuilder material = new StringBuilder(namespace);
    for (String part : parts) {
      material.append(SEPARATOR).append(part == null ? "" : part);
    }
    final byte[] hashed = hash(material.toString());
    // ByteBuffer は Big Endian が既定。言語間での再現性を優先して変更しない。
    return ByteBuffer.wrap(hashed, 0, LOCK_KEY_BYTES).getLong();
  }

  private static byte[] hash(String material) {
    try {
      final MessageDigest digest = MessageDigest.getInstance("SHA-256");
      return digest.digest(material.getBytes(StandardCharsets.UTF_8));
    } catch (NoSuchAlgorithmException ex) {
      throw new IllegalStateException("SHA-256 algorithm not available", ex);
    }
  }
}
