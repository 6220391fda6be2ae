/*
 * Where: Monitor service layer
 * What: Normalizes, hashes, masks and encrypts monitored identity values
 * Why: Identity values are stored only encrypted, looked up by hash and shown masked
 */
package com.breachwatch.monitor.service;

import com.breachwatch.monitor.config.IdentityProtectionProperties;
import com.google.common.hash.Hashing;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.Locale;
import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import org.springframework.stereotype.Component;

@Component
public class IdentityProtector {

  private static final String TRANSFORMATION = "AES/GCM/NoPadding";
  private static final int IV_LENGTH = 12;
  private static final int TAG_LENGTH_BITS = 128;
  private static final String MASK = "***";

  private final SecretKey key;
  private final SecureRandom secureRandom = new SecureRandom();

  public IdentityProtector(IdentityProtectionProperties properties) {
    final byte[] raw;
    try {
      raw = Base64.getDecoder().decode(properties.encryptionKey());
    } catch (IllegalArgumentException ex) {
      throw new IllegalStateException("monitor.identity.encryption-key is not valid base64", ex);
    }
    if (raw.length != 16 && raw.length != 24 && raw.length != 32) {
      throw new IllegalStateException(
          "monitor.identity.encryption-key must decode to 16, 24 or 32 bytes");
    }
    this.key = new SecretKeySpec(raw, "AES");
  }

  public static String normalize(String identity) {
    return identity.trim().toLowerCase(Locale.ROOT);
  }

  public static String hash(String identity) {
    return Hashing.sha256().hashString(normalize(identity), StandardCharsets.UTF_8).toString();
  }

  /** Masks the local part of an address: {@code johndoe@x.com} becomes {@code joh***@x.com}. */
  public static String preview(String identity) {
    final int at = identity.indexOf('@');
    if (at < 0) {
      return identity.isEmpty() ? MASK : identity.substring(0, 1) + MASK;
    }
    final String local = identity.substring(0, at);
    final String domain = identity.substring(at + 1);
    final String visible = local.length() <= 3 ? local.substring(0, Math.min(1, local.length()))
        : local.substring(0, 3);
    return visible + MASK + "@" + domain;
  }

  /** Encrypts the normalized identity; output is base64 of IV followed by ciphertext and tag. */
  public String encrypt(String identity) {
    final byte[] iv = new byte[IV_LENGTH];
    secureRandom.nextBytes(iv);
    try {
      final Cipher cipher = Cipher.getInstance(TRANSFORMATION);
      cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(TAG_LENGTH_BITS, iv));
      final byte[] ciphertext =
          cipher.doFinal(normalize(identity).getBytes(StandardCharsets.UTF_8));
      final ByteBuffer combined = ByteBuffer.allocate(iv.length + ciphertext.length);
      combined.put(iv).put(ciphertext);
      return Base64.getEncoder().encodeToString(combined.array());
    } catch (GeneralSecurityException ex) {
      throw new IllegalStateException("identity encryption failed", ex);
    }
  }

  public String decrypt(String encrypted) {
    final byte[] combined;
    try {
      combined = Base64.getDecoder().decode(encrypted);
    } catch (IllegalArgumentException ex) {
      throw new IdentityDecryptionException("stored identity is not valid base64", ex);
    }
    if (combined.length <= IV_LENGTH) {
      throw new IdentityDecryptionException("stored identity is truncated", null);
    }
    try {
      final Cipher cipher = Cipher.getInstance(TRANSFORMATION);
      cipher.init(
          Cipher.DECRYPT_MODE, key, new GCMParameterSpec(TAG_LENGTH_BITS, combined, 0, IV_LENGTH));
      final byte[] plain = cipher.doFinal(combined, IV_LENGTH, combined.length - IV_LENGTH);
      return new String(plain, StandardCharsets.UTF_8);
    } catch (GeneralSecurityException ex) {
      throw new IdentityDecryptionException("stored identity failed authentication", ex);
    }
  }

  /** Stored value cannot be decrypted with the configured key; retrying will not help. */
  public static class IdentityDecryptionException extends RuntimeException {
    public IdentityDecryptionException(String message, Throwable cause) {
      super(message, cause);
    }
  }
}
