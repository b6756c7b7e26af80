package com.backupcenter.server.service.secret;

import com.backupcenter.server.exception.DecryptionException;
import com.backupcenter.server.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;

/**
 * AES-256-GCM for stored database passwords. Stored form is {@code Base64(iv || ciphertext+tag)} with
 * a 12 byte random iv. The key is a dedicated Base64 encoded 32 byte value and is not derived from any
 * other secret.
 */
@Service
@Slf4j
public class CredentialCipherService {

    private static final String TRANSFORMATION = "AES/GCM/NoPadding";

    private static final int IV_LENGTH = 12;

    private static final int TAG_LENGTH_BITS = 128;

    private static final int KEY_LENGTH = 32;

    private final SecureRandom secureRandom = new SecureRandom();

    private final String encodedKey;

    private volatile SecretKey secretKey;

    public CredentialCipherService(@Value("${backupcenter.server.encryption.key:}") String encodedKey) {
        this.encodedKey = encodedKey;
    }

    // 启动时调用, 密钥缺失或长度不对时抛出 ValidationException
    public void validateKey() throws ValidationException {
        this.getSecretKey();
        log.info("encryption key loaded");
    }

    public String encrypt(String plainText) throws ValidationException {
        if (plainText == null) {
            throw new ValidationException("encrypt failed. plainText is null");
        }
        try {
            byte[] iv = new byte[IV_LENGTH];
            this.secureRandom.nextBytes(iv);
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, this.getSecretKey(), new GCMParameterSpec(TAG_LENGTH_BITS, iv));
            byte[] cipherText = cipher.doFinal(plainText.getBytes(StandardCharsets.UTF_8));
            ByteBuffer buffer = ByteBuffer.allocate(iv.length + cipherText.length);
            buffer.put(iv).put(cipherText);
            return Base64.getEncoder().encodeToString(buffer.array());
        } catch (GeneralSecurityException e) {
            throw new ValidationException("encrypt failed. cipher is not available", e);
        }
    }

    public String decrypt(String storedValue) throws DecryptionException {
        if (StringUtils.isBlank(storedValue)) {
            throw new DecryptionException("decrypt failed. stored value is blank");
        }
        byte[] decoded;
        try {
            decoded = Base64.getDecoder().decode(storedValue.trim());
        } catch (IllegalArgumentException e) {
            throw new DecryptionException("decrypt failed. stored value is not base64", e);
        }
        if (decoded.length <= IV_LENGTH) {
            throw new DecryptionException("decrypt failed. stored value is too short");
        }
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(
                    Cipher.DECRYPT_MODE,
                    this.getSecretKey(),
                    new GCMParameterSpec(TAG_LENGTH_BITS, decoded, 0, IV_LENGTH));
            byte[] plain = cipher.doFinal(decoded, IV_LENGTH, decoded.length - IV_LENGTH);
            return new String(plain, StandardCharsets.UTF_8);
        } catch (GeneralSecurityException e) {
            // 不能把密文或明文放进异常信息
            throw new DecryptionException("decrypt failed. wrong key or tampered value", e);
        } catch (ValidationException e) {
            throw new DecryptionException("decrypt failed. encryption key is invalid", e);
        }
    }

    private SecretKey getSecretKey() throws ValidationException {
        SecretKey key = this.secretKey;
        if (key != null) {
            return key;
        }
        if (StringUtils.isBlank(this.encodedKey)) {
            throw new ValidationException("backupcenter.server.encryption.key is not configured");
        }
        byte[] raw;
        try {
            raw = Base64.getDecoder().decode(this.encodedKey.trim());
        } catch (IllegalArgumentException e) {
            throw new ValidationException("backupcenter.server.encryption.key is not base64", e);
        }
        if (raw.length != KEY_LENGTH) {
            throw new ValidationException("backupcenter.server.encryption.key must be %s bytes, got %s"
                    .formatted(KEY_LENGTH, raw.length));
        }
        key = new SecretKeySpec(raw, "AES");
        this.secretKey = key;
        return key;
    }
}
