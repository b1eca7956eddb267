package com.verve.infrastructure.crypto;

import com.verve.domain.setting.adapter.gateway.ICredentialVault;
import com.verve.types.enums.ResponseCode;
import com.verve.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.HexFormat;

/**
 * AES-256-GCM 凭据加密。
 * <p>
 * 密钥为 64 位十六进制字符串（32 字节），密文格式为 base64(nonce || ciphertext || tag)。
 * 未配置密钥时不注册该 Bean，凭据写入会被拒绝。
 * </p>
 *
 * @author verve
 * @since 2025-06-02
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "verve.crypto.encryption-key")
public class AesGcmCredentialVault implements ICredentialVault {

    static final int KEY_SIZE = 32;
    private static final int NONCE_SIZE = 12;
    private static final int TAG_BITS = 128;
    private static final String TRANSFORMATION = "AES/GCM/NoPadding";

    private final SecretKeySpec key;
    private final SecureRandom random = new SecureRandom();

    public AesGcmCredentialVault(@Value("${verve.crypto.encryption-key}") String hexKey) {
        this.key = new SecretKeySpec(parseKey(hexKey), "AES");
        log.info("Credential vault enabled (AES-256-GCM)");
    }

    @Override
    public String encrypt(String plaintext) {
        byte[] nonce = new byte[NONCE_SIZE];
        random.nextBytes(nonce);
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(TAG_BITS, nonce));
            byte[] sealed = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));
            ByteBuffer buffer = ByteBuffer.allocate(nonce.length + sealed.length);
            buffer.put(nonce).put(sealed);
            return Base64.getEncoder().encodeToString(buffer.array());
        } catch (GeneralSecurityException ex) {
            throw new AppException(ResponseCode.UN_ERROR, "Failed to encrypt credential", ex);
        }
    }

    @Override
    public String decrypt(String encoded) {
        byte[] data;
        try {
            data = Base64.getDecoder().decode(encoded);
        } catch (IllegalArgumentException ex) {
            throw new AppException(ResponseCode.UN_ERROR, "Credential is not valid base64", ex);
        }
        if (data.length < NONCE_SIZE) {
            throw new AppException(ResponseCode.UN_ERROR, "Ciphertext too short");
        }
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(TAG_BITS, data, 0, NONCE_SIZE));
            byte[] plain = cipher.doFinal(data, NONCE_SIZE, data.length - NONCE_SIZE);
            return new String(plain, StandardCharsets.UTF_8);
        } catch (GeneralSecurityException ex) {
            throw new AppException(ResponseCode.UN_ERROR, "Failed to decrypt credential", ex);
        }
    }

    static byte[] parseKey(String hexKey) {
        if (StringUtils.isBlank(hexKey)) {
            throw new IllegalStateException("verve.crypto.encryption-key is empty");
        }
        byte[] raw;
        try {
            raw = HexFormat.of().parseHex(hexKey.trim());
        } catch (IllegalArgumentException ex) {
            throw new IllegalStateException("verve.crypto.encryption-key must be hex encoded", ex);
        }
        if (raw.length != KEY_SIZE) {
            throw new IllegalStateException("Encryption key must be " + KEY_SIZE + " bytes, got " + raw.length);
        }
        return raw;
    }
}
