package com.verve.test;

import com.verve.infrastructure.crypto.AesGcmCredentialVault;
import com.verve.types.exception.AppException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class AesGcmCredentialVaultTest {

    private static final String KEY = "000102030405060708090a0b0c0d0e0f101112131415161718191a1b1c1d1e1f";

    @Test
    public void shouldDecryptWhatItEncrypted() {
        AesGcmCredentialVault vault = new AesGcmCredentialVault(KEY);

        String sealed = vault.encrypt("ghp_secret");

        Assertions.assertNotEquals("ghp_secret", sealed);
        Assertions.assertEquals("ghp_secret", vault.decrypt(sealed));
    }

    @Test
    public void shouldUseFreshNoncePerEncryption() {
        AesGcmCredentialVault vault = new AesGcmCredentialVault(KEY);

        Assertions.assertNotEquals(vault.encrypt("ghp_secret"), vault.encrypt("ghp_secret"));
    }

    @Test
    public void shouldRejectTamperedCiphertext() {
        AesGcmCredentialVault vault = new AesGcmCredentialVault(KEY);
        String sealed = vault.encrypt("ghp_secret");
        char last = sealed.charAt(sealed.length() - 3);
        String tampered = sealed.substring(0, sealed.length() - 3) + (last == 'A' ? 'B' : 'A')
                + sealed.substring(sealed.length() - 2);

        Assertions.assertThrows(AppException.class, () -> vault.decrypt(tampered));
    }

    @Test
    public void shouldRejectCiphertextFromAnotherKey() {
        String sealed = new AesGcmCredentialVault(KEY).encrypt("ghp_secret");
        AesGcmCredentialVault other = new AesGcmCredentialVault(KEY.replace('0', 'f'));

        Assertions.assertThrows(AppException.class, () -> other.decrypt(sealed));
    }

    @Test
    public void shouldRejectWrongKeyLength() {
        Assertions.assertThrows(IllegalStateException.class, () -> new AesGcmCredentialVault("0011"));
        Assertions.assertThrows(IllegalStateException.class, () -> new AesGcmCredentialVault("zz"));
        Assertions.assertThrows(IllegalStateException.class, () -> new AesGcmCredentialVault(" "));
    }
}
