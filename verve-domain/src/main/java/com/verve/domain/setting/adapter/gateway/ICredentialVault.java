package com.verve.domain.setting.adapter.gateway;

/**
 * 凭据加解密网关，密文为 base64(nonce || ciphertext)。
 */
public interface ICredentialVault {

    String encrypt(String plaintext);

    String decrypt(String encoded);
}
