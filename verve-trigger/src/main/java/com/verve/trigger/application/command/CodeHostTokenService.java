package com.verve.trigger.application.command;

import com.verve.domain.setting.adapter.gateway.ICredentialVault;
import com.verve.domain.setting.model.entity.SettingEntity;
import com.verve.types.common.Constants;
import com.verve.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;

/**
 * 代码托管平台访问令牌：加密落库，解密结果进程内缓存。
 * <p>
 * 未配置加密密钥时 {@link ICredentialVault} 不存在，写入被拒绝，读取返回 null。
 * </p>
 *
 * @author verve
 * @since 2025-06-02
 */
@Slf4j
@Service
public class CodeHostTokenService {

    static final String CLASSIC_TOKEN_PREFIX = "ghp_";
    static final String FINE_GRAINED_TOKEN_PREFIX = "github_pat_";

    private final SettingCommandService settingCommandService;
    private final ICredentialVault credentialVault;
    private volatile String cachedToken;

    public CodeHostTokenService(SettingCommandService settingCommandService,
                                ObjectProvider<ICredentialVault> credentialVaultProvider) {
        this.settingCommandService = settingCommandService;
        this.credentialVault = credentialVaultProvider.getIfAvailable();
    }

    public static boolean isValidTokenPrefix(String token) {
        return token != null
                && (token.startsWith(CLASSIC_TOKEN_PREFIX) || token.startsWith(FINE_GRAINED_TOKEN_PREFIX));
    }

    public boolean isVaultAvailable() {
        return credentialVault != null;
    }

    public void saveToken(String token) {
        String normalized = StringUtils.trimToNull(token);
        if (!isValidTokenPrefix(normalized)) {
            throw AppException.illegalParameter("Token must start with "
                    + CLASSIC_TOKEN_PREFIX + " or " + FINE_GRAINED_TOKEN_PREFIX);
        }
        if (credentialVault == null) {
            throw AppException.preconditionFailed("Encryption key is not configured; set verve.crypto.encryption-key");
        }
        SettingEntity setting = new SettingEntity();
        setting.setKey(Constants.SETTING_CODE_HOST_TOKEN);
        setting.setValue(credentialVault.encrypt(normalized));
        setting.setUpdatedAt(LocalDateTime.now());
        settingCommandService.writeRaw(setting);
        cachedToken = normalized;
        log.info("Code host token stored");
    }

    /**
     * 读取明文令牌，未保存或无法解密时返回 null。
     */
    public String readToken() {
        String token = cachedToken;
        if (token != null) {
            return token;
        }
        if (credentialVault == null) {
            return null;
        }
        String encrypted = settingCommandService.getValue(Constants.SETTING_CODE_HOST_TOKEN);
        if (StringUtils.isBlank(encrypted)) {
            return null;
        }
        try {
            token = credentialVault.decrypt(encrypted);
        } catch (AppException ex) {
            log.warn("Stored code host token cannot be decrypted. error={}", ex.getInfo());
            return null;
        }
        cachedToken = token;
        return token;
    }
}
