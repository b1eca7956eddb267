package com.verve.trigger.http;

import com.verve.api.dto.CodeHostTokenRequestDTO;
import com.verve.api.dto.SettingDTO;
import com.verve.api.dto.SettingUpdateRequestDTO;
import com.verve.api.response.Response;
import com.verve.trigger.application.command.CodeHostTokenService;
import com.verve.trigger.application.command.SettingCommandService;
import com.verve.trigger.application.common.CatalogViewAssembler;
import com.verve.types.enums.ResponseCode;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 全局设置 API。令牌单独入口，只写不读。
 */
@RestController
@RequestMapping("/api/v1/settings")
public class SettingsController {

    private final SettingCommandService settingCommandService;
    private final CodeHostTokenService codeHostTokenService;
    private final CatalogViewAssembler catalogViewAssembler;

    public SettingsController(SettingCommandService settingCommandService,
                              CodeHostTokenService codeHostTokenService,
                              CatalogViewAssembler catalogViewAssembler) {
        this.settingCommandService = settingCommandService;
        this.codeHostTokenService = codeHostTokenService;
        this.catalogViewAssembler = catalogViewAssembler;
    }

    @GetMapping
    public Response<List<SettingDTO>> listSettings() {
        return success(settingCommandService.listSettings().stream()
                .map(catalogViewAssembler::toSettingDTO)
                .collect(Collectors.toList()));
    }

    @PutMapping("/code-host-token")
    public Response<Void> saveCodeHostToken(@RequestBody CodeHostTokenRequestDTO request) {
        codeHostTokenService.saveToken(request.getToken());
        return success(null);
    }

    @PutMapping("/{key}")
    public Response<SettingDTO> putSetting(@PathVariable("key") String key,
                                           @RequestBody SettingUpdateRequestDTO request) {
        return success(catalogViewAssembler.toSettingDTO(settingCommandService.putSetting(key, request.getValue())));
    }

    private <T> Response<T> success(T data) {
        return Response.<T>builder()
                .code(ResponseCode.SUCCESS.getCode())
                .info(ResponseCode.SUCCESS.getInfo())
                .data(data)
                .build();
    }
}
