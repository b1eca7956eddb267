package com.verve.trigger.http;

import com.verve.api.dto.RepoCreateRequestDTO;
import com.verve.api.dto.RepoDTO;
import com.verve.api.response.Response;
import com.verve.trigger.application.command.RepoCommandService;
import com.verve.trigger.application.common.CatalogViewAssembler;
import com.verve.types.enums.ResponseCode;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 仓库登记 API。
 */
@RestController
@RequestMapping("/api/v1/repos")
public class RepoController {

    private final RepoCommandService repoCommandService;
    private final CatalogViewAssembler catalogViewAssembler;

    public RepoController(RepoCommandService repoCommandService, CatalogViewAssembler catalogViewAssembler) {
        this.repoCommandService = repoCommandService;
        this.catalogViewAssembler = catalogViewAssembler;
    }

    @GetMapping
    public Response<List<RepoDTO>> listRepos() {
        return success(repoCommandService.listRepos().stream()
                .map(catalogViewAssembler::toRepoDTO)
                .collect(Collectors.toList()));
    }

    @PostMapping
    public Response<RepoDTO> createRepo(@RequestBody RepoCreateRequestDTO request) {
        return success(catalogViewAssembler.toRepoDTO(repoCommandService.createRepo(request.getFullName())));
    }

    @DeleteMapping("/{repoId}")
    public Response<Void> deleteRepo(@PathVariable("repoId") String repoId) {
        repoCommandService.deleteRepo(repoId);
        return success(null);
    }

    private <T> Response<T> success(T data) {
        return Response.<T>builder()
                .code(ResponseCode.SUCCESS.getCode())
                .info(ResponseCode.SUCCESS.getInfo())
                .data(data)
                .build();
    }
}
