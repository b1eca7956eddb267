package com.verve.trigger.http;

import com.verve.api.dto.AgentMetricsDTO;
import com.verve.api.dto.WorkerDTO;
import com.verve.api.response.Response;
import com.verve.domain.worker.service.WorkerRegistry;
import com.verve.trigger.application.common.CatalogViewAssembler;
import com.verve.trigger.application.query.AgentMetricsQueryService;
import com.verve.types.enums.ResponseCode;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 运行态查询：agent 指标与在线 worker。
 */
@RestController
@RequestMapping("/api/v1")
public class ObservabilityController {

    private final AgentMetricsQueryService agentMetricsQueryService;
    private final WorkerRegistry workerRegistry;
    private final CatalogViewAssembler catalogViewAssembler;

    public ObservabilityController(AgentMetricsQueryService agentMetricsQueryService,
                                   WorkerRegistry workerRegistry,
                                   CatalogViewAssembler catalogViewAssembler) {
        this.agentMetricsQueryService = agentMetricsQueryService;
        this.workerRegistry = workerRegistry;
        this.catalogViewAssembler = catalogViewAssembler;
    }

    @GetMapping("/metrics/agents")
    public Response<AgentMetricsDTO> getAgentMetrics() {
        return success(agentMetricsQueryService.getAgentMetrics());
    }

    @GetMapping("/workers")
    public Response<List<WorkerDTO>> listWorkers() {
        return success(workerRegistry.listWorkers(agentMetricsQueryService.getWorkerStaleness()).stream()
                .map(catalogViewAssembler::toWorkerDTO)
                .collect(Collectors.toList()));
    }

    private <T> Response<T> success(T data) {
        return Response.<T>builder()
                .code(ResponseCode.SUCCESS.getCode())
                .info(ResponseCode.SUCCESS.getInfo())
                .data(data)
                .build();
    }
}
