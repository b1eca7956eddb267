package com.verve.trigger.application.common;

import com.verve.api.dto.RepoDTO;
import com.verve.api.dto.SettingDTO;
import com.verve.api.dto.WorkerDTO;
import com.verve.domain.repo.model.entity.RepoEntity;
import com.verve.domain.setting.model.entity.SettingEntity;
import com.verve.domain.worker.model.valobj.WorkerInfo;
import org.springframework.stereotype.Component;

/**
 * 仓库、设置与 worker 的视图组装。
 */
@Component
public class CatalogViewAssembler {

    public RepoDTO toRepoDTO(RepoEntity repo) {
        RepoDTO dto = new RepoDTO();
        dto.setId(repo.getId());
        dto.setOwner(repo.getOwner());
        dto.setName(repo.getName());
        dto.setFullName(repo.getFullName());
        dto.setCreatedAt(repo.getCreatedAt());
        return dto;
    }

    public SettingDTO toSettingDTO(SettingEntity setting) {
        SettingDTO dto = new SettingDTO();
        dto.setKey(setting.getKey());
        dto.setValue(setting.getValue());
        dto.setUpdatedAt(setting.getUpdatedAt());
        return dto;
    }

    public WorkerDTO toWorkerDTO(WorkerInfo worker) {
        WorkerDTO dto = new WorkerDTO();
        dto.setWorkerId(worker.getWorkerId());
        dto.setMaxConcurrentTasks(worker.getMaxConcurrentTasks());
        dto.setActiveTasks(worker.getActiveTasks());
        dto.setConnectedAt(worker.getConnectedAt());
        dto.setLastPollAt(worker.getLastPollAt());
        dto.setUptimeMs(worker.getUptimeMs());
        dto.setPolling(worker.isPolling());
        return dto;
    }
}
