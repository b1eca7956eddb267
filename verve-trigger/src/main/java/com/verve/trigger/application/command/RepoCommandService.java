package com.verve.trigger.application.command;

import com.verve.domain.repo.adapter.repository.IRepoRepository;
import com.verve.domain.repo.model.entity.RepoEntity;
import com.verve.domain.task.adapter.repository.ITaskRepository;
import com.verve.trigger.application.common.StoreTimeoutRetrier;
import com.verve.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 仓库登记用例。
 */
@Slf4j
@Service
public class RepoCommandService {

    private final IRepoRepository repoRepository;
    private final ITaskRepository taskRepository;
    private final StoreTimeoutRetrier retrier;

    public RepoCommandService(IRepoRepository repoRepository, ITaskRepository taskRepository,
                              StoreTimeoutRetrier retrier) {
        this.repoRepository = repoRepository;
        this.taskRepository = taskRepository;
        this.retrier = retrier;
    }

    public RepoEntity createRepo(String fullName) {
        RepoEntity repo = RepoEntity.create(fullName, LocalDateTime.now());
        if (retrier.call("read repo", () -> repoRepository.findByFullName(repo.getFullName())) != null) {
            throw AppException.conflict("Repo already registered: " + repo.getFullName());
        }
        RepoEntity saved = retrier.call("create repo", () -> repoRepository.save(repo));
        log.info("Repo registered. repoId={}, fullName={}", saved.getId(), saved.getFullName());
        return saved;
    }

    public List<RepoEntity> listRepos() {
        return retrier.call("list repos", repoRepository::findAll);
    }

    public RepoEntity requireRepo(String repoId) {
        RepoEntity repo = retrier.call("read repo", () -> repoRepository.findById(repoId));
        if (repo == null) {
            throw AppException.notFound("Repo not found: " + repoId);
        }
        return repo;
    }

    /**
     * 仓库下仍有任务时拒绝删除。
     */
    public void deleteRepo(String repoId) {
        requireRepo(repoId);
        if (retrier.call("count tasks", () -> taskRepository.hasTasksForRepo(repoId))) {
            throw AppException.conflict("Repo still has tasks: " + repoId);
        }
        if (!retrier.call("delete repo", () -> repoRepository.deleteById(repoId))) {
            throw AppException.notFound("Repo not found: " + repoId);
        }
        log.info("Repo removed. repoId={}", repoId);
    }
}
