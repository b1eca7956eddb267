package com.verve.infrastructure.repository.memory;

import com.verve.domain.epic.model.entity.EpicEntity;
import com.verve.domain.repo.model.entity.RepoEntity;
import com.verve.domain.setting.model.entity.SettingEntity;
import com.verve.domain.task.model.entity.TaskEntity;
import com.verve.domain.task.model.entity.TaskLogEntity;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * 内存存储的共享状态。
 * <p>
 * 所有读写都在同一把可重入锁内完成，事务边界持锁执行整个回调；
 * 读出的实体一律为副本，调用方修改不会影响存储。
 * </p>
 *
 * @author verve
 * @since 2025-06-02
 */
@Component
@ConditionalOnProperty(name = "verve.store.type", havingValue = "memory", matchIfMissing = true)
public class InMemoryDataStore {

    private final ReentrantLock lock = new ReentrantLock();

    final Map<String, TaskEntity> tasks = new LinkedHashMap<>();
    final Map<String, List<TaskLogEntity>> taskLogs = new LinkedHashMap<>();
    final Map<String, EpicEntity> epics = new LinkedHashMap<>();
    final Map<String, RepoEntity> repos = new LinkedHashMap<>();
    final Map<String, SettingEntity> settings = new LinkedHashMap<>();

    private long logSequence;

    public <T> T locked(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public void lockedRun(Runnable action) {
        locked(() -> {
            action.run();
            return null;
        });
    }

    long nextLogId() {
        return ++logSequence;
    }

    /**
     * 按时间排序，时间相同按 id 同向排序，null 排在最后；与 SQL 的 ORDER BY time, id 一致。
     */
    static <E> List<E> sorted(List<E> items, Function<E, LocalDateTime> key, Function<E, String> id,
                              boolean descending) {
        Comparator<E> order = Comparator.comparing(key, Comparator.nullsLast(Comparator.<LocalDateTime>naturalOrder()))
                .thenComparing(id, Comparator.nullsLast(Comparator.<String>naturalOrder()));
        List<E> result = new ArrayList<>(items);
        result.sort(descending ? order.reversed() : order);
        return result;
    }
}
