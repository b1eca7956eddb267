package com.verve.trigger.application.dispatch;

import com.verve.domain.event.adapter.gateway.IDomainEventBroker;
import com.verve.domain.event.model.entity.DomainEventEntity;
import com.verve.types.enums.DomainEventTypeEnum;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 待处理工作信号：代数计数 + Condition。
 * <p>
 * 等待方先记下当前代数再检查存储，检查与等待之间发生的脉冲会使代数前进，不会丢失唤醒。
 * 通过订阅 broker 触发，跨实例事件同样会唤醒本实例的长轮询。
 * </p>
 */
@Slf4j
@Component
public class PendingWorkSignal {

    static final String SUBSCRIBER_ID = "pending-work-signal";

    private final IDomainEventBroker eventBroker;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();
    private long generation;

    public PendingWorkSignal(IDomainEventBroker eventBroker) {
        this.eventBroker = eventBroker;
    }

    @PostConstruct
    public void subscribe() {
        eventBroker.subscribe(SUBSCRIBER_ID, this::onEvent);
    }

    @PreDestroy
    public void unsubscribe() {
        eventBroker.unsubscribe(SUBSCRIBER_ID);
    }

    void onEvent(DomainEventEntity event) {
        if (event.getEventType() == DomainEventTypeEnum.LOGS_APPENDED) {
            return;
        }
        pulse();
    }

    public void pulse() {
        lock.lock();
        try {
            generation++;
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public long generation() {
        lock.lock();
        try {
            return generation;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 等待代数超过 seen，返回 false 表示超时。
     */
    public boolean awaitChange(long seen, long timeoutMillis) throws InterruptedException {
        long remainingNanos = TimeUnit.MILLISECONDS.toNanos(timeoutMillis);
        lock.lock();
        try {
            while (generation == seen) {
                if (remainingNanos <= 0) {
                    return false;
                }
                remainingNanos = changed.awaitNanos(remainingNanos);
            }
            return true;
        } finally {
            lock.unlock();
        }
    }
}
