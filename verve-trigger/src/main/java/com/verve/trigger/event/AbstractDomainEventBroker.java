package com.verve.trigger.event;

import com.verve.domain.event.adapter.gateway.IDomainEventBroker;
import com.verve.domain.event.model.entity.DomainEventEntity;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Consumer;

/**
 * 进程内订阅表与分发，单个订阅者异常不影响其他订阅者。
 */
@Slf4j
public abstract class AbstractDomainEventBroker implements IDomainEventBroker {

    private final ConcurrentMap<String, Consumer<DomainEventEntity>> subscribers = new ConcurrentHashMap<>();

    @Override
    public void subscribe(String subscriberId, Consumer<DomainEventEntity> listener) {
        if (subscriberId == null || listener == null) {
            return;
        }
        subscribers.put(subscriberId, listener);
    }

    @Override
    public void unsubscribe(String subscriberId) {
        if (subscriberId == null) {
            return;
        }
        subscribers.remove(subscriberId);
    }

    public int subscriberCount() {
        return subscribers.size();
    }

    protected void dispatch(DomainEventEntity event) {
        if (event == null || subscribers.isEmpty()) {
            return;
        }
        for (Map.Entry<String, Consumer<DomainEventEntity>> entry : subscribers.entrySet()) {
            try {
                entry.getValue().accept(event);
            } catch (Exception ex) {
                log.debug("Domain event dispatch failed. subscriberId={}, eventType={}, taskId={}, epicId={}, error={}",
                        entry.getKey(), event.getEventType(), event.getTaskId(), event.getEpicId(), ex.getMessage());
            }
        }
    }
}
