package com.verve.domain.event.adapter.gateway;

import com.verve.domain.event.model.entity.DomainEventEntity;

import java.util.function.Consumer;

/**
 * 领域事件 broker：尽力而为的 at-least-once 分发，不保证持久化与重放。
 */
public interface IDomainEventBroker {

    void publish(DomainEventEntity event);

    void subscribe(String subscriberId, Consumer<DomainEventEntity> listener);

    void unsubscribe(String subscriberId);
}
