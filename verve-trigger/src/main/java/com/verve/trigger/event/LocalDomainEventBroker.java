package com.verve.trigger.event;

import com.verve.domain.event.model.entity.DomainEventEntity;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * 单实例部署的进程内 broker。
 */
@Component
@ConditionalOnProperty(name = "verve.broker.mode", havingValue = "local", matchIfMissing = true)
public class LocalDomainEventBroker extends AbstractDomainEventBroker {

    @Override
    public void publish(DomainEventEntity event) {
        dispatch(event);
    }
}
