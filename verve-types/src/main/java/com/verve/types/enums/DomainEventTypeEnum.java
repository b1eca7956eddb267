package com.verve.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 领域事件类型（broker 与 SSE 流共用）。
 */
public enum DomainEventTypeEnum {

    TASK_CREATED("task_created"),
    TASK_UPDATED("task_updated"),
    LOGS_APPENDED("logs_appended"),
    EPIC_CREATED("epic_created"),
    EPIC_UPDATED("epic_updated"),
    EPIC_DELETED("epic_deleted");

    private final String eventName;

    DomainEventTypeEnum(String eventName) {
        this.eventName = eventName;
    }

    @JsonValue
    public String getEventName() {
        return eventName;
    }

    public boolean isTaskEvent() {
        return this == TASK_CREATED || this == TASK_UPDATED || this == LOGS_APPENDED;
    }

    public static DomainEventTypeEnum fromEventName(String eventName) {
        if (eventName == null) {
            return null;
        }
        for (DomainEventTypeEnum value : values()) {
            if (value.eventName.equals(eventName)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown domain event type: " + eventName);
    }
}
