package com.example.automation.protocol;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonTypeName;

/**
 * 通道级别的非致命错误
 *
 * @param message 错误描述
 */
@JsonTypeName("error")
public record ErrorEvent(@JsonProperty("message") String message) implements StatusEvent {

    @Override
    public EventType type() {
        return EventType.ERROR;
    }
}
