package com.openforge.agentchat.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of payload carried by a {@link MessageContent} block.
 */
public enum ContentType {

    TEXT("text"),
    CODE("code"),
    IMAGE("image"),
    /** Structured result of a tool with no dedicated rendering. */
    DATA("data"),
    ERROR("error");

    private final String value;

    ContentType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
