package com.openforge.agentchat.domain;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

/**
 * One block of a chat message.
 *
 * content is a String for TEXT, CODE and ERROR blocks and a Map for IMAGE
 * ({url, description}) and DATA blocks.  metadata is free-form and may be null.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MessageContent(
        ContentType type,
        Object content,
        Map<String, Object> metadata
) {

    public static MessageContent text(String text) {
        return new MessageContent(ContentType.TEXT, text, null);
    }

    public static MessageContent text(String text, Map<String, Object> metadata) {
        return new MessageContent(ContentType.TEXT, text, metadata);
    }

    public static MessageContent code(String code, Map<String, Object> metadata) {
        return new MessageContent(ContentType.CODE, code, metadata);
    }

    public static MessageContent image(Map<String, Object> image, Map<String, Object> metadata) {
        return new MessageContent(ContentType.IMAGE, image, metadata);
    }

    public static MessageContent data(Map<String, Object> data, Map<String, Object> metadata) {
        return new MessageContent(ContentType.DATA, data, metadata);
    }

    public static MessageContent error(String message, Map<String, Object> metadata) {
        return new MessageContent(ContentType.ERROR, message, metadata);
    }

    /** The payload rendered as a string, the way it is shown to the classifier. */
    public String contentAsText() {
        return content == null ? "" : content.toString();
    }
}
