package com.openforge.agentchat.intent;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * The fixed intent taxonomy offered to the classifier.
 */
public enum IntentCategory {

    TEXT_GENERATION("text_generation", "User wants text generated, questions answered, creative writing, explanations"),
    CODE_GENERATION("code_generation", "User wants code written, programming help, technical solutions"),
    WEB_SEARCH("web_search", "User needs current information, facts, news, or web-based research"),
    IMAGE_GENERATION("image_generation", "User wants images created, visual content, artwork"),
    DATA_ANALYSIS("data_analysis", "User has data to analyze, wants charts, statistics, or insights"),
    CALCULATION("calculation", "User needs mathematical calculations, conversions, or computations"),
    FILE_PROCESSING("file_processing", "User wants to process files, extract information, or convert formats"),
    GENERAL_CHAT("general_chat", "General conversation, greetings, casual chat");

    private final String value;
    private final String description;

    IntentCategory(String value, String description) {
        this.value       = value;
        this.description = description;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public String description() {
        return description;
    }

    public static Optional<IntentCategory> of(String value) {
        return Arrays.stream(values()).filter(c -> c.value.equals(value)).findFirst();
    }
}
