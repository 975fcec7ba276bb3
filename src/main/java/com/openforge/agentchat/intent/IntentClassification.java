package com.openforge.agentchat.intent;

import java.util.List;
import java.util.Map;

/**
 * Result of classifying one message.
 *
 * intent is kept as the raw label so that a backend answering outside the
 * taxonomy still round-trips; {@link IntentCategory#of} maps it when needed.
 * Every name in suggestedTools has an entry in parameters.
 */
public record IntentClassification(
        String intent,
        double confidence,
        List<String> suggestedTools,
        Map<String, Map<String, Object>> parameters,
        String reasoning
) {

    public IntentClassification {
        suggestedTools = suggestedTools == null ? List.of() : List.copyOf(suggestedTools);
        parameters = parameters == null ? Map.of() : parameters;
    }
}
