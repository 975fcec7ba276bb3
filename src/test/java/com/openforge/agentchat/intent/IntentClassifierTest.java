package com.openforge.agentchat.intent;

import com.openforge.agentchat.TestFixtures;
import com.openforge.agentchat.llm.LlmClient;
import com.openforge.agentchat.llm.LlmRouter;
import com.openforge.agentchat.llm.model.ChatRequest;
import com.openforge.agentchat.tool.ToolDefinition;
import com.openforge.agentchat.tool.ToolRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.ArgumentCaptor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class IntentClassifierTest {

    private LlmRouter router;
    private ToolRegistry registry;
    private IntentClassifier classifier;

    @BeforeEach
    void setUp() {
        router = mock(LlmRouter.class);
        registry = mock(ToolRegistry.class);
        when(registry.definitions()).thenReturn(List.of(new ToolDefinition("text_generation",
                "Generate text responses using AI language models", Map.of(), List.of("prompt"), "ai", true)));
        classifier = new IntentClassifier(router, registry, TestFixtures.objectMapper(), TestFixtures.agentProperties());
    }

    @Nested
    @DisplayName("Without an LLM backend")
    class KeywordFallback {

        @BeforeEach
        void noBackend() {
            when(router.isConfigured()).thenReturn(false);
        }

        @Test
        void greeting_shouldDefaultToTextGeneration() {
            IntentClassification result = classifier.classify("Hello");

            assertThat(result.intent()).isEqualTo("text_generation");
            assertThat(result.confidence()).isEqualTo(0.5);
            assertThat(result.suggestedTools()).containsExactly("text_generation");
            assertThat(result.parameters().get("text_generation")).containsEntry("prompt", "Hello");
            assertThat(result.reasoning()).isEqualTo("Default classification for general text generation");
            verify(router, never()).chat(any());
        }

        @Test
        void codeKeywords_shouldSelectCodeGeneration() {
            IntentClassification result = classifier.classify("debug this python function");

            assertThat(result.intent()).isEqualTo("code_generation");
            assertThat(result.confidence()).isEqualTo(0.7);
            assertThat(result.suggestedTools()).containsExactly("text_generation");
            assertThat(result.parameters().get("text_generation"))
                    .containsEntry("prompt", "Help with coding: debug this python function");
        }

        @Test
        void rules_shouldApplyInPriorityOrder() {
            assertThat(classifier.classify("Find the latest news").intent()).isEqualTo("web_search");
            assertThat(classifier.classify("Draw a PICTURE of a cat").intent()).isEqualTo("image_generation");
            assertThat(classifier.classify("solve this equation").intent()).isEqualTo("calculation");
            // code outranks search
            assertThat(classifier.classify("search my code for bugs").intent()).isEqualTo("code_generation");
        }

        @Test
        void fallbackConfidences_shouldBeFixedPerCategory() {
            assertThat(classifier.classify("what is rust").confidence()).isEqualTo(0.6);
            assertThat(classifier.classify("generate image of a boat").confidence()).isEqualTo(0.8);
            assertThat(classifier.classify("compute 2 + 2").confidence()).isEqualTo(0.7);
            assertThat(classifier.classify("what is rust").parameters().get("text_generation"))
                    .containsEntry("prompt", "Provide information about: what is rust");
        }
    }

    @Nested
    @DisplayName("With an LLM backend")
    class LlmClassification {

        @BeforeEach
        void backend() {
            when(router.isConfigured()).thenReturn(true);
        }

        @Test
        void structuredAnswer_shouldBeUsedAsIs() {
            // Given
            when(router.chat(any())).thenReturn(TestFixtures.chatResponse("""
                    {"intent": "general_chat", "confidence": 0.9,
                     "suggested_tools": ["text_generation"],
                     "parameters": {"text_generation": {"prompt": "Hi!", "temperature": 0.5}},
                     "reasoning": "greeting"}
                    """));

            // When
            IntentClassification result = classifier.classify("Hi!");

            // Then
            assertThat(result.intent()).isEqualTo("general_chat");
            assertThat(result.confidence()).isEqualTo(0.9);
            assertThat(result.parameters().get("text_generation"))
                    .containsEntry("prompt", "Hi!")
                    .containsEntry("temperature", 0.5);
            assertThat(result.reasoning()).isEqualTo("greeting");

            ArgumentCaptor<ChatRequest> request = ArgumentCaptor.forClass(ChatRequest.class);
            verify(router).chat(request.capture());
            assertThat(request.getValue().responseFormat()).isEqualTo(ChatRequest.ResponseFormat.JSON_OBJECT);
            assertThat(request.getValue().maxTokens()).isEqualTo(500);
            assertThat(request.getValue().temperature()).isEqualTo(0.3);
            assertThat(request.getValue().messages().get(0).content())
                    .contains("- text_generation: Generate text responses using AI language models (Category: ai)")
                    .contains("- file_processing:");
            assertThat(request.getValue().messages().get(1).content()).isEqualTo("Classify this query: Hi!");
        }

        @Test
        void emptyObject_shouldTakeDefaults() {
            when(router.chat(any())).thenReturn(TestFixtures.chatResponse("{}"));

            IntentClassification result = classifier.classify("Tell me a story");

            assertThat(result.intent()).isEqualTo("text_generation");
            assertThat(result.confidence()).isEqualTo(0.5);
            assertThat(result.suggestedTools()).containsExactly("text_generation");
            assertThat(result.parameters().get("text_generation")).containsEntry("prompt", "Tell me a story");
            assertThat(result.reasoning()).isEqualTo("Default classification");
        }

        @Test
        void suggestionsWithoutParameters_shouldBeRepaired() {
            when(router.chat(any())).thenReturn(TestFixtures.chatResponse("""
                    {"intent": "image_generation", "confidence": 1.7,
                     "suggested_tools": ["image_generation", "text_generation"],
                     "parameters": {}}
                    """));

            IntentClassification result = classifier.classify("paint a sunset");

            assertThat(result.suggestedTools()).containsExactly("text_generation");
            assertThat(result.parameters().get("text_generation")).containsEntry("prompt", "paint a sunset");
            assertThat(result.confidence()).isEqualTo(1.0);
        }

        @Test
        void backendFailure_shouldFallBackToKeywords() {
            when(router.chat(any())).thenThrow(new LlmClient.LlmException("HTTP 503"));

            IntentClassification result = classifier.classify("debug this python function");

            assertThat(result.intent()).isEqualTo("code_generation");
            assertThat(result.confidence()).isEqualTo(0.7);
        }

        @Test
        void nonJsonAnswer_shouldFallBackToKeywords() {
            when(router.chat(any())).thenReturn(TestFixtures.chatResponse("I think this is a greeting"));

            IntentClassification result = classifier.classify("Hello");

            assertThat(result.intent()).isEqualTo("text_generation");
            assertThat(result.reasoning()).isEqualTo("Default classification for general text generation");
        }

        @Test
        void history_shouldBeSentAsContextWithLastAssistantTurnFlagged() {
            // Given
            when(router.chat(any())).thenReturn(TestFixtures.chatResponse("{}"));
            List<ConversationTurn> history = new ArrayList<>();
            for (int i = 1; i <= 6; i++) {
                history.add(new ConversationTurn(i % 2 == 1 ? "user" : "assistant", "turn-" + i, Instant.now()));
            }

            // When
            classifier.classify("and then?", history);

            // Then
            ArgumentCaptor<ChatRequest> request = ArgumentCaptor.forClass(ChatRequest.class);
            verify(router).chat(request.capture());
            assertThat(request.getValue().messages()).hasSize(3);
            String context = request.getValue().messages().get(2).content();
            assertThat(context)
                    .startsWith("Additional context: ")
                    .contains("recent_conversation")
                    .contains("\"last_assistant_response\" : \"turn-6\"")
                    .contains("turn-2")
                    .doesNotContain("turn-1\"");
        }
    }

    @ParameterizedTest
    @ValueSource(strings = {"Hello", "write a script", "latest news", "draw me", "calculate pi", "", "   "})
    void everySuggestedTool_shouldHaveParameters(String message) {
        when(router.isConfigured()).thenReturn(false);

        IntentClassification result = classifier.classify(message);

        assertThat(result.suggestedTools()).isNotEmpty();
        assertThat(result.parameters()).containsKeys(result.suggestedTools().toArray(String[]::new));
    }

    @Test
    void availableIntents_shouldListTheTaxonomy() {
        assertThat(classifier.availableIntents()).containsExactly(
                "text_generation", "code_generation", "web_search", "image_generation",
                "data_analysis", "calculation", "file_processing", "general_chat");
    }
}
