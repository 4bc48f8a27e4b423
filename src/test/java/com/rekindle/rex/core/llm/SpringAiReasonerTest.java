package com.rekindle.rex.core.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.client.ChatClient.CallResponseSpec;
import org.springframework.ai.chat.client.ChatClient.ChatClientRequestSpec;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link SpringAiReasoner}.
 * <p>
 * Mocks the entire {@link ChatClient} chain so no real LLM calls are made.
 */
class SpringAiReasonerTest {

    private ChatClientRequestSpec mockRequestSpec;
    private CallResponseSpec mockCallResponse;
    private SpringAiReasoner reasoner;

    private final ReasonerRequest request = new ReasonerRequest("RETRY_DECISION",
            "{\"errorCode\":\"CARRIER_QUIRK\",\"retryCount\":0}", Set.of("RETRY", "FAIL_TERMINAL", "ESCALATE"));

    @BeforeEach
    void setUp() {
        ChatClient mockChatClient = mock(ChatClient.class);
        mockRequestSpec = mock(ChatClientRequestSpec.class);
        mockCallResponse = mock(CallResponseSpec.class);

        when(mockChatClient.prompt()).thenReturn(mockRequestSpec);
        when(mockRequestSpec.system(anyString())).thenReturn(mockRequestSpec);
        when(mockRequestSpec.user(anyString())).thenReturn(mockRequestSpec);
        when(mockRequestSpec.call()).thenReturn(mockCallResponse);

        ChatClient.Builder mockBuilder = mock(ChatClient.Builder.class);
        when(mockBuilder.build()).thenReturn(mockChatClient);

        var props = new LlmProperties();
        props.setMaxContextChars(40);
        reasoner = new SpringAiReasoner(mockBuilder, props);
    }

    @Test
    @DisplayName("sends the system prompt and a user prompt with format instructions")
    void sendsPrompts() throws Exception {
        when(mockCallResponse.content()).thenReturn("{\"decision\":\"RETRY\",\"confidence\":0.8}");

        reasoner.resolve(request);

        verify(mockRequestSpec).system(SpringAiReasoner.SYSTEM_PROMPT);
        ArgumentCaptor<String> userCaptor = ArgumentCaptor.forClass(String.class);
        verify(mockRequestSpec).user(userCaptor.capture());
        String user = userCaptor.getValue();
        assertTrue(user.startsWith("Question: RETRY_DECISION\n"));
        assertTrue(user.contains("Allowed decisions: ESCALATE, FAIL_TERMINAL, RETRY"));
        assertTrue(user.length() > reasoner.userPrompt(request).length() + 2, "format instructions appended");
    }

    @Test
    @DisplayName("deserializes the answer")
    void parsesAnswer() throws Exception {
        when(mockCallResponse.content()).thenReturn("{\"decision\":\"FAIL_TERMINAL\",\"confidence\":0.91}");

        ReasonerResult result = reasoner.resolve(request);

        assertEquals("FAIL_TERMINAL", result.decision());
        assertEquals(0.91, result.confidence(), 1e-9);
    }

    @Test
    @DisplayName("accepts an answer wrapped in a markdown fence")
    void parsesFencedAnswer() throws Exception {
        when(mockCallResponse.content()).thenReturn("```json\n{\"decision\":\"RETRY\",\"confidence\":0.7}\n```");

        ReasonerResult result = reasoner.resolve(request);

        assertEquals("RETRY", result.decision());
    }

    @Test
    @DisplayName("oversized contexts lose whole fields, largest first, and stay valid JSON")
    void dropsFieldsFromLongContext() throws Exception {
        String prompt = reasoner.userPrompt(request);
        String context = prompt.substring(prompt.indexOf("Context:\n") + "Context:\n".length());

        assertEquals("{\"retryCount\":0}", context);
        assertEquals(0, new ObjectMapper().readTree(context).get("retryCount").asInt());
    }

    @Test
    @DisplayName("contexts within the limit are sent unchanged")
    void keepsShortContext() {
        String small = "{\"retryCount\":1}";
        assertEquals(small, reasoner.fitContext("RETRY_DECISION", small));
    }

    @Test
    @DisplayName("a context that is not a JSON object is cut to the limit")
    void cutsNonObjectContext() {
        String array = "[\"" + "x".repeat(60) + "\"]";
        assertEquals(40, reasoner.fitContext("RETRY_DECISION", array).length());
    }

    @Test
    @DisplayName("empty content surfaces as ReasonerException")
    void emptyContent() {
        when(mockCallResponse.content()).thenReturn("  ");

        var ex = assertThrows(ReasonerException.class, () -> reasoner.resolve(request));
        assertInstanceOf(LlmEmptyResponseException.class, ex.getCause());
    }

    @Test
    @DisplayName("unparseable content surfaces as ReasonerException")
    void garbageContent() {
        when(mockCallResponse.content()).thenReturn("I think you should retry.");

        var ex = assertThrows(ReasonerException.class, () -> reasoner.resolve(request));
        assertInstanceOf(LlmParseException.class, ex.getCause());
    }

    @Test
    @DisplayName("transport failures surface as ReasonerException")
    void transportFailure() {
        when(mockRequestSpec.call()).thenThrow(new IllegalStateException("connection refused"));

        var ex = assertThrows(ReasonerException.class, () -> reasoner.resolve(request));
        assertTrue(ex.getMessage().contains("connection refused"));
    }
}
