package com.homeostat.core.adapter;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.homeostat.core.model.ChatMessage;
import com.homeostat.core.model.ToolCall;
import com.homeostat.core.port.ModelRequest;
import com.homeostat.core.port.ModelResponse;
import com.homeostat.core.port.ModelTransportException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.client.ChatClient.CallResponseSpec;
import org.springframework.ai.chat.client.ChatClient.ChatClientRequestSpec;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.converter.BeanOutputConverter;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link SpringAiModelAdapter}.
 * <p>
 * Mocks the entire {@link ChatClient} chain so no real model calls are made.
 */
class SpringAiModelAdapterTest {

    private ChatClientRequestSpec mockRequestSpec;
    private CallResponseSpec mockCallResponse;
    private SpringAiModelAdapter adapter;

    @BeforeEach
    void setUp() {
        ChatClient mockChatClient = mock(ChatClient.class);
        mockRequestSpec = mock(ChatClientRequestSpec.class);
        mockCallResponse = mock(CallResponseSpec.class);

        when(mockChatClient.prompt()).thenReturn(mockRequestSpec);
        when(mockRequestSpec.system(anyString())).thenReturn(mockRequestSpec);
        when(mockRequestSpec.user(anyString())).thenReturn(mockRequestSpec);
        when(mockRequestSpec.options(any())).thenReturn(mockRequestSpec);
        when(mockRequestSpec.call()).thenReturn(mockCallResponse);

        ChatClient.Builder mockBuilder = mock(ChatClient.Builder.class);
        when(mockBuilder.build()).thenReturn(mockChatClient);

        adapter = new SpringAiModelAdapter(mockBuilder, new ObjectMapper(), "Be brief.");
    }

    private static ModelRequest request(List<ChatMessage> messages, Integer maxTokens, Double temperature,
                                        List<String> tools) {
        return new ModelRequest("standard", messages, maxTokens, temperature, Duration.ofSeconds(5), tools);
    }

    @Test
    @DisplayName("sends the system prompt, plan notes and transcript to ChatClient")
    void sendsPrompts() {
        when(mockCallResponse.content()).thenReturn("Paris");

        ModelResponse response = adapter.complete(request(List.of(
                ChatMessage.user("capital of France?"),
                ChatMessage.system("Plan:\n1. answer"),
                ChatMessage.assistant("Paris"),
                ChatMessage.user("sure?")), null, null, List.of()));

        assertEquals("Paris", response.content());
        assertFalse(response.hasToolCalls());

        ArgumentCaptor<String> system = ArgumentCaptor.forClass(String.class);
        verify(mockRequestSpec).system(system.capture());
        assertTrue(system.getValue().startsWith("Be brief."));
        assertTrue(system.getValue().contains("Plan:\n1. answer"));
        assertFalse(system.getValue().contains("Available tools"));

        verify(mockRequestSpec).user("user: capital of France?\nassistant: Paris\nuser: sure?");
        verify(mockRequestSpec, never()).options(any());
    }

    @Test
    @DisplayName("applies token and temperature limits as chat options")
    void appliesOptions() {
        when(mockCallResponse.content()).thenReturn("ok");

        adapter.complete(request(List.of(ChatMessage.user("q")), 256, 0.2, List.of()));

        ArgumentCaptor<ChatOptions> options = ArgumentCaptor.forClass(ChatOptions.class);
        verify(mockRequestSpec).options(options.capture());
        assertEquals(256, options.getValue().getMaxTokens());
        assertEquals(0.2, options.getValue().getTemperature());
    }

    @Test
    @DisplayName("lists the available tools and the tool request format in the system prompt")
    void listsTools() {
        when(mockCallResponse.content()).thenReturn("ok");

        adapter.complete(request(List.of(ChatMessage.user("q")), null, null, List.of("read_file", "list_directory")));

        ArgumentCaptor<String> system = ArgumentCaptor.forClass(String.class);
        verify(mockRequestSpec).system(system.capture());
        assertTrue(system.getValue().contains("Available tools: read_file, list_directory."));
        assertTrue(system.getValue().endsWith(new BeanOutputConverter<>(ToolRequest.class).getFormat()));
        assertTrue(system.getValue().contains("\"toolCalls\""));
    }

    @Test
    @DisplayName("a JSON tool request becomes tool calls")
    void parsesToolCalls() {
        when(mockCallResponse.content()).thenReturn("""
                ```json
                {"toolCalls":[{"id":"x1","name":"read_file","arguments":{"path":"/tmp/a"}},{"name":"list_directory"}]}
                ```
                """);

        ModelResponse response = adapter.complete(request(List.of(ChatMessage.user("q")), null, null,
                List.of("read_file")));

        assertEquals(List.of(
                        new ToolCall("x1", "read_file", Map.of("path", "/tmp/a")),
                        new ToolCall("call-2", "list_directory", Map.of())),
                response.toolCalls());
    }

    @Test
    @DisplayName("JSON that is not a tool request is kept as text")
    void plainJsonIsText() {
        assertEquals("{\"answer\":42}", adapter.parse("{\"answer\":42}").content());
        assertEquals("{not json", adapter.parse("{not json").content());
        assertFalse(adapter.parse("{\"toolCalls\":[]}").hasToolCalls());
        assertFalse(adapter.parse("{\"toolCalls\":[{\"arguments\":{\"path\":\"/tmp\"}}]}").hasToolCalls());
    }

    @Test
    @DisplayName("tool arguments keep their JSON types and the accompanying text is kept")
    void typedArguments() {
        ModelResponse response = adapter.parse("""
                {"content":"Checking the file.","toolCalls":[{"name":"read_file","arguments":{"path":"/tmp/a","limit":10,"follow":true}}]}
                """);

        assertEquals("Checking the file.", response.content());
        ToolCall call = response.toolCalls().get(0);
        assertEquals("call-1", call.id());
        assertEquals(Map.of("path", "/tmp/a", "limit", 10, "follow", true), call.arguments());
    }

    @Test
    @DisplayName("backend failures surface as transport errors")
    void backendFailure() {
        when(mockRequestSpec.call()).thenThrow(new IllegalStateException("connection refused"));

        var e = assertThrows(ModelTransportException.class,
                () -> adapter.complete(request(List.of(ChatMessage.user("q")), null, null, List.of())));
        assertTrue(e.getMessage().contains("connection refused"));
    }

    @Test
    @DisplayName("an empty answer is a transport error")
    void emptyAnswer() {
        when(mockCallResponse.content()).thenReturn("  ");

        assertThrows(ModelTransportException.class,
                () -> adapter.complete(request(List.of(ChatMessage.user("q")), null, null, List.of())));
    }
}
