package com.homeostat.core.adapter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.homeostat.core.model.ChatMessage;
import com.homeostat.core.model.ToolCall;
import com.homeostat.core.port.ModelPort;
import com.homeostat.core.port.ModelRequest;
import com.homeostat.core.port.ModelResponse;
import com.homeostat.core.port.ModelTransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.client.ChatClient.ChatClientRequestSpec;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.converter.BeanOutputConverter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link ModelPort} backed by Spring AI's {@link ChatClient} (OpenAI-compatible endpoint).
 * <p>
 * The conversation is rendered as one transcript. When tools are offered, the format
 * instructions of a {@link BeanOutputConverter} for {@link ToolRequest} are appended to
 * the system prompt; an answer that converts to a request with tool calls becomes those
 * calls, any other answer is the reply text.
 */
public class SpringAiModelAdapter implements ModelPort {

    private static final Logger log = LoggerFactory.getLogger(SpringAiModelAdapter.class);

    private final ChatClient chatClient;
    private final ObjectMapper objectMapper;
    private final String systemPrompt;
    private final BeanOutputConverter<ToolRequest> converter = new BeanOutputConverter<>(ToolRequest.class);

    public SpringAiModelAdapter(ChatClient.Builder builder, ObjectMapper objectMapper, String systemPrompt) {
        this.chatClient = builder.build();
        this.objectMapper = objectMapper;
        this.systemPrompt = systemPrompt;
    }

    @Override
    public ModelResponse complete(ModelRequest request) {
        log.info("Model call started (role={}, messages={})", request.role(), request.messages().size());
        long start = System.currentTimeMillis();

        ChatClientRequestSpec spec = chatClient.prompt()
                .system(systemText(request))
                .user(transcript(request.messages()));
        if (request.maxTokens() != null || request.temperature() != null) {
            spec = spec.options(ChatOptions.builder()
                    .maxTokens(request.maxTokens())
                    .temperature(request.temperature())
                    .build());
        }

        String content;
        try {
            content = spec.call().content();
        } catch (RuntimeException e) {
            throw new ModelTransportException("Model backend call failed for role " + request.role()
                    + ": " + e.getMessage(), e);
        }
        log.info("Model call complete (role={}, {}ms)", request.role(), System.currentTimeMillis() - start);
        if (content == null || content.isBlank()) {
            throw new ModelTransportException("Model backend returned empty content for role " + request.role());
        }
        return parse(content);
    }

    ModelResponse parse(String content) {
        String candidate = unfence(content.strip());
        if (!candidate.startsWith("{")) {
            return ModelResponse.text(content);
        }
        ToolRequest request = convert(candidate);
        if (request == null || request.toolCalls() == null || request.toolCalls().isEmpty()) {
            return ModelResponse.text(content);
        }
        var toolCalls = new ArrayList<ToolCall>();
        int index = 0;
        for (ToolRequest.RequestedCall call : request.toolCalls()) {
            index++;
            if (call == null || call.name() == null || call.name().isBlank()) {
                continue;
            }
            String id = call.id() != null ? call.id() : "call-" + index;
            Map<String, Object> arguments = call.arguments() != null ? call.arguments() : Map.of();
            toolCalls.add(new ToolCall(id, call.name(), new LinkedHashMap<>(arguments)));
        }
        if (toolCalls.isEmpty()) {
            return ModelResponse.text(content);
        }
        return new ModelResponse(request.content() != null ? request.content() : "", toolCalls);
    }

    private ToolRequest convert(String json) {
        try {
            return converter.convert(json);
        } catch (RuntimeException e) {
            log.debug("Converter could not read the answer as a tool request: {}", e.getMessage());
        }
        try {
            return objectMapper.readValue(json, ToolRequest.class);
        } catch (JsonProcessingException e) {
            log.debug("Model answer is not a tool request, using it as text: {}", e.getMessage());
            return null;
        }
    }

    private String systemText(ModelRequest request) {
        var sb = new StringBuilder(systemPrompt);
        for (ChatMessage message : request.messages()) {
            if (ChatMessage.SYSTEM.equals(message.role())) {
                sb.append("\n\n").append(message.content());
            }
        }
        if (!request.tools().isEmpty()) {
            sb.append("\n\nAvailable tools: ").append(String.join(", ", request.tools()))
                    .append(". To use tools, answer with a tool request in the format below;")
                    .append(" otherwise answer in plain text.\n")
                    .append(converter.getFormat());
        }
        return sb.toString();
    }

    private static String transcript(List<ChatMessage> messages) {
        var sb = new StringBuilder();
        for (ChatMessage message : messages) {
            if (ChatMessage.SYSTEM.equals(message.role())) {
                continue;
            }
            sb.append(message.role()).append(": ");
            if (message.content() != null) {
                sb.append(message.content());
            }
            for (ToolCall call : message.toolCalls()) {
                sb.append(" [requested ").append(call.name()).append(' ').append(call.arguments()).append(']');
            }
            sb.append('\n');
        }
        return sb.toString().strip();
    }

    private static String unfence(String text) {
        if (!text.startsWith("```")) {
            return text;
        }
        String[] lines = text.split("\n");
        if (lines.length < 3) {
            return text;
        }
        return String.join("\n", List.of(lines).subList(1, lines.length - 1)).strip();
    }
}
