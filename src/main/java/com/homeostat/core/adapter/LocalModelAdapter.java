package com.homeostat.core.adapter;

import com.homeostat.core.model.ChatMessage;
import com.homeostat.core.model.ToolCall;
import com.homeostat.core.port.ModelPort;
import com.homeostat.core.port.ModelRequest;
import com.homeostat.core.port.ModelResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Deterministic offline responder used when no model backend is configured.
 * <p>
 * Recognises a few phrasings that map onto the local tools ("read &lt;path&gt;",
 * "list &lt;path&gt;", "write &lt;path&gt;: &lt;text&gt;", anything about metrics or
 * status); answers everything else by acknowledging the request.
 */
public class LocalModelAdapter implements ModelPort {

    private static final Logger log = LoggerFactory.getLogger(LocalModelAdapter.class);

    private static final Pattern READ = Pattern.compile("\\b(?:read|show|cat)\\s+(\\S+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern LIST = Pattern.compile("\\b(?:list|ls)\\s+(?:files\\s+in\\s+)?(\\S+)",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern WRITE = Pattern.compile("\\bwrite\\s+(\\S+?)\\s*:\\s*(.+)",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern METRICS = Pattern.compile("\\b(?:metrics|cpu|memory|load|status|health)\\b",
            Pattern.CASE_INSENSITIVE);

    private final AtomicLong callIds = new AtomicLong();

    @Override
    public ModelResponse complete(ModelRequest request) {
        List<ChatMessage> messages = request.messages();
        ChatMessage last = messages.isEmpty() ? null : messages.get(messages.size() - 1);
        log.debug("Local model answering role {} over {} messages", request.role(), messages.size());

        if ("planner".equals(request.role())) {
            return ModelResponse.text("1. Work out what is being asked.\n"
                    + "2. Gather any information the answer depends on.\n"
                    + "3. Answer concisely.");
        }
        if (last != null && ChatMessage.TOOL.equals(last.role())) {
            return ModelResponse.text(summarizeToolOutput(messages));
        }

        String userText = lastUserText(messages);
        ToolCall call = intendedCall(userText, request.tools());
        if (call != null) {
            return new ModelResponse("", List.of(call));
        }
        return ModelResponse.text("Acknowledged: " + userText);
    }

    private ToolCall intendedCall(String text, List<String> tools) {
        Matcher write = WRITE.matcher(text);
        if (write.find() && tools.contains("write_file")) {
            return call("write_file", Map.of("path", write.group(1), "content", write.group(2).trim()));
        }
        Matcher list = LIST.matcher(text);
        if (list.find() && tools.contains("list_directory")) {
            return call("list_directory", Map.of("path", list.group(1)));
        }
        Matcher read = READ.matcher(text);
        if (read.find() && tools.contains("read_file")) {
            return call("read_file", Map.of("path", read.group(1)));
        }
        if (METRICS.matcher(text).find() && tools.contains("system_metrics_snapshot")) {
            return call("system_metrics_snapshot", Map.of());
        }
        return null;
    }

    private ToolCall call(String name, Map<String, Object> arguments) {
        return new ToolCall("call-" + callIds.incrementAndGet(), name, arguments);
    }

    private static String lastUserText(List<ChatMessage> messages) {
        for (int i = messages.size() - 1; i >= 0; i--) {
            ChatMessage message = messages.get(i);
            if (ChatMessage.USER.equals(message.role())) {
                return message.content() == null ? "" : message.content();
            }
        }
        return "";
    }

    private static String summarizeToolOutput(List<ChatMessage> messages) {
        var sb = new StringBuilder();
        for (int i = messages.size() - 1; i >= 0 && ChatMessage.TOOL.equals(messages.get(i).role()); i--) {
            String content = messages.get(i).content();
            sb.insert(0, (content == null ? "" : truncate(content)) + "\n");
        }
        return ("Here is what I found:\n" + sb).strip();
    }

    private static String truncate(String text) {
        return text.length() <= 2000 ? text : text.substring(0, 2000) + "\n...(truncated)";
    }
}
