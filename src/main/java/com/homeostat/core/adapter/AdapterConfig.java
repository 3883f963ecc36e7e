package com.homeostat.core.adapter;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.homeostat.core.config.HomeostatProperties;
import com.homeostat.core.port.ModelPort;
import com.homeostat.core.port.SessionPort;
import com.homeostat.core.port.ToolPort;
import com.homeostat.core.tools.LocalTool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Default implementations of the model, tool and session ports. Any port bean defined
 * elsewhere replaces the default here.
 */
@Configuration
public class AdapterConfig {

    private static final Logger log = LoggerFactory.getLogger(AdapterConfig.class);

    @Bean
    @ConditionalOnProperty(name = "homeostat.model.provider", havingValue = "openai")
    public ModelPort springAiModelPort(ChatClient.Builder builder, ObjectMapper objectMapper,
                                       HomeostatProperties properties) {
        log.info("Using OpenAI-compatible model backend");
        return new SpringAiModelAdapter(builder, objectMapper, properties.getModel().getSystemPrompt());
    }

    @Bean
    @ConditionalOnMissingBean(ModelPort.class)
    public ModelPort localModelPort() {
        log.info("No model backend configured; using the local offline responder");
        return new LocalModelAdapter();
    }

    @Bean
    @ConditionalOnMissingBean(ToolPort.class)
    public ToolPort localToolPort(List<LocalTool> tools) {
        return new LocalToolAdapter(tools);
    }

    @Bean
    @ConditionalOnMissingBean(SessionPort.class)
    public SessionPort inMemorySessionPort() {
        return new InMemorySessionAdapter();
    }
}
