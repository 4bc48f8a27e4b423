package com.rekindle.rex.core.llm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Selects the {@link Reasoner}: Spring AI when enabled and a chat model is configured,
 * otherwise a reasoner that always fails over to the conservative defaults.
 */
@Configuration
public class LlmConfig {

    private static final Logger log = LoggerFactory.getLogger(LlmConfig.class);

    @Bean
    public Reasoner reasoner(LlmProperties properties, ObjectProvider<ChatClient.Builder> chatClientBuilder) {
        ChatClient.Builder builder = chatClientBuilder.getIfAvailable();
        if (!properties.isEnabled() || builder == null) {
            log.info("LLM reasoning disabled (enabled={}, chat client available={})",
                    properties.isEnabled(), builder != null);
            return new DisabledReasoner();
        }
        return new SpringAiReasoner(builder, properties);
    }
}
