package com.rekindle.rex.core.decision;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rekindle.rex.core.events.EventBus;
import com.rekindle.rex.core.llm.Reasoner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the decision layers.
 */
@Configuration
public class DecisionConfig {

    @Bean
    public StateMachineLayer stateMachineLayer() {
        return new StateMachineLayer();
    }

    @Bean
    public RuleEngine ruleEngine(DecisionProperties properties) {
        return RuleEngine.withDefaultRules(properties);
    }

    @Bean
    public ContextRedactor contextRedactor(ObjectMapper objectMapper) {
        return new ContextRedactor(objectMapper);
    }

    @Bean(destroyMethod = "close")
    public LlmReasonerLayer llmReasonerLayer(Reasoner reasoner, ObjectMapper objectMapper,
                                             DecisionProperties properties) {
        return new LlmReasonerLayer(reasoner, objectMapper, properties);
    }

    @Bean
    public DecisionAuditLog decisionAuditLog(DecisionProperties properties, EventBus eventBus) {
        return new DecisionAuditLog(properties.getAuditCapacity(), eventBus);
    }
}
