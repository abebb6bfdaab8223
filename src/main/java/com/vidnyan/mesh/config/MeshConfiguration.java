package com.vidnyan.mesh.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.vidnyan.mesh.domain.expression.ExpressionParser;
import com.vidnyan.mesh.domain.rule.SpecRule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Wires the domain components that are not Spring beans themselves.
 */
@Slf4j
@Configuration
public class MeshConfiguration {

    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(SerializationFeature.INDENT_OUTPUT, true)
                .registerModule(new JavaTimeModule());
    }

    @Bean
    public ExpressionParser expressionParser(MeshProperties properties) {
        if (properties.isStrictAggregationSource()) {
            log.info("Strict aggregation source inference enabled");
        }
        return new ExpressionParser(properties.isStrictAggregationSource());
    }

    /**
     * Log available rules on startup.
     */
    @Bean
    public String logRules(List<SpecRule> rules, MeshProperties properties) {
        log.info("Registered {} validation rules:", rules.size());
        rules.forEach(r -> log.info("  - {} ({}){}", r.id(), r.getName(),
                properties.getDisabledRules().contains(r.id()) ? " [disabled]" : ""));
        return "rules-logged";
    }
}
