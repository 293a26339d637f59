package me.golemcore.chains.infrastructure.config;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.chains.adapter.outbound.llm.Langchain4jAdapter;
import me.golemcore.chains.adapter.outbound.llm.LlmAdapterFactory;
import me.golemcore.chains.adapter.outbound.llm.LlmProviderAdapter;
import me.golemcore.chains.adapter.outbound.llm.NoOpLlmAdapter;
import me.golemcore.chains.adapter.outbound.memory.NoOpMemory;
import me.golemcore.chains.adapter.outbound.memory.SimpleMemory;
import me.golemcore.chains.adapter.outbound.memory.WindowBufferMemory;
import me.golemcore.chains.domain.agent.AgentExecutorSettings;
import me.golemcore.chains.domain.component.MemoryComponent;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

import java.time.Clock;
import java.util.List;

/**
 * Wires the model provider, default memory and agent settings from
 * {@link ChainsProperties}. Every bean backs off when the application defines
 * its own.
 *
 * <p>
 * The {@link LlmAdapterFactory} is the primary {@code LlmPort}; inject it to
 * get whichever provider {@code chains.llm.provider} selects.
 */
@AutoConfiguration(after = JacksonAutoConfiguration.class)
@EnableConfigurationProperties(ChainsProperties.class)
@Slf4j
public class ChainsAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public static Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    @ConditionalOnMissingBean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Bean
    @ConditionalOnMissingBean
    public NoOpLlmAdapter noOpLlmAdapter() {
        return new NoOpLlmAdapter();
    }

    @Bean
    @ConditionalOnMissingBean
    public Langchain4jAdapter langchain4jAdapter(ChainsProperties properties, ObjectMapper objectMapper) {
        return new Langchain4jAdapter(properties, objectMapper);
    }

    @Bean
    @Primary
    @ConditionalOnMissingBean
    public LlmAdapterFactory llmAdapterFactory(ChainsProperties properties, List<LlmProviderAdapter> adapters) {
        return new LlmAdapterFactory(properties, adapters);
    }

    @Bean
    @ConditionalOnMissingBean
    public MemoryComponent memoryComponent(ChainsProperties properties) {
        ChainsProperties.MemoryProperties memory = properties.getMemory();
        MemoryComponent component = switch (memory.getType()) {
        case "window" -> new WindowBufferMemory(memory.getWindowSize());
        case "none" -> new NoOpMemory();
        case "simple" -> new SimpleMemory();
        default -> throw new IllegalStateException("Unknown chains.memory.type: " + memory.getType()
                + " (expected simple, window or none)");
        };
        log.info("[Memory] Using {} memory", memory.getType());
        return component;
    }

    @Bean
    @ConditionalOnMissingBean
    public AgentExecutorSettings agentExecutorSettings(ChainsProperties properties) {
        ChainsProperties.AgentProperties agent = properties.getAgent();
        return AgentExecutorSettings.builder()
                .maxIterations(agent.getMaxIterations())
                .timeout(agent.getTimeout())
                .maxParseRetries(agent.getMaxParseRetries())
                .stopOnToolFailure(agent.isStopOnToolFailure())
                .forceFinalAnswer(agent.isForceFinalAnswer())
                .build();
    }
}
