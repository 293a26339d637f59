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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties bound from the {@code chains.*} prefix.
 *
 * <ul>
 * <li>{@link LlmProperties} - model provider selection and connection</li>
 * <li>{@link AgentProperties} - agent executor bounds</li>
 * <li>{@link MemoryProperties} - default conversation memory</li>
 * </ul>
 */
@ConfigurationProperties(prefix = "chains")
@Data
public class ChainsProperties {

    private LlmProperties llm = new LlmProperties();
    private AgentProperties agent = new AgentProperties();
    private MemoryProperties memory = new MemoryProperties();

    @Data
    public static class LlmProperties {
        /** {@code langchain4j} or {@code none}. */
        private String provider = "none";
        /** {@code openai} (any OpenAI-compatible endpoint) or {@code anthropic}. */
        private String apiType = "openai";
        private String model = "gpt-4o-mini";
        private String apiKey;
        private String baseUrl;
        private Duration timeout = Duration.ofSeconds(60);
        private Double temperature;
        private Integer maxTokens;
        private boolean streaming = false;
    }

    @Data
    public static class AgentProperties {
        private int maxIterations = 10;
        private Duration timeout;
        private int maxParseRetries = 3;
        private boolean stopOnToolFailure = false;
        private boolean forceFinalAnswer = true;
    }

    @Data
    public static class MemoryProperties {
        /** {@code simple}, {@code window} or {@code none}. */
        private String type = "simple";
        private int windowSize = 10;
    }
}
