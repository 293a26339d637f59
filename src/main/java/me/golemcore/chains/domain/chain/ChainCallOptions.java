package me.golemcore.chains.domain.chain;

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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Options attached to a single chain call. Every field is optional; unset
 * fields fall back to the chain's own defaults.
 *
 * <p>
 * {@link #fromMap(Map)} reads snake_case keys ({@code max_iterations},
 * {@code top_k}, ...) and ignores keys it does not know.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ChainCallOptions {

    public static final String STREAMING_SINK_KEY = "streaming_sink";

    private static final ObjectMapper DEFAULT_MAPPER = new ObjectMapper().registerModule(new JavaTimeModule());

    @JsonIgnore
    private StreamingSink streamingSink;

    private Integer maxIterations;
    private Duration timeout;
    private Integer topK;
    private Double temperature;
    private Integer maxTokens;
    private List<String> stopWords;
    private String model;

    public static ChainCallOptions defaults() {
        return new ChainCallOptions();
    }

    public static ChainCallOptions fromMap(Map<String, ?> options) {
        return fromMap(options, DEFAULT_MAPPER);
    }

    /**
     * Reads options from a loosely typed map. A {@link StreamingSink} may be
     * passed under {@value #STREAMING_SINK_KEY}.
     */
    public static ChainCallOptions fromMap(Map<String, ?> options, ObjectMapper objectMapper) {
        if (options == null || options.isEmpty()) {
            return defaults();
        }
        Map<String, Object> copy = new LinkedHashMap<>(options);
        Object sink = copy.remove(STREAMING_SINK_KEY);
        ChainCallOptions result = objectMapper.convertValue(copy, ChainCallOptions.class);
        if (sink instanceof StreamingSink streamingSinkValue) {
            result.setStreamingSink(streamingSinkValue);
        }
        result.validate();
        return result;
    }

    /**
     * Returns a copy where every field set on {@code overrides} replaces the
     * value of this instance.
     */
    public ChainCallOptions mergeWith(ChainCallOptions overrides) {
        if (overrides == null) {
            return this;
        }
        return ChainCallOptions.builder()
                .streamingSink(overrides.streamingSink != null ? overrides.streamingSink : streamingSink)
                .maxIterations(overrides.maxIterations != null ? overrides.maxIterations : maxIterations)
                .timeout(overrides.timeout != null ? overrides.timeout : timeout)
                .topK(overrides.topK != null ? overrides.topK : topK)
                .temperature(overrides.temperature != null ? overrides.temperature : temperature)
                .maxTokens(overrides.maxTokens != null ? overrides.maxTokens : maxTokens)
                .stopWords(overrides.stopWords != null ? overrides.stopWords : stopWords)
                .model(overrides.model != null ? overrides.model : model)
                .build();
    }

    /**
     * Checks cross-field consistency once, before a call starts.
     *
     * @throws IllegalArgumentException
     *             if a bound is not positive or the temperature is out of range
     */
    public void validate() {
        requirePositive("max_iterations", maxIterations);
        requirePositive("top_k", topK);
        requirePositive("max_tokens", maxTokens);
        if (timeout != null && (timeout.isZero() || timeout.isNegative())) {
            throw new IllegalArgumentException("timeout must be positive, got " + timeout);
        }
        if (temperature != null && (temperature < 0.0 || temperature > 2.0)) {
            throw new IllegalArgumentException("temperature must be within [0, 2], got " + temperature);
        }
    }

    private static void requirePositive(String name, Integer value) {
        if (value != null && value < 1) {
            throw new IllegalArgumentException(name + " must be at least 1, got " + value);
        }
    }
}
