package com.reprise.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Identity of a model invocation plus the raw provider response to memoize.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StoreRequest {

    @JsonProperty("model")
    private String model;

    @JsonProperty("parameters")
    private JsonNode parameters;

    @JsonProperty("system_prompt")
    private String systemPrompt;

    @JsonProperty("user_prompt")
    private String userPrompt;

    @JsonProperty("iteration")
    private int iteration;

    /**
     * Raw response payload; serialized into the entry's output.
     */
    @JsonProperty("response")
    private JsonNode response;

    @JsonProperty("service")
    private String service;

    @JsonProperty("validated")
    private boolean validated;

    public CacheRequest toCacheRequest() {
        return CacheRequest.builder()
                .model(model)
                .parameters(parameters)
                .systemPrompt(systemPrompt)
                .userPrompt(userPrompt)
                .iteration(iteration)
                .build();
    }
}
