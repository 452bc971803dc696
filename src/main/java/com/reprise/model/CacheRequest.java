package com.reprise.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Identity of a model invocation: the five fields a cache key is derived from.
 * This is the input of a cache fetch.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheRequest {

    @JsonProperty("model")
    private String model;

    /**
     * Parameter mapping (JSON object) or a pre-serialized parameter string.
     */
    @JsonProperty("parameters")
    private JsonNode parameters;

    @JsonProperty("system_prompt")
    private String systemPrompt;

    @JsonProperty("user_prompt")
    private String userPrompt;

    @JsonProperty("iteration")
    private int iteration;

    /**
     * Cache key for this identity.
     */
    @JsonIgnore
    public String getKey() {
        return CacheEntry.genKey(model, parameters, systemPrompt, userPrompt, iteration);
    }
}
