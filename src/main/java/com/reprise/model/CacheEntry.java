package com.reprise.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.reprise.exception.CacheDeserializationException;
import com.reprise.service.canonicalization.CanonicalJsonWriter;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Value;
import org.apache.commons.codec.digest.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * One memoized model invocation.
 *
 * The key is derived from the identity fields only (model, parameters, system prompt,
 * user prompt, iteration). Equality covers every field except the timestamp.
 */
@Value
@Builder(toBuilder = true)
public class CacheEntry {

    public static final List<String> KEY_FIELDS =
            List.of("model", "parameters", "system_prompt", "user_prompt", "iteration");

    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
            .enable(JsonReadFeature.ALLOW_NON_NUMERIC_NUMBERS)
            .build();

    String model;

    /**
     * Parameter mapping (JSON object) or a pre-serialized parameter string.
     */
    JsonNode parameters;

    String systemPrompt;

    String userPrompt;

    int iteration;

    /**
     * Serialized (JSON text) response payload.
     */
    String output;

    @EqualsAndHashCode.Exclude
    @Builder.Default
    long timestamp = Instant.now().getEpochSecond();

    String service;

    boolean validated;

    /**
     * Derive the cache key for an identity.
     *
     * @return 32 lowercase hex characters (MD5)
     */
    public static String genKey(String model, JsonNode parameters, String systemPrompt,
                                String userPrompt, int iteration) {
        String longKey = model
                + CanonicalJsonWriter.writeSorted(normalizeParameters(parameters))
                + systemPrompt
                + userPrompt
                + iteration;
        return DigestUtils.md5Hex(longKey.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Key derivation for a pre-serialized parameter string.
     */
    public static String genKey(String model, String parameters, String systemPrompt,
                                String userPrompt, int iteration) {
        return genKey(model, TextNode.valueOf(parameters), systemPrompt, userPrompt, iteration);
    }

    /**
     * Key derivation for a parameter mapping.
     */
    public static String genKey(String model, Map<String, ?> parameters, String systemPrompt,
                                String userPrompt, int iteration) {
        return genKey(model, parametersOf(parameters), systemPrompt, userPrompt, iteration);
    }

    public static JsonNode parametersOf(Map<String, ?> parameters) {
        return normalizeParameters(MAPPER.valueToTree(parameters));
    }

    /**
     * Re-read parameters from their JSON text, so numbers carry the node types a
     * reload from disk produces (100L becomes an int node, 0.5f a double node).
     */
    static JsonNode normalizeParameters(JsonNode parameters) {
        if (parameters == null) {
            return null;
        }
        try {
            return MAPPER.readTree(MAPPER.writeValueAsString(parameters));
        } catch (JsonProcessingException e) {
            throw new CacheDeserializationException("parameters are not serializable as JSON", e);
        }
    }

    /**
     * Build the entry recorded for a completed call; the response is serialized into the output.
     */
    public static CacheEntry forResponse(CacheRequest request, JsonNode response, String service, boolean validated) {
        requirePresent(request.getModel(), "model");
        requirePresent(request.getParameters(), "parameters");
        requirePresent(request.getSystemPrompt(), "system_prompt");
        requirePresent(request.getUserPrompt(), "user_prompt");
        requirePresent(response, "response");
        return CacheEntry.builder()
                .model(request.getModel())
                .parameters(request.getParameters())
                .systemPrompt(request.getSystemPrompt())
                .userPrompt(request.getUserPrompt())
                .iteration(request.getIteration())
                .output(CanonicalJsonWriter.write(response))
                .service(service)
                .validated(validated)
                .build();
    }

    public String getKey() {
        return genKey(model, parameters, systemPrompt, userPrompt, iteration);
    }

    /**
     * Output parsed back into a JSON value.
     *
     * @throws CacheDeserializationException if the output is not valid JSON text
     */
    public JsonNode parsedOutput() {
        return parseOutput(output);
    }

    /**
     * Fetch-input projection: identity fields only.
     */
    public CacheRequest toCacheRequest() {
        return CacheRequest.builder()
                .model(model)
                .parameters(parameters)
                .systemPrompt(systemPrompt)
                .userPrompt(userPrompt)
                .iteration(iteration)
                .build();
    }

    /**
     * Store-input projection: identity fields plus the raw response.
     */
    public StoreRequest toStoreRequest() {
        return StoreRequest.builder()
                .model(model)
                .parameters(parameters)
                .systemPrompt(systemPrompt)
                .userPrompt(userPrompt)
                .iteration(iteration)
                .response(parsedOutput())
                .service(service)
                .validated(validated)
                .build();
    }

    public ObjectNode toJson() {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put("model", model);
        node.set("parameters", parameters);
        node.put("system_prompt", systemPrompt);
        node.put("user_prompt", userPrompt);
        node.put("iteration", iteration);
        node.put("output", output);
        node.put("timestamp", timestamp);
        node.put("service", service);
        node.put("validated", validated);
        return node;
    }

    /**
     * Rebuild an entry from its JSON form. Unknown fields are ignored.
     *
     * @throws CacheDeserializationException if an identity field or the output is missing or malformed
     */
    public static CacheEntry fromJson(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new CacheDeserializationException("cache entry must be a JSON object");
        }

        JsonNode parameters = node.get("parameters");
        if (parameters == null || parameters.isNull()) {
            throw new CacheDeserializationException("missing field 'parameters'");
        }

        JsonNode iteration = node.get("iteration");
        if (iteration == null || !iteration.isIntegralNumber() || !iteration.canConvertToInt()) {
            throw new CacheDeserializationException("missing or non-integer field 'iteration'");
        }

        String output = requireText(node, "output");
        parseOutput(output);

        JsonNode timestamp = node.get("timestamp");
        JsonNode service = node.get("service");
        JsonNode validated = node.get("validated");

        return CacheEntry.builder()
                .model(requireText(node, "model"))
                .parameters(parameters.deepCopy())
                .systemPrompt(requireText(node, "system_prompt"))
                .userPrompt(requireText(node, "user_prompt"))
                .iteration(iteration.intValue())
                .output(output)
                .timestamp(timestamp != null && timestamp.isNumber()
                        ? timestamp.longValue()
                        : Instant.now().getEpochSecond())
                .service(service != null && service.isTextual() ? service.textValue() : null)
                .validated(validated != null && validated.asBoolean(false))
                .build();
    }

    /**
     * Example entry used by tests and demos.
     *
     * @param randomize append a random suffix to the system prompt so the key is unique
     */
    public static CacheEntry example(boolean randomize) {
        String addition = randomize ? UUID.randomUUID().toString() : "";
        return CacheEntry.builder()
                .model("gpt-3.5-turbo")
                .parameters(parametersOf(Map.of("temperature", 0.5)))
                .systemPrompt("The quick brown fox jumps over the lazy dog." + addition)
                .userPrompt("What does the fox say?")
                .iteration(1)
                .output("\"The fox says 'hello'\"")
                .service("openai")
                .build();
    }

    public static CacheEntry example() {
        return example(false);
    }

    private static void requirePresent(Object value, String field) {
        if (value == null) {
            throw new CacheDeserializationException("missing field '" + field + "'");
        }
    }

    private static String requireText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual()) {
            throw new CacheDeserializationException("missing or non-string field '" + field + "'");
        }
        return value.textValue();
    }

    public static class CacheEntryBuilder {

        public CacheEntryBuilder parameters(JsonNode parameters) {
            this.parameters = normalizeParameters(parameters);
            return this;
        }
    }

    /**
     * Parse serialized output text.
     *
     * @throws CacheDeserializationException if the text is not a single JSON value
     */
    public static JsonNode parseOutput(String output) {
        try {
            JsonNode parsed = MAPPER.readTree(output);
            if (parsed == null || parsed.isMissingNode()) {
                throw new CacheDeserializationException("output is empty");
            }
            return parsed;
        } catch (JsonProcessingException e) {
            throw new CacheDeserializationException("output is not valid JSON", e);
        }
    }
}
