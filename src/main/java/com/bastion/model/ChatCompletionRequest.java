package com.bastion.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * OpenAI-compatible chat completion request. This is the request shape of the LLM route;
 * adapters for other vendors translate from it.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ChatCompletionRequest implements CacheableRequest {

    // OpenAI defaults
    private static final Map<String, Object> DEFAULTS = Map.of(
            "temperature", 1.0,
            "top_p", 1.0,
            "n", 1,
            "presence_penalty", 0.0,
            "frequency_penalty", 0.0
    );

    @JsonProperty("model")
    private String model;

    @JsonProperty("messages")
    private List<Message> messages;

    @JsonProperty("temperature")
    private Double temperature;

    @JsonProperty("top_p")
    private Double topP;

    @JsonProperty("n")
    private Integer n;

    @JsonProperty("stream")
    private Boolean stream;

    @JsonProperty("stop")
    private Object stop; // Can be String or List<String>

    @JsonProperty("max_tokens")
    private Integer maxTokens;

    @JsonProperty("presence_penalty")
    private Double presencePenalty;

    @JsonProperty("frequency_penalty")
    private Double frequencyPenalty;

    @JsonProperty("logit_bias")
    private Map<String, Integer> logitBias;

    @JsonProperty("user")
    private String user;

    @JsonProperty("functions")
    private List<Object> functions;

    @JsonProperty("function_call")
    private Object functionCall;

    @JsonProperty("tools")
    private List<Object> tools;

    @JsonProperty("tool_choice")
    private Object toolChoice;

    @Override
    public String cacheModel() {
        return model;
    }

    @Override
    public boolean streaming() {
        return Boolean.TRUE.equals(stream);
    }

    @Override
    public long requestedOutputSize() {
        return maxTokens == null ? 0 : maxTokens;
    }

    /**
     * Everything that changes the completion. {@code user} and {@code stream} do not.
     */
    @Override
    public Map<String, Object> fingerprintFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("model", model);
        fields.put("messages", messages);
        fields.put("temperature", temperature);
        fields.put("top_p", topP);
        fields.put("n", n);
        fields.put("stop", stop);
        fields.put("max_tokens", maxTokens);
        fields.put("presence_penalty", presencePenalty);
        fields.put("frequency_penalty", frequencyPenalty);
        fields.put("logit_bias", logitBias);
        fields.put("functions", functions);
        fields.put("function_call", functionCall);
        fields.put("tools", tools);
        fields.put("tool_choice", toolChoice);
        return fields;
    }

    @Override
    public Map<String, Object> fingerprintDefaults() {
        return DEFAULTS;
    }
}
