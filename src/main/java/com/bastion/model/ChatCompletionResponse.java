package com.bastion.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * OpenAI-compatible chat completion response. Normalized form of every LLM provider,
 * and the value stored in the llm cache namespace.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ChatCompletionResponse {

    public static final String OBJECT_TYPE = "chat.completion";

    @JsonProperty("id")
    private String id;

    @JsonProperty("object")
    private String object;

    @JsonProperty("created")
    private Long created;

    @JsonProperty("model")
    private String model;

    @JsonProperty("choices")
    private List<Choice> choices;

    @JsonProperty("usage")
    private Usage usage;

    /**
     * Text of every choice, concatenated. Empty when the provider returned no choices.
     */
    @JsonIgnore
    public String completionText() {
        if (choices == null || choices.isEmpty()) {
            return "";
        }
        StringBuilder text = new StringBuilder();
        for (Choice choice : choices) {
            text.append(choice.text());
        }
        return text.toString();
    }
}
