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
 * One conversation turn. Part of the completion fingerprint, so field order and names are stable.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Message {

    public static final String SYSTEM = "system";
    public static final String USER = "user";
    public static final String ASSISTANT = "assistant";

    @JsonProperty("role")
    private String role;

    @JsonProperty("content")
    private String content;

    @JsonProperty("name")
    private String name;

    // forwarded verbatim to OpenAI; dropped when converting for Anthropic
    @JsonProperty("tool_calls")
    private List<Object> toolCalls;

    public static Message system(String content) {
        return Message.builder().role(SYSTEM).content(content).build();
    }

    public static Message user(String content) {
        return Message.builder().role(USER).content(content).build();
    }

    public static Message assistant(String content) {
        return Message.builder().role(ASSISTANT).content(content).build();
    }

    @JsonIgnore
    public boolean isSystem() {
        return SYSTEM.equals(role);
    }
}
