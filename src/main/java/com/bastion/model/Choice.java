package com.bastion.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Choice {

    public static final String FINISH_STOP = "stop";
    public static final String FINISH_LENGTH = "length";
    public static final String FINISH_TOOL_CALLS = "tool_calls";

    @JsonProperty("index")
    private Integer index;

    @JsonProperty("message")
    private Message message;

    @JsonProperty("finish_reason")
    private String finishReason;

    public static Choice of(int index, Message message, String finishReason) {
        return new Choice(index, message, finishReason);
    }

    @JsonIgnore
    public String text() {
        return message == null || message.getContent() == null ? "" : message.getContent();
    }

    /**
     * True when the provider cut the answer at the token limit.
     */
    @JsonIgnore
    public boolean isTruncated() {
        return FINISH_LENGTH.equals(finishReason);
    }
}
