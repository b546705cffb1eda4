package com.bastion.provider;

import com.bastion.config.BastionProperties;
import com.bastion.exception.ProviderErrorType;
import com.bastion.exception.ProviderException;
import com.bastion.model.ChatCompletionRequest;
import com.bastion.model.ChatCompletionResponse;
import com.bastion.model.Choice;
import com.bastion.model.Message;
import com.bastion.model.ProviderCategory;
import com.bastion.model.Usage;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

/**
 * Anthropic (Claude) Messages API, the secondary LLM provider.
 * Requests are sent in Anthropic's own shape and answers converted to the completion shape.
 */
@Slf4j
@Component
public class AnthropicProvider extends AbstractProvider<ChatCompletionRequest, JsonNode, ChatCompletionResponse> {

    public static final String NAME = "anthropic";
    private static final String DEFAULT_BASE_URL = "https://api.anthropic.com";
    private static final String ANTHROPIC_VERSION = "2023-06-01";
    private static final String DEFAULT_MODEL = "claude-3-5-sonnet-20241022";
    private static final int DEFAULT_MAX_TOKENS = 4096;

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public AnthropicProvider(
            WebClient webClient,
            BastionProperties properties,
            ObjectMapper objectMapper,
            Clock clock) {
        super(webClient, properties, NAME);
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public ProviderCategory getCategory() {
        return ProviderCategory.LLM;
    }

    @Override
    protected Mono<JsonNode> send(ChatCompletionRequest request) {
        JsonNode anthropicRequest = toAnthropicRequest(request);
        log.info("Forwarding request to Anthropic: model={}", anthropicRequest.path("model").asText());

        return webClient.post()
                .uri(baseUrl(DEFAULT_BASE_URL) + "/v1/messages")
                .header("x-api-key", config.getApiKey())
                .header("anthropic-version", ANTHROPIC_VERSION)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .bodyValue(anthropicRequest)
                .retrieve()
                .bodyToMono(JsonNode.class);
    }

    /**
     * Convert a completion request to Anthropic format. Non-Claude models are mapped to the
     * default Claude model, since a fallback call cannot use the primary's model id.
     */
    JsonNode toAnthropicRequest(ChatCompletionRequest request) {
        ObjectNode anthropicRequest = objectMapper.createObjectNode();

        String model = request.getModel();
        anthropicRequest.put("model", model != null && model.toLowerCase().startsWith("claude") ? model : DEFAULT_MODEL);

        StringBuilder system = new StringBuilder();
        ArrayNode messagesArray = objectMapper.createArrayNode();
        if (request.getMessages() != null) {
            for (Message msg : request.getMessages()) {
                if (msg.isSystem()) {
                    if (system.length() > 0) {
                        system.append("\n\n");
                    }
                    system.append(msg.getContent());
                    continue;
                }
                ObjectNode anthropicMsg = objectMapper.createObjectNode();
                anthropicMsg.put("role", Message.ASSISTANT.equals(msg.getRole()) ? Message.ASSISTANT : Message.USER);

                // Anthropic uses array of content blocks
                ArrayNode contentArray = objectMapper.createArrayNode();
                ObjectNode textContent = objectMapper.createObjectNode();
                textContent.put("type", "text");
                textContent.put("text", msg.getContent());
                contentArray.add(textContent);

                anthropicMsg.set("content", contentArray);
                messagesArray.add(anthropicMsg);
            }
        }
        anthropicRequest.set("messages", messagesArray);

        if (system.length() > 0) {
            anthropicRequest.put("system", system.toString());
        }

        anthropicRequest.put("max_tokens", request.getMaxTokens() != null ? request.getMaxTokens() : DEFAULT_MAX_TOKENS);

        // Anthropic caps temperature at 1.0
        if (request.getTemperature() != null) {
            anthropicRequest.put("temperature", Math.min(1.0, request.getTemperature()));
        }
        if (request.getTopP() != null) {
            anthropicRequest.put("top_p", request.getTopP());
        }

        return anthropicRequest;
    }

    @Override
    public ChatCompletionResponse toNormalizedForm(JsonNode anthropicResponse) {
        JsonNode content = anthropicResponse.get("content");
        if (content == null || !content.isArray()) {
            throw new ProviderException(NAME, ProviderErrorType.MALFORMED_RESPONSE,
                    "response has no content blocks");
        }

        StringBuilder contentBuilder = new StringBuilder();
        for (JsonNode item : content) {
            if ("text".equals(item.path("type").asText())) {
                contentBuilder.append(item.path("text").asText());
            }
        }

        Choice choice = Choice.of(0, Message.assistant(contentBuilder.toString()),
                mapStopReason(anthropicResponse.path("stop_reason").asText("end_turn")));

        Usage usage = null;
        JsonNode usageNode = anthropicResponse.get("usage");
        if (usageNode != null) {
            int input = usageNode.path("input_tokens").asInt(0);
            int output = usageNode.path("output_tokens").asInt(0);
            usage = Usage.builder()
                    .promptTokens(input)
                    .completionTokens(output)
                    .totalTokens(input + output)
                    .build();
        }

        return ChatCompletionResponse.builder()
                .id(anthropicResponse.has("id")
                        ? "chatcmpl-" + anthropicResponse.get("id").asText()
                        : "chatcmpl-" + UUID.randomUUID().toString().substring(0, 8))
                .object(ChatCompletionResponse.OBJECT_TYPE)
                .created(clock.instant().getEpochSecond())
                .model(anthropicResponse.path("model").asText(null))
                .choices(List.of(choice))
                .usage(usage)
                .build();
    }

    /**
     * Map Claude stop reasons to OpenAI finish reasons.
     */
    private String mapStopReason(String claudeStopReason) {
        return switch (claudeStopReason) {
            case "max_tokens" -> Choice.FINISH_LENGTH;
            case "tool_use" -> Choice.FINISH_TOOL_CALLS;
            default -> Choice.FINISH_STOP;
        };
    }
}
