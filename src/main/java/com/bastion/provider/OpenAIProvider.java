package com.bastion.provider;

import com.bastion.config.BastionProperties;
import com.bastion.model.ChatCompletionRequest;
import com.bastion.model.ChatCompletionResponse;
import com.bastion.model.ProviderCategory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/**
 * OpenAI chat completion provider. Its response is already the normalized completion shape.
 */
@Slf4j
@Component
public class OpenAIProvider extends AbstractProvider<ChatCompletionRequest, ChatCompletionResponse, ChatCompletionResponse> {

    public static final String NAME = "openai";
    private static final String DEFAULT_BASE_URL = "https://api.openai.com/v1";

    public OpenAIProvider(WebClient webClient, BastionProperties properties) {
        super(webClient, properties, NAME);
    }

    @Override
    public ProviderCategory getCategory() {
        return ProviderCategory.LLM;
    }

    @Override
    protected Mono<ChatCompletionResponse> send(ChatCompletionRequest request) {
        log.info("Forwarding request to OpenAI: model={}", request.getModel());

        String endpoint = baseUrl(DEFAULT_BASE_URL) + "/chat/completions";

        return webClient.post()
                .uri(endpoint)
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + config.getApiKey())
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .bodyValue(request.toBuilder().stream(false).build())
                .retrieve()
                .bodyToMono(ChatCompletionResponse.class);
    }

    @Override
    public ChatCompletionResponse toNormalizedForm(ChatCompletionResponse response) {
        return response;
    }
}
