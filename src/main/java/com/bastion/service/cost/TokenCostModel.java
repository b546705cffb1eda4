package com.bastion.service.cost;

import com.bastion.model.ChatCompletionRequest;
import com.bastion.model.ChatCompletionResponse;
import com.bastion.model.Message;
import com.bastion.model.Usage;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.Map;

/**
 * Token pricing for chat completions, per 1K tokens.
 */
public class TokenCostModel implements CostModel<ChatCompletionRequest, ChatCompletionResponse> {

    static final BigDecimal UNKNOWN_MODEL_COST = new BigDecimal("0.02");
    static final int DEFAULT_OUTPUT_TOKENS = 1000;

    private static final BigDecimal THOUSAND = BigDecimal.valueOf(1000);

    private static final Map<String, Pricing> PRICING = Map.ofEntries(
            Map.entry("gpt-4o", new Pricing("0.0025", "0.01")),
            Map.entry("gpt-4o-mini", new Pricing("0.000075", "0.0003")),
            Map.entry("gpt-4", new Pricing("0.03", "0.06")),
            Map.entry("gpt-4-32k", new Pricing("0.06", "0.12")),
            Map.entry("gpt-4-turbo", new Pricing("0.01", "0.03")),
            Map.entry("gpt-3.5-turbo", new Pricing("0.0005", "0.0015")),
            Map.entry("gpt-3.5-turbo-16k", new Pricing("0.003", "0.004")),
            Map.entry("claude-3-5-sonnet-20241022", new Pricing("0.003", "0.015")),
            Map.entry("claude-3-opus-20240229", new Pricing("0.015", "0.075")),
            Map.entry("claude-3-haiku-20240307", new Pricing("0.00025", "0.00125"))
    );

    @Override
    public BigDecimal estimate(ChatCompletionRequest request) {
        Pricing pricing = pricingFor(request);
        if (pricing == null) {
            return UNKNOWN_MODEL_COST;
        }
        long inputTokens = promptChars(request) / 4;
        long outputTokens = request.getMaxTokens() != null ? request.getMaxTokens() : DEFAULT_OUTPUT_TOKENS;
        return pricing.cost(inputTokens, outputTokens);
    }

    @Override
    public BigDecimal actual(ChatCompletionRequest request, ChatCompletionResponse response) {
        Pricing pricing = pricingFor(request);
        Usage usage = response.getUsage();
        if (pricing == null || usage == null) {
            return estimate(request);
        }
        return pricing.cost(orZero(usage.getPromptTokens()), orZero(usage.getCompletionTokens()));
    }

    @Override
    public long unitsServed(ChatCompletionResponse response) {
        Usage usage = response.getUsage();
        return usage == null ? 0 : orZero(usage.getTotalTokens());
    }

    /**
     * Completion tokens, compared against the operation's token cap. Estimated from the
     * text when the provider reported no usage.
     */
    @Override
    public long responseSize(ChatCompletionResponse response) {
        Usage usage = response.getUsage();
        if (usage == null || usage.getCompletionTokens() == null) {
            return response.completionText().length() / 4;
        }
        return usage.getCompletionTokens();
    }

    @Override
    public Class<ChatCompletionResponse> responseType() {
        return ChatCompletionResponse.class;
    }

    private static Pricing pricingFor(ChatCompletionRequest request) {
        return request.getModel() == null ? null : PRICING.get(request.getModel());
    }

    private static long promptChars(ChatCompletionRequest request) {
        if (request.getMessages() == null) {
            return 0;
        }
        long chars = 0;
        for (Message message : request.getMessages()) {
            if (message.getContent() != null) {
                chars += message.getContent().length();
            }
        }
        return chars;
    }

    private static long orZero(Integer value) {
        return value == null ? 0 : value;
    }

    private static final class Pricing {
        private final BigDecimal input;
        private final BigDecimal output;

        private Pricing(String input, String output) {
            this.input = new BigDecimal(input);
            this.output = new BigDecimal(output);
        }

        private BigDecimal cost(long inputTokens, long outputTokens) {
            BigDecimal in = BigDecimal.valueOf(inputTokens).multiply(input).divide(THOUSAND, MathContext.DECIMAL64);
            BigDecimal out = BigDecimal.valueOf(outputTokens).multiply(output).divide(THOUSAND, MathContext.DECIMAL64);
            return in.add(out);
        }
    }
}
