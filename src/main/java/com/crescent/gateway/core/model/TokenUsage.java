package com.crescent.gateway.core.model;

import lombok.Value;

@Value(staticConstructor = "of")
public class TokenUsage {
    int promptTokens;
    int completionTokens;
    int totalTokens;

    public TokenUsage plus(TokenUsage other) {
        if (other == null) {
            return this;
        }
        return TokenUsage.of(promptTokens + other.promptTokens,
                completionTokens + other.completionTokens,
                totalTokens + other.totalTokens);
    }
}
