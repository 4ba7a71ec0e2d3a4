package com.demo.chathub.service.provider;

import com.demo.chathub.domain.MessageRole;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class CompletionRequest {

    String model;

    @Singular
    List<Turn> turns;

    public static CompletionRequest singleTurn(String model, String userContent) {
        return CompletionRequest.builder()
                .model(model)
                .turn(new Turn(MessageRole.USER, userContent))
                .build();
    }

    @Value
    public static class Turn {
        MessageRole role;
        String content;
    }
}
