package com.demo.chathub.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MemberView {

    @JsonProperty("chat_id")
    private String chatId;

    @JsonProperty("user_id")
    private long userId;

    private MemberRole role;

    @JsonProperty("joined_at")
    private Instant joinedAt;
}
