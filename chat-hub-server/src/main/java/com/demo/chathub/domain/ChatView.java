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
public class ChatView {

    private String id;

    private String title;

    @JsonProperty("chat_type")
    private String chatType;

    @JsonProperty("created_by")
    private Long createdBy;

    @JsonProperty("created_at")
    private Instant createdAt;
}
