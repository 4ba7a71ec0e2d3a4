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
public class MessageEditView {

    private long id;

    @JsonProperty("message_id")
    private String messageId;

    @JsonProperty("edited_by_user_id")
    private long editedByUserId;

    @JsonProperty("old_content")
    private String oldContent;

    @JsonProperty("new_content")
    private String newContent;

    @JsonProperty("edited_at")
    private Instant editedAt;
}
