package com.demo.chathub.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Input to the message pipeline's create operation.
 * Thread and reply-to references are public message ids inside the same chat.
 */
@Value
@Builder
public class NewMessage {
    String chatId;
    long authorId;
    String content;
    MessageRole role;
    String model;
    String messageType;
    String threadId;
    String replyToId;
}
