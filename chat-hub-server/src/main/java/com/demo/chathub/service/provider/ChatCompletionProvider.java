package com.demo.chathub.service.provider;

import java.util.Set;

/**
 * A language-model backend. Register an implementation as a Spring bean and every model
 * it lists becomes addressable by name in {@code send_message}.
 */
public interface ChatCompletionProvider {

    /**
     * Model names this provider serves.
     */
    Set<String> models();

    /**
     * Run one completion and block until it finishes.
     *
     * @throws Exception any provider failure; reported to the sender, never persisted
     */
    Completion complete(CompletionRequest request) throws Exception;
}
