package com.demo.chathub.service.provider;

import java.util.Optional;
import java.util.Set;

public interface ModelProviderRegistry {

    /**
     * Model used when a request names none.
     */
    Optional<String> defaultModel();

    /**
     * @throws com.demo.chathub.common.ChatHubException PROVIDER_UNAVAILABLE if no provider serves the model
     */
    ChatCompletionProvider providerForModel(String model);

    Set<String> availableModels();
}
