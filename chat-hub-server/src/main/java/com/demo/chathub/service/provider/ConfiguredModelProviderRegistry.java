package com.demo.chathub.service.provider;

import com.demo.chathub.common.ChatHubException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Indexes every {@link ChatCompletionProvider} bean by the model names it serves.
 * When two providers claim the same model the first registered wins.
 */
@Component
@Slf4j
public class ConfiguredModelProviderRegistry implements ModelProviderRegistry {

    private final Map<String, ChatCompletionProvider> providersByModel;
    private final String defaultModel;

    @Autowired
    public ConfiguredModelProviderRegistry(ObjectProvider<ChatCompletionProvider> providers,
                                           @Value("${chat.models.default:}") String defaultModel) {
        this(providers.orderedStream().collect(Collectors.toList()), defaultModel);
    }

    public ConfiguredModelProviderRegistry(List<ChatCompletionProvider> providers, String defaultModel) {
        Map<String, ChatCompletionProvider> index = new TreeMap<>();
        for (ChatCompletionProvider provider : providers) {
            for (String model : provider.models()) {
                ChatCompletionProvider existing = index.putIfAbsent(model, provider);
                if (existing != null) {
                    log.warn("Model served by more than one provider, keeping first: model={}, kept={}, ignored={}",
                            model, existing.getClass().getSimpleName(), provider.getClass().getSimpleName());
                }
            }
        }
        this.providersByModel = Collections.unmodifiableMap(index);
        this.defaultModel = defaultModel == null || defaultModel.isBlank() ? null : defaultModel.trim();

        log.info("Model providers registered: models={}, default={}", providersByModel.keySet(), this.defaultModel);
    }

    @Override
    public Optional<String> defaultModel() {
        return Optional.ofNullable(defaultModel);
    }

    @Override
    public ChatCompletionProvider providerForModel(String model) {
        ChatCompletionProvider provider = providersByModel.get(model);
        if (provider == null) {
            throw ChatHubException.providerUnavailable("No provider registered for model " + model);
        }
        return provider;
    }

    @Override
    public Set<String> availableModels() {
        return providersByModel.keySet();
    }
}
