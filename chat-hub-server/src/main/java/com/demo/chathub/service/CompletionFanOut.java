package com.demo.chathub.service;

import com.demo.chathub.common.ChatHubException;
import com.demo.chathub.domain.MessageRole;
import com.demo.chathub.domain.MessageView;
import com.demo.chathub.domain.NewMessage;
import com.demo.chathub.domain.ServerEvent;
import com.demo.chathub.infrastructure.EventSink;
import com.demo.chathub.service.provider.ChatCompletionProvider;
import com.demo.chathub.service.provider.Completion;
import com.demo.chathub.service.provider.CompletionRequest;
import com.demo.chathub.service.provider.ModelProviderRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Sends one user message to several models at once.
 *
 * Each model gets its own task. A task either stores the assistant reply (which the
 * message pipeline broadcasts) or reports an error to the sender, never both. Tasks do
 * not know about each other and keep running if the sender disconnects. A model the
 * executor refuses is reported straight away.
 *
 * Sender errors go through {@link EventSink#deliver}, which never waits on the
 * connection, so a client that stops reading cannot hold a completion thread.
 */
@Service
@Slf4j
public class CompletionFanOut {

    static final String NO_MODEL_CONFIGURED = "No model configured";
    static final String REJECTED_PREFIX = "LLM completion failed: too many pending completions for ";

    private final ModelProviderRegistry providerRegistry;
    private final MessageService messageService;
    private final Executor completionExecutor;
    private final MetricsService metricsService;

    public CompletionFanOut(ModelProviderRegistry providerRegistry,
                            MessageService messageService,
                            @Qualifier("completionExecutor") Executor completionExecutor,
                            MetricsService metricsService) {
        this.providerRegistry = providerRegistry;
        this.messageService = messageService;
        this.completionExecutor = completionExecutor;
        this.metricsService = metricsService;
    }

    /**
     * Start one task per resolved model for {@code trigger}.
     *
     * @return one future per started task; empty if no model could be resolved, in
     *         which case the sender has already been sent an error
     */
    public List<CompletableFuture<Void>> dispatch(MessageView trigger, Collection<String> requestedModels, EventSink sender) {
        List<String> models = resolveModels(requestedModels);
        if (models.isEmpty()) {
            log.info("Completion skipped, no model configured: chatId={}, messageId={}",
                    trigger.getChatId(), trigger.getId());
            sender.deliver(ServerEvent.error(NO_MODEL_CONFIGURED));
            return List.of();
        }

        log.info("Completion fan-out: chatId={}, messageId={}, models={}",
                trigger.getChatId(), trigger.getId(), models);

        List<CompletableFuture<Void>> tasks = new ArrayList<>(models.size());
        for (String model : models) {
            try {
                tasks.add(CompletableFuture.runAsync(() -> runCompletion(trigger, model, sender), completionExecutor));
            } catch (RejectedExecutionException e) {
                log.warn("Completion rejected, executor saturated: chatId={}, messageId={}, model={}",
                        trigger.getChatId(), trigger.getId(), model);
                metricsService.recordCompletion(model, false, Duration.ZERO);
                sender.deliver(ServerEvent.error(REJECTED_PREFIX + model));
            }
        }
        return tasks;
    }

    /**
     * Trimmed, non-empty, first occurrence wins. Falls back to the default model.
     */
    List<String> resolveModels(Collection<String> requestedModels) {
        Set<String> models = new LinkedHashSet<>();
        if (requestedModels != null) {
            for (String model : requestedModels) {
                if (model == null) {
                    continue;
                }
                String trimmed = model.trim();
                if (!trimmed.isEmpty()) {
                    models.add(trimmed);
                }
            }
        }
        if (models.isEmpty()) {
            Optional<String> fallback = providerRegistry.defaultModel();
            fallback.ifPresent(models::add);
        }
        return new ArrayList<>(models);
    }

    private void runCompletion(MessageView trigger, String model, EventSink sender) {
        MetricsService.TimerSample timer = metricsService.startTimer();
        try {
            Completion completion = complete(trigger, model);
            storeReply(trigger, model, completion);
            metricsService.recordCompletion(model, true, timer.stop());
        } catch (ChatHubException e) {
            metricsService.recordCompletion(model, false, timer.stop());
            sender.deliver(ServerEvent.error(e.getMessage()));
        }
    }

    private Completion complete(MessageView trigger, String model) {
        ChatCompletionProvider provider;
        try {
            provider = providerRegistry.providerForModel(model);
        } catch (ChatHubException e) {
            log.warn("Provider unavailable: chatId={}, model={}, error={}", trigger.getChatId(), model, e.getMessage());
            throw ChatHubException.providerUnavailable("LLM provider not available for " + model + ": " + e.getMessage());
        }

        try {
            Completion completion = provider.complete(CompletionRequest.singleTurn(model, trigger.getContent()));
            if (completion == null || completion.getContent() == null) {
                throw new IllegalStateException("empty completion");
            }
            return completion;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw ChatHubException.providerFailed("LLM completion failed: interrupted", e);
        } catch (Exception e) {
            log.warn("Completion failed: chatId={}, model={}, error={}", trigger.getChatId(), model, e.getMessage());
            throw ChatHubException.providerFailed("LLM completion failed: " + e.getMessage(), e);
        }
    }

    private void storeReply(MessageView trigger, String model, Completion completion) {
        try {
            messageService.create(NewMessage.builder()
                    .chatId(trigger.getChatId())
                    .authorId(trigger.getUserId())
                    .content(completion.getContent())
                    .role(MessageRole.ASSISTANT)
                    .model(model)
                    .build());
        } catch (ChatHubException e) {
            log.warn("Assistant reply rejected: chatId={}, model={}, error={}", trigger.getChatId(), model, e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            log.error("Failed to store assistant reply: chatId={}, model={}", trigger.getChatId(), model, e);
            throw ChatHubException.internal("Failed to save LLM response", e);
        }
    }
}
