package com.bko.conductor.orchestration.service;

import com.bko.conductor.orchestration.api.ModelInvocationService;
import com.bko.conductor.orchestration.model.InvocationRequest;
import com.bko.conductor.orchestration.model.InvocationResult;
import com.bko.conductor.orchestration.model.ModelProvider;
import com.bko.conductor.orchestration.model.TokenUsage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.metadata.Usage;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.google.genai.GoogleGenAiChatOptions;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.ToolCallbackProvider;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import reactor.core.Disposable;

import java.time.Clock;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Streams a model response through Spring AI. Claude-family models go through the OpenAI-compatible
 * client, Gemini-family models through the Google GenAI client. Expected failures become
 * {@code ERROR}/{@code PARTIAL} results; nothing here completes exceptionally.
 */
@Service
@Slf4j
public class ChatClientInvocationService implements ModelInvocationService {

    private final ChatClient chatClient;
    private final ChatClient openAiChatClient;
    private final ObjectProvider<ToolCallbackProvider> toolCallbackProviders;
    private final ModelCatalog modelCatalog;
    private final FailoverRegistry failoverRegistry;
    private final OrchestrationMetricsService metricsService;
    private final ScheduledExecutorService invocationTimer;
    private final Clock clock;
    private final Map<String, InFlight> inFlight = new ConcurrentHashMap<>();

    public ChatClientInvocationService(ChatClient chatClient,
                                       @Qualifier("openAiChatClient") ObjectProvider<ChatClient> openAiChatClientProvider,
                                       ObjectProvider<ToolCallbackProvider> toolCallbackProviders,
                                       ModelCatalog modelCatalog,
                                       FailoverRegistry failoverRegistry,
                                       OrchestrationMetricsService metricsService,
                                       ScheduledExecutorService invocationTimer,
                                       Clock clock) {
        this.chatClient = chatClient;
        this.openAiChatClient = openAiChatClientProvider.getIfAvailable();
        this.toolCallbackProviders = toolCallbackProviders;
        this.modelCatalog = modelCatalog;
        this.failoverRegistry = failoverRegistry;
        this.metricsService = metricsService;
        this.invocationTimer = invocationTimer;
        this.clock = clock;
    }

    @Override
    public CompletableFuture<InvocationResult> invoke(InvocationRequest request, CancellationSignal signal) {
        if (signal.isAborted()) {
            return CompletableFuture.completedFuture(null);
        }
        String invocationId = UUID.randomUUID().toString();
        InFlight call = new InFlight(invocationId, request, clock.millis());
        inFlight.put(invocationId, call);
        signal.track(invocationId);
        Runnable deregister = signal.onAbort(call::abort);
        call.future.whenComplete((result, error) -> {
            deregister.run();
            signal.untrack(invocationId);
            inFlight.remove(invocationId);
            if (result != null) {
                reportToRegistry(request, result);
            }
        });
        if (call.future.isDone()) {
            return call.future;
        }

        metricsService.recordLlmRequest(request.purpose(), request.model());
        try {
            ChatClient.ChatClientRequestSpec spec = applyTools(getChatRequestSpec(request.model()), request);
            if (StringUtils.hasText(request.systemPrompt())) {
                spec = spec.system(request.systemPrompt());
            }
            call.timeout = invocationTimer.schedule(call::timeOut, request.timeout().toMillis(), TimeUnit.MILLISECONDS);
            call.subscription = spec.user(request.prompt())
                    .stream()
                    .chatResponse()
                    .subscribe(call::onChunk, call::onError, call::onComplete);
            if (call.future.isDone()) {
                call.subscription.dispose();
            }
        } catch (RuntimeException ex) {
            log.warn("Invocation {} ({}) failed to start: {}", request.purpose(), request.model(), ex.getMessage());
            call.settle(InvocationResult.error("Invocation failed to start: " + ex.getMessage()));
        }
        return call.future;
    }

    @Override
    public boolean terminate(String invocationId) {
        InFlight call = inFlight.get(invocationId);
        if (call == null) {
            return false;
        }
        log.info("Terminating invocation {} ({}, {})", invocationId, call.request.purpose(), call.request.model());
        return call.abort();
    }

    private void reportToRegistry(InvocationRequest request, InvocationResult result) {
        metricsService.recordLlmOutcome(request.purpose(), request.model(), result.outcome(),
                result.durationMs() == null ? 0 : result.durationMs());
        if (failoverRegistry.isRateLimitError(result.stderr())) {
            failoverRegistry.reportFailure(request.model(), result.firstStderrLine());
        } else if (StringUtils.hasText(result.content())) {
            failoverRegistry.reportSuccess(request.model());
        }
    }

    private ChatClient.ChatClientRequestSpec getChatRequestSpec(String model) {
        if (modelCatalog.providerOf(model) == ModelProvider.GOOGLE) {
            return chatClient.prompt().options(GoogleGenAiChatOptions.builder().model(model).build());
        }
        if (openAiChatClient == null) {
            throw new IllegalStateException("OpenAI-compatible provider is not configured for " + model + ". "
                    + "Check that you have a valid API key or a custom Base URL in your configuration.");
        }
        return openAiChatClient.prompt().options(OpenAiChatOptions.builder().model(model).build());
    }

    private ChatClient.ChatClientRequestSpec applyTools(ChatClient.ChatClientRequestSpec prompt, InvocationRequest request) {
        if (!request.toolsEnabled() || request.singleTurn()) {
            return prompt;
        }
        ToolCallbackProvider provider = toolCallbackProviders.getIfAvailable();
        if (provider == null) {
            log.debug("Tool callbacks are not configured. purpose={}", request.purpose());
            return prompt;
        }
        ToolCallback[] callbacks = provider.getToolCallbacks();
        if (callbacks == null || callbacks.length == 0) {
            log.debug("No tool callbacks registered from provider. purpose={}", request.purpose());
            return prompt;
        }
        return prompt.toolCallbacks(provider);
    }

    @Nullable
    private static TokenUsage toTokenUsage(@Nullable Usage usage) {
        if (usage == null) {
            return null;
        }
        long input = usage.getPromptTokens() == null ? 0 : usage.getPromptTokens();
        long output = usage.getCompletionTokens() == null ? 0 : usage.getCompletionTokens();
        long total = usage.getTotalTokens() == null ? input + output : usage.getTotalTokens();
        if (input == 0 && output == 0 && total == 0) {
            return null;
        }
        return new TokenUsage(input, output, total);
    }

    private final class InFlight {

        private final String id;
        private final InvocationRequest request;
        private final long startedAt;
        private final StringBuilder text = new StringBuilder();
        private final AtomicBoolean settled = new AtomicBoolean();
        private final CompletableFuture<InvocationResult> future = new CompletableFuture<>();
        private volatile TokenUsage tokens;
        private volatile Disposable subscription;
        private volatile ScheduledFuture<?> timeout;

        private InFlight(String id, InvocationRequest request, long startedAt) {
            this.id = id;
            this.request = request;
            this.startedAt = startedAt;
        }

        private void onChunk(ChatResponse response) {
            if (settled.get() || response == null) {
                return;
            }
            if (response.getMetadata() != null) {
                TokenUsage usage = toTokenUsage(response.getMetadata().getUsage());
                if (usage != null) {
                    tokens = usage;
                }
            }
            if (response.getResult() == null || response.getResult().getOutput() == null) {
                return;
            }
            String chunk = response.getResult().getOutput().getText();
            if (!StringUtils.hasLength(chunk)) {
                return;
            }
            String soFar;
            synchronized (text) {
                text.append(chunk);
                soFar = text.toString();
            }
            request.onStreamingText().accept(soFar);
        }

        private void onError(Throwable error) {
            String content = currentText();
            String detail = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
            if (StringUtils.hasText(content)) {
                log.warn("Invocation {} ({}) failed after streaming {} chars: {}", request.purpose(), request.model(),
                        content.length(), detail);
                settle(InvocationResult.partial(content, tokens, elapsed(), detail));
            } else {
                settle(InvocationResult.error(detail));
            }
        }

        private void onComplete() {
            String content = currentText();
            if (StringUtils.hasText(content)) {
                settle(InvocationResult.success(content, null, tokens, elapsed()));
            } else {
                settle(InvocationResult.error("Model produced no output"));
            }
        }

        private void timeOut() {
            String content = currentText();
            long timeoutMs = request.timeout().toMillis();
            if (StringUtils.hasText(content)) {
                log.warn("Invocation {} ({}) timed out after {}ms with {} chars preserved", request.purpose(),
                        request.model(), timeoutMs, content.length());
                settle(InvocationResult.partial(content, tokens, elapsed(), "Timeout after " + timeoutMs + "ms"));
            } else {
                settle(InvocationResult.error("Timeout after " + timeoutMs + "ms with no output"));
            }
        }

        private boolean abort() {
            if (!settled.compareAndSet(false, true)) {
                return false;
            }
            stop();
            future.complete(null);
            return true;
        }

        private void settle(InvocationResult result) {
            if (!settled.compareAndSet(false, true)) {
                return;
            }
            stop();
            future.complete(result);
        }

        private void stop() {
            ScheduledFuture<?> pendingTimeout = timeout;
            if (pendingTimeout != null) {
                pendingTimeout.cancel(false);
            }
            Disposable active = subscription;
            if (active != null && !active.isDisposed()) {
                active.dispose();
            }
        }

        private String currentText() {
            synchronized (text) {
                return text.toString();
            }
        }

        private long elapsed() {
            return clock.millis() - startedAt;
        }

        @Override
        public String toString() {
            return "InFlight[" + id + "]";
        }
    }
}
