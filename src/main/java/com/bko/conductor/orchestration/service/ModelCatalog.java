package com.bko.conductor.orchestration.service;

import com.bko.conductor.orchestration.model.ModelDescriptor;
import com.bko.conductor.orchestration.model.ModelProvider;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Canonical model table: labels, providers, cross-provider failover chains and the substitutions
 * used when a planner names a model loosely or a worker needs a stronger retry model.
 */
@Component
public class ModelCatalog {

    public static final String OPUS = "claude-opus-4-6";
    public static final String SONNET = "claude-sonnet-4-6";
    public static final String SONNET_45 = "claude-sonnet-4-5-20250929";
    public static final String HAIKU = "claude-haiku-4-5-20251001";
    public static final String GEMINI_31_PRO = "gemini-3.1-pro-preview";
    public static final String GEMINI_3_PRO = "gemini-3-pro-preview";
    public static final String GEMINI_3_FLASH = "gemini-3-flash-preview";
    public static final String GEMINI_25_PRO = "gemini-2.5-pro";
    public static final String GEMINI_25_FLASH = "gemini-2.5-flash";

    public static final String DEFAULT_WORKER_MODEL = SONNET;

    private static final List<ModelDescriptor> MODELS = List.of(
            new ModelDescriptor(SONNET, "Sonnet 4.6", ModelProvider.ANTHROPIC),
            new ModelDescriptor(OPUS, "Opus 4.6", ModelProvider.ANTHROPIC),
            new ModelDescriptor(SONNET_45, "Sonnet 4.5", ModelProvider.ANTHROPIC),
            new ModelDescriptor(HAIKU, "Haiku 4.5", ModelProvider.ANTHROPIC),
            new ModelDescriptor(GEMINI_31_PRO, "Gemini 3.1 Pro", ModelProvider.GOOGLE),
            new ModelDescriptor(GEMINI_3_PRO, "Gemini 3 Pro", ModelProvider.GOOGLE),
            new ModelDescriptor(GEMINI_3_FLASH, "Gemini 3 Flash", ModelProvider.GOOGLE),
            new ModelDescriptor(GEMINI_25_PRO, "Gemini 2.5 Pro", ModelProvider.GOOGLE),
            new ModelDescriptor(GEMINI_25_FLASH, "Gemini 2.5 Flash", ModelProvider.GOOGLE)
    );

    // Same-tier cross-provider alternatives first, then same-provider downgrades.
    private static final Map<String, List<String>> FAILOVER_CHAINS = Map.of(
            OPUS, List.of(GEMINI_31_PRO, GEMINI_3_PRO, GEMINI_25_PRO, SONNET),
            SONNET, List.of(GEMINI_3_FLASH, GEMINI_25_PRO, SONNET_45),
            SONNET_45, List.of(GEMINI_25_FLASH, GEMINI_3_FLASH),
            HAIKU, List.of(GEMINI_25_FLASH, GEMINI_3_FLASH),
            GEMINI_31_PRO, List.of(GEMINI_3_PRO, OPUS, SONNET),
            GEMINI_3_PRO, List.of(GEMINI_31_PRO, OPUS, SONNET, GEMINI_25_PRO),
            GEMINI_3_FLASH, List.of(SONNET, GEMINI_25_PRO, GEMINI_25_FLASH),
            GEMINI_25_PRO, List.of(SONNET, GEMINI_31_PRO, GEMINI_3_PRO, SONNET_45),
            GEMINI_25_FLASH, List.of(HAIKU, GEMINI_3_FLASH, SONNET_45)
    );

    // 3.1 Pro is not offered to commander workers.
    private static final List<String> COMMANDER_WORKER_MODELS = List.of(
            OPUS, SONNET, HAIKU, GEMINI_3_PRO, GEMINI_3_FLASH, GEMINI_25_PRO, GEMINI_25_FLASH);

    private static final List<String> RESEARCH_WORKER_MODELS = List.of(
            SONNET, SONNET_45, HAIKU, GEMINI_31_PRO, GEMINI_3_PRO, GEMINI_3_FLASH, GEMINI_25_PRO, GEMINI_25_FLASH);

    private static final Map<String, String> RETRY_UPGRADES = Map.of(
            GEMINI_25_FLASH, GEMINI_25_PRO,
            GEMINI_3_FLASH, GEMINI_3_PRO,
            GEMINI_3_PRO, GEMINI_31_PRO,
            HAIKU, SONNET,
            SONNET_45, SONNET
    );

    private static final Map<String, String> CROSS_PROVIDER_FALLBACK = Map.of(
            OPUS, GEMINI_31_PRO,
            SONNET, GEMINI_25_PRO,
            GEMINI_31_PRO, SONNET,
            GEMINI_3_PRO, SONNET,
            GEMINI_25_PRO, SONNET
    );

    public List<ModelDescriptor> models() {
        return MODELS;
    }

    public Optional<ModelDescriptor> find(@Nullable String model) {
        return MODELS.stream().filter(descriptor -> descriptor.id().equals(model)).findFirst();
    }

    public ModelProvider providerOf(String model) {
        return model != null && model.startsWith("gemini-") ? ModelProvider.GOOGLE : ModelProvider.ANTHROPIC;
    }

    public List<String> failoverChain(String model) {
        return FAILOVER_CHAINS.getOrDefault(model, List.of());
    }

    public boolean isResearchWorkerModel(@Nullable String model) {
        return model != null && RESEARCH_WORKER_MODELS.contains(model);
    }

    /**
     * Maps a planner-supplied model name onto a commander worker model. Exact names pass through;
     * legacy and loosely written names are matched by substring. Returns {@code null} when nothing matches.
     */
    @Nullable
    public String correctWorkerModel(@Nullable String model) {
        if (!StringUtils.hasText(model)) {
            return null;
        }
        if (COMMANDER_WORKER_MODELS.contains(model)) {
            return model;
        }
        String normalized = model.toLowerCase(Locale.ROOT).trim();
        if (normalized.contains("sonnet")) {
            return SONNET;
        }
        if (normalized.contains("opus")) {
            return OPUS;
        }
        if (normalized.contains("haiku")) {
            return HAIKU;
        }
        if (normalized.contains("gemini-3.1")) {
            return GEMINI_3_PRO;
        }
        if (normalized.contains("gemini-3-pro") || normalized.contains("gemini-3.0-pro")) {
            return GEMINI_3_PRO;
        }
        if (normalized.contains("gemini-3-flash") || normalized.contains("gemini-3.0-flash")) {
            return GEMINI_3_FLASH;
        }
        if (normalized.contains("gemini-2.5-pro")) {
            return GEMINI_25_PRO;
        }
        if (normalized.contains("gemini-2.5")) {
            return GEMINI_25_FLASH;
        }
        return null;
    }

    /** Flash to pro, haiku to sonnet; models without an upgrade are returned unchanged. */
    public String upgrade(String model) {
        return RETRY_UPGRADES.getOrDefault(model, model);
    }

    @Nullable
    public String crossProviderFallback(String model) {
        return CROSS_PROVIDER_FALLBACK.get(model);
    }
}
