package com.bko.conductor.orchestration.service;

import com.bko.conductor.orchestration.model.CooldownInfo;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Process-wide view of rate-limited models. Cooldowns escalate per consecutive failure on the same
 * model and are cleared by the next success or when they elapse. State is in memory only.
 */
@Service
@Slf4j
public class FailoverRegistry {

    static final List<Duration> BACKOFF = List.of(
            Duration.ofMinutes(1),
            Duration.ofMinutes(5),
            Duration.ofMinutes(25),
            Duration.ofMinutes(60));

    private static final List<Pattern> RATE_LIMIT_PATTERNS = List.of(
            Pattern.compile("rate.?limit", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\b429\\b"),
            Pattern.compile("overloaded", Pattern.CASE_INSENSITIVE),
            Pattern.compile("too many requests", Pattern.CASE_INSENSITIVE),
            Pattern.compile("quota.?exceeded", Pattern.CASE_INSENSITIVE),
            Pattern.compile("RESOURCE_EXHAUSTED", Pattern.CASE_INSENSITIVE),
            Pattern.compile("capacity", Pattern.CASE_INSENSITIVE),
            Pattern.compile("exceeded.*limit", Pattern.CASE_INSENSITIVE),
            Pattern.compile("retry.?after", Pattern.CASE_INSENSITIVE));

    private final ModelCatalog modelCatalog;
    private final Clock clock;
    private final Map<String, Cooldown> cooldowns = new ConcurrentHashMap<>();

    public FailoverRegistry(ModelCatalog modelCatalog, Clock clock) {
        this.modelCatalog = modelCatalog;
        this.clock = clock;
    }

    public boolean isRateLimitError(@Nullable String errorText) {
        if (!StringUtils.hasText(errorText)) {
            return false;
        }
        return RATE_LIMIT_PATTERNS.stream().anyMatch(pattern -> pattern.matcher(errorText).find());
    }

    public void reportFailure(String model, @Nullable String reason) {
        Cooldown updated = cooldowns.compute(model, (key, existing) -> {
            int failures = existing == null ? 1 : existing.failures() + 1;
            Duration backoff = BACKOFF.get(Math.min(failures, BACKOFF.size()) - 1);
            return new Cooldown(clock.instant().plus(backoff), failures,
                    StringUtils.hasText(reason) ? reason : "rate limit");
        });
        long minutes = Duration.between(clock.instant(), updated.until()).toMinutes();
        log.warn("{} rate-limited (attempt #{}). Cooldown: {}m", model, updated.failures(), minutes);
    }

    public void reportSuccess(String model) {
        if (cooldowns.remove(model) != null) {
            log.info("{} recovered, cooldown cleared", model);
        }
    }

    public boolean isAvailable(String model) {
        return remaining(model).isZero();
    }

    /**
     * Returns the preferred model when available, otherwise the first available member of its failover
     * chain. When every candidate is cooling down, the one with the least remaining cooldown wins.
     */
    public String resolve(String preferred) {
        if (isAvailable(preferred)) {
            return preferred;
        }
        List<String> chain = modelCatalog.failoverChain(preferred);
        for (String alternative : chain) {
            if (isAvailable(alternative)) {
                return alternative;
            }
        }
        String best = preferred;
        Duration bestRemaining = remaining(preferred);
        for (String candidate : chain) {
            Duration candidateRemaining = remaining(candidate);
            if (candidateRemaining.compareTo(bestRemaining) < 0) {
                best = candidate;
                bestRemaining = candidateRemaining;
            }
        }
        return best;
    }

    public Duration remaining(String model) {
        Cooldown state = cooldowns.get(model);
        if (state == null) {
            return Duration.ZERO;
        }
        Duration remaining = Duration.between(clock.instant(), state.until());
        if (remaining.isNegative() || remaining.isZero()) {
            cooldowns.remove(model, state);
            return Duration.ZERO;
        }
        return remaining;
    }

    @Nullable
    public CooldownInfo cooldownInfo(String model) {
        Cooldown state = cooldowns.get(model);
        Duration remaining = remaining(model);
        if (state == null || remaining.isZero()) {
            return null;
        }
        String failoverModel = modelCatalog.failoverChain(model).stream()
                .filter(this::isAvailable)
                .findFirst()
                .orElse(null);
        return new CooldownInfo(model, remaining.toMillis(), state.failures(), state.reason(), failoverModel);
    }

    public List<CooldownInfo> activeCooldowns() {
        List<CooldownInfo> active = new ArrayList<>();
        for (String model : List.copyOf(cooldowns.keySet())) {
            CooldownInfo info = cooldownInfo(model);
            if (info != null) {
                active.add(info);
            }
        }
        return active;
    }

    public void clearAll() {
        cooldowns.clear();
    }

    private record Cooldown(Instant until, int failures, String reason) {
    }
}
