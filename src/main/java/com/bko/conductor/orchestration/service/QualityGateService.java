package com.bko.conductor.orchestration.service;

import com.bko.conductor.config.ConductorProperties;
import com.bko.conductor.orchestration.api.ModelInvocationService;
import com.bko.conductor.orchestration.model.InvocationRequest;
import com.bko.conductor.orchestration.model.InvocationResult;
import com.bko.conductor.orchestration.model.QualityCheckResult;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import static com.bko.conductor.orchestration.OrchestrationConstants.PURPOSE_QUALITY_CHECK;
import static com.bko.conductor.orchestration.OrchestrationConstants.QUALITY_CHECK_PROMPT;

/**
 * Scores a synthesized answer with a fast model before it is returned.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class QualityGateService {

    private final ModelInvocationService invocationService;
    private final JsonProcessingService jsonProcessingService;
    private final OrchestrationPromptService promptService;
    private final ConductorProperties properties;

    /**
     * Runs the quality check. Short answers are not checked.
     *
     * @return the verdict, or {@code null} when the check was skipped or produced nothing usable
     *         (timeout, cancellation, unparseable or out-of-range score)
     */
    @Nullable
    public QualityCheckResult checkQuality(String userQuery, String synthesis, CancellationSignal signal) {
        ConductorProperties.QualityConfig config = properties.getQuality();
        if (synthesis == null || synthesis.length() < config.getMinLength() || signal.isAborted()) {
            return null;
        }
        InvocationRequest request = InvocationRequest.reasoning(PURPOSE_QUALITY_CHECK, config.getModel(),
                QUALITY_CHECK_PROMPT, promptService.qualityCheckMessage(userQuery, synthesis),
                properties.getTimeouts().getQualityCheck());
        InvocationResult result = invocationService.invoke(request, signal).join();
        if (result == null || !StringUtils.hasText(result.content())) {
            return null;
        }
        return parseVerdict(result.content(), config.getPassScore());
    }

    @Nullable
    QualityCheckResult parseVerdict(String raw, int passScore) {
        JsonNode root = jsonProcessingService.extractJson(raw, null);
        if (root == null || !root.path("score").isNumber()) {
            log.debug("Quality check returned no usable score.");
            return null;
        }
        double score = root.get("score").asDouble();
        if (score < 1 || score > 10) {
            return null;
        }
        JsonNode issues = root.get("issues");
        String issueText = issues != null && issues.isTextual() ? issues.asText() : null;
        return new QualityCheckResult((int) Math.round(score), score >= passScore, issueText);
    }

    /** Feedback passed to the revision pass; a missing issue description falls back to the score. */
    public String revisionFeedback(QualityCheckResult verdict) {
        if (StringUtils.hasText(verdict.issues())) {
            return verdict.issues();
        }
        return "Quality score " + verdict.score() + "/10 below threshold.";
    }
}
