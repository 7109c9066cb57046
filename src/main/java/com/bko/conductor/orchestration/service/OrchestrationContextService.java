package com.bko.conductor.orchestration.service;

import com.bko.conductor.orchestration.model.ConversationMessage;
import com.bko.conductor.orchestration.model.WorkerResult;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static com.bko.conductor.orchestration.OrchestrationConstants.MAX_CONTEXT_MESSAGE_CHARS;
import static com.bko.conductor.orchestration.OrchestrationConstants.RESULT_DIVIDER;
import static com.bko.conductor.orchestration.OrchestrationConstants.TRUNCATED_SUFFIX;

@Service
@RequiredArgsConstructor
public class OrchestrationContextService {

    private final SourceExtractionService sourceExtractionService;

    /**
     * Renders the most recent user and assistant messages as {@code User: ...} / {@code Assistant: ...}
     * lines, clipping each message.
     */
    public String conversationContext(List<ConversationMessage> history, int maxMessages) {
        if (history == null || history.isEmpty()) {
            return "";
        }
        List<ConversationMessage> relevant = history.stream()
                .filter(message -> message.isUser() || message.isAssistant())
                .toList();
        return relevant.subList(Math.max(0, relevant.size() - maxMessages), relevant.size()).stream()
                .map(message -> (message.isUser() ? "User: " : "Assistant: ") + clip(message.content()))
                .collect(Collectors.joining("\n"));
    }

    /**
     * Concatenation of usable worker output, returned when synthesis produced nothing.
     */
    public String fallbackContent(Collection<WorkerResult> results, boolean cleanCitations) {
        return results.stream()
                .filter(WorkerResult::hasUsableContent)
                .map(result -> cleanCitations
                        ? sourceExtractionService.cleanWorkerContent(result.content())
                        : result.content())
                .collect(Collectors.joining(RESULT_DIVIDER));
    }

    public void collectUsableOutputs(Collection<WorkerResult> results, Map<String, String> outputs) {
        for (WorkerResult result : results) {
            if (result.hasUsableContent()) {
                outputs.put(result.taskId(), result.content());
            }
        }
    }

    private static String clip(String content) {
        if (!StringUtils.hasLength(content)) {
            return "";
        }
        return content.length() > MAX_CONTEXT_MESSAGE_CHARS
                ? content.substring(0, MAX_CONTEXT_MESSAGE_CHARS) + TRUNCATED_SUFFIX
                : content;
    }
}
