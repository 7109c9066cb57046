package com.bko.conductor.orchestration.service;

import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Citation handling for research output.
 */
@Service
public class SourceExtractionService {

    private static final List<String> FILTERED_SOURCE_DOMAINS = List.of(
            "vertexaisearch.cloud.google.com",
            "googleusercontent.com/grounding"
    );

    private static final Pattern REDIRECT_URL =
            Pattern.compile("https?://vertexaisearch\\.cloud\\.google\\.com/grounding-api-redirect/[^\\s\\])\"',]+");
    private static final Pattern REDIRECT_ONLY_CITATION =
            Pattern.compile("\\[Source:\\s*(?:\\[internal-redirect\\](?:,\\s*)?)+\\]", Pattern.CASE_INSENSITIVE);
    private static final Pattern URL = Pattern.compile("https?://[^\\s\\])\"'<>,]+");
    private static final Pattern DOMAIN_CITATION = Pattern.compile("\\[Source:\\s*([^\\]]+)\\]", Pattern.CASE_INSENSITIVE);
    private static final String PLACEHOLDER = "[internal-redirect]";

    /**
     * Strips grounding redirect URLs, and citations left empty by that, from worker output.
     */
    public String cleanWorkerContent(@Nullable String content) {
        if (!StringUtils.hasText(content)) {
            return "";
        }
        String cleaned = REDIRECT_URL.matcher(content).replaceAll(Matcher.quoteReplacement(PLACEHOLDER));
        cleaned = REDIRECT_ONLY_CITATION.matcher(cleaned).replaceAll("");
        cleaned = cleaned.replace(PLACEHOLDER, "");
        cleaned = cleaned.replaceAll("\\(\\s*\\)", "");
        cleaned = cleaned.replaceAll("\\n{3,}", "\n\n");
        return cleaned.trim();
    }

    /**
     * Collects unique source URLs in order of first appearance. Bare-domain citations such as
     * {@code [Source: example.com]} become {@code https://example.com}.
     */
    public List<String> extractSources(@Nullable String content) {
        if (!StringUtils.hasText(content)) {
            return List.of();
        }
        Set<String> urls = new LinkedHashSet<>();
        Matcher urlMatcher = URL.matcher(content);
        while (urlMatcher.find()) {
            String url = urlMatcher.group().replaceAll("[.),:;]+$", "");
            if (url.length() > 10 && FILTERED_SOURCE_DOMAINS.stream().noneMatch(url::contains)) {
                urls.add(url);
            }
        }
        Matcher citationMatcher = DOMAIN_CITATION.matcher(content);
        while (citationMatcher.find()) {
            for (String domain : citationMatcher.group(1).split(",")) {
                String trimmed = domain.trim();
                if (!trimmed.isEmpty() && !trimmed.startsWith("http") && trimmed.contains(".")) {
                    urls.add("https://" + trimmed);
                }
            }
        }
        return new ArrayList<>(urls);
    }

    public List<String> extractSources(Collection<String> contents) {
        Set<String> merged = new LinkedHashSet<>();
        for (String content : contents) {
            merged.addAll(extractSources(content));
        }
        return new ArrayList<>(merged);
    }
}
