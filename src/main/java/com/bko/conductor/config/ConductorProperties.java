package com.bko.conductor.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "conductor")
public class ConductorProperties {

    private int maxTasks = 7;
    private int workerConcurrency = 4;
    private int researchConcurrency = 3;
    private Duration stagger = Duration.ofMillis(800);
    private Duration streamThrottle = Duration.ofMillis(80);
    private boolean strictCriticalAccounting;
    private ResearchConfig research = new ResearchConfig();
    private QualityConfig quality = new QualityConfig();
    private ModelsConfig models = new ModelsConfig();
    private TimeoutsConfig timeouts = new TimeoutsConfig();

    public static class ResearchConfig {
        private int quickMaxQuestions = 4;
        private int deepMaxQuestions = 15;
        private int maxFollowUps = 3;

        public int getQuickMaxQuestions() { return quickMaxQuestions; }
        public void setQuickMaxQuestions(int quickMaxQuestions) { this.quickMaxQuestions = quickMaxQuestions; }
        public int getDeepMaxQuestions() { return deepMaxQuestions; }
        public void setDeepMaxQuestions(int deepMaxQuestions) { this.deepMaxQuestions = deepMaxQuestions; }
        public int getMaxFollowUps() { return maxFollowUps; }
        public void setMaxFollowUps(int maxFollowUps) { this.maxFollowUps = maxFollowUps; }
    }

    public static class QualityConfig {
        private int minLength = 200;
        private int passScore = 7;
        private String model = "claude-haiku-4-5-20251001";

        public int getMinLength() { return minLength; }
        public void setMinLength(int minLength) { this.minLength = minLength; }
        public int getPassScore() { return passScore; }
        public void setPassScore(int passScore) { this.passScore = passScore; }
        public String getModel() { return model; }
        public void setModel(String model) { this.model = model; }
    }

    public static class ModelsConfig {
        private String planning = "claude-opus-4-6";
        private String synthesis = "claude-opus-4-6";
        private String researchSynthesis = "claude-sonnet-4-6";
        private String defaultWorker = "claude-sonnet-4-6";
        private String followUpFallback = "gemini-2.5-flash";

        public String getPlanning() { return planning; }
        public void setPlanning(String planning) { this.planning = planning; }
        public String getSynthesis() { return synthesis; }
        public void setSynthesis(String synthesis) { this.synthesis = synthesis; }
        public String getResearchSynthesis() { return researchSynthesis; }
        public void setResearchSynthesis(String researchSynthesis) { this.researchSynthesis = researchSynthesis; }
        public String getDefaultWorker() { return defaultWorker; }
        public void setDefaultWorker(String defaultWorker) { this.defaultWorker = defaultWorker; }
        public String getFollowUpFallback() { return followUpFallback; }
        public void setFollowUpFallback(String followUpFallback) { this.followUpFallback = followUpFallback; }
    }

    public static class TimeoutsConfig {
        private Duration planning = Duration.ofSeconds(120);
        private Duration worker = Duration.ofSeconds(300);
        private Duration synthesis = Duration.ofSeconds(90);
        private Duration qualityCheck = Duration.ofSeconds(15);
        private Duration researchPlanning = Duration.ofSeconds(60);
        private Duration researchWorker = Duration.ofSeconds(180);
        private Duration gapCheck = Duration.ofSeconds(45);
        private Duration researchSynthesis = Duration.ofSeconds(180);

        public Duration getPlanning() { return planning; }
        public void setPlanning(Duration planning) { this.planning = planning; }
        public Duration getWorker() { return worker; }
        public void setWorker(Duration worker) { this.worker = worker; }
        public Duration getSynthesis() { return synthesis; }
        public void setSynthesis(Duration synthesis) { this.synthesis = synthesis; }
        public Duration getQualityCheck() { return qualityCheck; }
        public void setQualityCheck(Duration qualityCheck) { this.qualityCheck = qualityCheck; }
        public Duration getResearchPlanning() { return researchPlanning; }
        public void setResearchPlanning(Duration researchPlanning) { this.researchPlanning = researchPlanning; }
        public Duration getResearchWorker() { return researchWorker; }
        public void setResearchWorker(Duration researchWorker) { this.researchWorker = researchWorker; }
        public Duration getGapCheck() { return gapCheck; }
        public void setGapCheck(Duration gapCheck) { this.gapCheck = gapCheck; }
        public Duration getResearchSynthesis() { return researchSynthesis; }
        public void setResearchSynthesis(Duration researchSynthesis) { this.researchSynthesis = researchSynthesis; }
    }

    public int getMaxTasks() {
        return maxTasks;
    }

    public void setMaxTasks(int maxTasks) {
        this.maxTasks = maxTasks;
    }

    public int getWorkerConcurrency() {
        return workerConcurrency;
    }

    public void setWorkerConcurrency(int workerConcurrency) {
        this.workerConcurrency = workerConcurrency;
    }

    public int getResearchConcurrency() {
        return researchConcurrency;
    }

    public void setResearchConcurrency(int researchConcurrency) {
        this.researchConcurrency = researchConcurrency;
    }

    public Duration getStagger() {
        return stagger;
    }

    public void setStagger(Duration stagger) {
        this.stagger = stagger;
    }

    public Duration getStreamThrottle() {
        return streamThrottle;
    }

    public void setStreamThrottle(Duration streamThrottle) {
        this.streamThrottle = streamThrottle;
    }

    public boolean isStrictCriticalAccounting() {
        return strictCriticalAccounting;
    }

    public void setStrictCriticalAccounting(boolean strictCriticalAccounting) {
        this.strictCriticalAccounting = strictCriticalAccounting;
    }

    public ResearchConfig getResearch() {
        return research;
    }

    public void setResearch(ResearchConfig research) {
        this.research = research != null ? research : new ResearchConfig();
    }

    public QualityConfig getQuality() {
        return quality;
    }

    public void setQuality(QualityConfig quality) {
        this.quality = quality != null ? quality : new QualityConfig();
    }

    public ModelsConfig getModels() {
        return models;
    }

    public void setModels(ModelsConfig models) {
        this.models = models != null ? models : new ModelsConfig();
    }

    public TimeoutsConfig getTimeouts() {
        return timeouts;
    }

    public void setTimeouts(TimeoutsConfig timeouts) {
        this.timeouts = timeouts != null ? timeouts : new TimeoutsConfig();
    }
}
