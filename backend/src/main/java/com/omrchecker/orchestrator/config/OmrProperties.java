package com.omrchecker.orchestrator.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "omr")
public class OmrProperties {
    private static final String DEFAULT_USER_AGENT = "omr-job-orchestrator/0.1";

    private String userAgent;
    private Processing processing = new Processing();
    private Http http = new Http();
    private Images images = new Images();
    private Engine engine = new Engine();
    private Webhook webhook = new Webhook();
    private Callbacks callbacks = new Callbacks();
    private Api api = new Api();

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public Processing getProcessing() {
        return processing;
    }

    public void setProcessing(Processing processing) {
        this.processing = processing;
    }

    public Http getHttp() {
        return http;
    }

    public void setHttp(Http http) {
        this.http = http;
    }

    public Images getImages() {
        return images;
    }

    public void setImages(Images images) {
        this.images = images;
    }

    public Engine getEngine() {
        return engine;
    }

    public void setEngine(Engine engine) {
        this.engine = engine;
    }

    public Webhook getWebhook() {
        return webhook;
    }

    public void setWebhook(Webhook webhook) {
        this.webhook = webhook;
    }

    public Callbacks getCallbacks() {
        return callbacks;
    }

    public void setCallbacks(Callbacks callbacks) {
        this.callbacks = callbacks;
    }

    public Api getApi() {
        return api;
    }

    public void setApi(Api api) {
        this.api = api;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Processing {
        private int jobConcurrency = 4;

        public int getJobConcurrency() {
            return Math.max(1, jobConcurrency);
        }

        public void setJobConcurrency(int jobConcurrency) {
            this.jobConcurrency = Math.max(1, jobConcurrency);
        }
    }

    public static class Http {
        private int connectTimeoutSeconds = 10;
        private int requestTimeoutSeconds = 30;
        private int executorThreads = 4;

        public int getConnectTimeoutSeconds() {
            return Math.max(1, connectTimeoutSeconds);
        }

        public void setConnectTimeoutSeconds(int connectTimeoutSeconds) {
            this.connectTimeoutSeconds = connectTimeoutSeconds;
        }

        public int getRequestTimeoutSeconds() {
            return Math.max(1, requestTimeoutSeconds);
        }

        public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
            this.requestTimeoutSeconds = requestTimeoutSeconds;
        }

        public int getExecutorThreads() {
            return Math.max(1, executorThreads);
        }

        public void setExecutorThreads(int executorThreads) {
            this.executorThreads = executorThreads;
        }
    }

    public static class Images {
        private long maxBytes = 20L * 1024 * 1024;
        private String tempFilePrefix = "omr-sheet-";

        public long getMaxBytes() {
            return maxBytes <= 0 ? Long.MAX_VALUE : maxBytes;
        }

        public void setMaxBytes(long maxBytes) {
            this.maxBytes = maxBytes;
        }

        public String getTempFilePrefix() {
            return tempFilePrefix == null || tempFilePrefix.isBlank() ? "omr-sheet-" : tempFilePrefix;
        }

        public void setTempFilePrefix(String tempFilePrefix) {
            this.tempFilePrefix = tempFilePrefix;
        }
    }

    public static class Engine {
        private String url = "http://localhost:5000/api/recognize";
        private int timeoutSeconds = 60;

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public int getTimeoutSeconds() {
            return Math.max(1, timeoutSeconds);
        }

        public void setTimeoutSeconds(int timeoutSeconds) {
            this.timeoutSeconds = timeoutSeconds;
        }
    }

    public static class Webhook {
        private int timeoutSeconds = 30;

        public int getTimeoutSeconds() {
            return Math.max(1, timeoutSeconds);
        }

        public void setTimeoutSeconds(int timeoutSeconds) {
            this.timeoutSeconds = timeoutSeconds;
        }
    }

    public static class Callbacks {
        private boolean sweepEnabled = false;
        private int sweepIntervalSeconds = 300;
        private int maxAttempts = 100;

        public boolean isSweepEnabled() {
            return sweepEnabled;
        }

        public void setSweepEnabled(boolean sweepEnabled) {
            this.sweepEnabled = sweepEnabled;
        }

        public int getSweepIntervalSeconds() {
            return Math.max(5, sweepIntervalSeconds);
        }

        public void setSweepIntervalSeconds(int sweepIntervalSeconds) {
            this.sweepIntervalSeconds = sweepIntervalSeconds;
        }

        public int getMaxAttempts() {
            return Math.max(1, maxAttempts);
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }
    }

    public static class Api {
        private int defaultListLimit = 50;
        private int maxListLimit = 200;

        public int getDefaultListLimit() {
            return Math.max(1, defaultListLimit);
        }

        public void setDefaultListLimit(int defaultListLimit) {
            this.defaultListLimit = defaultListLimit;
        }

        public int getMaxListLimit() {
            return Math.max(1, maxListLimit);
        }

        public void setMaxListLimit(int maxListLimit) {
            this.maxListLimit = maxListLimit;
        }
    }
}
