package com.homeostat.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Runtime tuning for the sampler, mode controller and task executor.
 * Governance rules live separately under {@code homeostat.policy}.
 */
@Component
@ConfigurationProperties(prefix = "homeostat")
public class HomeostatProperties {

    private Sampler sampler = new Sampler();
    private Controller controller = new Controller();
    private Executor executor = new Executor();
    private Model model = new Model();
    private Tools tools = new Tools();

    public Sampler getSampler() {
        return sampler;
    }

    public void setSampler(Sampler sampler) {
        this.sampler = sampler;
    }

    public Controller getController() {
        return controller;
    }

    public void setController(Controller controller) {
        this.controller = controller;
    }

    public Executor getExecutor() {
        return executor;
    }

    public void setExecutor(Executor executor) {
        this.executor = executor;
    }

    public Model getModel() {
        return model;
    }

    public void setModel(Model model) {
        this.model = model;
    }

    public Tools getTools() {
        return tools;
    }

    public void setTools(Tools tools) {
        this.tools = tools;
    }

    public static class Sampler {
        private boolean enabled = true;
        /** Used when the active mode does not set its own sampling interval. */
        private Duration interval = Duration.ofSeconds(5);
        private Duration collectorTimeout = Duration.ofSeconds(2);
        private int windowCapacity = 720;
        private int signalHistory = 256;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getInterval() {
            return interval;
        }

        public void setInterval(Duration interval) {
            this.interval = interval;
        }

        public Duration getCollectorTimeout() {
            return collectorTimeout;
        }

        public void setCollectorTimeout(Duration collectorTimeout) {
            this.collectorTimeout = collectorTimeout;
        }

        public int getWindowCapacity() {
            return windowCapacity;
        }

        public void setWindowCapacity(int windowCapacity) {
            this.windowCapacity = windowCapacity;
        }

        public int getSignalHistory() {
            return signalHistory;
        }

        public void setSignalHistory(int signalHistory) {
            this.signalHistory = signalHistory;
        }
    }

    public static class Controller {
        private boolean enabled = true;
        private Duration tickInterval = Duration.ofSeconds(1);
        /** Observations older than this no longer satisfy any condition. */
        private Duration staleAfter = Duration.ofSeconds(60);
        /** Samples retained for windowed conditions. */
        private int windowCapacity = 720;
        private int historySize = 100;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getTickInterval() {
            return tickInterval;
        }

        public void setTickInterval(Duration tickInterval) {
            this.tickInterval = tickInterval;
        }

        public Duration getStaleAfter() {
            return staleAfter;
        }

        public void setStaleAfter(Duration staleAfter) {
            this.staleAfter = staleAfter;
        }

        public int getWindowCapacity() {
            return windowCapacity;
        }

        public void setWindowCapacity(int windowCapacity) {
            this.windowCapacity = windowCapacity;
        }

        public int getHistorySize() {
            return historySize;
        }

        public void setHistorySize(int historySize) {
            this.historySize = historySize;
        }
    }

    public static class Executor {
        private int poolSize = 8;
        private Duration taskBudget = Duration.ofMinutes(5);
        private int maxToolIterations = 5;
        /** Requests longer than this many characters get a planning step. */
        private int planningThreshold = 400;
        private int retryAttempts = 2;
        private Duration retryBackoff = Duration.ofMillis(500);

        public int getPoolSize() {
            return poolSize;
        }

        public void setPoolSize(int poolSize) {
            this.poolSize = poolSize;
        }

        public Duration getTaskBudget() {
            return taskBudget;
        }

        public void setTaskBudget(Duration taskBudget) {
            this.taskBudget = taskBudget;
        }

        public int getMaxToolIterations() {
            return maxToolIterations;
        }

        public void setMaxToolIterations(int maxToolIterations) {
            this.maxToolIterations = maxToolIterations;
        }

        public int getPlanningThreshold() {
            return planningThreshold;
        }

        public void setPlanningThreshold(int planningThreshold) {
            this.planningThreshold = planningThreshold;
        }

        public int getRetryAttempts() {
            return retryAttempts;
        }

        public void setRetryAttempts(int retryAttempts) {
            this.retryAttempts = retryAttempts;
        }

        public Duration getRetryBackoff() {
            return retryBackoff;
        }

        public void setRetryBackoff(Duration retryBackoff) {
            this.retryBackoff = retryBackoff;
        }
    }

    public static class Model {
        /** {@code local} for the offline responder, {@code openai} for an OpenAI-compatible backend. */
        private String provider = "local";
        private String systemPrompt = "You are a careful local assistant. Use tools only when they are needed.";

        public String getProvider() {
            return provider;
        }

        public void setProvider(String provider) {
            this.provider = provider;
        }

        public String getSystemPrompt() {
            return systemPrompt;
        }

        public void setSystemPrompt(String systemPrompt) {
            this.systemPrompt = systemPrompt;
        }
    }

    public static class Tools {
        private long maxReadBytes = 1024 * 1024;
        private int maxDirectoryEntries = 200;

        public long getMaxReadBytes() {
            return maxReadBytes;
        }

        public void setMaxReadBytes(long maxReadBytes) {
            this.maxReadBytes = maxReadBytes;
        }

        public int getMaxDirectoryEntries() {
            return maxDirectoryEntries;
        }

        public void setMaxDirectoryEntries(int maxDirectoryEntries) {
            this.maxDirectoryEntries = maxDirectoryEntries;
        }
    }
}
