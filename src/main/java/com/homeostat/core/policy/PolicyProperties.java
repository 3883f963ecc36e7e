package com.homeostat.core.policy;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Raw governance policy as bound from configuration. {@link PolicyLoader} validates
 * it into the immutable {@link GovernancePolicy} used at runtime.
 */
@Component
@ConfigurationProperties(prefix = "homeostat.policy")
public class PolicyProperties {

    private Map<String, ModeDefinition> modes = new LinkedHashMap<>();
    private List<RuleDefinition> transitionRules = new ArrayList<>();
    private List<ToolDefinition> tools = new ArrayList<>();
    private Duration approvalTimeout = Duration.ofSeconds(300);

    public Map<String, ModeDefinition> getModes() {
        return modes;
    }

    public void setModes(Map<String, ModeDefinition> modes) {
        this.modes = modes;
    }

    public List<RuleDefinition> getTransitionRules() {
        return transitionRules;
    }

    public void setTransitionRules(List<RuleDefinition> transitionRules) {
        this.transitionRules = transitionRules;
    }

    public List<ToolDefinition> getTools() {
        return tools;
    }

    public void setTools(List<ToolDefinition> tools) {
        this.tools = tools;
    }

    public Duration getApprovalTimeout() {
        return approvalTimeout;
    }

    public void setApprovalTimeout(Duration approvalTimeout) {
        this.approvalTimeout = approvalTimeout;
    }

    public static class ModeDefinition {
        private String description = "";
        private Integer maxConcurrentTasks;
        private List<String> allowedToolCategories = new ArrayList<>();
        private List<String> requireApprovalFor = new ArrayList<>();
        private List<String> allowedModelRoles = new ArrayList<>();
        private Map<String, RoleLimits> modelLimits = new LinkedHashMap<>();
        private RateLimitDefinition rateLimits = new RateLimitDefinition();
        private Duration stepTimeout;
        private Duration samplingInterval;
        private List<ThresholdDefinition> signalThresholds = new ArrayList<>();
        private List<String> transitionsTo;

        public String getDescription() {
            return description;
        }

        public void setDescription(String description) {
            this.description = description;
        }

        public Integer getMaxConcurrentTasks() {
            return maxConcurrentTasks;
        }

        public void setMaxConcurrentTasks(Integer maxConcurrentTasks) {
            this.maxConcurrentTasks = maxConcurrentTasks;
        }

        public List<String> getAllowedToolCategories() {
            return allowedToolCategories;
        }

        public void setAllowedToolCategories(List<String> allowedToolCategories) {
            this.allowedToolCategories = allowedToolCategories;
        }

        public List<String> getRequireApprovalFor() {
            return requireApprovalFor;
        }

        public void setRequireApprovalFor(List<String> requireApprovalFor) {
            this.requireApprovalFor = requireApprovalFor;
        }

        public List<String> getAllowedModelRoles() {
            return allowedModelRoles;
        }

        public void setAllowedModelRoles(List<String> allowedModelRoles) {
            this.allowedModelRoles = allowedModelRoles;
        }

        public Map<String, RoleLimits> getModelLimits() {
            return modelLimits;
        }

        public void setModelLimits(Map<String, RoleLimits> modelLimits) {
            this.modelLimits = modelLimits;
        }

        public RateLimitDefinition getRateLimits() {
            return rateLimits;
        }

        public void setRateLimits(RateLimitDefinition rateLimits) {
            this.rateLimits = rateLimits;
        }

        public Duration getStepTimeout() {
            return stepTimeout;
        }

        public void setStepTimeout(Duration stepTimeout) {
            this.stepTimeout = stepTimeout;
        }

        public Duration getSamplingInterval() {
            return samplingInterval;
        }

        public void setSamplingInterval(Duration samplingInterval) {
            this.samplingInterval = samplingInterval;
        }

        public List<ThresholdDefinition> getSignalThresholds() {
            return signalThresholds;
        }

        public void setSignalThresholds(List<ThresholdDefinition> signalThresholds) {
            this.signalThresholds = signalThresholds;
        }

        public List<String> getTransitionsTo() {
            return transitionsTo;
        }

        public void setTransitionsTo(List<String> transitionsTo) {
            this.transitionsTo = transitionsTo;
        }
    }

    public static class RoleLimits {
        private Integer maxTokens;
        private Double temperature;
        private Duration timeout;

        public Integer getMaxTokens() {
            return maxTokens;
        }

        public void setMaxTokens(Integer maxTokens) {
            this.maxTokens = maxTokens;
        }

        public Double getTemperature() {
            return temperature;
        }

        public void setTemperature(Double temperature) {
            this.temperature = temperature;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }
    }

    public static class RateLimitDefinition {
        private Integer toolCallsPerMinute;
        private Integer modelCallsPerMinute;

        public Integer getToolCallsPerMinute() {
            return toolCallsPerMinute;
        }

        public void setToolCallsPerMinute(Integer toolCallsPerMinute) {
            this.toolCallsPerMinute = toolCallsPerMinute;
        }

        public Integer getModelCallsPerMinute() {
            return modelCallsPerMinute;
        }

        public void setModelCallsPerMinute(Integer modelCallsPerMinute) {
            this.modelCallsPerMinute = modelCallsPerMinute;
        }
    }

    public static class ThresholdDefinition {
        private String metric;
        private Double value;

        public String getMetric() {
            return metric;
        }

        public void setMetric(String metric) {
            this.metric = metric;
        }

        public Double getValue() {
            return value;
        }

        public void setValue(Double value) {
            this.value = value;
        }
    }

    public static class RuleDefinition {
        private String name;
        private String from;
        private String to;
        private String combinator = "ANY";
        private boolean requiresApproval;
        private List<ConditionDefinition> conditions = new ArrayList<>();

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getFrom() {
            return from;
        }

        public void setFrom(String from) {
            this.from = from;
        }

        public String getTo() {
            return to;
        }

        public void setTo(String to) {
            this.to = to;
        }

        public String getCombinator() {
            return combinator;
        }

        public void setCombinator(String combinator) {
            this.combinator = combinator;
        }

        public boolean isRequiresApproval() {
            return requiresApproval;
        }

        public void setRequiresApproval(boolean requiresApproval) {
            this.requiresApproval = requiresApproval;
        }

        public List<ConditionDefinition> getConditions() {
            return conditions;
        }

        public void setConditions(List<ConditionDefinition> conditions) {
            this.conditions = conditions;
        }
    }

    public static class ConditionDefinition {
        private String metric;
        private String operator;
        private Double threshold;
        private Duration sustained = Duration.ZERO;
        private Duration window;

        public String getMetric() {
            return metric;
        }

        public void setMetric(String metric) {
            this.metric = metric;
        }

        public String getOperator() {
            return operator;
        }

        public void setOperator(String operator) {
            this.operator = operator;
        }

        public Double getThreshold() {
            return threshold;
        }

        public void setThreshold(Double threshold) {
            this.threshold = threshold;
        }

        public Duration getSustained() {
            return sustained;
        }

        public void setSustained(Duration sustained) {
            this.sustained = sustained;
        }

        public Duration getWindow() {
            return window;
        }

        public void setWindow(Duration window) {
            this.window = window;
        }
    }

    public static class ToolDefinition {
        private String name;
        private String category;
        private List<String> allowedInModes = new ArrayList<>();
        private List<String> forbiddenInModes = new ArrayList<>();
        private List<String> requiresApprovalInModes = new ArrayList<>();
        private boolean requiresApproval;
        private List<String> allowedPaths = new ArrayList<>();
        private List<String> forbiddenPaths = new ArrayList<>();
        private List<String> allowedCommands = new ArrayList<>();
        private List<String> forbiddenCommands = new ArrayList<>();
        private Integer rateLimitPerHour;

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getCategory() {
            return category;
        }

        public void setCategory(String category) {
            this.category = category;
        }

        public List<String> getAllowedInModes() {
            return allowedInModes;
        }

        public void setAllowedInModes(List<String> allowedInModes) {
            this.allowedInModes = allowedInModes;
        }

        public List<String> getForbiddenInModes() {
            return forbiddenInModes;
        }

        public void setForbiddenInModes(List<String> forbiddenInModes) {
            this.forbiddenInModes = forbiddenInModes;
        }

        public List<String> getRequiresApprovalInModes() {
            return requiresApprovalInModes;
        }

        public void setRequiresApprovalInModes(List<String> requiresApprovalInModes) {
            this.requiresApprovalInModes = requiresApprovalInModes;
        }

        public boolean isRequiresApproval() {
            return requiresApproval;
        }

        public void setRequiresApproval(boolean requiresApproval) {
            this.requiresApproval = requiresApproval;
        }

        public List<String> getAllowedPaths() {
            return allowedPaths;
        }

        public void setAllowedPaths(List<String> allowedPaths) {
            this.allowedPaths = allowedPaths;
        }

        public List<String> getForbiddenPaths() {
            return forbiddenPaths;
        }

        public void setForbiddenPaths(List<String> forbiddenPaths) {
            this.forbiddenPaths = forbiddenPaths;
        }

        public List<String> getAllowedCommands() {
            return allowedCommands;
        }

        public void setAllowedCommands(List<String> allowedCommands) {
            this.allowedCommands = allowedCommands;
        }

        public List<String> getForbiddenCommands() {
            return forbiddenCommands;
        }

        public void setForbiddenCommands(List<String> forbiddenCommands) {
            this.forbiddenCommands = forbiddenCommands;
        }

        public Integer getRateLimitPerHour() {
            return rateLimitPerHour;
        }

        public void setRateLimitPerHour(Integer rateLimitPerHour) {
            this.rateLimitPerHour = rateLimitPerHour;
        }
    }
}
