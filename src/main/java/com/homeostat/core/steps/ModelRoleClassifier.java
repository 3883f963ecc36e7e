package com.homeostat.core.steps;

import com.homeostat.core.config.HomeostatProperties;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Picks a model role for a request from its wording. Keyword rules only.
 */
@Component
public class ModelRoleClassifier {

    public static final String ROUTER = "router";
    public static final String STANDARD = "standard";
    public static final String REASONING = "reasoning";
    public static final String CODING = "coding";
    public static final String PLANNER = "planner";

    private static final Pattern CODE = Pattern.compile(
            "```|\\b(code|function|method|class|compile|stack ?trace|refactor|bug|java|python|sql|regex)\\b");
    private static final Pattern REASON = Pattern.compile(
            "\\b(why|explain|analy[sz]e|compare|trade-?offs?|prove|evaluate|design|diagnose)\\b");
    private static final Pattern MULTI_STEP = Pattern.compile(
            "\\b(step by step|and then|first\\b.*\\bthen|plan)\\b|(^|\\n)\\s*\\d+[.)]\\s");

    private final int planningThreshold;

    public ModelRoleClassifier(HomeostatProperties properties) {
        this.planningThreshold = properties.getExecutor().getPlanningThreshold();
    }

    public String classify(String message) {
        String text = normalize(message);
        if (CODE.matcher(text).find()) {
            return CODING;
        }
        if (REASON.matcher(text).find() || text.length() >= planningThreshold) {
            return REASONING;
        }
        return STANDARD;
    }

    /**
     * Long or explicitly multi-step requests get a planning step first.
     */
    public boolean needsPlanning(String message) {
        String text = normalize(message);
        return text.length() >= planningThreshold || MULTI_STEP.matcher(text).find();
    }

    private static String normalize(String message) {
        return message == null ? "" : message.toLowerCase(Locale.ROOT).strip();
    }
}
