package com.aigent.core.selection;

import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.List;

/**
 * Default {@link TaskClassifier}: case-insensitive keyword matching on the task text.
 * <p>
 * Every matching keyword contributes its action type; the relevant skill is that of the
 * first matching keyword in table order, or {@value TaskProfile#GENERAL_SKILL}.
 */
@Component
public class KeywordTaskClassifier implements TaskClassifier {

    private record KeywordRule(String keyword, String actionType, String skill) {}

    private static final List<KeywordRule> RULES = List.of(
            new KeywordRule("weather", "WeatherQuery", "weather_analysis"),
            new KeywordRule("plan", "Planning", "planning"),
            new KeywordRule("urgent", "ReactiveResponse", "quick_response")
    );

    @Override
    public TaskProfile classify(String task) {
        if (task == null || task.isBlank()) {
            return new TaskProfile(null, null);
        }
        String lower = task.toLowerCase();
        var actionTypes = new LinkedHashSet<String>();
        String skill = null;
        for (var rule : RULES) {
            if (lower.contains(rule.keyword())) {
                actionTypes.add(rule.actionType());
                if (skill == null) {
                    skill = rule.skill();
                }
            }
        }
        return new TaskProfile(actionTypes, skill);
    }
}
