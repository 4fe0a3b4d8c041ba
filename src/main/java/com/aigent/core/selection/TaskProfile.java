package com.aigent.core.selection;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * What a task needs from an agent, as derived by a {@link TaskClassifier}.
 *
 * @param requiredActionTypes action types the task calls for
 * @param relevantSkill       the skill whose level is weighed; never null
 */
public record TaskProfile(Set<String> requiredActionTypes, String relevantSkill) {

    public static final String GENERAL_SKILL = "general";

    public TaskProfile {
        requiredActionTypes = requiredActionTypes == null
                ? Set.of()
                : Collections.unmodifiableSet(new LinkedHashSet<>(requiredActionTypes));
        relevantSkill = relevantSkill != null ? relevantSkill : GENERAL_SKILL;
    }
}
