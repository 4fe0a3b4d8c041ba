package com.aigent.core.safety;

import com.aigent.core.agent.Agent;
import com.aigent.core.model.Action;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Rejects actions whose type is on a configured deny list. Matching ignores case.
 */
public class ActionTypeSafetyValidator implements SafetyValidator {

    private static final Logger log = LoggerFactory.getLogger(ActionTypeSafetyValidator.class);

    private final Set<String> restricted;

    public ActionTypeSafetyValidator(Collection<String> restrictedActionTypes) {
        this.restricted = restrictedActionTypes == null
                ? Set.of()
                : restrictedActionTypes.stream()
                        .filter(t -> t != null && !t.isBlank())
                        .map(t -> t.trim().toLowerCase(Locale.ROOT))
                        .collect(Collectors.toUnmodifiableSet());
    }

    @Override
    public ValidationResult validate(Agent agent, Action action) {
        if (action.type() != null && restricted.contains(action.type().toLowerCase(Locale.ROOT))) {
            log.warn("Agent {} attempted restricted action type {}", agent.id(), action.type());
            return ValidationResult.rejected("action type '" + action.type() + "' is restricted");
        }
        return ValidationResult.ok();
    }
}
