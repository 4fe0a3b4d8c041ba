package com.aigent.core.selection;

import com.aigent.core.agent.Agent;
import com.aigent.core.model.AgentCapabilities;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Scores candidate agents for a task and picks the best one.
 * <p>
 * {@code score = 10 * matchedActionTypes + 5 * skillLevel - 2 * loadFactor + 3 * historicalPerformance}
 * <p>
 * Only a strictly higher score displaces the current best, so among equal maxima the
 * candidate that comes first in the given list wins. Lists obtained from the
 * {@link com.aigent.core.registry.AgentRegistry} are in registration order, which makes the
 * first-registered agent the winner of any tie.
 */
@Service
public class AgentSelector {

    private static final Logger log = LoggerFactory.getLogger(AgentSelector.class);

    static final double ACTION_TYPE_WEIGHT = 10.0;
    static final double SKILL_WEIGHT = 5.0;
    static final double LOAD_WEIGHT = 2.0;
    static final double PERFORMANCE_WEIGHT = 3.0;

    private final TaskClassifier classifier;

    public AgentSelector(TaskClassifier classifier) {
        this.classifier = classifier;
    }

    /**
     * Returns the highest-scoring candidate for the task.
     *
     * @throws NoCandidateException if {@code candidates} is null or empty
     */
    public Agent selectBestAgent(String task, List<? extends Agent> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            throw new NoCandidateException("No candidate agents available for task: " + task);
        }
        var profile = classifier.classify(task);
        Agent best = null;
        double bestScore = Double.NEGATIVE_INFINITY;
        for (Agent candidate : candidates) {
            double score = score(candidate.capabilities(), profile);
            if (score > bestScore) {
                best = candidate;
                bestScore = score;
            }
        }
        log.debug("Selected agent {} (score {}) among {} candidates for task '{}'",
                best.id(), bestScore, candidates.size(), task);
        return best;
    }

    /**
     * Scores every candidate for the task, in candidate order.
     */
    public List<ScoredAgent> rank(String task, List<? extends Agent> candidates) {
        var profile = classifier.classify(task);
        var scored = new ArrayList<ScoredAgent>();
        for (Agent candidate : candidates) {
            scored.add(new ScoredAgent(candidate, score(candidate.capabilities(), profile)));
        }
        return scored;
    }

    public double score(AgentCapabilities capabilities, TaskProfile profile) {
        if (capabilities == null) {
            capabilities = AgentCapabilities.none();
        }
        long matched = profile.requiredActionTypes().stream()
                .filter(capabilities.supportedActionTypes()::contains)
                .count();
        return ACTION_TYPE_WEIGHT * matched
                + SKILL_WEIGHT * capabilities.skillLevel(profile.relevantSkill())
                - LOAD_WEIGHT * capabilities.loadFactor()
                + PERFORMANCE_WEIGHT * capabilities.historicalPerformance();
    }
}
