package com.aigent.core.selection;

import com.aigent.core.agent.Agent;

/**
 * A candidate agent together with its selection score.
 */
public record ScoredAgent(Agent agent, double score) {}
