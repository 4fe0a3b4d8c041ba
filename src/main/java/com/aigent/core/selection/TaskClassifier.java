package com.aigent.core.selection;

/**
 * Derives the action types and skill a task requires.
 * Replace the default keyword heuristic by exposing another bean of this type.
 */
@FunctionalInterface
public interface TaskClassifier {

    TaskProfile classify(String task);
}
