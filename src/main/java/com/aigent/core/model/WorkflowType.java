package com.aigent.core.model;

/**
 * Execution strategy of a workflow.
 */
public enum WorkflowType {
    /** Steps run one at a time in declared order; the first failure stops the walk. */
    SEQUENTIAL,
    /** All steps run concurrently; every step runs regardless of sibling failures. */
    PARALLEL,
    /** Steps run in declared order when their condition holds; others are skipped. */
    CONDITIONAL,
    /** Dependencies form a tree/DAG walked from the roots down. */
    HIERARCHICAL
}
