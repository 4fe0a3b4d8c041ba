package com.aigent.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "aigent")
public class OrchestratorProperties {

    private Workflow workflow = new Workflow();
    private Safety safety = new Safety();

    // -- Workflow accessors (delegate to nested) --
    public int getMaxParallelSteps() { return workflow.maxParallelSteps; }
    public int getDefaultTimeoutSeconds() { return workflow.defaultTimeoutSeconds; }
    public int getDefaultStepTimeoutSeconds() { return workflow.defaultStepTimeoutSeconds; }
    public int getHistorySize() { return workflow.historySize; }

    public Workflow getWorkflow() { return workflow; }
    public void setWorkflow(Workflow workflow) { this.workflow = workflow; }
    public Safety getSafety() { return safety; }
    public void setSafety(Safety safety) { this.safety = safety; }

    public static class Workflow {
        /** Upper bound on steps of one PARALLEL workflow running at the same time; 0 runs every step at once. */
        private int maxParallelSteps = 0;
        /** Overall workflow deadline when the definition sets none; 0 disables it. */
        private int defaultTimeoutSeconds = 0;
        /** Per-step deadline when the step sets none; 0 disables it. */
        private int defaultStepTimeoutSeconds = 0;
        /** Finished executions kept for status queries. */
        private int historySize = 100;

        public int getMaxParallelSteps() { return maxParallelSteps; }
        public void setMaxParallelSteps(int maxParallelSteps) { this.maxParallelSteps = maxParallelSteps; }
        public int getDefaultTimeoutSeconds() { return defaultTimeoutSeconds; }
        public void setDefaultTimeoutSeconds(int defaultTimeoutSeconds) { this.defaultTimeoutSeconds = defaultTimeoutSeconds; }
        public int getDefaultStepTimeoutSeconds() { return defaultStepTimeoutSeconds; }
        public void setDefaultStepTimeoutSeconds(int defaultStepTimeoutSeconds) { this.defaultStepTimeoutSeconds = defaultStepTimeoutSeconds; }
        public int getHistorySize() { return historySize; }
        public void setHistorySize(int historySize) { this.historySize = historySize; }
    }

    public static class Safety {
        private boolean enabled = false;
        private List<String> restrictedActionTypes = new ArrayList<>();

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public List<String> getRestrictedActionTypes() { return restrictedActionTypes; }
        public void setRestrictedActionTypes(List<String> restrictedActionTypes) { this.restrictedActionTypes = restrictedActionTypes; }
    }
}
