package com.aigent.dispatch.cli;

import com.aigent.core.orchestrator.Orchestrator;
import com.aigent.core.plan.PlanNode;
import com.aigent.core.plan.WorkflowConfigurationException;
import com.aigent.dispatch.definition.DefinitionLoadException;
import com.aigent.dispatch.definition.WorkflowDefinitionLoader;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: aigent validate &lt;workflow-file&gt;
 * <p>
 * Compiles the workflow without running it and prints its execution order.
 */
@Command(name = "validate", mixinStandardHelpOptions = true, description = "Check a workflow definition")
@Component
public class ValidateCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Workflow definition file (JSON)")
    private Path workflowFile;

    private final Orchestrator orchestrator;
    private final WorkflowDefinitionLoader workflowLoader;

    public ValidateCommand(Orchestrator orchestrator, WorkflowDefinitionLoader workflowLoader) {
        this.orchestrator = orchestrator;
        this.workflowLoader = workflowLoader;
    }

    @Override
    public Integer call() {
        try {
            var plan = orchestrator.validateWorkflow(workflowLoader.load(workflowFile));
            ConsoleOutput.success("Workflow '" + plan.name() + "' (" + plan.type() + ") is valid: "
                    + plan.size() + " steps");
            for (int index : plan.topologicalOrder()) {
                PlanNode node = plan.node(index);
                System.out.printf("  %-20s [%-13s]%s%s%n", node.name(), node.step().requiredAgentType(),
                        node.step().dependencies().isEmpty() ? "" : " after " + node.step().dependencies(),
                        node.condition() == null ? "" : " when " + node.condition());
            }
            return AigentCommand.EXIT_OK;
        } catch (DefinitionLoadException | WorkflowConfigurationException e) {
            ConsoleOutput.error(e.getMessage());
            return AigentCommand.EXIT_CONFIG_ERROR;
        }
    }
}
