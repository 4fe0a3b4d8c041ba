package com.aigent.dispatch.cli;

import com.aigent.core.agent.Agent;
import com.aigent.core.events.EventBus;
import com.aigent.core.events.OrchestrationEvent;
import com.aigent.core.model.WorkflowDefinition;
import com.aigent.core.model.WorkflowResult;
import com.aigent.core.orchestrator.Orchestrator;
import com.aigent.core.plan.WorkflowConfigurationException;
import com.aigent.dispatch.definition.AgentDefinitionLoader;
import com.aigent.dispatch.definition.DefinitionLoadException;
import com.aigent.dispatch.definition.WorkflowDefinitionLoader;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: aigent run &lt;workflow-file&gt; --agents &lt;agents-file&gt;
 * <p>
 * Registers the agents from the agents file, executes the workflow and prints per-step
 * outcomes. Exits with 1 when the workflow fails and 2 on configuration errors.
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Execute a workflow definition")
@Component
public class RunCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Workflow definition file (JSON)")
    private Path workflowFile;

    @Option(names = {"--agents", "-a"}, required = true, description = "Agent definitions file (JSON)")
    private Path agentsFile;

    @Option(names = {"--watch", "-w"}, description = "Stream orchestration events while the workflow runs")
    private boolean watch;

    private final Orchestrator orchestrator;
    private final WorkflowDefinitionLoader workflowLoader;
    private final AgentDefinitionLoader agentLoader;
    private final EventBus eventBus;

    public RunCommand(Orchestrator orchestrator, WorkflowDefinitionLoader workflowLoader,
                      AgentDefinitionLoader agentLoader, EventBus eventBus) {
        this.orchestrator = orchestrator;
        this.workflowLoader = workflowLoader;
        this.agentLoader = agentLoader;
        this.eventBus = eventBus;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        WorkflowDefinition definition;
        List<Agent> agents;
        try {
            definition = workflowLoader.load(workflowFile);
            agents = agentLoader.load(agentsFile);
        } catch (DefinitionLoadException e) {
            ConsoleOutput.error(e.getMessage());
            return AigentCommand.EXIT_CONFIG_ERROR;
        }
        agents.forEach(orchestrator::registerAgent);
        ConsoleOutput.info("Registered " + agents.size() + " agent" + (agents.size() != 1 ? "s" : ""));

        EventBus.Subscription subscription = watch
                ? eventBus.subscribeTypes(OrchestrationEvent.WORKFLOW_EVENT_TYPES,
                        event -> ConsoleOutput.watchEvent(event.eventType(), describe(event)))
                : null;
        WorkflowResult result;
        try {
            result = orchestrator.executeWorkflow(definition);
        } catch (WorkflowConfigurationException e) {
            ConsoleOutput.error("Invalid workflow: " + e.getMessage());
            return AigentCommand.EXIT_CONFIG_ERROR;
        } finally {
            if (subscription != null) {
                subscription.unsubscribe();
            }
        }

        System.out.println();
        System.out.println("WORKFLOW " + result.workflowId() + " (" + result.workflowName() + ")");
        result.results().forEach((name, step) -> ConsoleOutput.stepResult(name, step, 0));

        if (!result.errors().isEmpty()) {
            System.out.println();
            ConsoleOutput.error("Errors (" + result.errors().size() + "):");
            for (String error : result.errors()) {
                ConsoleOutput.error("  " + error);
            }
        }

        System.out.println();
        String summary = "Workflow " + result.state() + " in " + ConsoleOutput.formatDuration(result.durationMs());
        if (result.success()) {
            ConsoleOutput.success(summary);
            return AigentCommand.EXIT_OK;
        }
        ConsoleOutput.error(summary);
        return AigentCommand.EXIT_WORKFLOW_FAILED;
    }

    private static String describe(OrchestrationEvent event) {
        var sb = new StringBuilder();
        if (event.workflowId() != null) {
            sb.append(event.workflowId());
        }
        if (event.stepName() != null) {
            sb.append(sb.length() > 0 ? " " : "").append(event.stepName());
        }
        Object message = event.payload().get("message");
        if (message == null) {
            message = event.payload().get("reason");
        }
        if (message == null) {
            message = event.payload().get("agentId");
        }
        if (message != null) {
            sb.append(sb.length() > 0 ? ": " : "").append(message);
        }
        return sb.toString();
    }
}
