package com.aigent.dispatch.cli;

import com.aigent.core.agent.Agent;
import com.aigent.core.orchestrator.Orchestrator;
import com.aigent.core.selection.NoCandidateException;
import com.aigent.dispatch.definition.AgentDefinitionLoader;
import com.aigent.dispatch.definition.DefinitionLoadException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: aigent assign "&lt;task&gt;" --agents &lt;agents-file&gt;
 * <p>
 * Shows which agent the selector picks for a task, with every candidate's score.
 */
@Command(name = "assign", mixinStandardHelpOptions = true, description = "Pick the best agent for a task")
@Component
public class AssignCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Task description")
    private String task;

    @Option(names = {"--agents", "-a"}, required = true, description = "Agent definitions file (JSON)")
    private Path agentsFile;

    private final Orchestrator orchestrator;
    private final AgentDefinitionLoader agentLoader;

    public AssignCommand(Orchestrator orchestrator, AgentDefinitionLoader agentLoader) {
        this.orchestrator = orchestrator;
        this.agentLoader = agentLoader;
    }

    @Override
    public Integer call() {
        List<Agent> agents;
        try {
            agents = agentLoader.load(agentsFile);
        } catch (DefinitionLoadException e) {
            ConsoleOutput.error(e.getMessage());
            return AigentCommand.EXIT_CONFIG_ERROR;
        }
        agents.forEach(orchestrator::registerAgent);

        Agent selected;
        try {
            selected = orchestrator.assignTask(task);
        } catch (NoCandidateException e) {
            ConsoleOutput.error(e.getMessage());
            return AigentCommand.EXIT_WORKFLOW_FAILED;
        }
        for (var scored : orchestrator.rankAgents(task)) {
            System.out.printf("  %-20s %-13s %6.2f%s%n", scored.agent().id(), scored.agent().type(), scored.score(),
                    scored.agent() == selected ? "  <" : "");
        }
        ConsoleOutput.agent(selected.id(), "selected for '" + task + "'");
        return AigentCommand.EXIT_OK;
    }
}
