package com.aigent.dispatch.definition;

import com.aigent.core.model.WorkflowDefinition;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads {@link WorkflowDefinition}s from JSON.
 * <pre>
 * {
 *   "name": "forecast-then-plan",
 *   "type": "SEQUENTIAL",
 *   "timeoutSeconds": 60,
 *   "steps": [
 *     {"name": "forecast", "requiredAgentType": "REACTIVE", "parameters": {"input": "weather in Oslo"}},
 *     {"name": "plan", "requiredAgentType": "DELIBERATIVE", "dependencies": ["forecast"]}
 *   ]
 * }
 * </pre>
 * Structural validation (names, dependencies, conditions) happens later, in the plan compiler.
 */
@Component
public class WorkflowDefinitionLoader {

    private static final Logger log = LoggerFactory.getLogger(WorkflowDefinitionLoader.class);

    private final ObjectMapper mapper = DefinitionMappers.create();

    public WorkflowDefinition load(Path file) {
        if (file == null || !Files.isRegularFile(file)) {
            throw new DefinitionLoadException("Workflow file not found: " + file);
        }
        try {
            WorkflowDefinition definition = mapper.readValue(file.toFile(), WorkflowDefinition.class);
            log.debug("Loaded workflow '{}' from {}", definition.name(), file);
            return definition;
        } catch (IOException e) {
            throw new DefinitionLoadException("Invalid workflow file " + file + ": "
                    + DefinitionMappers.rootCauseMessage(e), e);
        }
    }

    public WorkflowDefinition parse(String json) {
        try {
            return mapper.readValue(json, WorkflowDefinition.class);
        } catch (IOException e) {
            throw new DefinitionLoadException("Invalid workflow definition: "
                    + DefinitionMappers.rootCauseMessage(e), e);
        }
    }
}
