package com.aigent.dispatch.definition;

import com.aigent.core.agent.Agent;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;

/**
 * Reads a JSON array of {@link AgentDefinition}s and builds the agents they describe.
 */
@Component
public class AgentDefinitionLoader {

    private static final Logger log = LoggerFactory.getLogger(AgentDefinitionLoader.class);
    private static final TypeReference<List<AgentDefinition>> AGENT_LIST = new TypeReference<>() {};

    private final ObjectMapper mapper = DefinitionMappers.create();

    public List<Agent> load(Path file) {
        if (file == null || !Files.isRegularFile(file)) {
            throw new DefinitionLoadException("Agents file not found: " + file);
        }
        List<AgentDefinition> definitions;
        try {
            definitions = mapper.readValue(file.toFile(), AGENT_LIST);
        } catch (IOException e) {
            throw new DefinitionLoadException("Invalid agents file " + file + ": "
                    + DefinitionMappers.rootCauseMessage(e), e);
        }
        var agents = toAgents(definitions);
        log.debug("Loaded {} agents from {}", agents.size(), file);
        return agents;
    }

    public List<Agent> parse(String json) {
        try {
            return toAgents(mapper.readValue(json, AGENT_LIST));
        } catch (IOException e) {
            throw new DefinitionLoadException("Invalid agent definitions: "
                    + DefinitionMappers.rootCauseMessage(e), e);
        }
    }

    private List<Agent> toAgents(List<AgentDefinition> definitions) {
        var agents = new ArrayList<Agent>();
        var ids = new HashSet<String>();
        for (AgentDefinition definition : definitions == null ? List.<AgentDefinition>of() : definitions) {
            if (definition == null || definition.id() == null || definition.id().isBlank()) {
                throw new DefinitionLoadException("Agent definition without an id");
            }
            if (definition.type() == null) {
                throw new DefinitionLoadException("Agent " + definition.id() + " has no type");
            }
            if (!ids.add(definition.id())) {
                throw new DefinitionLoadException("Duplicate agent id: " + definition.id());
            }
            agents.add(definition.toAgent());
        }
        return agents;
    }
}
