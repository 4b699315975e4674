package com.z254.butterfly.conclave.bootstrap;

import com.z254.butterfly.conclave.config.ConclaveProperties.AgentDefinition;
import com.z254.butterfly.conclave.config.ConclaveProperties.AgentKind;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Checks declarative agent definitions before any agent is built.
 */
public final class AgentDefinitionValidator {

    private AgentDefinitionValidator() {
    }

    /**
     * @param llmAvailable whether an {@code LlmClient} is available for LLM agents
     * @return the problems found, empty when every definition can be started
     */
    public static List<String> validate(List<AgentDefinition> definitions, boolean llmAvailable) {
        List<String> errors = new ArrayList<>();
        Set<String> names = new HashSet<>();
        for (int i = 0; i < definitions.size(); i++) {
            AgentDefinition definition = definitions.get(i);
            String label = definition.getName() == null || definition.getName().isBlank()
                    ? "agents[" + i + "]" : definition.getName();

            if (definition.getName() == null || definition.getName().isBlank()) {
                errors.add(label + ": name is required");
            } else if (!names.add(definition.getName())) {
                errors.add(label + ": duplicate agent name");
            }
            if (definition.getKind() == null) {
                errors.add(label + ": kind is required");
                continue;
            }
            if (definition.getMaxToolRounds() != null && definition.getMaxToolRounds() < 0) {
                errors.add(label + ": max-tool-rounds must not be negative");
            }
            validateKind(definition, definition.getKind(), label, llmAvailable, errors);
        }
        return errors;
    }

    private static void validateKind(AgentDefinition definition, AgentKind kind, String label,
                                     boolean llmAvailable, List<String> errors) {
        switch (kind) {
            case LLM -> {
                if (!llmAvailable) {
                    errors.add(label + ": LLM agents need an LlmClient bean");
                }
            }
            case SEQUENTIAL_COORDINATOR -> {
                if (definition.getAgents() == null || definition.getAgents().isEmpty()) {
                    errors.add(label + ": sequential coordinator needs agents");
                } else if (definition.getAgents().contains(definition.getName())) {
                    errors.add(label + ": sequential coordinator cannot list itself");
                }
            }
            case PHASED_COORDINATOR -> {
                List<List<String>> phases = definition.getPhases();
                if (phases == null || phases.isEmpty()) {
                    errors.add(label + ": phased coordinator needs phases");
                    return;
                }
                for (int p = 0; p < phases.size(); p++) {
                    List<String> phase = phases.get(p);
                    if (phase == null || phase.isEmpty()) {
                        errors.add(label + ": phase " + p + " has no agents");
                    } else if (new HashSet<>(phase).size() != phase.size()) {
                        errors.add(label + ": phase " + p + " lists an agent twice");
                    }
                }
            }
        }
    }
}
