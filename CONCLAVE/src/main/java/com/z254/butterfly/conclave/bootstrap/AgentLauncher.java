package com.z254.butterfly.conclave.bootstrap;

import com.z254.butterfly.conclave.agent.AgentRuntime;
import com.z254.butterfly.conclave.config.ConclaveProperties;
import com.z254.butterfly.conclave.config.ConclaveProperties.AgentDefinition;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Starts the agents defined under {@code conclave.agents} with the application and stops
 * them, in reverse order, on shutdown.
 */
@Slf4j
@Component
public class AgentLauncher implements SmartLifecycle {

    private final ConclaveProperties properties;
    private final AgentFactory agentFactory;
    private final List<AgentRuntime> agents = new ArrayList<>();
    private volatile boolean running;

    public AgentLauncher(ConclaveProperties properties, AgentFactory agentFactory) {
        this.properties = properties;
        this.agentFactory = agentFactory;
    }

    @Override
    public synchronized void start() {
        List<AgentDefinition> definitions = properties.getAgents();
        List<String> errors = AgentDefinitionValidator.validate(definitions, agentFactory.isLlmAvailable());
        if (!errors.isEmpty()) {
            throw new InvalidAgentDefinitionException(errors);
        }
        try {
            for (AgentDefinition definition : definitions) {
                AgentRuntime agent = agentFactory.create(definition);
                agent.start();
                agents.add(agent);
            }
        } catch (RuntimeException e) {
            stopAll();
            throw e;
        }
        running = true;
        log.info("Started {} configured agents", agents.size());
    }

    @Override
    public synchronized void stop() {
        stopAll();
        agentFactory.pruneQueues();
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    public synchronized List<AgentRuntime> getAgents() {
        return List.copyOf(agents);
    }

    private void stopAll() {
        List<AgentRuntime> reversed = new ArrayList<>(agents);
        Collections.reverse(reversed);
        for (AgentRuntime agent : reversed) {
            agent.stop();
        }
        agents.clear();
    }
}
