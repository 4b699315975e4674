package com.z254.butterfly.conclave.bootstrap;

import com.z254.butterfly.conclave.agent.AgentRuntime;
import com.z254.butterfly.conclave.agent.AgentServices;
import com.z254.butterfly.conclave.agent.impl.LlmAgent;
import com.z254.butterfly.conclave.agent.impl.PhasedCoordinator;
import com.z254.butterfly.conclave.agent.impl.SequentialCoordinator;
import com.z254.butterfly.conclave.config.ConclaveProperties;
import com.z254.butterfly.conclave.config.ConclaveProperties.AgentDefinition;
import com.z254.butterfly.conclave.llm.LlmClient;
import com.z254.butterfly.conclave.transport.AgentTransport;
import com.z254.butterfly.conclave.transport.InProcessMessageBus;
import com.z254.butterfly.conclave.transport.InProcessTransport;
import com.z254.butterfly.conclave.transport.MessageCodec;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

/**
 * Builds agents from their declarative definitions, each on its own in-process transport.
 */
@Component
public class AgentFactory {

    private final AgentServices services;
    private final InProcessMessageBus bus;
    private final MessageCodec codec;
    private final ObjectProvider<LlmClient> llmClient;
    private final ConclaveProperties properties;

    public AgentFactory(AgentServices services, InProcessMessageBus bus, MessageCodec codec,
                        ObjectProvider<LlmClient> llmClient, ConclaveProperties properties) {
        this.services = services;
        this.bus = bus;
        this.codec = codec;
        this.llmClient = llmClient;
        this.properties = properties;
    }

    public boolean isLlmAvailable() {
        return llmClient.getIfAvailable() != null;
    }

    public AgentRuntime create(AgentDefinition definition) {
        AgentTransport transport = new InProcessTransport(definition.getName(), bus, codec);
        return switch (definition.getKind()) {
            case LLM -> new LlmAgent(definition.getName(), definition.getDescription(), transport, services,
                    llmClient.getObject(), definition.getSystemMessage(), maxToolRounds(definition));
            case SEQUENTIAL_COORDINATOR -> new SequentialCoordinator(definition.getName(),
                    definition.getDescription(), transport, services, definition.getAgents());
            case PHASED_COORDINATOR -> new PhasedCoordinator(definition.getName(),
                    definition.getDescription(), transport, services, definition.getPhases());
        };
    }

    /**
     * Drops bus queues addressed to agents the registry no longer lists.
     */
    public int pruneQueues() {
        return bus.pruneQueues(services.registry().getAgents().keySet());
    }

    private int maxToolRounds(AgentDefinition definition) {
        return definition.getMaxToolRounds() != null
                ? definition.getMaxToolRounds()
                : properties.getLlmAgent().getMaxToolRounds();
    }
}
