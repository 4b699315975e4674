package com.z254.butterfly.conclave.registry;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.butterfly.conclave.context.Context;
import com.z254.butterfly.conclave.domain.model.ToolDefinition;
import com.z254.butterfly.conclave.store.SharedStore;
import com.z254.butterfly.conclave.store.StoreException;
import com.z254.butterfly.conclave.tool.Tool;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

/**
 * Directory of the agents, contexts and tools sharing one {@link SharedStore}.
 *
 * <p>Registrations live in the store, so every process pointed at the same store sees the
 * same directory. Tool callbacks cannot be shared and stay in the process that registered
 * them.
 */
@Slf4j
public class Registry implements AutoCloseable {

    private final SharedStore store;
    private final ObjectMapper mapper;
    private final String keyPrefix;
    private final String agentsKey;
    private final String contextsKey;
    private final String toolsKey;

    private final Map<String, Tool> localTools = new ConcurrentHashMap<>();
    private final Set<String> ownedAgents = ConcurrentHashMap.newKeySet();

    public Registry(SharedStore store, ObjectMapper mapper, String keyPrefix) {
        this.store = store;
        this.mapper = mapper;
        this.keyPrefix = keyPrefix;
        this.agentsKey = keyPrefix + ":registry:agents";
        this.contextsKey = keyPrefix + ":registry:contexts";
        this.toolsKey = keyPrefix + ":registry:tools";
    }

    // --------------------------------------------------------------------------------------------
    // Agents
    // --------------------------------------------------------------------------------------------

    /**
     * @throws AgentNameConflictException if an agent with this name is already registered
     */
    public void registerAgent(String name, String description) {
        if (!store.mapSetIfAbsent(agentsKey, name, description == null ? "" : description)) {
            throw new AgentNameConflictException(name);
        }
        ownedAgents.add(name);
        log.info("Registered agent: {}", name);
    }

    public void unregisterAgent(String name) {
        store.mapDelete(agentsKey, name);
        if (ownedAgents.remove(name)) {
            log.info("Unregistered agent: {}", name);
        }
    }

    public Optional<String> getAgentDescription(String name) {
        return store.mapGet(agentsKey, name);
    }

    public Map<String, String> getAgents() {
        return store.mapGetAll(agentsKey);
    }

    /**
     * Lines of the form {@code name: description}, for prompts listing the available agents.
     */
    public Stream<String> getAgentNamesAndDescriptions() {
        return Stream.of(agentsKey)
                .flatMap(key -> store.mapGetAll(key).entrySet().stream())
                .map(entry -> entry.getKey() + ": " + entry.getValue());
    }

    // --------------------------------------------------------------------------------------------
    // Contexts
    // --------------------------------------------------------------------------------------------

    /**
     * Returns the named context, registering it first if nobody has yet.
     */
    public Context getOrCreateContext(String name) {
        if (store.mapSetIfAbsent(contextsKey, name, write(new ContextDescriptor(name, Instant.now())))) {
            log.info("Created context: {}", name);
        }
        return handle(name);
    }

    public Optional<Context> getContext(String name) {
        return doesContextExist(name) ? Optional.of(handle(name)) : Optional.empty();
    }

    public boolean doesContextExist(String name) {
        return store.mapExists(contextsKey, name);
    }

    public List<String> getContextNames() {
        return new ArrayList<>(store.mapGetAll(contextsKey).keySet());
    }

    /**
     * Drops the context registration and all of its state.
     */
    public void removeContext(String name) {
        handle(name).clear();
        store.mapDelete(contextsKey, name);
        log.info("Removed context: {}", name);
    }

    // --------------------------------------------------------------------------------------------
    // Tools
    // --------------------------------------------------------------------------------------------

    /**
     * Registers or replaces a tool.
     */
    public void registerTool(Tool tool) {
        store.mapSet(toolsKey, tool.getName(), write(ToolDescriptor.of(tool)));
        if (tool.getCallback() != null) {
            localTools.put(tool.getName(), tool);
        } else {
            localTools.remove(tool.getName());
        }
        log.info("Registered tool: {} (agent tool: {})", tool.getName(), tool.isAgentTool());
    }

    public Optional<Tool> getTool(String name) {
        return store.mapGet(toolsKey, name).map(this::toTool);
    }

    public Map<String, Tool> getTools() {
        Map<String, Tool> tools = new LinkedHashMap<>();
        store.mapGetAll(toolsKey).forEach((name, json) -> tools.put(name, toTool(json)));
        return tools;
    }

    /**
     * Definitions of the named tools that are registered, in the given order.
     */
    public List<ToolDefinition> getToolDefinitions(Collection<String> names) {
        List<ToolDefinition> definitions = new ArrayList<>();
        for (String name : names) {
            getTool(name).map(Tool::toDefinition).ifPresent(definitions::add);
        }
        return definitions;
    }

    @Override
    public void close() {
        for (String name : List.copyOf(ownedAgents)) {
            unregisterAgent(name);
        }
        localTools.clear();
    }

    private Context handle(String name) {
        return new Context(name, store, mapper, keyPrefix);
    }

    private Tool toTool(String json) {
        Tool tool = read(json).toTool();
        Tool local = localTools.get(tool.getName());
        return local != null ? tool.withCallback(local.getCallback()) : tool;
    }

    private String write(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new StoreException("Failed to serialize registry entry", e);
        }
    }

    private ToolDescriptor read(String json) {
        try {
            return mapper.readValue(json, ToolDescriptor.class);
        } catch (JsonProcessingException e) {
            throw new StoreException("Corrupt tool entry in registry", e);
        }
    }
}
