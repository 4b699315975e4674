package com.z254.butterfly.conclave.context;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.butterfly.conclave.domain.model.ChatMessage;
import com.z254.butterfly.conclave.domain.model.CollaborationType;
import com.z254.butterfly.conclave.domain.model.Message;
import com.z254.butterfly.conclave.domain.model.ToolDefinition;
import com.z254.butterfly.conclave.store.SharedStore;
import com.z254.butterfly.conclave.store.StoreException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Shared state of a group of agents working on the same conversations.
 *
 * <p>A context is a stateless handle over the {@link SharedStore}: every getter reads the
 * store and every mutator is a single atomic store operation, so handles held by different
 * agents, or by different processes, always observe the same state. Obtain instances through
 * {@code Registry#getOrCreateContext(String)}.
 *
 * <p>Per-chat state lives in store maps whose field is the chat id. Getters return empty
 * values for unknown or null chat ids; mutators require a chat id.
 */
public class Context {

    private static final TypeReference<List<ChatMessage>> CHAT_HISTORY = new TypeReference<>() { };
    private static final TypeReference<List<String>> STRINGS = new TypeReference<>() { };
    private static final TypeReference<List<ToolDefinition>> TOOLS = new TypeReference<>() { };
    private static final TypeReference<List<List<String>>> PHASES = new TypeReference<>() { };

    private final String name;
    private final SharedStore store;
    private final ObjectMapper mapper;
    private final String keyBase;

    public Context(String name, SharedStore store, ObjectMapper mapper, String keyPrefix) {
        this.name = Objects.requireNonNull(name, "name");
        this.store = Objects.requireNonNull(store, "store");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.keyBase = keyPrefix + ":context:" + name + ":";
    }

    public String getName() {
        return name;
    }

    // --------------------------------------------------------------------------------------------
    // Participants and trace
    // --------------------------------------------------------------------------------------------

    /**
     * Adds the agent to the participants unless already present.
     */
    public void addParticipant(String agentName) {
        store.listAppendIfAbsent(key(Field.PARTICIPANTS), agentName);
    }

    public List<String> getParticipants() {
        return store.listRange(key(Field.PARTICIPANTS));
    }

    public void trace(Message message) {
        store.listAppend(key(Field.MESSAGE_TRACE), write(message));
    }

    public List<Message> getMessageTrace() {
        List<Message> trace = new ArrayList<>();
        for (String json : store.listRange(key(Field.MESSAGE_TRACE))) {
            trace.add(read(json, Message.class));
        }
        return trace;
    }

    // --------------------------------------------------------------------------------------------
    // Chat history
    // --------------------------------------------------------------------------------------------

    public void appendChatHistory(String chatId, ChatMessage entry) {
        appendTo(Field.CHAT_HISTORY, chatId, CHAT_HISTORY, entry);
    }

    public List<ChatMessage> getChatHistory(String chatId) {
        return readField(Field.CHAT_HISTORY, chatId, CHAT_HISTORY).orElse(List.of());
    }

    public Map<String, List<ChatMessage>> getChatHistories() {
        Map<String, List<ChatMessage>> histories = new LinkedHashMap<>();
        store.mapGetAll(key(Field.CHAT_HISTORY))
                .forEach((chatId, json) -> histories.put(chatId, read(json, CHAT_HISTORY)));
        return histories;
    }

    // --------------------------------------------------------------------------------------------
    // Tools
    // --------------------------------------------------------------------------------------------

    public void appendRequiredToolCall(String chatId, String toolName) {
        appendTo(Field.REQUIRED_TOOL_CALLS, chatId, STRINGS, toolName);
    }

    /**
     * Removes one pending call of the tool. Removing the last pending call deletes the
     * chat's entry; removing a call that is not pending does nothing.
     */
    public void removeRequiredToolCall(String chatId, String toolName) {
        store.mapUpdate(key(Field.REQUIRED_TOOL_CALLS), requireChat(chatId), current -> {
            if (current == null) {
                return null;
            }
            List<String> calls = new ArrayList<>(read(current, STRINGS));
            if (!calls.remove(toolName)) {
                return current;
            }
            return calls.isEmpty() ? null : write(calls);
        });
    }

    public List<String> getRequiredToolCalls(String chatId) {
        return readField(Field.REQUIRED_TOOL_CALLS, chatId, STRINGS).orElse(List.of());
    }

    public void appendAvailableTool(String chatId, ToolDefinition definition) {
        appendTo(Field.AVAILABLE_TOOLS, chatId, TOOLS, definition);
    }

    public List<ToolDefinition> getAvailableTools(String chatId) {
        return readField(Field.AVAILABLE_TOOLS, chatId, TOOLS).orElse(List.of());
    }

    // --------------------------------------------------------------------------------------------
    // Sequential collaboration
    // --------------------------------------------------------------------------------------------

    public void setAgentSequence(String chatId, List<String> agents) {
        store.mapSet(key(Field.AGENT_SEQUENCE), requireChat(chatId), write(List.copyOf(agents)));
    }

    public List<String> getAgentSequence(String chatId) {
        return readField(Field.AGENT_SEQUENCE, chatId, STRINGS).orElse(List.of());
    }

    /**
     * The agent following {@code currentAgent} in the chat's sequence. Empty when the
     * current agent is last or not part of the sequence.
     */
    public Optional<String> getNextAgentInSequence(String chatId, String currentAgent) {
        List<String> sequence = getAgentSequence(chatId);
        int index = sequence.indexOf(currentAgent);
        if (index < 0 || index + 1 >= sequence.size()) {
            return Optional.empty();
        }
        return Optional.of(sequence.get(index + 1));
    }

    public void setRouteResponseTo(String chatId, String agentName) {
        store.mapSet(key(Field.ROUTE_RESPONSE_TO), requireChat(chatId), agentName);
    }

    public Optional<String> getRouteResponseTo(String chatId) {
        if (chatId == null) {
            return Optional.empty();
        }
        return store.mapGet(key(Field.ROUTE_RESPONSE_TO), chatId);
    }

    // --------------------------------------------------------------------------------------------
    // Phased collaboration
    // --------------------------------------------------------------------------------------------

    public void setAgentPhaseAssignments(String chatId, List<List<String>> phases) {
        List<List<String>> copy = new ArrayList<>();
        phases.forEach(phase -> copy.add(List.copyOf(phase)));
        store.mapSet(key(Field.AGENT_PHASE_ASSIGNMENTS), requireChat(chatId), write(copy));
    }

    public List<List<String>> getAgentPhaseAssignments(String chatId) {
        return readField(Field.AGENT_PHASE_ASSIGNMENTS, chatId, PHASES).orElse(List.of());
    }

    /**
     * Moves the chat to the given phase and snapshots that phase's agents as the required
     * set.
     *
     * @throws IllegalArgumentException if the index is outside the phase assignments
     * @throws IllegalStateException    if the chat is already past that phase
     */
    public void setCurrentPhase(String chatId, int phaseIndex) {
        List<List<String>> phases = getAgentPhaseAssignments(requireChat(chatId));
        if (phaseIndex < 0 || phaseIndex >= phases.size()) {
            throw new IllegalArgumentException("Phase " + phaseIndex + " out of range for chat "
                    + chatId + " with " + phases.size() + " phases");
        }
        store.mapUpdate(key(Field.PHASE_STATE), chatId, current -> {
            if (current != null) {
                int existing = read(current, PhaseState.class).currentPhase();
                if (phaseIndex < existing) {
                    throw new IllegalStateException("Chat " + chatId + " is at phase " + existing
                            + ", cannot go back to phase " + phaseIndex);
                }
            }
            return write(new PhaseState(phaseIndex, phases.get(phaseIndex)));
        });
    }

    public Optional<Integer> getCurrentPhase(String chatId) {
        return readPhaseState(chatId).map(PhaseState::currentPhase);
    }

    /**
     * Advances the chat to the next phase and returns that phase's agents, which also
     * become the required set. Empty when no phase has been set or the chat is at its
     * last phase; the state is then left untouched.
     */
    public Optional<List<String>> getAgentsForNextPhase(String chatId) {
        if (chatId == null) {
            return Optional.empty();
        }
        List<List<String>> phases = getAgentPhaseAssignments(chatId);
        AtomicReference<List<String>> advancedTo = new AtomicReference<>();
        store.mapUpdate(key(Field.PHASE_STATE), chatId, current -> {
            advancedTo.set(null);
            if (current == null) {
                return null;
            }
            int next = read(current, PhaseState.class).currentPhase() + 1;
            if (next >= phases.size()) {
                return current;
            }
            advancedTo.set(List.copyOf(phases.get(next)));
            return write(new PhaseState(next, phases.get(next)));
        });
        return Optional.ofNullable(advancedTo.get());
    }

    public List<String> getRequiredAgentsForCurrentPhase(String chatId) {
        return readPhaseState(chatId).map(PhaseState::requiredAgents).orElse(List.of());
    }

    /**
     * Marks the agent as done with the current phase.
     *
     * @return true if this call removed the last required agent
     */
    public boolean removeRequiredAgentForCurrentPhase(String chatId, String agentName) {
        AtomicBoolean emptied = new AtomicBoolean();
        store.mapUpdate(key(Field.PHASE_STATE), requireChat(chatId), current -> {
            emptied.set(false);
            if (current == null) {
                return null;
            }
            PhaseState state = read(current, PhaseState.class);
            List<String> remaining = new ArrayList<>(state.requiredAgents());
            if (!remaining.remove(agentName)) {
                return current;
            }
            emptied.set(remaining.isEmpty());
            return write(new PhaseState(state.currentPhase(), remaining));
        });
        return emptied.get();
    }

    // --------------------------------------------------------------------------------------------
    // Queries and collaboration type
    // --------------------------------------------------------------------------------------------

    public void addQuery(String chatId, String query) {
        appendTo(Field.QUERIES, chatId, STRINGS, query);
    }

    public List<String> getQueries(String chatId) {
        return readField(Field.QUERIES, chatId, STRINGS).orElse(List.of());
    }

    public Optional<String> getCurrentQuery(String chatId) {
        List<String> queries = getQueries(chatId);
        return queries.isEmpty() ? Optional.empty() : Optional.of(queries.get(queries.size() - 1));
    }

    public void setCollaborationType(String chatId, CollaborationType type) {
        store.mapSet(key(Field.COLLABORATION_TYPE), requireChat(chatId), type.name());
    }

    public CollaborationType getCollaborationType(String chatId) {
        if (chatId == null) {
            return CollaborationType.INDEPENDENT;
        }
        return store.mapGet(key(Field.COLLABORATION_TYPE), chatId)
                .map(CollaborationType::valueOf)
                .orElse(CollaborationType.INDEPENDENT);
    }

    /**
     * Deletes everything stored for this context.
     */
    public void clear() {
        for (Field field : Field.values()) {
            store.delete(key(field));
        }
    }

    @Override
    public String toString() {
        return "Context[" + name + "]";
    }

    // --------------------------------------------------------------------------------------------
    // Internal helpers
    // --------------------------------------------------------------------------------------------

    private enum Field {
        PARTICIPANTS("participants"),
        MESSAGE_TRACE("message_trace"),
        CHAT_HISTORY("chat_history"),
        REQUIRED_TOOL_CALLS("required_tool_calls"),
        AVAILABLE_TOOLS("available_tools"),
        AGENT_SEQUENCE("agent_sequence"),
        ROUTE_RESPONSE_TO("route_response_to"),
        AGENT_PHASE_ASSIGNMENTS("agent_phase_assignments"),
        PHASE_STATE("phase_state"),
        QUERIES("queries"),
        COLLABORATION_TYPE("collaboration_type");

        private final String suffix;

        Field(String suffix) {
            this.suffix = suffix;
        }
    }

    private String key(Field field) {
        return keyBase + field.suffix;
    }

    private Optional<PhaseState> readPhaseState(String chatId) {
        if (chatId == null) {
            return Optional.empty();
        }
        return store.mapGet(key(Field.PHASE_STATE), chatId).map(json -> read(json, PhaseState.class));
    }

    private <T> Optional<T> readField(Field field, String chatId, TypeReference<T> type) {
        if (chatId == null) {
            return Optional.empty();
        }
        return store.mapGet(key(field), chatId).map(json -> read(json, type));
    }

    private <T> void appendTo(Field field, String chatId, TypeReference<List<T>> type, T element) {
        store.mapUpdate(key(field), requireChat(chatId), current -> {
            List<T> list = current == null ? new ArrayList<>() : new ArrayList<>(read(current, type));
            list.add(element);
            return write(list);
        });
    }

    private static String requireChat(String chatId) {
        return Objects.requireNonNull(chatId, "chatId");
    }

    private String write(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new StoreException("Failed to serialize state of context " + name, e);
        }
    }

    private <T> T read(String json, Class<T> type) {
        try {
            return mapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new StoreException("Corrupt state in context " + name, e);
        }
    }

    private <T> T read(String json, TypeReference<T> type) {
        try {
            return mapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new StoreException("Corrupt state in context " + name, e);
        }
    }
}
