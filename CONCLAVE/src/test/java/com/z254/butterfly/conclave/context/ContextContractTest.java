package com.z254.butterfly.conclave.context;

import com.z254.butterfly.conclave.domain.model.ChatMessage;
import com.z254.butterfly.conclave.domain.model.CollaborationType;
import com.z254.butterfly.conclave.domain.model.Message;
import com.z254.butterfly.conclave.domain.model.ToolDefinition;
import com.z254.butterfly.conclave.store.SharedStore;
import com.z254.butterfly.conclave.support.ConclaveJson;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Behaviour every store backend must give a {@link Context}.
 */
abstract class ContextContractTest {

    protected SharedStore store;
    protected Context context;
    protected String chatId;

    protected abstract SharedStore createStore();

    protected void closeStore() {
    }

    @BeforeEach
    void createContext() {
        store = createStore();
        context = newHandle("ctx");
        chatId = UUID.randomUUID().toString();
    }

    @AfterEach
    void releaseStore() {
        closeStore();
    }

    protected Context newHandle(String name) {
        return new Context(name, store, ConclaveJson.mapper(), keyPrefix());
    }

    protected String keyPrefix() {
        return "test";
    }

    @Test
    @DisplayName("unknown chat ids read as empty defaults")
    void shouldReturnDefaultsForUnknownChat() {
        assertThat(context.getChatHistory(chatId)).isEmpty();
        assertThat(context.getRequiredToolCalls(chatId)).isEmpty();
        assertThat(context.getAvailableTools(chatId)).isEmpty();
        assertThat(context.getAgentSequence(chatId)).isEmpty();
        assertThat(context.getNextAgentInSequence(chatId, "A")).isEmpty();
        assertThat(context.getRouteResponseTo(chatId)).isEmpty();
        assertThat(context.getAgentPhaseAssignments(chatId)).isEmpty();
        assertThat(context.getCurrentPhase(chatId)).isEmpty();
        assertThat(context.getRequiredAgentsForCurrentPhase(chatId)).isEmpty();
        assertThat(context.getAgentsForNextPhase(chatId)).isEmpty();
        assertThat(context.getQueries(chatId)).isEmpty();
        assertThat(context.getCurrentQuery(chatId)).isEmpty();
        assertThat(context.getCollaborationType(chatId)).isEqualTo(CollaborationType.INDEPENDENT);
        assertThat(context.getCollaborationType(null)).isEqualTo(CollaborationType.INDEPENDENT);
        assertThat(context.getChatHistory(null)).isEmpty();
    }

    @Test
    void shouldAddParticipantOnce() {
        context.addParticipant("A");
        context.addParticipant("B");
        context.addParticipant("A");

        assertThat(context.getParticipants()).containsExactly("A", "B");
    }

    @Test
    void shouldTraceMessagesInOrder() {
        Message first = Message.request("ctx", chatId, "one").withSender("A");
        Message second = Message.response("ctx", chatId, "two").withSender("B");

        context.trace(first);
        context.trace(second);

        assertThat(context.getMessageTrace()).containsExactly(first, second);
    }

    @Test
    void shouldReadChatHistoryInAppendOrder() {
        List<ChatMessage> entries = List.of(
                ChatMessage.user("question"),
                ChatMessage.assistant("first answer"),
                ChatMessage.assistant("second answer"));

        entries.forEach(entry -> context.appendChatHistory(chatId, entry));

        assertThat(context.getChatHistory(chatId)).containsExactlyElementsOf(entries);
        assertThat(context.getChatHistories()).containsOnlyKeys(chatId);
    }

    @Test
    void shouldKeepChatsApart() {
        String otherChat = UUID.randomUUID().toString();

        context.appendChatHistory(chatId, ChatMessage.user("mine"));
        context.setCollaborationType(chatId, CollaborationType.CHAT);

        assertThat(context.getChatHistory(otherChat)).isEmpty();
        assertThat(context.getCollaborationType(otherChat)).isEqualTo(CollaborationType.INDEPENDENT);
    }

    @Test
    void shouldShareStateBetweenHandles() {
        Context other = newHandle("ctx");

        context.appendChatHistory(chatId, ChatMessage.user("hello"));

        assertThat(other.getChatHistory(chatId)).containsExactly(ChatMessage.user("hello"));
        assertThat(newHandle("another").getChatHistory(chatId)).isEmpty();
    }

    @Nested
    @DisplayName("Tool bookkeeping")
    class ToolBookkeeping {

        @Test
        void shouldDeleteEntryWhenLastCallRemoved() {
            context.appendRequiredToolCall(chatId, "toolX");
            context.removeRequiredToolCall(chatId, "toolX");

            assertThat(context.getRequiredToolCalls(chatId)).isEmpty();
            assertThat(store.mapExists(keyPrefix() + ":context:ctx:required_tool_calls", chatId)).isFalse();
        }

        @Test
        void shouldRemoveOneCallAtATime() {
            context.appendRequiredToolCall(chatId, "toolX");
            context.appendRequiredToolCall(chatId, "toolX");
            context.removeRequiredToolCall(chatId, "toolX");

            assertThat(context.getRequiredToolCalls(chatId)).containsExactly("toolX");
        }

        @Test
        void shouldIgnoreRemovalOfUnknownCall() {
            context.appendRequiredToolCall(chatId, "toolX");

            context.removeRequiredToolCall(chatId, "toolY");
            context.removeRequiredToolCall(UUID.randomUUID().toString(), "toolX");

            assertThat(context.getRequiredToolCalls(chatId)).containsExactly("toolX");
        }

        @Test
        void shouldListAvailableToolsInOrder() {
            ToolDefinition search = ToolDefinition.function("search", "Search", Map.of("type", "object"));
            ToolDefinition fetch = ToolDefinition.function("fetch", "Fetch", Map.of("type", "object"));

            context.appendAvailableTool(chatId, search);
            context.appendAvailableTool(chatId, fetch);

            assertThat(context.getAvailableTools(chatId)).containsExactly(search, fetch);
        }
    }

    @Nested
    @DisplayName("Sequential state")
    class SequentialState {

        @Test
        void shouldWalkSequence() {
            context.setAgentSequence(chatId, List.of("A", "B", "C"));

            assertThat(context.getNextAgentInSequence(chatId, "A")).contains("B");
            assertThat(context.getNextAgentInSequence(chatId, "B")).contains("C");
            assertThat(context.getNextAgentInSequence(chatId, "C")).isEmpty();
            assertThat(context.getNextAgentInSequence(chatId, "Z")).isEmpty();
        }

        @Test
        void shouldStoreRouteResponseTarget() {
            context.setRouteResponseTo(chatId, "R");

            assertThat(context.getRouteResponseTo(chatId)).contains("R");
        }
    }

    @Nested
    @DisplayName("Phased state")
    class PhasedState {

        @BeforeEach
        void assignPhases() {
            context.setAgentPhaseAssignments(chatId, List.of(List.of("A", "B"), List.of("C")));
        }

        @Test
        void shouldRunThroughPhases() {
            context.setCurrentPhase(chatId, 0);
            assertThat(context.getCurrentPhase(chatId)).contains(0);
            assertThat(context.getRequiredAgentsForCurrentPhase(chatId)).containsExactly("A", "B");

            assertThat(context.removeRequiredAgentForCurrentPhase(chatId, "A")).isFalse();
            assertThat(context.removeRequiredAgentForCurrentPhase(chatId, "B")).isTrue();
            assertThat(context.getRequiredAgentsForCurrentPhase(chatId)).isEmpty();

            assertThat(context.getAgentsForNextPhase(chatId)).contains(List.of("C"));
            assertThat(context.getCurrentPhase(chatId)).contains(1);
            assertThat(context.getRequiredAgentsForCurrentPhase(chatId)).containsExactly("C");

            assertThat(context.getAgentsForNextPhase(chatId)).isEmpty();
            assertThat(context.getCurrentPhase(chatId)).contains(1);
        }

        @Test
        void shouldSnapshotRequiredAgents() {
            context.setCurrentPhase(chatId, 0);
            context.removeRequiredAgentForCurrentPhase(chatId, "A");

            assertThat(context.getAgentPhaseAssignments(chatId).get(0)).containsExactly("A", "B");
        }

        @Test
        void shouldIgnoreRemovalOfAgentNotRequired() {
            context.setCurrentPhase(chatId, 0);

            assertThat(context.removeRequiredAgentForCurrentPhase(chatId, "C")).isFalse();
            assertThat(context.getRequiredAgentsForCurrentPhase(chatId)).containsExactly("A", "B");
        }

        @Test
        void shouldReportEmptyingOnlyOnce() {
            context.setCurrentPhase(chatId, 1);

            assertThat(context.removeRequiredAgentForCurrentPhase(chatId, "C")).isTrue();
            assertThat(context.removeRequiredAgentForCurrentPhase(chatId, "C")).isFalse();
        }

        @Test
        void shouldRejectGoingBack() {
            context.setCurrentPhase(chatId, 1);

            assertThatThrownBy(() -> context.setCurrentPhase(chatId, 0))
                    .isInstanceOf(IllegalStateException.class);
            assertThat(context.getCurrentPhase(chatId)).contains(1);
        }

        @Test
        void shouldRejectUnknownPhase() {
            assertThatThrownBy(() -> context.setCurrentPhase(chatId, 2))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Test
    void shouldTrackQueries() {
        context.addQuery(chatId, "first");
        context.addQuery(chatId, "second");

        assertThat(context.getQueries(chatId)).containsExactly("first", "second");
        assertThat(context.getCurrentQuery(chatId)).contains("second");
    }

    @Test
    void shouldClearEverything() {
        context.addParticipant("A");
        context.appendChatHistory(chatId, ChatMessage.user("hi"));
        context.setCollaborationType(chatId, CollaborationType.PHASED);

        context.clear();

        assertThat(context.getParticipants()).isEmpty();
        assertThat(context.getChatHistory(chatId)).isEmpty();
        assertThat(context.getCollaborationType(chatId)).isEqualTo(CollaborationType.INDEPENDENT);
    }
}
