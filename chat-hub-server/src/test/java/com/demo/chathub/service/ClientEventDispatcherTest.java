package com.demo.chathub.service;

import com.demo.chathub.domain.MemberRole;
import com.demo.chathub.infrastructure.BroadcastHub;
import com.demo.chathub.infrastructure.ConnectionSession;
import com.demo.chathub.service.provider.ConfiguredModelProviderRegistry;
import com.demo.chathub.support.InMemoryChatStore;
import com.demo.chathub.support.RecordingSink;
import com.demo.chathub.support.TestObjects;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;

class ClientEventDispatcherTest {

    private static final long ALICE = 1L;
    private static final long BOB = 2L;

    private ExecutorService executor;
    private ObjectMapper objectMapper;
    private InMemoryChatStore store;
    private BroadcastHub hub;
    private ClientEventDispatcher dispatcher;

    private RecordingSink aliceSink;
    private RecordingSink bobSink;
    private ConnectionSession alice;
    private ConnectionSession bob;

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
        objectMapper = TestObjects.objectMapper();
        store = new InMemoryChatStore();
        store.createChat("c1", ALICE);
        store.addMember("c1", BOB, MemberRole.MEMBER);
        hub = new BroadcastHub(16);

        MetricsService metrics = new MetricsService();
        MessageService messageService = new MessageService(store, hub, metrics);
        CompletionFanOut fanOut = new CompletionFanOut(
                new ConfiguredModelProviderRegistry(List.of(), null), messageService, executor, metrics);
        dispatcher = new ClientEventDispatcher(objectMapper, messageService,
                new ChatService(store, hub, metrics), fanOut, hub, metrics);

        aliceSink = new RecordingSink();
        bobSink = new RecordingSink();
        alice = connect(ALICE, aliceSink);
        bob = connect(BOB, bobSink);
    }

    @AfterEach
    void tearDown() {
        alice.close();
        bob.close();
        executor.shutdownNow();
    }

    private ConnectionSession connect(long userId, RecordingSink sink) {
        ConnectionSession session = new ConnectionSession("ws-" + userId, TestObjects.user(userId), sink,
                objectMapper, hub, executor, new MetricsService(), 32);
        session.start("1.0");
        sink.awaitType("hello", 1);
        return session;
    }

    @Test
    void messageReachesSubscriberAndUnsubscribedMember() {
        dispatcher.handleFrame(alice, "{\"type\":\"subscribe\",\"chat_id\":\"c1\"}");
        aliceSink.awaitType("subscribed", 1);

        dispatcher.handleFrame(alice, "{\"type\":\"send_message\",\"chat_id\":\"c1\",\"content\":\"hello bob\"}");

        aliceSink.awaitType("error", 1);
        RecordingSink.settle();
        assertThat(aliceSink.framesOfType("message")).hasSize(1);
        assertThat(aliceSink.types()).containsSubsequence("subscribed", "message", "error");
        assertThat(aliceSink.framesOfType("error").get(0).path("message").asText())
                .isEqualTo(CompletionFanOut.NO_MODEL_CONFIGURED);

        JsonNode bobMessage = bobSink.awaitType("message", 1).get(1);
        assertThat(bobMessage.path("content").asText()).isEqualTo("hello bob");
        assertThat(bobMessage.path("user_id").asLong()).isEqualTo(ALICE);
        assertThat(bobMessage.path("chat_id").asText()).isEqualTo("c1");
        assertThat(bobMessage.has("model")).isFalse();
    }

    @Test
    void legacyMessageTypeWithSingleModelNameIsAcceptedAsSendMessage() {
        dispatcher.handleFrame(alice, "{\"type\":\"message\",\"chat_id\":\"c1\",\"content\":\"hi\",\"models\":\"gpt-x\"}");

        aliceSink.awaitType("error", 1);
        assertThat(store.messagesOf("c1")).hasSize(1);
        assertThat(aliceSink.framesOfType("error").get(0).path("message").asText())
                .isEqualTo("LLM provider not available for gpt-x: No provider registered for model gpt-x");
    }

    @Test
    void subscribeToForeignChatIsRejected() {
        store.createChat("private", 99L);

        dispatcher.handleFrame(bob, "{\"type\":\"subscribe\",\"chat_id\":\"private\"}");

        JsonNode error = bobSink.awaitType("error", 1).get(1);
        assertThat(error.path("message").asText()).isEqualTo("Not a member of this chat");
        assertThat(bob.isSubscribed("private")).isFalse();
    }

    @Test
    void typingRequiresSubscriptionAndGoesToChatSubscribersOnly() {
        dispatcher.handleFrame(bob, "{\"type\":\"typing\",\"chat_id\":\"c1\",\"is_typing\":true}");
        JsonNode rejected = bobSink.awaitType("error", 1).get(1);
        assertThat(rejected.path("message").asText()).isEqualTo(ClientEventDispatcher.NOT_SUBSCRIBED);

        dispatcher.handleFrame(alice, "{\"type\":\"subscribe\",\"chat_id\":\"c1\"}");
        dispatcher.handleFrame(bob, "{\"type\":\"subscribe\",\"chat_id\":\"c1\"}");
        aliceSink.awaitType("subscribed", 1);
        bobSink.awaitType("subscribed", 1);

        dispatcher.handleFrame(bob, "{\"type\":\"typing\",\"chat_id\":\"c1\",\"is_typing\":true}");

        JsonNode typing = aliceSink.awaitType("typing", 1).get(2);
        assertThat(typing.path("user_id").asLong()).isEqualTo(BOB);
        assertThat(typing.path("is_typing").asBoolean()).isTrue();
    }

    @Test
    void unsubscribeIsAcknowledgedEvenWhenNotSubscribed() {
        dispatcher.handleFrame(alice, "{\"type\":\"unsubscribe\",\"chat_id\":\"c1\"}");
        dispatcher.handleFrame(alice, "{\"type\":\"unsubscribe\",\"chat_id\":\"c1\"}");

        List<JsonNode> acks = aliceSink.awaitType("unsubscribed", 2);
        assertThat(acks).extracting(f -> f.path("type").asText()).doesNotContain("error");
    }

    @Test
    void malformedFrameGetsErrorAndConnectionStaysUsable() {
        dispatcher.handleFrame(alice, "{not json");
        dispatcher.handleFrame(alice, "{\"type\":\"teleport\"}");
        dispatcher.handleFrame(alice, "{\"type\":\"ping\"}");

        aliceSink.awaitType("pong", 1);
        assertThat(aliceSink.framesOfType("error"))
                .extracting(f -> f.path("message").asText())
                .containsExactly("Invalid event format", "Invalid event format");
        assertThat(alice.isOpen()).isTrue();
    }

    @Test
    void createMessageWithUnknownRoleIsRejected() {
        dispatcher.handleFrame(alice,
                "{\"type\":\"create_message\",\"chat_id\":\"c1\",\"content\":\"x\",\"role\":\"wizard\"}");

        JsonNode error = aliceSink.awaitType("error", 1).get(1);
        assertThat(error.path("message").asText()).isEqualTo("Unknown message role: wizard");
        assertThat(store.messagesOf("c1")).isEmpty();
    }

    @Test
    void editAndDeleteFlowReachesOtherMember() {
        dispatcher.handleFrame(bob,
                "{\"type\":\"create_message\",\"chat_id\":\"c1\",\"content\":\"v1\",\"role\":\"user\"}");
        String messageId = bobSink.awaitType("message", 1).get(1).path("message_id").asText();

        dispatcher.handleFrame(bob, "{\"type\":\"update_message\",\"chat_id\":\"c1\",\"message_id\":\""
                + messageId + "\",\"content\":\"v2\"}");
        JsonNode updated = aliceSink.awaitType("message_updated", 1).stream()
                .filter(f -> "message_updated".equals(f.path("type").asText()))
                .findFirst().orElseThrow();
        assertThat(updated.path("message").path("content").asText()).isEqualTo("v2");

        dispatcher.handleFrame(alice, "{\"type\":\"get_message_edits\",\"chat_id\":\"c1\",\"message_id\":\""
                + messageId + "\"}");
        JsonNode edits = aliceSink.awaitType("message_edits", 1).stream()
                .filter(f -> "message_edits".equals(f.path("type").asText()))
                .findFirst().orElseThrow();
        assertThat(edits.path("edits").get(0).path("old_content").asText()).isEqualTo("v1");

        dispatcher.handleFrame(alice, "{\"type\":\"delete_message\",\"chat_id\":\"c1\",\"message_id\":\""
                + messageId + "\"}");
        bobSink.awaitType("message_deleted", 1);
        assertThat(store.messagesOf("c1")).isEmpty();
    }

    @Test
    void memberCannotEditOwnersMessage() {
        dispatcher.handleFrame(alice,
                "{\"type\":\"create_message\",\"chat_id\":\"c1\",\"content\":\"mine\",\"role\":\"user\"}");
        String messageId = aliceSink.awaitType("message", 1).stream()
                .filter(f -> "message".equals(f.path("type").asText()))
                .findFirst().orElseThrow()
                .path("message_id").asText();

        dispatcher.handleFrame(bob, "{\"type\":\"update_message\",\"chat_id\":\"c1\",\"message_id\":\""
                + messageId + "\",\"content\":\"hijack\"}");

        assertThat(bobSink.awaitType("error", 1).stream()
                .filter(f -> "error".equals(f.path("type").asText()))
                .findFirst().orElseThrow()
                .path("message").asText()).isEqualTo("Not allowed to edit this message");
    }

    @Test
    void historyListsMessagesInOrder() {
        dispatcher.handleFrame(alice,
                "{\"type\":\"create_message\",\"chat_id\":\"c1\",\"content\":\"first\",\"role\":\"user\"}");
        dispatcher.handleFrame(alice,
                "{\"type\":\"create_message\",\"chat_id\":\"c1\",\"content\":\"second\",\"role\":\"system\"}");

        dispatcher.handleFrame(bob, "{\"type\":\"get_messages\",\"chat_id\":\"c1\"}");

        JsonNode list = bobSink.awaitType("messages", 1).stream()
                .filter(f -> "messages".equals(f.path("type").asText()))
                .findFirst().orElseThrow();
        assertThat(list.path("messages")).hasSize(2);
        assertThat(list.path("messages").get(0).path("content").asText()).isEqualTo("first");
        assertThat(list.path("messages").get(1).path("role").asText()).isEqualTo("system");
    }

    @Test
    void ownerDeletesChatAndSubscribersAreDetached() {
        dispatcher.handleFrame(bob, "{\"type\":\"subscribe\",\"chat_id\":\"c1\"}");
        bobSink.awaitType("subscribed", 1);

        dispatcher.handleFrame(alice, "{\"type\":\"delete_chat\",\"chat_id\":\"c1\"}");

        bobSink.awaitType("chat_deleted", 1);
        aliceSink.awaitType("chat_deleted", 1);
        RecordingSink.settle();
        assertThat(bobSink.framesOfType("chat_deleted")).hasSize(1);
        assertThat(bob.isSubscribed("c1")).isFalse();
        assertThat(store.chatExists("c1")).isFalse();
    }

    @Test
    void createdChatComesBackToItsCreator() {
        dispatcher.handleFrame(bob, "{\"type\":\"create_chat\",\"title\":\"Side project\",\"chat_type\":\"group\"}");

        JsonNode created = bobSink.awaitType("chat_created", 1).stream()
                .filter(f -> "chat_created".equals(f.path("type").asText()))
                .findFirst().orElseThrow();
        RecordingSink.settle();
        assertThat(bobSink.framesOfType("chat_created")).hasSize(1);
        assertThat(created.path("chat").path("title").asText()).isEqualTo("Side project");
        assertThat(created.path("chat").path("created_by").asLong()).isEqualTo(BOB);

        dispatcher.handleFrame(bob, "{\"type\":\"subscribe\",\"chat_id\":\""
                + created.path("chat").path("id").asText() + "\"}");
        bobSink.awaitType("subscribed", 1);
    }

    @Test
    void membersAreListedWithWireRoles() {
        dispatcher.handleFrame(bob, "{\"type\":\"list_members\",\"chat_id\":\"c1\"}");

        JsonNode list = bobSink.awaitType("members", 1).stream()
                .filter(f -> "members".equals(f.path("type").asText()))
                .findFirst().orElseThrow();
        assertThat(list.path("chat_id").asText()).isEqualTo("c1");
        assertThat(list.path("members")).hasSize(2);
        assertThat(list.path("members").get(0).path("user_id").asLong()).isEqualTo(ALICE);
        assertThat(list.path("members").get(0).path("role").asText()).isEqualTo("owner");
        assertThat(list.path("members").get(1).path("role").asText()).isEqualTo("member");
    }

    @Test
    void promotedMemberIsToldAboutTheNewRole() {
        dispatcher.handleFrame(alice, "{\"type\":\"update_member_role\",\"chat_id\":\"c1\","
                + "\"member_user_id\":2,\"role\":\"admin\"}");

        JsonNode updated = bobSink.awaitType("member_updated", 1).stream()
                .filter(f -> "member_updated".equals(f.path("type").asText()))
                .findFirst().orElseThrow();
        assertThat(updated.path("member").path("user_id").asLong()).isEqualTo(BOB);
        assertThat(updated.path("member").path("role").asText()).isEqualTo("admin");
        aliceSink.awaitType("member_updated", 1);
    }

    @Test
    void removedMemberIsToldAndLosesItsSubscription() {
        dispatcher.handleFrame(bob, "{\"type\":\"subscribe\",\"chat_id\":\"c1\"}");
        bobSink.awaitType("subscribed", 1);

        dispatcher.handleFrame(alice, "{\"type\":\"remove_member\",\"chat_id\":\"c1\",\"member_user_id\":2}");

        JsonNode removed = bobSink.awaitType("member_removed", 1).stream()
                .filter(f -> "member_removed".equals(f.path("type").asText()))
                .findFirst().orElseThrow();
        assertThat(removed.path("user_id").asLong()).isEqualTo(BOB);
        aliceSink.awaitType("member_removed", 1);
        RecordingSink.settle();
        assertThat(bobSink.framesOfType("member_removed")).hasSize(1);
        assertThat(bob.isSubscribed("c1")).isFalse();

        dispatcher.handleFrame(alice, "{\"type\":\"send_message\",\"chat_id\":\"c1\",\"content\":\"bob is gone\"}");
        aliceSink.awaitType("message", 1);
        RecordingSink.settle();
        assertThat(bobSink.framesOfType("message")).isEmpty();
    }

    @Test
    void plainMemberCannotRemoveTheOwner() {
        dispatcher.handleFrame(bob, "{\"type\":\"remove_member\",\"chat_id\":\"c1\",\"member_user_id\":1}");

        JsonNode error = bobSink.awaitType("error", 1).get(1);
        assertThat(error.path("message").asText()).isEqualTo("Insufficient permissions");
        assertThat(store.operations).isEmpty();
    }

    @Test
    void subscribeLosingARaceWithChatDeletionLeavesNoChannelBehind() {
        InMemoryChatStore racingStore = new InMemoryChatStore() {
            private final AtomicBoolean deleted = new AtomicBoolean();

            @Override
            public long checkChatMembership(String chatId, long userId) {
                long chatKey = super.checkChatMembership(chatId, userId);
                if (deleted.compareAndSet(false, true)) {
                    deleteChat(chatKey);
                }
                return chatKey;
            }
        };
        racingStore.createChat("doomed", ALICE);
        MetricsService metrics = new MetricsService();
        MessageService messageService = new MessageService(racingStore, hub, metrics);
        ClientEventDispatcher racing = new ClientEventDispatcher(objectMapper, messageService,
                new ChatService(racingStore, hub, metrics),
                new CompletionFanOut(new ConfiguredModelProviderRegistry(List.of(), null),
                        messageService, executor, metrics),
                hub, metrics);

        racing.handleFrame(alice, "{\"type\":\"subscribe\",\"chat_id\":\"doomed\"}");

        JsonNode error = aliceSink.awaitType("error", 1).get(1);
        assertThat(error.path("message").asText()).isEqualTo("Not a member of this chat");
        assertThat(alice.isSubscribed("doomed")).isFalse();
        assertThat(hub.hasChatChannel("doomed")).isFalse();
        assertThat(aliceSink.framesOfType("subscribed")).isEmpty();
    }
}
