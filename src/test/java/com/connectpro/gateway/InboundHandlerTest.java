package com.connectpro.gateway;

import com.connectpro.MutableClock;
import com.connectpro.channels.FakeTransport;
import com.connectpro.channels.TransportException;
import com.connectpro.maintenance.CleanupReport;
import com.connectpro.maintenance.RetentionSweep;
import com.connectpro.observability.DoctorCommand;
import com.connectpro.observability.RelayMetrics;
import com.connectpro.policy.Footer;
import com.connectpro.policy.PolicyEngine;
import com.connectpro.routing.MessageRouter;
import com.connectpro.shared.config.PolicyConfig;
import com.connectpro.shared.model.InboundEvent;
import com.connectpro.shared.model.OnboardingStep;
import com.connectpro.shared.model.Owner;
import com.connectpro.shared.model.OwnerMode;
import com.connectpro.store.InMemoryRecordStore;
import com.connectpro.tenants.TenantOrchestrator;
import com.connectpro.tenants.TenantRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class InboundHandlerTest {

    private static final Instant NOON = Instant.parse("2026-03-10T12:00:00Z");
    private static final long SHOP = 100;
    private static final long TENANT = 200;
    private static final long ALICE = 7;
    private static final long ADMIN = 1;

    private final MutableClock clock = new MutableClock(NOON);
    private final InMemoryRecordStore store = new InMemoryRecordStore(clock);
    private final ExecutorService io = Executors.newCachedThreadPool();
    private final FakeTransport frontDoor = new FakeTransport("front");
    private final Map<Long, FakeTransport> tenantBots = new ConcurrentHashMap<>();
    private final TenantRegistry registry = new TenantRegistry(Duration.ofMillis(200));
    private final PolicyEngine policy = new PolicyEngine(PolicyConfig.defaults());
    private final Footer footer = new Footer("This Bot was made using @Connectsprobot");
    private final RelayMetrics metrics = new RelayMetrics();
    private final MessageRouter router = new MessageRouter(store, policy, registry, frontDoor, footer, io,
            Duration.ofSeconds(2), clock, metrics);
    private final TenantOrchestrator orchestrator = new TenantOrchestrator(store, registry,
            (id, cred) -> tenantBots.computeIfAbsent(id, k -> new FakeTransport(cred)), e -> { }, policy, frontDoor,
            io, Duration.ofSeconds(2), clock, metrics);
    private final RetentionSweep retention = mock(RetentionSweep.class);
    private final InboundHandler handler = new InboundHandler(store, router, orchestrator, retention,
            new DoctorCommand(store, registry, frontDoor), new Replies(policy.config(), footer, () -> "front_bot"),
            frontDoor, id -> id == ADMIN, io, Duration.ofSeconds(2));

    @AfterEach
    void tearDown() {
        orchestrator.shutdown();
        io.shutdownNow();
    }

    private void sharedShop() {
        store.putOwner(new Owner(SHOP, "shop", "Corner Shop", null, "Fresh bread", null, OwnerMode.SHARED_FRONT_DOOR,
                null, null, null, false, true, OnboardingStep.DONE, NOON));
    }

    private void dedicatedTenant(Instant trialStart, boolean expired) {
        store.putOwner(new Owner(TENANT, "tenant", "Tenant Co", null, null, null, OwnerMode.DEDICATED_CHANNEL,
                "tok", "tenant_bot", trialStart, expired, true, OnboardingStep.DONE, trialStart));
    }

    private static InboundEvent front(long sender, String text, Long replyTo) {
        return new InboundEvent(InboundEvent.Origin.FRONT_DOOR, null, sender, "user" + sender, "User" + sender,
                sender, text, 500 + sender, replyTo, NOON);
    }

    private static InboundEvent dedicated(long sender, String text, Long replyTo) {
        return new InboundEvent(InboundEvent.Origin.DEDICATED, TENANT, sender, "user" + sender, "User" + sender,
                sender, text, 600 + sender, replyTo, NOON);
    }

    private List<String> textsTo(FakeTransport transport, long chatId) {
        return transport.sent.stream().filter(m -> m.chatId() == chatId).map(m -> m.text()).toList();
    }

    @Test
    void unboundUserGetsHint() {
        handler.accept(front(ALICE, "hello", null));
        assertEquals(List.of(Replies.UNBOUND), textsTo(frontDoor, ALICE));
    }

    @Test
    void deepLinkBindsUserAndRoutesMessages() {
        sharedShop();
        handler.accept(front(ALICE, "/start owner_" + SHOP, null));
        handler.accept(front(ALICE, "Do you deliver?", null));

        assertEquals(SHOP, handler.boundOwner(ALICE).orElseThrow());
        var toAlice = textsTo(frontDoor, ALICE);
        assertTrue(toAlice.get(0).contains("Corner Shop"));
        assertEquals("✅ Message sent! The owner will reply soon.", toAlice.get(1));
        assertTrue(textsTo(frontDoor, SHOP).get(0).contains("Do you deliver?"));
    }

    @Test
    void deepLinkToUnknownOwner() {
        handler.accept(front(ALICE, "/start owner_999", null));
        assertEquals(List.of("❌ This business is no longer available."), textsTo(frontDoor, ALICE));
        assertTrue(handler.boundOwner(ALICE).isEmpty());
    }

    @Test
    void limitReachedMessageNamesTheCap() {
        sharedShop();
        handler.accept(front(ALICE, "/start owner_" + SHOP, null));
        handler.accept(front(ALICE, "one", null));
        handler.accept(front(ALICE, "two", null));
        handler.accept(front(ALICE, "three", null));

        var toAlice = textsTo(frontDoor, ALICE);
        assertEquals("📫 You've reached your daily limit of 2 messages.\n\nTry again tomorrow!",
                toAlice.get(toAlice.size() - 1));
    }

    @Test
    void ownerRepliesByReplyingToForward() {
        sharedShop();
        handler.accept(front(ALICE, "/start owner_" + SHOP, null));
        handler.accept(front(ALICE, "Are you open?", null));
        var forwardId = 1002L;

        handler.accept(front(SHOP, "Yes until 6", forwardId));

        assertEquals(List.of("✅ Reply sent!"), textsTo(frontDoor, SHOP).subList(1, 2));
        var toAlice = textsTo(frontDoor, ALICE);
        assertEquals("📬 Reply from Corner Shop:\n\nYes until 6", toAlice.get(toAlice.size() - 1));
    }

    @Test
    void ownerReplyCommandAddressesUserById() {
        sharedShop();
        handler.accept(front(ALICE, "/start owner_" + SHOP, null));
        handler.accept(front(ALICE, "Are you open?", null));

        handler.accept(front(SHOP, "/reply " + ALICE + " We are", null));

        var toAlice = textsTo(frontDoor, ALICE);
        assertEquals("📬 Reply from Corner Shop:\n\nWe are", toAlice.get(toAlice.size() - 1));
    }

    @Test
    void ownerStatsCommand() {
        sharedShop();
        handler.accept(front(ALICE, "/start owner_" + SHOP, null));
        handler.accept(front(ALICE, "Are you open?", null));

        handler.accept(front(SHOP, "/stats", null));

        var toShop = textsTo(frontDoor, SHOP);
        var stats = toShop.get(toShop.size() - 1);
        assertTrue(stats.contains("Users: 1"));
        assertTrue(stats.contains("Messages: 1"));
    }

    @Test
    void dedicatedBotRoutesAndAcksWithFooter() {
        dedicatedTenant(NOON.minus(Duration.ofDays(5)), false);
        orchestrator.startAll();
        var bot = tenantBots.get(TENANT);

        handler.accept(dedicated(ALICE, "Hi there", null));

        assertTrue(textsTo(bot, TENANT).get(0).contains("Hi there"));
        assertEquals(footer.add("✅ Message sent! The owner will reply soon."), textsTo(bot, ALICE).get(0));
        assertTrue(frontDoor.sent.isEmpty());
    }

    @Test
    void dedicatedOwnerMessagesAreReplies() {
        dedicatedTenant(NOON.minus(Duration.ofDays(5)), false);
        orchestrator.startAll();
        var bot = tenantBots.get(TENANT);
        handler.accept(dedicated(ALICE, "Hi there", null));

        handler.accept(dedicated(TENANT, "Hello Alice", 1001L));

        var toAlice = textsTo(bot, ALICE);
        assertEquals(footer.add("📬 Reply from Tenant Co:\n\nHello Alice"), toAlice.get(toAlice.size() - 1));
        assertEquals("✅ Reply sent!", textsTo(bot, TENANT).get(1));
    }

    @Test
    void dedicatedStartShowsTrialEndedNotice() {
        dedicatedTenant(NOON.minus(Duration.ofDays(5)), false);
        orchestrator.startAll();
        store.markTrialExpired(TENANT);

        handler.accept(dedicated(ALICE, "/start", null));

        assertEquals(List.of(Replies.TRIAL_ENDED), textsTo(tenantBots.get(TENANT), ALICE));
    }

    @Test
    void sharedRegistrationCreatesOwnerWithLink() {
        handler.accept(front(SHOP, "/register shared", null));

        var owner = store.getOwner(SHOP).orElseThrow();
        assertEquals(OwnerMode.SHARED_FRONT_DOOR, owner.mode());
        assertNull(owner.trialStart());
        assertTrue(textsTo(frontDoor, SHOP).get(0).contains("https://t.me/front_bot?start=owner_" + SHOP));

        handler.accept(front(ALICE, "/start owner_" + SHOP, null));
        assertEquals(SHOP, handler.boundOwner(ALICE).orElseThrow());
    }

    @Test
    void registerWithoutChoiceShowsOptions() {
        handler.accept(front(SHOP, "/register", null));

        assertEquals(List.of(Replies.REGISTER_USAGE), textsTo(frontDoor, SHOP));
        assertTrue(store.getOwner(SHOP).isEmpty());
    }

    @Test
    void dedicatedRegistrationThenTokenStartsBot() {
        handler.accept(front(TENANT, "/register dedicated", null));
        assertEquals(Replies.TOKEN_PROMPT, textsTo(frontDoor, TENANT).get(0));
        assertEquals(NOON, store.getOwner(TENANT).orElseThrow().trialStart());

        handler.accept(front(TENANT, "/token 123:abc", null));

        var owner = store.getOwner(TENANT).orElseThrow();
        assertEquals("123:abc", owner.credential());
        assertTrue(owner.eligibleForDedicated());
        assertTrue(registry.get(TENANT).isPresent());
        assertEquals(1, tenantBots.get(TENANT).opens.get());
        assertTrue(textsTo(frontDoor, TENANT).get(1).contains("@123:abc_bot"));
    }

    @Test
    void rejectedTokenIsReportedToOwner() {
        var bad = new FakeTransport("bad");
        bad.openFailure = new TransportException(TransportException.Reason.INVALID_CREDENTIAL, "401 Unauthorized");
        tenantBots.put(TENANT, bad);
        handler.accept(front(TENANT, "/register dedicated", null));

        handler.accept(front(TENANT, "/token bad", null));

        assertEquals(Replies.INVALID_TOKEN, textsTo(frontDoor, TENANT).get(1));
        assertFalse(store.getOwner(TENANT).orElseThrow().hasCredential());
        assertTrue(registry.get(TENANT).isEmpty());
    }

    @Test
    void tokenBeforeRegistrationIsRefused() {
        handler.accept(front(TENANT, "/token 123:abc", null));

        assertTrue(textsTo(frontDoor, TENANT).get(0).contains("/register dedicated"));
        assertTrue(tenantBots.isEmpty());
    }

    @Test
    void ownerListsRecentMessagesByCategory() {
        sharedShop();
        handler.accept(front(ALICE, "/start owner_" + SHOP, null));
        handler.accept(front(ALICE, "What is the price?", null));
        handler.accept(front(ALICE, "It is broken, please help", null));

        handler.accept(front(SHOP, "/messages support", null));
        handler.accept(front(SHOP, "/messages", null));

        var toShop = textsTo(frontDoor, SHOP);
        var support = toShop.get(toShop.size() - 2);
        assertTrue(support.contains("It is broken"));
        assertFalse(support.contains("price"));
        var all = toShop.get(toShop.size() - 1);
        assertTrue(all.contains("It is broken"));
        assertTrue(all.contains("price"));
    }

    @Test
    void hungAckDoesNotBlockTheHandler() {
        var slowFront = new FakeTransport("slow");
        slowFront.sendDelayMs = 60_000;
        var slowHandler = new InboundHandler(store, router, orchestrator, retention,
                new DoctorCommand(store, registry, slowFront), new Replies(policy.config(), footer), slowFront,
                id -> id == ADMIN, io, Duration.ofMillis(300));

        assertTimeoutPreemptively(Duration.ofSeconds(3), () -> slowHandler.accept(front(ALICE, "hello", null)));
        assertTrue(slowFront.sent.isEmpty());
    }

    @Test
    void adminCommandsRequireAdmin() {
        sharedShop();
        when(retention.run()).thenReturn(new CleanupReport(3, List.of()));
        when(retention.stats()).thenReturn(Map.of("retentionDays", 3L, "schedule", "0 0 3 * * *"));

        handler.accept(front(ADMIN, "/pause " + SHOP, null));
        handler.accept(front(ADMIN, "/cleanup", null));
        handler.accept(front(ALICE, "/pause " + SHOP, null));

        assertFalse(store.getOwner(SHOP).orElseThrow().active());
        var toAdmin = textsTo(frontDoor, ADMIN);
        assertEquals("⏸ Owner " + SHOP + " paused.", toAdmin.get(0));
        assertTrue(toAdmin.get(1).startsWith("Cleanup: 3 messages deleted"));
        assertEquals(List.of(Replies.UNBOUND), textsTo(frontDoor, ALICE));
        verify(retention, times(1)).run();
    }
}
