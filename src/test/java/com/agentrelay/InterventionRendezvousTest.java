package com.agentrelay;

import com.agentrelay.models.InterventionOutcome;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class InterventionRendezvousTest {

    private final ConnectionHandle connection = new ConnectionHandle();
    private final RecordingChannel channel = new RecordingChannel("controller");
    private final TelemetryEmitter telemetry = new TelemetryEmitter(connection, new ObjectMapper());
    private final ExecutorService pool = Executors.newCachedThreadPool();

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    @Test
    void completionWakesWaiterWithPayload() throws Exception {
        connection.attach(channel);
        InterventionRendezvous rendezvous = new InterventionRendezvous(telemetry, Duration.ofSeconds(10));

        Future<InterventionOutcome> waiter = pool.submit(
            () -> rendezvous.request("tab-1", "Solve the captcha", new CancellationToken("tab-1")));

        JsonNode frame = channel.await(RecordingChannel.ofType(TelemetryEmitter.TYPE_INTERVENTION_REQUIRED), 5000);
        assertNotNull(frame);
        assertEquals("Solve the captcha", frame.path("reason").asText());
        String id = frame.path("intervention_id").asText();
        assertEquals(1, rendezvous.pendingCount());

        assertTrue(rendezvous.complete(id, "done"));

        InterventionOutcome outcome = waiter.get(5, TimeUnit.SECONDS);
        assertTrue(outcome.isSuccess());
        assertEquals("done", outcome.getPayload());
        assertEquals("Human intervention completed for: Solve the captcha", outcome.getMessage());
        assertEquals(0, rendezvous.pendingCount());
    }

    @Test
    void unknownIdIsIgnored() {
        InterventionRendezvous rendezvous = new InterventionRendezvous(telemetry, Duration.ofSeconds(1));

        assertFalse(rendezvous.complete("no-such-id", null));
        assertFalse(rendezvous.complete(null, null));
    }

    @Test
    void blankReasonUsesDefault() throws Exception {
        connection.attach(channel);
        InterventionRendezvous rendezvous = new InterventionRendezvous(telemetry, Duration.ofMillis(50));

        rendezvous.request("tab-1", "  ", null);

        JsonNode frame = channel.await(RecordingChannel.ofType(TelemetryEmitter.TYPE_INTERVENTION_REQUIRED), 1000);
        assertEquals(InterventionRendezvous.DEFAULT_REASON, frame.path("reason").asText());
    }

    @Test
    void waitTimesOut() {
        connection.attach(channel);
        InterventionRendezvous rendezvous = new InterventionRendezvous(telemetry, Duration.ofMillis(100));

        InterventionOutcome outcome = rendezvous.request("tab-1", "Login", new CancellationToken("tab-1"));

        assertEquals(InterventionOutcome.Status.TIMEOUT, outcome.getStatus());
        assertEquals("Timeout waiting for human intervention", outcome.getMessage());
        assertEquals(0, rendezvous.pendingCount());
    }

    @Test
    void cancellingTokenEndsWait() throws Exception {
        connection.attach(channel);
        InterventionRendezvous rendezvous = new InterventionRendezvous(telemetry, Duration.ofSeconds(30));
        CancellationToken token = new CancellationToken("tab-1");

        Future<InterventionOutcome> waiter = pool.submit(() -> rendezvous.request("tab-1", "Login", token));
        assertNotNull(channel.await(RecordingChannel.ofType(TelemetryEmitter.TYPE_INTERVENTION_REQUIRED), 5000));

        token.cancel();

        InterventionOutcome outcome = waiter.get(5, TimeUnit.SECONDS);
        assertEquals(InterventionOutcome.Status.CANCELLED, outcome.getStatus());
        assertEquals(0, rendezvous.pendingCount());
    }

    @Test
    void alreadyCancelledTokenReturnsWithoutWaiting() {
        connection.attach(channel);
        InterventionRendezvous rendezvous = new InterventionRendezvous(telemetry, Duration.ofSeconds(30));
        CancellationToken token = new CancellationToken("tab-1");
        token.cancel();

        InterventionOutcome outcome = rendezvous.request("tab-1", "Login", token);

        assertEquals(InterventionOutcome.Status.CANCELLED, outcome.getStatus());
        assertTrue(channel.framesMatching(RecordingChannel.ofType(TelemetryEmitter.TYPE_INTERVENTION_REQUIRED)).isEmpty());
        assertEquals(0, rendezvous.pendingCount());
    }

    @Test
    void noControllerFailsImmediately() {
        InterventionRendezvous rendezvous = new InterventionRendezvous(telemetry, Duration.ofSeconds(30));

        InterventionOutcome outcome = rendezvous.request("tab-1", "Login", new CancellationToken("tab-1"));

        assertEquals(InterventionOutcome.Status.FAILED, outcome.getStatus());
        assertEquals(0, rendezvous.pendingCount());
    }

    @Test
    void cancelAllWakesEveryWaiter() throws Exception {
        connection.attach(channel);
        InterventionRendezvous rendezvous = new InterventionRendezvous(telemetry, Duration.ofSeconds(30));

        Future<InterventionOutcome> a = pool.submit(() -> rendezvous.request("tab-1", "A", null));
        Future<InterventionOutcome> b = pool.submit(() -> rendezvous.request("tab-2", "B", null));
        long deadline = System.currentTimeMillis() + 5000;
        while (rendezvous.pendingCount() < 2 && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }

        assertEquals(2, rendezvous.cancelAll());
        assertEquals(InterventionOutcome.Status.CANCELLED, a.get(5, TimeUnit.SECONDS).getStatus());
        assertEquals(InterventionOutcome.Status.CANCELLED, b.get(5, TimeUnit.SECONDS).getStatus());
    }

    @Test
    void lateCompletionAfterTimeoutIsUnknown() throws Exception {
        connection.attach(channel);
        InterventionRendezvous rendezvous = new InterventionRendezvous(telemetry, Duration.ofMillis(50));

        CompletableFuture.runAsync(() -> rendezvous.request("tab-1", "Login", null), pool).get(5, TimeUnit.SECONDS);
        String id = channel.await(RecordingChannel.ofType(TelemetryEmitter.TYPE_INTERVENTION_REQUIRED), 1000)
            .path("intervention_id").asText();

        assertFalse(rendezvous.complete(id, "late"));
    }
}
