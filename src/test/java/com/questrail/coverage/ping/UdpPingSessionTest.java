package com.questrail.coverage.ping;

import com.questrail.coverage.model.IpVersion;
import com.questrail.coverage.model.PingFailure;
import com.questrail.coverage.model.SessionToken;
import com.questrail.coverage.time.DeterministicScheduler;
import com.questrail.coverage.time.ManualMonotonicClock;
import com.questrail.coverage.transport.FakeDatagramEndpoint;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * UdpPingSessionTest
 * -----------------------------------------------------------------------------
 * Drives the ping session over a fake datagram endpoint and a manual clock.
 */
class UdpPingSessionTest {

    private static final SocketAddress SERVER = new InetSocketAddress("127.0.0.1", 444);

    private ManualMonotonicClock clock;
    private DeterministicScheduler scheduler;
    private List<FakeDatagramEndpoint> endpoints;
    private List<IpVersion> requestedVersions;
    private CompletableFuture<SessionToken> nextToken;
    private UdpPingSession session;

    @BeforeEach
    void setUp() {
        clock = new ManualMonotonicClock();
        scheduler = new DeterministicScheduler(clock);
        endpoints = new ArrayList<>();
        requestedVersions = new ArrayList<>();
        nextToken = CompletableFuture.completedFuture(token("test-1", IpVersion.V4));

        session = new UdpPingSession(
                () -> nextToken,
                version -> {
                    requestedVersions.add(version);
                    FakeDatagramEndpoint endpoint = new FakeDatagramEndpoint();
                    endpoints.add(endpoint);
                    return endpoint;
                },
                token -> SERVER,
                clock,
                scheduler,
                Duration.ofSeconds(1),
                100);
    }

    @Test
    void initiateOpensEndpointForTokenIpVersion() throws Exception {
        nextToken = CompletableFuture.completedFuture(token("test-6", IpVersion.V6));

        PingSessionHandle handle = session.initiateSession().get();

        assertEquals("test-6", handle.token().testUuid());
        assertEquals(List.of(IpVersion.V6), requestedVersions);
        assertTrue(endpoints.get(0).isStarted());
    }

    @Test
    void successfulReplyCompletesWithRoundTripTime() throws Exception {
        PingSessionHandle handle = session.initiateSession().get();

        CompletableFuture<Duration> ping = session.sendPing(handle);
        FakeDatagramEndpoint endpoint = endpoints.get(0);
        assertEquals(1, endpoint.sent().size());
        assertEquals(SERVER, endpoint.sent().get(0).remote());
        assertEquals(100L, sequenceOf(endpoint.sent().get(0).payload()));

        clock.advanceMillis(23);
        endpoint.injectDatagram(SERVER, reply("RR01", 100));

        assertEquals(Duration.ofMillis(23), ping.get());
        assertEquals(0, session.outstandingPings());
    }

    @Test
    void missingReplyTimesOutAndLateReplyIsDropped() throws Exception {
        PingSessionHandle handle = session.initiateSession().get();
        CompletableFuture<Duration> ping = session.sendPing(handle);

        clock.advanceMillis(1000);
        scheduler.runDueTasks();

        assertEquals(PingFailure.TIMED_OUT, failureOf(ping));

        endpoints.get(0).injectDatagram(SERVER, reply("RR01", 100));
        assertEquals(0, session.outstandingPings());
    }

    @Test
    void pipelinedRepliesAreMatchedBySequence() throws Exception {
        PingSessionHandle handle = session.initiateSession().get();
        CompletableFuture<Duration> first = session.sendPing(handle);
        clock.advanceMillis(10);
        CompletableFuture<Duration> second = session.sendPing(handle);

        clock.advanceMillis(5);
        endpoints.get(0).injectDatagram(SERVER, reply("RR01", 101));
        clock.advanceMillis(20);
        endpoints.get(0).injectDatagram(SERVER, reply("RR01", 100));

        assertEquals(Duration.ofMillis(5), second.get());
        assertEquals(Duration.ofMillis(35), first.get());
    }

    @Test
    void errorReplyInvalidatesSessionAndFailsAllOutstanding() throws Exception {
        PingSessionHandle handle = session.initiateSession().get();
        CompletableFuture<Duration> first = session.sendPing(handle);
        CompletableFuture<Duration> second = session.sendPing(handle);

        endpoints.get(0).injectDatagram(SERVER, reply("RE01", 0));

        assertEquals(PingFailure.NEEDS_REINITIALIZATION, failureOf(first));
        assertEquals(PingFailure.NEEDS_REINITIALIZATION, failureOf(second));
        assertEquals(PingFailure.NEEDS_REINITIALIZATION, failureOf(session.sendPing(handle)));
    }

    @Test
    void staleHandleNeedsReinitialization() throws Exception {
        PingSessionHandle old = session.initiateSession().get();
        nextToken = CompletableFuture.completedFuture(token("test-2", IpVersion.V4));
        PingSessionHandle fresh = session.initiateSession().get();

        assertEquals(PingFailure.NEEDS_REINITIALIZATION, failureOf(session.sendPing(old)));
        assertTrue(endpoints.get(0).isStopped());
        assertFalse(session.sendPing(fresh).isDone());
    }

    @Test
    void malformedAndUnknownRepliesAreIgnored() throws Exception {
        PingSessionHandle handle = session.initiateSession().get();
        CompletableFuture<Duration> ping = session.sendPing(handle);

        endpoints.get(0).injectDatagram(SERVER, new byte[] {1, 2, 3});
        endpoints.get(0).injectDatagram(SERVER, reply("RR01", 999));

        assertFalse(ping.isDone());
        assertEquals(1, session.outstandingPings());
    }

    @Test
    void sendFailureIsNetworkIssue() throws Exception {
        PingSessionHandle handle = session.initiateSession().get();
        endpoints.get(0).failSends(true);

        assertEquals(PingFailure.NETWORK_ISSUE, failureOf(session.sendPing(handle)));
    }

    @Test
    void transportDownFailsOutstandingWithNetworkIssue() throws Exception {
        PingSessionHandle handle = session.initiateSession().get();
        CompletableFuture<Duration> ping = session.sendPing(handle);

        endpoints.get(0).injectTransportDown(new IOException("socket closed"));

        assertEquals(PingFailure.NETWORK_ISSUE, failureOf(ping));
    }

    @Test
    void invalidBase64TokenFailsInitiation() {
        nextToken = CompletableFuture.completedFuture(new SessionToken(
                "test-1", "%%%", "ping.example.net", 444, IpVersion.V4, null, null, null));

        assertEquals(PingFailure.NEEDS_REINITIALIZATION, failureOf(session.initiateSession()));
        assertTrue(endpoints.isEmpty());
    }

    @Test
    void closeFailsOutstandingAndStopsEndpoint() throws Exception {
        PingSessionHandle handle = session.initiateSession().get();
        CompletableFuture<Duration> ping = session.sendPing(handle);

        session.close();

        assertTrue(endpoints.get(0).isStopped());
        assertEquals(PingFailure.NETWORK_ISSUE, failureOf(ping));
    }

    static SessionToken token(String testUuid, IpVersion version) {
        return new SessionToken(testUuid, "dG9rZW4=", "ping.example.net", 444, version, null, null, null);
    }

    static byte[] reply(String tag, long sequence) {
        ByteBuffer buf = ByteBuffer.allocate(8);
        buf.put(tag.getBytes(StandardCharsets.US_ASCII));
        buf.putInt((int) sequence);
        return buf.array();
    }

    static long sequenceOf(byte[] request) {
        return Integer.toUnsignedLong(ByteBuffer.wrap(request, 4, 4).getInt());
    }

    static PingFailure failureOf(CompletableFuture<?> future) {
        assertTrue(future.isDone(), "future should be completed");
        ExecutionException e = assertThrows(ExecutionException.class, future::get);
        return PingFailureException.reasonOf(e);
    }
}
