package com.questrail.coverage.ping;

import com.questrail.coverage.internal.time.Cancellable;
import com.questrail.coverage.internal.time.MonotonicClock;
import com.questrail.coverage.internal.time.MonotonicScheduler;
import com.questrail.coverage.model.IpVersion;
import com.questrail.coverage.model.PingFailure;
import com.questrail.coverage.model.SessionToken;
import com.questrail.coverage.transport.DatagramEndpoint;
import com.questrail.coverage.transport.DatagramEndpointListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;

/**
 * UdpPingSession
 * =============================================================================
 * UDP implementation of {@link PingSessionProtocol}.
 *
 * <h2>Session</h2>
 * {@link #initiateSession()} asks the {@link PingSessionInitiator} for a control
 * plane token, opens a fresh {@link DatagramEndpoint} for the token's address
 * family and resolves once the socket is up. Only the most recent session is
 * live; handles of earlier sessions fail with
 * {@link PingFailure#NEEDS_REINITIALIZATION}.
 *
 * <h2>Pipelining</h2>
 * Every request carries its own sequence number. Outstanding requests are kept in
 * a map keyed by that number and a reply is matched to its request only through
 * it, so replies may arrive in any order. Each request has its own reply timeout
 * armed on the {@link MonotonicScheduler}. A late reply for a request that has
 * already timed out is dropped.
 *
 * <h2>Failure classification</h2>
 * <ul>
 *   <li>no reply in time: {@link PingFailure#TIMED_OUT}, session stays valid</li>
 *   <li>send failure or socket down: {@link PingFailure#NETWORK_ISSUE}, session stays valid</li>
 *   <li>{@code RE01}: session invalidated, every outstanding request fails with
 *       {@link PingFailure#NEEDS_REINITIALIZATION}</li>
 * </ul>
 */
public final class UdpPingSession implements PingSessionProtocol {

    private static final Logger log = LoggerFactory.getLogger(UdpPingSession.class);

    private final PingSessionInitiator initiator;
    private final Function<IpVersion, DatagramEndpoint> endpointFactory;
    private final Function<SessionToken, SocketAddress> addressResolver;
    private final PingDatagramCodec codec = new PingDatagramCodec();
    private final MonotonicClock clock;
    private final MonotonicScheduler scheduler;
    private final Duration replyTimeout;

    private final AtomicLong generations = new AtomicLong();
    private final AtomicLong nextSequence;

    private volatile Connection current;

    public UdpPingSession(PingSessionInitiator initiator,
                          Function<IpVersion, DatagramEndpoint> endpointFactory,
                          MonotonicClock clock,
                          MonotonicScheduler scheduler,
                          Duration replyTimeout) {
        this(initiator,
                endpointFactory,
                token -> new InetSocketAddress(token.pingHost(), token.pingPort()),
                clock,
                scheduler,
                replyTimeout,
                ThreadLocalRandom.current().nextInt() & 0xFFFF_FFFFL);
    }

    /**
     * Full constructor.
     *
     * @param addressResolver maps a token to the ping server's socket address
     * @param initialSequence first sequence number; later ones increment and wrap at 2^32
     */
    public UdpPingSession(PingSessionInitiator initiator,
                          Function<IpVersion, DatagramEndpoint> endpointFactory,
                          Function<SessionToken, SocketAddress> addressResolver,
                          MonotonicClock clock,
                          MonotonicScheduler scheduler,
                          Duration replyTimeout,
                          long initialSequence) {
        this.initiator = Objects.requireNonNull(initiator, "initiator");
        this.endpointFactory = Objects.requireNonNull(endpointFactory, "endpointFactory");
        this.addressResolver = Objects.requireNonNull(addressResolver, "addressResolver");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.replyTimeout = Objects.requireNonNull(replyTimeout, "replyTimeout");
        if (replyTimeout.isNegative() || replyTimeout.isZero()) {
            throw new IllegalArgumentException("replyTimeout must be positive");
        }
        this.nextSequence = new AtomicLong(initialSequence & 0xFFFF_FFFFL);
    }

    @Override
    public CompletableFuture<PingSessionHandle> initiateSession() {
        return initiator.requestToken().thenCompose(this::open);
    }

    @Override
    public CompletableFuture<Duration> sendPing(PingSessionHandle session) {
        Objects.requireNonNull(session, "session");

        Connection connection = current;
        if (connection == null
                || connection.handle.generation() != session.generation()
                || connection.invalidated) {
            return CompletableFuture.failedFuture(new PingFailureException(
                    PingFailure.NEEDS_REINITIALIZATION, "ping session is no longer valid"));
        }
        return connection.send();
    }

    @Override
    public void close() {
        Connection connection;
        synchronized (this) {
            connection = current;
            current = null;
        }
        if (connection != null) {
            connection.close();
        }
    }

    /**
     * Number of requests awaiting a reply on the current session.
     */
    public int outstandingPings() {
        Connection connection = current;
        return connection == null ? 0 : connection.pending.size();
    }

    private CompletableFuture<PingSessionHandle> open(SessionToken token) {
        byte[] tokenBytes;
        try {
            tokenBytes = codec.decodeToken(token.pingToken());
        } catch (IllegalArgumentException e) {
            return CompletableFuture.failedFuture(new PingFailureException(
                    PingFailure.NEEDS_REINITIALIZATION, "ping token is not valid Base64", e));
        }

        PingSessionHandle handle = new PingSessionHandle(generations.incrementAndGet(), token);
        Connection connection = new Connection(
                handle,
                endpointFactory.apply(token.ipVersion()),
                addressResolver.apply(token),
                tokenBytes);

        Connection previous;
        synchronized (this) {
            previous = current;
            current = connection;
        }
        if (previous != null) {
            previous.close();
        }

        connection.endpoint.setListener(connection);
        connection.endpoint.start();

        return connection.up.thenApply(ignored -> {
            log.info("Ping session {} open to {} (test {})", handle.generation(), connection.remote, token.testUuid());
            return handle;
        });
    }

    /**
     * One open socket bound to one token, with its outstanding requests.
     */
    private final class Connection implements DatagramEndpointListener {

        private final PingSessionHandle handle;
        private final DatagramEndpoint endpoint;
        private final SocketAddress remote;
        private final byte[] tokenBytes;
        private final Map<Long, Pending> pending = new ConcurrentHashMap<>();
        private final CompletableFuture<Void> up = new CompletableFuture<>();

        private volatile boolean invalidated;

        private Connection(PingSessionHandle handle, DatagramEndpoint endpoint, SocketAddress remote, byte[] tokenBytes) {
            this.handle = handle;
            this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
            this.remote = Objects.requireNonNull(remote, "remote");
            this.tokenBytes = tokenBytes;
        }

        CompletableFuture<Duration> send() {
            long sequence = nextSequence.getAndIncrement() & 0xFFFF_FFFFL;
            Pending request = new Pending(clock.nowNanos());
            pending.put(sequence, request);

            request.timeout = scheduler.scheduleAfter(replyTimeout, clock, () -> fail(sequence,
                    new PingFailureException(PingFailure.TIMED_OUT, "no reply for ping " + sequence)));

            endpoint.send(remote, codec.encodeRequest(sequence, tokenBytes))
                    .whenComplete((ignored, error) -> {
                        if (error != null) {
                            fail(sequence, new PingFailureException(
                                    PingFailure.NETWORK_ISSUE, "could not send ping " + sequence, error));
                        }
                    });

            return request.result;
        }

        void close() {
            invalidated = true;
            endpoint.stop();
            failAll(PingFailure.NETWORK_ISSUE, "ping session closed");
        }

        @Override
        public void onTransportUp() {
            up.complete(null);
        }

        @Override
        public void onTransportDown(Throwable cause) {
            if (!up.isDone()) {
                up.completeExceptionally(new PingFailureException(
                        PingFailure.NETWORK_ISSUE, "could not open UDP socket", cause));
            }
            failAll(PingFailure.NETWORK_ISSUE, "UDP socket went down");
        }

        @Override
        public void onDatagram(SocketAddress sender, byte[] payload) {
            Optional<PingReply> decoded = codec.decodeReply(payload);
            if (decoded.isEmpty()) {
                log.debug("Dropping malformed datagram ({} bytes) from {}", payload.length, sender);
                return;
            }

            PingReply reply = decoded.get();
            if (reply.kind() == PingReply.Kind.ERROR) {
                log.warn("Ping server rejected session {} (sequence {})", handle.generation(), reply.sequence());
                invalidated = true;
                failAll(PingFailure.NEEDS_REINITIALIZATION, "ping server rejected the session token");
                return;
            }

            Pending request = pending.remove(reply.sequence());
            if (request == null) {
                log.debug("Dropping reply for unknown or expired ping {}", reply.sequence());
                return;
            }
            request.cancelTimeout();
            request.result.complete(Duration.ofNanos(Math.max(0, clock.nowNanos() - request.sentAtNanos)));
        }

        private void fail(long sequence, PingFailureException error) {
            Pending request = pending.remove(sequence);
            if (request != null) {
                request.cancelTimeout();
                request.result.completeExceptionally(error);
            }
        }

        private void failAll(PingFailure failure, String message) {
            List<Long> sequences = new ArrayList<>(pending.keySet());
            for (Long sequence : sequences) {
                fail(sequence, new PingFailureException(failure, message));
            }
        }
    }

    private static final class Pending {
        private final long sentAtNanos;
        private final CompletableFuture<Duration> result = new CompletableFuture<>();
        private volatile Cancellable timeout;

        private Pending(long sentAtNanos) {
            this.sentAtNanos = sentAtNanos;
        }

        void cancelTimeout() {
            Cancellable t = timeout;
            if (t != null) {
                t.cancel();
            }
        }
    }
}
