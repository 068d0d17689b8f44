package com.questrail.coverage.transport;

import java.net.SocketAddress;
import java.util.concurrent.CompletableFuture;

/**
 * DatagramEndpoint
 * -----------------------------------------------------------------------------
 * Minimal port for the UDP channel between the client and a ping server.
 *
 * <p>The endpoint moves opaque byte arrays. Framing of the ping protocol lives in
 * {@code PingDatagramCodec}; request/reply matching and timeouts live in
 * {@code UdpPingSession}.</p>
 *
 * <p>Implementations may be backed by Netty or by a test harness.</p>
 */
public interface DatagramEndpoint
{
    /**
     * Start the endpoint and begin receiving datagrams.
     *
     * <p>On successful activation, the endpoint MUST notify its listener via
     * {@link DatagramEndpointListener#onTransportUp()} exactly once.</p>
     */
    void start();

    /**
     * Stop the endpoint and release all transport resources.
     *
     * <p>The listener is notified via
     * {@link DatagramEndpointListener#onTransportDown(Throwable)} at most once
     * per transition.</p>
     */
    void stop();

    /**
     * Send a datagram to the specified remote endpoint.
     *
     * @param remote  remote destination
     * @param payload datagram payload
     * @return a future completed when the datagram has been handed to the
     *         network stack, or completed exceptionally if the write failed or
     *         the endpoint is not up
     */
    CompletableFuture<Void> send(SocketAddress remote, byte[] payload);

    /**
     * Register the listener that receives inbound datagrams and lifecycle events.
     *
     * <p>This must be called before {@link #start()}.</p>
     */
    void setListener(DatagramEndpointListener listener);
}
