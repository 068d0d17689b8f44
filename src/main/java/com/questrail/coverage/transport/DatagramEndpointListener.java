package com.questrail.coverage.transport;

import java.net.SocketAddress;

/**
 * DatagramEndpointListener
 * -----------------------------------------------------------------------------
 * Callback sink for {@link DatagramEndpoint}.
 *
 * <p>Callbacks are delivered serially by the implementation. The Netty endpoint
 * delivers them on the channel's event loop, so there is a single receive path
 * per endpoint.</p>
 */
public interface DatagramEndpointListener
{
    /**
     * Called when the transport becomes usable.
     */
    void onTransportUp();

    /**
     * Called when the transport becomes unusable.
     *
     * @param cause diagnostic cause; {@code null} for an orderly shutdown
     */
    void onTransportDown(Throwable cause);

    /**
     * Called with each received datagram, copied out of any framework buffer.
     *
     * @param remote  sender address
     * @param payload full datagram payload
     */
    void onDatagram(SocketAddress remote, byte[] payload);
}
