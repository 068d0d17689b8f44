/**
 * Datagram transport port used by the UDP ping protocol.
 *
 * <p>Nothing in this package knows about ping framing or sessions. The only
 * production implementation lives in {@code transport.udp.netty}.</p>
 */
package com.questrail.coverage.transport;
