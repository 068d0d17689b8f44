package com.questrail.coverage.ping;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Base64;
import java.util.Objects;
import java.util.Optional;

/**
 * PingDatagramCodec
 * =============================================================================
 * Wire format of the UDP ping protocol.
 *
 * <pre>
 *   request : "RP01" | seq (u32, big endian) | token bytes
 *   success : "RR01" | seq (u32, big endian)
 *   error   : "RE01" | seq (u32, big endian)
 * </pre>
 *
 * <p>The token is handed out Base64-encoded by the control server and sent on
 * the wire in its decoded form.</p>
 *
 * <p>Decoding never throws: anything that is not a well-formed reply yields
 * {@link Optional#empty()} and is dropped by the caller.</p>
 */
public final class PingDatagramCodec {

    static final byte[] REQUEST_TAG = "RP01".getBytes(StandardCharsets.US_ASCII);
    static final byte[] SUCCESS_TAG = "RR01".getBytes(StandardCharsets.US_ASCII);
    static final byte[] ERROR_TAG = "RE01".getBytes(StandardCharsets.US_ASCII);

    static final int TAG_LENGTH = 4;
    static final int REPLY_LENGTH = TAG_LENGTH + Integer.BYTES;

    /**
     * Decodes the Base64 token issued by the control server.
     *
     * @throws IllegalArgumentException if {@code base64Token} is not valid Base64
     */
    public byte[] decodeToken(String base64Token) {
        Objects.requireNonNull(base64Token, "base64Token");
        return Base64.getDecoder().decode(base64Token);
    }

    public byte[] encodeRequest(long sequence, byte[] token) {
        Objects.requireNonNull(token, "token");
        ByteBuffer buf = ByteBuffer.allocate(TAG_LENGTH + Integer.BYTES + token.length);
        buf.put(REQUEST_TAG);
        buf.putInt((int) sequence);
        buf.put(token);
        return buf.array();
    }

    public Optional<PingReply> decodeReply(byte[] payload) {
        if (payload == null || payload.length < REPLY_LENGTH) {
            return Optional.empty();
        }

        byte[] tag = Arrays.copyOfRange(payload, 0, TAG_LENGTH);
        PingReply.Kind kind;
        if (Arrays.equals(tag, SUCCESS_TAG)) {
            kind = PingReply.Kind.SUCCESS;
        }
        else if (Arrays.equals(tag, ERROR_TAG)) {
            kind = PingReply.Kind.ERROR;
        }
        else {
            return Optional.empty();
        }

        long sequence = Integer.toUnsignedLong(ByteBuffer.wrap(payload, TAG_LENGTH, Integer.BYTES).getInt());
        return Optional.of(new PingReply(kind, sequence));
    }
}
