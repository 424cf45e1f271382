package io.edgesim.core.model;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Raw body bytes of a request or response.
 *
 * <p>
 * The record overrides {@code equals}/{@code hashCode} to use
 * {@link Arrays#equals(byte[], byte[])} for byte content comparison (records use
 * reference equality for arrays by default). The array is copied on the way in
 * and on the way out, so a body can be shared between pipeline stages.
 */
public record EventBody(byte[] content) {

    private static final EventBody EMPTY = new EventBody(new byte[0]);

    /** Canonical constructor; normalizes null content to an empty byte array. */
    public EventBody {
        content = content == null ? new byte[0] : content.clone();
    }

    @Override
    public byte[] content() {
        return content.clone();
    }

    /** True when there are no bytes. */
    public boolean isEmpty() {
        return content.length == 0;
    }

    /** Returns content as a UTF-8 string. */
    public String asString() {
        return new String(content, StandardCharsets.UTF_8);
    }

    /** Content length in bytes. */
    public int size() {
        return content.length;
    }

    // ── Factory methods ──

    /** Creates a body from raw bytes. */
    public static EventBody of(byte[] content) {
        return content == null || content.length == 0 ? EMPTY : new EventBody(content);
    }

    /** Creates a body from a string (UTF-8 encoded). */
    public static EventBody of(String content) {
        return content == null || content.isEmpty() ? EMPTY : new EventBody(content.getBytes(StandardCharsets.UTF_8));
    }

    /** Returns an empty body. */
    public static EventBody empty() {
        return EMPTY;
    }

    // ── equals / hashCode (byte-content-aware) ──

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EventBody that)) return false;
        return Arrays.equals(content, that.content);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(content);
    }

    @Override
    public String toString() {
        return "EventBody[" + content.length + " bytes]";
    }
}
