package work.agentflow.engine.shared;

import java.nio.charset.StandardCharsets;

public final class Utf8 {
    private Utf8() {}

    /**
     * Decodes at most {@code limit} bytes, backing off so a multi-byte character is never split.
     */
    public static String prefix(byte[] bytes, int length, int limit) {
        var end = Math.min(length, limit);
        if (end < length) {
            while (end > 0 && (bytes[end] & 0xC0) == 0x80) {
                end--;
            }
        }
        return new String(bytes, 0, end, StandardCharsets.UTF_8);
    }
}
