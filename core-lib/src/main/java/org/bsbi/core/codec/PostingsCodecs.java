package org.bsbi.core.codec;

import java.util.List;
import java.util.Locale;

/**
 * Lookup of the available {@link PostingsCodec} implementations by name.
 */
public final class PostingsCodecs {
    private PostingsCodecs() {}

    public static PostingsCodec forName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Codec name is required");
        }
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case StandardPostingsCodec.NAME -> new StandardPostingsCodec();
            case VbePostingsCodec.NAME -> new VbePostingsCodec();
            default -> throw new IllegalArgumentException(
                "Unknown codec: " + name + ". Valid options: " + String.join(", ", names()));
        };
    }

    public static List<String> names() {
        return List.of(StandardPostingsCodec.NAME, VbePostingsCodec.NAME);
    }
}
