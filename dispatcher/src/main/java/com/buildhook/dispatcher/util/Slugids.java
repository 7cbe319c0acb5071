package com.buildhook.dispatcher.util;

import java.nio.ByteBuffer;
import java.util.Base64;
import java.util.UUID;

/**
 * Taskcluster-style task ids: a v4 UUID as 22 characters of URL-safe base64.
 */
public final class Slugids {

    private Slugids() {}

    /**
     * A "nice" slug id: the first bit is cleared so the id never starts with
     * '-', which would be mistaken for a command-line flag.
     */
    public static String nice() {
        UUID uuid = UUID.randomUUID();
        ByteBuffer bytes = ByteBuffer.allocate(16)
                .putLong(uuid.getMostSignificantBits())
                .putLong(uuid.getLeastSignificantBits());
        byte[] raw = bytes.array();
        raw[0] &= 0x7f;
        return Base64.getUrlEncoder().withoutPadding().encodeToString(raw);
    }
}
