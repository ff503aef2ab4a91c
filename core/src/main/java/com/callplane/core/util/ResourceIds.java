package com.callplane.core.util;

import com.google.common.hash.HashCode;
import com.google.common.hash.Hashing;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.UUID;

/**
 * Name-based resource identifiers.
 * <p>
 * SHA-256 over a fixed namespace and the name, truncated to 128 bits and
 * stamped with the RFC 4122 version-5 and variant bits.
 * </p>
 */
public final class ResourceIds {
    private ResourceIds() {
    }

    private static final String NAMESPACE = "callplane:resource:";

    public static String fromName(String name) {
        HashCode hash = Hashing.sha256().hashString(NAMESPACE + name, StandardCharsets.UTF_8);
        byte[] bytes = new byte[16];
        System.arraycopy(hash.asBytes(), 0, bytes, 0, 16);

        bytes[6] &= 0x0f;
        bytes[6] |= 0x50;
        bytes[8] &= 0x3f;
        bytes[8] |= (byte) 0x80;

        ByteBuffer buffer = ByteBuffer.wrap(bytes);
        return new UUID(buffer.getLong(), buffer.getLong()).toString();
    }
}
