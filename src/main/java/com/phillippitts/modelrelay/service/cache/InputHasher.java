package com.phillippitts.modelrelay.service.cache;

import com.phillippitts.modelrelay.domain.ChatMessage;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.List;

/**
 * Derives the 64-bit cache key of a chat request.
 *
 * <p>The key is the first eight bytes of a SHA-256 digest over the model, every (role, content)
 * pair in order, and the sampling parameters. Every string is length-prefixed so that
 * {@code ("ab","c")} and {@code ("a","bc")} hash differently.
 */
public final class InputHasher {

    private InputHasher() {
    }

    public static long hash(List<ChatMessage> messages, String model, double temperature, double topP) {
        MessageDigest digest = sha256();
        update(digest, model);
        for (ChatMessage message : messages) {
            update(digest, message.role());
            update(digest, message.content());
        }
        digest.update(ByteBuffer.allocate(Double.BYTES * 2)
                .putDouble(temperature)
                .putDouble(topP)
                .array());
        return ByteBuffer.wrap(digest.digest()).getLong();
    }

    private static void update(MessageDigest digest, String value) {
        byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
        digest.update(ByteBuffer.allocate(Integer.BYTES).putInt(bytes.length).array());
        digest.update(bytes);
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }
}
