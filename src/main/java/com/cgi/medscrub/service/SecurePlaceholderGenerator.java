package com.cgi.medscrub.service;

import com.cgi.medscrub.model.PlaceholderToken;
import com.cgi.medscrub.model.enums.EntityType;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Derives placeholder tokens from a SHA-256 digest of the session salt, the entity type and the entity text.
 * The same triple always gives the same token; a different salt gives an unrelated one.
 */
@Component
public class SecurePlaceholderGenerator {
    private static final String ALGORITHM = "SHA-256";

    /**
     * Generates the placeholder for an entity.
     *
     * @param entityText Original value
     * @param entityType Category of the value
     * @param sessionSalt Secret of the current scrub session
     * @return Placeholder token
     */
    public PlaceholderToken generate(String entityText, EntityType entityType, String sessionSalt) {
        if (entityText == null || entityType == null || sessionSalt == null) {
            throw new IllegalArgumentException("Entity text, type and session salt are required");
        }
        // Separators keep ("ab", "c") and ("a", "bc") apart
        String material = sessionSalt + ":" + entityType.name() + ":" + entityText;
        byte[] digest = newDigest().digest(material.getBytes(StandardCharsets.UTF_8));
        String hex = HexFormat.of().formatHex(digest, 0, PlaceholderToken.DIGEST_LENGTH / 2);
        return new PlaceholderToken(entityType, hex);
    }

    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance(ALGORITHM);
        } catch (NoSuchAlgorithmException e) {
            // Every Java platform is required to provide SHA-256
            throw new IllegalStateException(ALGORITHM + " not available", e);
        }
    }
}
