package com.cgi.medscrub.model;

import com.cgi.medscrub.model.enums.EntityType;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Value;

import java.util.BitSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Replacement token of the form {@code [TYPE_xxxxxxxx]}.
 */
@Value
public class PlaceholderToken {
    public static final int DIGEST_LENGTH = 8;

    /**
     * Matches any token already present in a text, whichever session produced it.
     */
    public static final Pattern PATTERN = Pattern.compile("\\[[A-Z][A-Z_]{1,29}_[0-9a-f]{8}\\]");

    EntityType entityType;
    String digest;

    public PlaceholderToken(EntityType entityType, String digest) {
        if (entityType == null) {
            throw new IllegalArgumentException("Entity type is required");
        }
        if (digest == null || !digest.matches("[0-9a-f]{" + DIGEST_LENGTH + "}")) {
            throw new IllegalArgumentException("Digest must be " + DIGEST_LENGTH + " lowercase hex characters");
        }
        this.entityType = entityType;
        this.digest = digest;
    }

    @JsonValue
    public String getValue() {
        return "[" + entityType.getPlaceholderPrefix() + "_" + digest + "]";
    }

    @Override
    public String toString() {
        return getValue();
    }

    public static boolean isPlaceholder(String value) {
        return value != null && PATTERN.matcher(value).matches();
    }

    /**
     * Marks every character of the text that belongs to an existing placeholder token.
     *
     * @param text Text to scan
     * @return Bit set of covered character positions
     */
    public static BitSet coveredPositions(String text) {
        BitSet covered = new BitSet(text.length());
        Matcher matcher = PATTERN.matcher(text);
        while (matcher.find()) {
            covered.set(matcher.start(), matcher.end());
        }
        return covered;
    }

    public static boolean intersects(BitSet covered, int start, int end) {
        int next = covered.nextSetBit(start);
        return next >= 0 && next < end;
    }
}
