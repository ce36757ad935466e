package io.marketsync.cache;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.LocalDate;
import java.util.HexFormat;

/**
 * SHA-256 cache key of a fetch request. Fields are length-prefixed so that no two distinct requests
 * encode to the same digest input.
 */
public final class Fingerprint {
    private Fingerprint() {}

    public static String of(String subjectId, String category, LocalDate rangeStart, LocalDate rangeEnd) {
        StringBuilder sb = new StringBuilder(64);
        field(sb, subjectId);
        field(sb, category);
        field(sb, rangeStart == null ? null : rangeStart.toString());
        field(sb, rangeEnd == null ? null : rangeEnd.toString());
        return sha256Hex(sb.toString());
    }

    private static void field(StringBuilder sb, String v) {
        if (v == null) {
            sb.append("-1:|");
        } else {
            sb.append(v.length()).append(':').append(v).append('|');
        }
    }

    static String sha256Hex(String s) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(md.digest(s.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            // every JRE ships SHA-256
            throw new IllegalStateException(e);
        }
    }
}
