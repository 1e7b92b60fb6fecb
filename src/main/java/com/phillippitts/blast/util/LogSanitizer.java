package com.phillippitts.blast.util;

/** Utility for log-safe renderings of raw text and bytes. */
public final class LogSanitizer {

    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private LogSanitizer() {}

    /**
     * Truncate the input string to at most max characters; returns "" for null.
     */
    public static String truncate(String s, int max) {
        if (s == null) {
            return "";
        }
        if (max <= 0) {
            return "";
        }
        return s.length() <= max ? s : s.substring(0, max);
    }

    /**
     * Lowercase hex dump without separators; returns "" for null.
     */
    public static String toHex(byte[] data) {
        if (data == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder(data.length * 2);
        for (byte b : data) {
            sb.append(HEX[(b >> 4) & 0x0f]).append(HEX[b & 0x0f]);
        }
        return sb.toString();
    }

    /**
     * Printable ASCII rendering. Bytes 32..126 are kept, everything else becomes {@code \xNN}.
     */
    public static String toSafeAscii(byte[] data) {
        if (data == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder(data.length);
        for (byte b : data) {
            int v = b & 0xff;
            if (v >= 32 && v <= 126) {
                sb.append((char) v);
            } else {
                sb.append("\\x").append(HEX[v >> 4]).append(HEX[v & 0x0f]);
            }
        }
        return sb.toString();
    }
}
