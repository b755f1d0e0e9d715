package io.github.simbo1905.tex.math;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Package-private helper for key=value JUL events.
/// Each line starts with event=NAME; hot paths (token pops, expansions) use sampling.
final class StructuredLog {
    private static final Map<String, AtomicLong> COUNTERS = new ConcurrentHashMap<>();
    private static final int MAX_VALUE_LENGTH = 120;

    private StructuredLog() {}

    static void fine(Logger log, String event, Object... kv) {
        if (log.isLoggable(Level.FINE)) log.fine(() -> ev(event, kv));
    }

    static void finer(Logger log, String event, Object... kv) {
        if (log.isLoggable(Level.FINER)) log.finer(() -> ev(event, kv));
    }

    static void finest(Logger log, String event, Object... kv) {
        if (log.isLoggable(Level.FINEST)) log.finest(() -> ev(event, kv));
    }

    /// Log at FINEST but only every Nth occurrence of the event.
    static void finestSampled(Logger log, String event, int everyN, Object... kv) {
        if (!log.isLoggable(Level.FINEST)) return;
        if (everyN <= 1) {
            log.finest(() -> ev(event, kv));
            return;
        }
        long n = COUNTERS.computeIfAbsent(event, k -> new AtomicLong()).incrementAndGet();
        if (n % everyN == 0L) {
            final Object[] withSample = new Object[kv.length + 2];
            withSample[0] = "sample";
            withSample[1] = n;
            System.arraycopy(kv, 0, withSample, 2, kv.length);
            log.finest(() -> ev(event, withSample));
        }
    }

    static String ev(String event, Object... kv) {
        final StringBuilder sb = new StringBuilder(64);
        sb.append("event=").append(clean(event));
        for (int i = 0; i + 1 < kv.length; i += 2) {
            if (kv[i] == null) continue;
            final String value = kv[i + 1] == null ? "null" : clean(kv[i + 1].toString());
            sb.append(' ').append(kv[i]).append('=');
            if (needsQuotes(value)) {
                sb.append('"').append(value.replace("\"", "\\\"")).append('"');
            } else {
                sb.append(value);
            }
        }
        return sb.toString();
    }

    private static boolean needsQuotes(String s) {
        if (s.isEmpty()) return true;
        for (int i = 0; i < s.length(); i++) {
            final char c = s.charAt(i);
            if (Character.isWhitespace(c) || c == '"' || c == '=') return true;
        }
        return false;
    }

    private static String clean(String s) {
        final String trimmed = s.length() > MAX_VALUE_LENGTH ? s.substring(0, MAX_VALUE_LENGTH) + "…" : s;
        return trimmed.replace('\n', ' ').replace('\r', ' ').replace('\t', ' ');
    }
}
