package io.backbork.utils;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Pattern;

/**
 * Issues job and schedule ids of the form {@code bb_yyyyMMdd_HHmmss_ssssrrrr}.
 * <p>
 * The timestamp (UTC) keeps ids sortable by creation; {@code ssss} is a per-process sequence so
 * ids issued within the same second still sort in issue order, and {@code rrrr} is random to keep
 * ids from different processes apart. Ids only use {@code [A-Za-z0-9_]} and are safe as file names.
 */
public final class JobIds {
    private static final DateTimeFormatter STAMP =
            DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC);
    private static final Pattern SAFE_ID = Pattern.compile("^[A-Za-z0-9][A-Za-z0-9_.-]{0,127}$");
    private static final AtomicInteger SEQUENCE = new AtomicInteger(ThreadLocalRandom.current().nextInt(0x10000));

    private JobIds() {
    }

    public static String next(Instant now) {
        int seq = SEQUENCE.getAndIncrement() & 0xFFFF;
        int rnd = ThreadLocalRandom.current().nextInt(0x10000);
        return "bb_" + STAMP.format(now) + "_" + String.format("%04x%04x", seq, rnd);
    }

    /**
     * True if {@code id} can be used directly as a file name or document key.
     */
    public static boolean isSafe(String id) {
        return id != null && SAFE_ID.matcher(id).matches() && !id.contains("..");
    }

    public static String requireSafe(String id) {
        if (!isSafe(id)) {
            throw new IllegalArgumentException("Unsafe id: " + id);
        }
        return id;
    }
}
