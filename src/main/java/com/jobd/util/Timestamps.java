package com.jobd.util;

import java.sql.Timestamp;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

public final class Timestamps {
    private Timestamps() {}

    /** Current time at the millisecond precision the stores keep. */
    public static Instant now() {
        return Instant.now().truncatedTo(ChronoUnit.MILLIS);
    }

    public static Timestamp toSql(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }

    public static Instant fromSql(Timestamp ts) {
        return ts == null ? null : ts.toInstant();
    }
}
