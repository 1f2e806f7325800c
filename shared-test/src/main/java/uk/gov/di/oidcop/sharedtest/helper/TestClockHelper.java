package uk.gov.di.oidcop.sharedtest.helper;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;

public class TestClockHelper {

    public static final Instant FIXED_INSTANT = Instant.parse("2007-12-03T10:15:30.00Z");

    public static Clock getInstance() {
        return Clock.fixed(FIXED_INSTANT, ZoneId.of("UTC"));
    }

    public static Clock secondsAfterFixedInstant(long seconds) {
        return Clock.offset(getInstance(), Duration.ofSeconds(seconds));
    }

    public static long fixedEpochSecond() {
        return FIXED_INSTANT.getEpochSecond();
    }
}
