package uk.gov.di.oidcop.shared.helpers;

import java.time.Clock;
import java.util.Date;

public class NowHelper {

    private static final NowClock clock = new NowClock(Clock.systemUTC());

    public static Date now() {
        return clock.now();
    }

    public static long nowEpochSecond() {
        return clock.nowEpochSecond();
    }

    public static class NowClock {
        private final Clock clock;

        public NowClock(Clock clock) {
            this.clock = clock;
        }

        public Date now() {
            return Date.from(clock.instant());
        }

        public long nowEpochSecond() {
            return clock.instant().getEpochSecond();
        }
    }
}
