package com.wavesmith.workers.governor;

import com.wavesmith.core.executor.CreateArtifactFn;
import com.wavesmith.core.graph.ArtifactSpec;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

class ResourceGovernorTest {

    private static final Duration SHORT_WAIT = Duration.ofMillis(100);

    @Test
    @DisplayName("rejects a call when every slot stays busy past maxWait")
    void concurrencyCeiling() throws Exception {
        var governor = new ResourceGovernor(1, 0, 0, SHORT_WAIT);
        governor.acquire();

        assertEquals(1, governor.inFlight());
        var e = assertThrows(ResourceExhaustedException.class, governor::acquire);
        assertTrue(e.getMessage().contains("No call slot"));

        governor.release();
        assertDoesNotThrow(governor::acquire);
    }

    @Test
    @DisplayName("enforces the per-minute call budget over a sliding window")
    void rateLimit() throws Exception {
        var clock = new SteppingClock(Instant.parse("2026-05-01T12:00:00Z"));
        var governor = new ResourceGovernor(4, 2, 0, SHORT_WAIT, clock, () -> 0L);

        governor.acquire();
        governor.release();
        governor.acquire();
        governor.release();

        assertEquals(2, governor.callsInLastMinute());
        assertThrows(ResourceExhaustedException.class, governor::acquire);
        assertEquals(0, governor.inFlight());

        clock.now = clock.now.plus(Duration.ofSeconds(61));
        assertEquals(0, governor.callsInLastMinute());
        assertDoesNotThrow(governor::acquire);
    }

    @Test
    @DisplayName("holds calls while heap usage is above the ceiling")
    void memoryCeiling() throws Exception {
        var used = new AtomicLong(2_000);
        var governor = new ResourceGovernor(2, 0, 1_000, SHORT_WAIT, Clock.systemUTC(), used::get);

        assertThrows(ResourceExhaustedException.class, governor::acquire);
        assertEquals(0, governor.inFlight());

        used.set(500);
        assertDoesNotThrow(governor::acquire);
    }

    @Test
    @DisplayName("governed functions release their slot even when they throw")
    void governReleases() {
        var governor = new ResourceGovernor(1, 0, 0, SHORT_WAIT);
        CreateArtifactFn failing = governor.govern(spec -> {
            throw new IllegalStateException("backend down");
        });

        assertThrows(IllegalStateException.class, () -> failing.create(ArtifactSpec.of("a", "a")));
        assertEquals(0, governor.inFlight());
    }

    static final class SteppingClock extends Clock {
        volatile Instant now;

        SteppingClock(Instant start) {
            this.now = start;
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
