package com.flighttracker.common.id;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class UlidGeneratorTest {

    private static final Instant SOME_INSTANT = Instant.parse("2026-10-19T10:00:00Z");

    @Test
    void generateReturns26CharCrockfordString() {
        String ulid = UlidGenerator.generate(SOME_INSTANT);
        assertThat(ulid).hasSize(UlidGenerator.LENGTH).matches("^[0-9A-HJKMNP-TV-Z]{26}$");
    }

    @Test
    void generatedUlidsAreUniqueWithinTheSameMillisecond() {
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 1000; i++) {
            ids.add(UlidGenerator.generate(SOME_INSTANT));
        }
        assertThat(ids).hasSize(1000);
    }

    @Test
    void laterTimestampSortsAfterEarlierTimestamp() {
        var first = UlidGenerator.generate(SOME_INSTANT);
        var second = UlidGenerator.generate(SOME_INSTANT.plusMillis(1));
        assertThat(first.compareTo(second)).isLessThan(0);
    }

    @Test
    void epochEncodesAsZeroTimestampPrefix() {
        assertThat(UlidGenerator.generate(Instant.EPOCH)).startsWith("0000000000");
    }
}
