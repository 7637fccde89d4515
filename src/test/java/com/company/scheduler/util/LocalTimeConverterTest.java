package com.company.scheduler.util;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;

class LocalTimeConverterTest {

    @Test
    void shouldSubtractOffsetWhenConvertingToLocal() {
        Instant instant = Instant.parse("2024-05-15T05:00:00Z");

        assertThat(LocalTimeConverter.toLocal(instant, -300))
                .isEqualTo(LocalDateTime.of(2024, 5, 15, 10, 0));
        assertThat(LocalTimeConverter.toLocal(instant, 60))
                .isEqualTo(LocalDateTime.of(2024, 5, 15, 4, 0));
    }

    @Test
    void shouldAddOffsetWhenConvertingToInstant() {
        LocalDateTime local = LocalDateTime.of(2024, 5, 22, 9, 0);

        assertThat(LocalTimeConverter.toInstant(local, -300))
                .isEqualTo(Instant.parse("2024-05-22T04:00:00Z"));
    }

    @Test
    void shouldRoundTripForIntegerMinuteOffsets() {
        Instant instant = Instant.parse("2024-02-29T23:59:59.123Z");

        for (int offset = -840; offset <= 840; offset += 15) {
            LocalDateTime local = LocalTimeConverter.toLocal(instant, offset);
            assertThat(LocalTimeConverter.toInstant(local, offset)).isEqualTo(instant);
        }
    }

    @Test
    void shouldPassNullsThrough() {
        assertThat(LocalTimeConverter.toLocal(null, 0)).isNull();
        assertThat(LocalTimeConverter.toInstant(null, 0)).isNull();
    }
}
