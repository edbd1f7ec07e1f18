package com.guno.orderpipeline.repository;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.TimeZone;

import static org.assertj.core.api.Assertions.*;

class JdbcAnalyticsStoreTest {

    @Test
    void shouldBindInstantsAtUtcWhateverTheJvmZone() {
        Instant placedAt = Instant.parse("2024-03-10T23:30:00Z");
        TimeZone original = TimeZone.getDefault();
        try {
            TimeZone.setDefault(TimeZone.getTimeZone("Asia/Ho_Chi_Minh"));

            Object bound = JdbcAnalyticsStore.toJdbc(placedAt);

            assertThat(bound).isInstanceOf(OffsetDateTime.class);
            OffsetDateTime dateTime = (OffsetDateTime) bound;
            assertThat(dateTime.getOffset()).isEqualTo(ZoneOffset.UTC);
            assertThat(dateTime.toLocalDateTime().toString()).isEqualTo("2024-03-10T23:30");
            assertThat(JdbcAnalyticsStore.fromJdbc(bound)).isEqualTo(placedAt);
        } finally {
            TimeZone.setDefault(original);
        }
    }

    @Test
    void shouldPassOtherValuesThrough() {
        assertThat(JdbcAnalyticsStore.toJdbc("S1")).isEqualTo("S1");
        assertThat(JdbcAnalyticsStore.toJdbc(null)).isNull();
        assertThat(JdbcAnalyticsStore.fromJdbc(3)).isEqualTo(3L);
    }
}
