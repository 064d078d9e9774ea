package sqlrunner.util;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.sql.Date;
import java.sql.Timestamp;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

class JdbcValuesTest {

    @Test
    void primitivesPassThrough() throws Exception {
        assertThat(JdbcValues.toJsonSafe(42)).isEqualTo(42);
        assertThat(JdbcValues.toJsonSafe(new BigDecimal("1.50"))).isEqualTo(new BigDecimal("1.50"));
        assertThat(JdbcValues.toJsonSafe(true)).isEqualTo(true);
        assertThat(JdbcValues.toJsonSafe("text")).isEqualTo("text");
        assertThat(JdbcValues.toJsonSafe(null)).isNull();
    }

    @Test
    void temporalValuesBecomeIsoStrings() throws Exception {
        assertThat(JdbcValues.toJsonSafe(LocalDate.of(2024, 1, 31))).isEqualTo("2024-01-31");
        assertThat(JdbcValues.toJsonSafe(Date.valueOf("2024-01-31"))).isEqualTo("2024-01-31");
        assertThat(JdbcValues.toJsonSafe(OffsetDateTime.of(2024, 1, 31, 8, 0, 0, 0, ZoneOffset.UTC)))
                .isEqualTo("2024-01-31T08:00Z");
        assertThat(JdbcValues.toJsonSafe(Timestamp.valueOf("2024-01-31 08:00:00"))).isInstanceOf(String.class);
    }

    @Test
    void bytesBecomeBase64() throws Exception {
        assertThat(JdbcValues.toJsonSafe(new byte[]{1, 2, 3})).isEqualTo("AQID");
    }

    @Test
    void uuidBecomesString() throws Exception {
        UUID id = UUID.fromString("123e4567-e89b-12d3-a456-426614174000");
        assertThat(JdbcValues.toJsonSafe(id)).isEqualTo("123e4567-e89b-12d3-a456-426614174000");
    }

    @Test
    void objectArraysBecomeLists() throws Exception {
        Object converted = JdbcValues.toJsonSafe(new Object[]{1, "a", LocalDate.of(2024, 2, 1)});

        assertThat(converted).isEqualTo(List.of(1, "a", "2024-02-01"));
    }
}
