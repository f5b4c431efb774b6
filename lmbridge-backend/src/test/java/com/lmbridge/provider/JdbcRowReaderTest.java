package com.lmbridge.provider;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.sql.Array;
import java.sql.Timestamp;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("JdbcRowReader")
class JdbcRowReaderTest {

    @Test
    @DisplayName("keeps scalars and stringifies identifiers and timestamps")
    void scalars() throws Exception {
        UUID id = UUID.fromString("0f7ed8a2-3e1f-4b4a-9b5a-2b9fd8d2a001");

        assertThat(JdbcRowReader.toPlain("x", 0)).isEqualTo("x");
        assertThat(JdbcRowReader.toPlain(5L, 0)).isEqualTo(5L);
        assertThat(JdbcRowReader.toPlain(id, 0)).isEqualTo(id.toString());
        assertThat(JdbcRowReader.toPlain(Timestamp.valueOf("2024-01-02 03:04:05"), 0)).isEqualTo("2024-01-02 03:04:05.0");
    }

    @Test
    @DisplayName("converts SQL arrays to lists")
    void arrays() throws Exception {
        Array array = mock(Array.class);
        when(array.getArray()).thenReturn(new Object[]{"CD", "Vinyl"});

        assertThat(JdbcRowReader.toPlain(array, 0)).isEqualTo(List.of("CD", "Vinyl"));
    }
}
