package com.ninesync.sync;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * SyncStrategy unit tests
 */
class SyncStrategyTest {

    @Test
    @DisplayName("Parse the fixed strategies, case insensitive")
    void testParse() {
        assertThat(SyncStrategy.parse("full")).isEqualTo(SyncStrategy.FULL);
        assertThat(SyncStrategy.parse("INCREMENTAL")).isEqualTo(SyncStrategy.INCREMENTAL);
        assertThat(SyncStrategy.parse("headers_only")).isEqualTo(SyncStrategy.HEADERS_ONLY);
        assertThat(SyncStrategy.parse("HEADERS")).isEqualTo(SyncStrategy.HEADERS_ONLY);
    }

    @Test
    @DisplayName("Recent with and without a day count")
    void testParseRecent() {
        assertThat(SyncStrategy.parse("RECENT:3")).isEqualTo(SyncStrategy.recent(3));
        assertThat(SyncStrategy.parse("recent(14)").getDays()).isEqualTo(14);
        assertThat(SyncStrategy.parse("RECENT").getDays()).isEqualTo(7);
    }

    @Test
    @DisplayName("Text form parses back to the same strategy")
    void testToString() {
        assertThat(SyncStrategy.recent(5).toString()).isEqualTo("RECENT:5");
        assertThat(SyncStrategy.parse(SyncStrategy.recent(5).toString())).isEqualTo(SyncStrategy.recent(5));
        assertThat(SyncStrategy.FULL.toString()).isEqualTo("FULL");
    }

    @Test
    @DisplayName("Only headers-only skips bodies")
    void testFetchesBody() {
        assertThat(SyncStrategy.HEADERS_ONLY.fetchesBody()).isFalse();
        assertThat(SyncStrategy.recent(1).fetchesBody()).isTrue();
        assertThat(SyncStrategy.INCREMENTAL.fetchesBody()).isTrue();
    }

    @Test
    @DisplayName("Invalid input")
    void testInvalid() {
        assertThatThrownBy(() -> SyncStrategy.parse("sometimes")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> SyncStrategy.parse("RECENT:x")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> SyncStrategy.recent(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
