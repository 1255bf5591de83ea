package com.connectpro.store;

import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.Date;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLTimeoutException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class PostgresRecordStoreTest {

    private static final Instant NOW = Instant.parse("2026-03-10T12:00:00Z");

    private final PreparedStatement ps = mock(PreparedStatement.class);
    private final Connection conn = mock(Connection.class);
    private final DataSource ds = mock(DataSource.class);
    private final PostgresRecordStore store =
            new PostgresRecordStore(ds, Duration.ofSeconds(3), Clock.fixed(NOW, ZoneOffset.UTC));

    PostgresRecordStoreTest() throws SQLException {
        when(ds.getConnection()).thenReturn(conn);
        when(conn.prepareStatement(anyString())).thenReturn(ps);
    }

    @Test
    void markTrialExpiredReportsFreshTransitionOnly() throws Exception {
        when(ps.executeUpdate()).thenReturn(1, 0);

        assertTrue(store.markTrialExpired(7L));
        assertFalse(store.markTrialExpired(7L));
        verify(ps, times(2)).setLong(1, 7L);
        verify(ps, times(2)).setQueryTimeout(3);
    }

    @Test
    void quotaBindsDayAndCap() throws Exception {
        when(ps.executeUpdate()).thenReturn(1);
        var day = LocalDate.of(2026, 3, 10);

        assertEquals(QuotaResult.ALLOWED, store.tryConsumeDailyQuota(5L, 9L, 2, day));
        verify(ps).setDate(1, Date.valueOf(day));
        verify(ps).setLong(3, 5L);
        verify(ps).setLong(4, 9L);
        verify(ps).setInt(6, 2);
    }

    @Test
    void quotaDeniedWhenNoRowUpdated() throws Exception {
        when(ps.executeUpdate()).thenReturn(0);
        assertEquals(QuotaResult.DENIED, store.tryConsumeDailyQuota(5L, 9L, 2, LocalDate.of(2026, 3, 10)));
    }

    @Test
    void purgeUsesRetentionCutoff() throws Exception {
        when(ps.executeUpdate()).thenReturn(4);

        assertEquals(4, store.purgeMessagesOlderThan(Duration.ofHours(72)));
        verify(ps).setTimestamp(1, Timestamp.from(NOW.minus(Duration.ofHours(72))));
    }

    @Test
    void forwardLookupIsScopedToChannel() throws Exception {
        var rs = mock(ResultSet.class);
        when(rs.next()).thenReturn(false);
        when(ps.executeQuery()).thenReturn(rs);

        store.recordForward(11L, "bot:9", 1001L);
        assertTrue(store.findConversationByForward(9L, "front", 1001L).isEmpty());

        verify(ps).setString(1, "bot:9");
        verify(ps).setString(2, "front");
        verify(ps, times(2)).setLong(anyInt(), eq(1001L));
        verify(conn, times(2)).prepareStatement(contains("forward_channel = ?"));
    }

    @Test
    void missingOwnerIsEmpty() throws Exception {
        var rs = mock(ResultSet.class);
        when(rs.next()).thenReturn(false);
        when(ps.executeQuery()).thenReturn(rs);

        assertTrue(store.getOwner(123L).isEmpty());
    }

    @Test
    void canceledQueryBecomesTimeout() throws Exception {
        when(ps.executeUpdate()).thenThrow(new SQLException("canceling statement", "57014"));

        var ex = assertThrows(StoreException.class, () -> store.markTrialExpired(1L));
        assertEquals(StoreException.Reason.TIMEOUT, ex.reason());
    }

    @Test
    void sqlStatesMapToReasons() {
        assertEquals(StoreException.Reason.CONSTRAINT_VIOLATION,
                StoreException.from(new SQLException("dup", "23505"), "x").reason());
        assertEquals(StoreException.Reason.TIMEOUT,
                StoreException.from(new SQLTimeoutException("slow"), "x").reason());
        assertEquals(StoreException.Reason.FAILURE,
                StoreException.from(new SQLException("down", "08006"), "x").reason());
    }
}
