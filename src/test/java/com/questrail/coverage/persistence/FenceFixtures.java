package com.questrail.coverage.persistence;

import com.questrail.coverage.model.Fence;
import com.questrail.coverage.model.LocationSample;
import com.questrail.coverage.model.PingOutcome;
import com.questrail.coverage.model.RadioTechnology;
import org.h2.jdbcx.JdbcDataSource;

import javax.sql.DataSource;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Builders for fences and throwaway in-memory stores.
 */
public final class FenceFixtures {

    public static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    private FenceFixtures() {
    }

    public static Instant t(long seconds) {
        return T0.plusSeconds(seconds);
    }

    public static Fence fence(String sessionUuid, long enteredSecond, Long exitedSecond) {
        Fence fence = Fence.openAt(
                LocationSample.of(48.0 + enteredSecond * 0.001, 16.0, 4.5, t(enteredSecond)),
                RadioTechnology.LTE,
                20.0,
                sessionUuid);
        fence = fence.withPing(PingOutcome.success(t(enteredSecond), Duration.ofMillis(30)));
        return exitedSecond == null ? fence : fence.exitedAt(t(exitedSecond));
    }

    public static JdbcCoverageStore newStore() {
        return newStore(newDataSource());
    }

    public static JdbcCoverageStore newStore(DataSource dataSource) {
        JdbcCoverageStore store = new JdbcCoverageStore(dataSource);
        store.initializeSchema();
        return store;
    }

    public static DataSource newDataSource() {
        JdbcDataSource dataSource = new JdbcDataSource();
        dataSource.setURL("jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
        return dataSource;
    }
}
