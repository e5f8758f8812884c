package com.ryuqq.remoteops.testkit.contract;

import com.ryuqq.remoteops.application.config.ClientDefaults;
import com.ryuqq.remoteops.core.cache.Lookup;
import com.ryuqq.remoteops.core.cache.TtlCache;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for the TTL cache driven by the manual clock.
 *
 * @author RemoteOps Team
 * @since 1.0.0
 */
class CachingContractTest extends AbstractContractTest {

    private final Map<String, String> remoteTable = new ConcurrentHashMap<>();
    private final AtomicInteger lookups = new AtomicInteger();
    private TtlCache<String, String> cache;
    private Lookup<String, String> describeTable;

    @BeforeEach
    void setUpCache() {
        cache = new TtlCache<>(ClientDefaults.cacheConfig(), clock);
        describeTable = key -> {
            lookups.incrementAndGet();
            return Optional.ofNullable(remoteTable.get(key));
        };
    }

    @Test
    void testCaching_HitBeforeExpiry_RefreshAfter() {
        // Given
        remoteTable.put("orders", "schema-v1");
        assertEquals(Optional.of("schema-v1"), cache.get("orders", describeTable));
        remoteTable.put("orders", "schema-v2");

        // When: just before expiry
        clock.advance(ClientDefaults.CACHE_TTL.minusMillis(1));
        Optional<String> beforeExpiry = cache.get("orders", describeTable);

        // When: exactly at expiry
        clock.advance(Duration.ofMillis(1));
        Optional<String> atExpiry = cache.get("orders", describeTable);

        // Then
        assertEquals(Optional.of("schema-v1"), beforeExpiry);
        assertEquals(Optional.of("schema-v2"), atExpiry);
        assertEquals(2, lookups.get());
    }

    @Test
    void testCaching_MissingValue_NotCached() {
        // Given
        assertEquals(Optional.empty(), cache.get("orders", describeTable));

        // When
        remoteTable.put("orders", "schema-v1");
        Optional<String> result = cache.get("orders", describeTable);

        // Then
        assertEquals(Optional.of("schema-v1"), result);
        assertEquals(2, lookups.get());
        assertEquals(1, cache.getStats().emptyLoadCount());
    }
}
