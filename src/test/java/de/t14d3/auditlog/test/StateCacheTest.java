package de.t14d3.auditlog.test;

import de.t14d3.auditlog.cache.LocalMemoryStateCache;
import de.t14d3.auditlog.cache.StateCacheKey;
import de.t14d3.auditlog.history.HistoricalObjectState;
import de.t14d3.auditlog.history.HistoricalStateLookup;
import de.t14d3.auditlog.history.HistoryRegistry;
import de.t14d3.auditlog.log.EntityKey;
import de.t14d3.auditlog.log.LogAction;
import de.t14d3.auditlog.log.LogEntry;
import de.t14d3.auditlog.log.LogEntryQuery;
import de.t14d3.auditlog.log.LogRecordSource;
import de.t14d3.auditlog.log.memory.InMemoryLogEntryStore;
import de.t14d3.auditlog.test.entities.Article;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

public class StateCacheTest {
    private static final Instant BASE = Instant.parse("2024-02-01T00:00:00Z");

    private InMemoryLogEntryStore store;
    private CountingSource countingSource;
    private LocalMemoryStateCache cache;
    private Article article;

    /**
     * Counts how often the log is actually queried.
     */
    private static final class CountingSource implements LogRecordSource<Object> {
        private final InMemoryLogEntryStore delegate;
        private final AtomicInteger queries = new AtomicInteger();

        private CountingSource(InMemoryLogEntryStore delegate) {
            this.delegate = delegate;
        }

        @Override
        public EntityKey keyOf(Object entity) {
            return delegate.keyOf(entity);
        }

        @Override
        public LogEntryQuery recordsFor(Object entity) {
            queries.incrementAndGet();
            return delegate.recordsFor(entity);
        }

        @Override
        public Optional<LogEntry> fetch(long logEntryId) {
            return delegate.fetch(logEntryId);
        }
    }

    @BeforeEach
    void setup() {
        store = new InMemoryLogEntryStore();
        countingSource = new CountingSource(store);
        cache = new LocalMemoryStateCache();
        article = new Article(1L, "a", "draft");
    }

    @Test
    void testRepeatedLookupsHitCache() {
        store.append(article, LogAction.CREATE, BASE, "{\"fields\": {\"title\": \"a\"}}");
        HistoricalStateLookup<Article> lookup = new HistoricalStateLookup<Article>(countingSource).withCache(cache);

        HistoricalObjectState first = lookup.getObjectStateAtTimestamp(article, BASE.plusSeconds(5));
        HistoricalObjectState second = lookup.getObjectStateAtTimestamp(article, BASE.plusSeconds(5));
        lookup.getFieldStateAtTimestamp(article, "title", BASE.plusSeconds(5));

        assertEquals(first, second);
        assertEquals(1, countingSource.queries.get());
        assertTrue(cache.get(new StateCacheKey(new EntityKey("articles", "1"), BASE.plusSeconds(5))).isPresent());

        lookup.getObjectStateAtTimestamp(article, BASE.plusSeconds(6));
        assertEquals(2, countingSource.queries.get());
    }

    @Test
    void testAppendInvalidatesThroughListener() {
        store.addListener(cache.invalidationListener());
        HistoricalStateLookup<Article> lookup = new HistoricalStateLookup<Article>(countingSource).withCache(cache);
        Instant at = BASE.plusSeconds(10);

        assertFalse(lookup.getObjectStateAtTimestamp(article, at).logFound());

        store.append(article, LogAction.CREATE, BASE, "{\"fields\": {\"title\": \"a\"}}");
        HistoricalObjectState afterCreate = lookup.getObjectStateAtTimestamp(article, at);
        assertTrue(afterCreate.logFound());
        assertEquals(Map.of("title", "a"), afterCreate.serializedFields().orElseThrow());

        store.append(article, LogAction.UPDATE, BASE.plusSeconds(1), "{\"fields\": {\"title\": \"b\"}}");
        assertEquals("b", lookup.getFieldStateAtTimestamp(article, "title", at).value());
        assertEquals(3, countingSource.queries.get());
    }

    @Test
    void testInvalidationOnlyAffectsAppendedEntity() {
        Article other = new Article(2L, "x", "draft");
        store.addListener(cache.invalidationListener());
        HistoricalStateLookup<Article> lookup = new HistoricalStateLookup<Article>(countingSource).withCache(cache);

        lookup.getObjectStateAtTimestamp(article, BASE);
        lookup.getObjectStateAtTimestamp(other, BASE);
        assertEquals(2, cache.size());

        store.append(other, LogAction.CREATE, BASE, null);
        assertEquals(1, cache.size());
        assertTrue(cache.get(new StateCacheKey(new EntityKey("articles", "1"), BASE)).isPresent());
    }

    @Test
    void testExpiredEntriesAreDropped() throws InterruptedException {
        StateCacheKey key = new StateCacheKey(new EntityKey("articles", "1"), BASE);
        cache.put(key, HistoricalObjectState.notFound(), Duration.ofMillis(1));

        Thread.sleep(20);

        assertTrue(cache.get(key).isEmpty());
        assertEquals(0, cache.size());
    }

    @Test
    void testExpiredEntriesAreSweptOnPut() throws InterruptedException {
        EntityKey entity = new EntityKey("articles", "1");
        for (int i = 0; i < 10_000; i++) {
            cache.put(new StateCacheKey(entity, BASE.plusMillis(i)), HistoricalObjectState.notFound(), Duration.ofMillis(1));
        }

        Thread.sleep(20);

        // one sweep falls into any run of SWEEP_INTERVAL consecutive puts
        for (int i = 0; i < LocalMemoryStateCache.SWEEP_INTERVAL; i++) {
            cache.put(new StateCacheKey(entity, BASE.minusSeconds(i + 1)), HistoricalObjectState.notFound(), Duration.ZERO);
        }

        assertEquals(LocalMemoryStateCache.SWEEP_INTERVAL, cache.size());
    }

    @Test
    void testEvictExpiredKeepsLiveEntries() throws InterruptedException {
        EntityKey entity = new EntityKey("articles", "1");
        cache.put(new StateCacheKey(entity, BASE), HistoricalObjectState.notFound(), Duration.ofMillis(1));
        cache.put(new StateCacheKey(entity, BASE.plusSeconds(1)), HistoricalObjectState.notFound(), Duration.ofMillis(1));
        StateCacheKey live = new StateCacheKey(entity, BASE.plusSeconds(2));
        cache.put(live, HistoricalObjectState.notFound(), Duration.ZERO);

        Thread.sleep(20);

        assertEquals(2, cache.evictExpired());
        assertEquals(1, cache.size());
        assertTrue(cache.get(live).isPresent());
    }

    @Test
    void testNonPositiveTtlNeverExpires() {
        StateCacheKey key = new StateCacheKey(new EntityKey("articles", "1"), BASE);
        cache.put(key, HistoricalObjectState.notFound(), Duration.ZERO);

        assertEquals(Optional.of(HistoricalObjectState.notFound()), cache.get(key));
        cache.clear();
        assertTrue(cache.get(key).isEmpty());
    }

    @Test
    void testRegistryAppliesCacheToRegisteredLookups() {
        HistoryRegistry registry = new HistoryRegistry().withCache(cache).withCacheTtl(Duration.ofMinutes(1));
        registry.register(Article.class, countingSource);

        registry.getObjectStateAtTimestamp(article, BASE);
        registry.getFieldStateAtTimestamp(article, "title", BASE);

        assertEquals(1, countingSource.queries.get());
    }
}
