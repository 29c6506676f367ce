package de.t14d3.auditlog.test;

import de.t14d3.auditlog.cache.LocalMemoryStateCache;
import de.t14d3.auditlog.cache.StateCacheKey;
import de.t14d3.auditlog.history.HistoricalObjectState;
import de.t14d3.auditlog.history.HistoricalStateLookup;
import de.t14d3.auditlog.log.EntityKey;
import de.t14d3.auditlog.log.LogAction;
import de.t14d3.auditlog.log.jdbc.JdbcLogEntryStore;
import de.t14d3.auditlog.log.jdbc.JdbcLogPollingInvalidator;
import de.t14d3.auditlog.test.entities.Article;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

public class JdbcLogPollingInvalidatorTest {
    private static final Instant BASE = Instant.parse("2024-04-01T00:00:00Z");

    private static String newDatabaseUrl() {
        String dbName = "log_polling_" + UUID.randomUUID().toString().replace("-", "");
        return "jdbc:h2:mem:" + dbName + ";DB_CLOSE_DELAY=-1";
    }

    @Test
    void testCrossConnectionInvalidation() {
        String jdbcUrl = newDatabaseUrl();
        Article article = new Article(3L, "v1", "draft");
        StateCacheKey key = new StateCacheKey(EntityKey.of(article), BASE.plusSeconds(60));

        LocalMemoryStateCache readerCache = new LocalMemoryStateCache();

        try (JdbcLogEntryStore writer = JdbcLogEntryStore.connect(jdbcUrl);
             JdbcLogEntryStore reader = JdbcLogEntryStore.connect(jdbcUrl);
             JdbcLogPollingInvalidator invalidator = JdbcLogPollingInvalidator.connect(jdbcUrl, readerCache, Duration.ofMillis(20))) {

            writer.append(article, LogAction.CREATE, BASE, "{\"fields\": {\"title\": \"v1\"}}");
            invalidator.start();

            HistoricalStateLookup<Article> lookup = new HistoricalStateLookup<Article>(reader).withCache(readerCache);
            assertEquals("v1", lookup.getFieldStateAtTimestamp(article, "title", key.timestamp()).value());
            assertTrue(readerCache.get(key).isPresent());

            // Writer appends on its own connection; only the poller can tell the reader
            writer.append(article, LogAction.UPDATE, BASE.plusSeconds(30), "{\"fields\": {\"title\": \"v2\"}}");

            long deadline = System.currentTimeMillis() + 2_000;
            while (System.currentTimeMillis() < deadline && readerCache.get(key).isPresent()) {
                try {
                    Thread.sleep(10);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }

            assertFalse(readerCache.get(key).isPresent(), "expected cached state to be invalidated");
            assertEquals("v2", lookup.getFieldStateAtTimestamp(article, "title", key.timestamp()).value());
            assertTrue(readerCache.get(key).isPresent());
        }
    }

    @Test
    void testStartSkipsExistingEntriesAndPollOnceCatchesUp() {
        String jdbcUrl = newDatabaseUrl();
        Article article = new Article(4L, "x", "draft");
        LocalMemoryStateCache cache = new LocalMemoryStateCache();

        try (JdbcLogEntryStore writer = JdbcLogEntryStore.connect(jdbcUrl);
             JdbcLogPollingInvalidator invalidator = new JdbcLogPollingInvalidator(
                     JdbcLogEntryStore.connect(jdbcUrl), cache, Duration.ofHours(1))) {

            long existing = writer.append(article, LogAction.CREATE, BASE, null).id();
            invalidator.start();
            assertEquals(existing, invalidator.getLastSeenId());

            StateCacheKey key = new StateCacheKey(EntityKey.of(article), BASE);
            cache.put(key, HistoricalObjectState.notFound(), Duration.ZERO);

            long appended = 0;
            for (int i = 1; i <= 3; i++) {
                appended = writer.append(article, LogAction.UPDATE, BASE.plusSeconds(i), null).id();
            }

            // The loop sleeps for an hour after its first poll, so poll explicitly until all three are seen
            long deadline = System.currentTimeMillis() + 2_000;
            while (invalidator.getLastSeenId() < appended && System.currentTimeMillis() < deadline) {
                invalidator.pollOnce();
            }

            assertEquals(appended, invalidator.getLastSeenId());
            assertTrue(cache.get(key).isEmpty());
            assertEquals(0, invalidator.pollOnce());
        }
    }
}
