package de.t14d3.auditlog.history;

import de.t14d3.auditlog.cache.NoOpStateCache;
import de.t14d3.auditlog.cache.StateCache;
import de.t14d3.auditlog.exceptions.UnregisteredEntityException;
import de.t14d3.auditlog.log.LogRecordSource;
import de.t14d3.auditlog.mapping.EntityScanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Binds entity types to the log source their history is read from.
 * <p>
 * Every entity type queried through the registry must be registered up front, either explicitly
 * or by scanning a package for {@code @Entity} classes. Querying an unregistered type fails with
 * {@link UnregisteredEntityException}. A type without its own registration uses the registration
 * of its nearest registered superclass.
 */
public class HistoryRegistry {
    private static final Logger LOGGER = LoggerFactory.getLogger(HistoryRegistry.class);

    private final Map<Class<?>, HistoricalStateLookup<?>> lookups = new ConcurrentHashMap<>();
    private StateCache cache = new NoOpStateCache();
    private Duration cacheTtl = Duration.ofMinutes(5);

    /**
     * Cache object-level results of lookups registered from now on.
     */
    public HistoryRegistry withCache(StateCache cache) {
        this.cache = Objects.requireNonNull(cache, "cache");
        return this;
    }

    public HistoryRegistry withCacheTtl(Duration ttl) {
        this.cacheTtl = Objects.requireNonNull(ttl, "ttl");
        return this;
    }

    /**
     * Register the log source of one entity type, replacing any previous registration.
     */
    public <E> HistoryRegistry register(Class<E> entityType, LogRecordSource<? super E> source) {
        Objects.requireNonNull(entityType, "entityType");
        HistoricalStateLookup<E> lookup = new HistoricalStateLookup<E>(source)
                .withCache(cache)
                .withCacheTtl(cacheTtl);
        lookups.put(entityType, lookup);
        LOGGER.debug("Registered {} with {}", entityType.getName(), source.getClass().getSimpleName());
        return this;
    }

    /**
     * Register every {@code @Entity} class under the given package with one source.
     *
     * @return the registered entity classes
     */
    public Set<Class<?>> registerAnnotated(String basePackage, LogRecordSource<Object> source) {
        Set<Class<?>> entities = EntityScanner.scan(basePackage);
        for (Class<?> entityType : entities) {
            register(entityType, source);
        }
        LOGGER.info("Registered {} entity type(s) from {}", entities.size(), basePackage);
        return entities;
    }

    public boolean isRegistered(Class<?> entityType) {
        return resolve(entityType) != null;
    }

    /**
     * @throws UnregisteredEntityException if neither the type nor a superclass is registered
     */
    @SuppressWarnings("unchecked")
    public <E> HistoricalStateLookup<E> lookupFor(Class<E> entityType) {
        HistoricalStateLookup<?> lookup = resolve(entityType);
        if (lookup == null) {
            throw new UnregisteredEntityException(entityType);
        }
        return (HistoricalStateLookup<E>) lookup;
    }

    /**
     * Get the state of an entity at a given instant using the source registered for its type.
     */
    public HistoricalObjectState getObjectStateAtTimestamp(Object entity, Instant timestamp) {
        return lookupForInstance(entity).getObjectStateAtTimestamp(entity, timestamp);
    }

    /**
     * Get the value of one field of an entity at a given instant using the source registered for its type.
     */
    public HistoricalFieldState getFieldStateAtTimestamp(Object entity, String fieldName, Instant timestamp) {
        return lookupForInstance(entity).getFieldStateAtTimestamp(entity, fieldName, timestamp);
    }

    @SuppressWarnings("unchecked")
    private HistoricalStateLookup<Object> lookupForInstance(Object entity) {
        Objects.requireNonNull(entity, "entity");
        HistoricalStateLookup<?> lookup = resolve(entity.getClass());
        if (lookup == null) {
            throw new UnregisteredEntityException(entity.getClass());
        }
        return (HistoricalStateLookup<Object>) lookup;
    }

    private HistoricalStateLookup<?> resolve(Class<?> entityType) {
        for (Class<?> type = entityType; type != null; type = type.getSuperclass()) {
            HistoricalStateLookup<?> lookup = lookups.get(type);
            if (lookup != null) {
                return lookup;
            }
        }
        return null;
    }
}
