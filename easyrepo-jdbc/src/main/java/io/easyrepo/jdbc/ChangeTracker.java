package io.easyrepo.jdbc;

import io.easyrepo.jdbc.mapping.EntityMapping;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Staged changes of a persistence context, in staging order. Entities are
 * tracked by identity.
 */
final class ChangeTracker {

    enum EntityState { ADDED, MODIFIED, DELETED }

    static final class Entry {
        final Object entity;
        final EntityMapping<?> mapping;
        EntityState state;

        private Entry(Object entity, EntityMapping<?> mapping, EntityState state) {
            this.entity = entity;
            this.mapping = mapping;
            this.state = state;
        }
    }

    private final List<Entry> entries = new ArrayList<>();
    private final Map<Object, Entry> byEntity = new IdentityHashMap<>();

    void add(Object entity, EntityMapping<?> mapping) {
        Entry existing = byEntity.get(entity);
        if (existing == null) {
            track(entity, mapping, EntityState.ADDED);
        } else if (existing.state == EntityState.DELETED) {
            existing.state = EntityState.MODIFIED;
        }
    }

    void update(Object entity, EntityMapping<?> mapping) {
        Entry existing = byEntity.get(entity);
        if (existing == null) {
            track(entity, mapping, EntityState.MODIFIED);
        } else if (existing.state == EntityState.DELETED) {
            existing.state = EntityState.MODIFIED;
        }
    }

    void remove(Object entity, EntityMapping<?> mapping) {
        Entry existing = byEntity.get(entity);
        if (existing == null) {
            track(entity, mapping, EntityState.DELETED);
        } else if (existing.state == EntityState.ADDED) {
            entries.remove(existing);
            byEntity.remove(entity);
        } else {
            existing.state = EntityState.DELETED;
        }
    }

    /** Most recently staged entry of the mapped type with the given id. */
    Optional<Entry> find(EntityMapping<?> mapping, Object id) {
        for (int i = entries.size() - 1; i >= 0; i--) {
            Entry entry = entries.get(i);
            if (entry.mapping == mapping && Objects.equals(idOf(entry), id)) {
                return Optional.of(entry);
            }
        }
        return Optional.empty();
    }

    List<Entry> entries() {
        return List.copyOf(entries);
    }

    int size() {
        return entries.size();
    }

    void clear() {
        entries.clear();
        byEntity.clear();
    }

    private void track(Object entity, EntityMapping<?> mapping, EntityState state) {
        Entry entry = new Entry(entity, mapping, state);
        entries.add(entry);
        byEntity.put(entity, entry);
    }

    private static Object idOf(Entry entry) {
        return idOf(entry.mapping, entry.entity);
    }

    private static <T> Object idOf(EntityMapping<T> mapping, Object entity) {
        return mapping.idOf(mapping.type().cast(entity));
    }
}
