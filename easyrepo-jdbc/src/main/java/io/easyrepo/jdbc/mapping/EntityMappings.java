package io.easyrepo.jdbc.mapping;

import io.easyrepo.jdbc.DataStoreException;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable registry of {@link EntityMapping}s keyed by entity class.
 */
public final class EntityMappings {
    private final Map<Class<?>, EntityMapping<?>> byType;

    private EntityMappings(Collection<? extends EntityMapping<?>> mappings) {
        Map<Class<?>, EntityMapping<?>> map = new LinkedHashMap<>();
        for (EntityMapping<?> mapping : mappings) {
            Objects.requireNonNull(mapping, "mapping");
            if (map.putIfAbsent(mapping.type(), mapping) != null) {
                throw new IllegalArgumentException("Duplicate mapping for " + mapping.type().getName());
            }
        }
        this.byType = Map.copyOf(map);
    }

    public static EntityMappings of(EntityMapping<?>... mappings) {
        return new EntityMappings(List.of(mappings));
    }

    public static EntityMappings of(Collection<? extends EntityMapping<?>> mappings) {
        return new EntityMappings(mappings);
    }

    public Collection<EntityMapping<?>> all() {
        return byType.values();
    }

    /**
     * Mapping registered for exactly {@code type}.
     *
     * @throws DataStoreException if the type is not mapped
     */
    @SuppressWarnings("unchecked")
    public <T> EntityMapping<T> forType(Class<T> type) {
        EntityMapping<?> mapping = byType.get(type);
        if (mapping == null) {
            throw new DataStoreException("No mapping registered for " + type.getName());
        }
        return (EntityMapping<T>) mapping;
    }

    /**
     * Mapping for an entity instance, searching its superclasses when the
     * concrete class is not mapped.
     *
     * @throws DataStoreException if no class in the hierarchy is mapped
     */
    public EntityMapping<?> forEntity(Object entity) {
        Objects.requireNonNull(entity, "entity");
        for (Class<?> c = entity.getClass(); c != null; c = c.getSuperclass()) {
            EntityMapping<?> mapping = byType.get(c);
            if (mapping != null) {
                return mapping;
            }
        }
        throw new DataStoreException("No mapping registered for " + entity.getClass().getName());
    }
}
