package io.easyrepo;

/**
 * Thrown by {@link Repository#delete(Class, Object)} when no entity exists for the identifier.
 */
public final class EntityNotFoundException extends PersistenceException {
    private final Class<?> entityType;
    private final Object id;

    public EntityNotFoundException(Class<?> entityType, Object id) {
        super("No " + entityType.getName() + " found for id " + id);
        this.entityType = entityType;
        this.id = id;
    }

    public Class<?> entityType() {
        return entityType;
    }

    public Object id() {
        return id;
    }
}
