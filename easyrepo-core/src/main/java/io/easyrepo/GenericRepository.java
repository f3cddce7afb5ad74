package io.easyrepo;

import io.easyrepo.spi.PersistenceContext;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * {@link Repository} that forwards each call to a {@link PersistenceContext}
 * after consulting its {@link ContextGuard}.
 *
 * <p>The context is borrowed from the owning {@link UnitOfWork}; this class never closes it.
 *
 * @param <K> identifier type
 */
public final class GenericRepository<K> implements Repository<K> {
    private final PersistenceContext context;
    private final ContextGuard guard;

    public GenericRepository(PersistenceContext context, ContextGuard guard) {
        this.context = Objects.requireNonNull(context, "context");
        this.guard = Objects.requireNonNull(guard, "guard");
    }

    @Override
    public <T> Optional<T> findById(Class<T> type, K id) {
        guard.ensureUsable();
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(id, "id");
        try {
            return context.find(type, id);
        } catch (RuntimeException e) {
            throw new PersistenceException("Failed to find entity: " + e.getMessage(), e);
        }
    }

    @Override
    public <T> List<T> getList(Class<T> type) {
        return getList(type, entity -> true);
    }

    @Override
    public <T> List<T> getList(Class<T> type, Predicate<? super T> filter) {
        guard.ensureUsable();
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(filter, "filter");
        return list(type, filter, List.of());
    }

    @SafeVarargs
    @Override
    public final <T> List<T> getListIncluding(Class<T> type, Predicate<? super T> filter, Include<T>... includes) {
        guard.ensureUsable();
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(filter, "filter");
        return list(type, filter, List.of(includes));
    }

    @Override
    public <T> T add(T entity) {
        guard.ensureUsable();
        try {
            context.stageInsert(entity);
            return entity;
        } catch (RuntimeException e) {
            throw new PersistenceException("Failed to add entity: " + e.getMessage(), e);
        }
    }

    @Override
    public <T> T update(T entity) {
        guard.ensureUsable();
        try {
            context.stageUpdate(entity);
            return entity;
        } catch (RuntimeException e) {
            throw new PersistenceException("Failed to update entity: " + e.getMessage(), e);
        }
    }

    @Override
    public <T> void delete(Class<T> type, K id) {
        guard.ensureUsable();
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(id, "id");
        T entity;
        try {
            entity = context.find(type, id).orElse(null);
        } catch (RuntimeException e) {
            throw new PersistenceException("Failed to delete entity: " + e.getMessage(), e);
        }
        if (entity == null) {
            throw new EntityNotFoundException(type, id);
        }
        try {
            context.stageRemoval(entity);
        } catch (RuntimeException e) {
            throw new PersistenceException("Failed to delete entity: " + e.getMessage(), e);
        }
    }

    private <T> List<T> list(Class<T> type, Predicate<? super T> filter, List<Include<T>> includes) {
        try {
            return context.list(type, filter, includes);
        } catch (RuntimeException e) {
            throw new PersistenceException("Failed to list entities: " + e.getMessage(), e);
        }
    }
}
