package io.easyrepo;

import io.easyrepo.spi.EntityValidationException;
import io.easyrepo.spi.EntityValidationResult;
import io.easyrepo.spi.FieldValidationError;
import io.easyrepo.spi.PersistenceContext;
import io.easyrepo.spi.TransactionHandle;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Test double storing {@link Widget}s in a map. Writes become visible on commit.
 * Failure switches let tests drive each engine error path.
 */
final class InMemoryPersistenceContext implements PersistenceContext {
    enum Kind { INSERT, UPDATE, REMOVE }

    record Change(Kind kind, Widget widget) {
    }

    final Map<Long, Widget> store = new LinkedHashMap<>();
    final List<Change> staged = new ArrayList<>();
    final List<Change> flushed = new ArrayList<>();
    final List<String> calls = new ArrayList<>();
    List<Include<?>> lastIncludes;

    RuntimeException queryFailure;
    RuntimeException beginFailure;
    RuntimeException saveFailure;
    RuntimeException commitFailure;
    RuntimeException rollbackFailure;
    RuntimeException closeFailure;
    RuntimeException handleCloseFailure;

    int closeCount;
    int handleCloseCount;
    boolean transactionOpen;

    @Override
    public <T> Optional<T> find(Class<T> type, Object id) {
        calls.add("find");
        if (queryFailure != null) {
            throw queryFailure;
        }
        for (Change change : staged) {
            if (change.widget().getId().equals(id)) {
                return change.kind() == Kind.REMOVE ? Optional.empty() : Optional.of(type.cast(change.widget()));
            }
        }
        return Optional.ofNullable(store.get(id)).map(type::cast);
    }

    @Override
    public <T> List<T> list(Class<T> type, Predicate<? super T> filter, List<Include<T>> includes) {
        calls.add("list");
        if (queryFailure != null) {
            throw queryFailure;
        }
        lastIncludes = List.copyOf(includes);
        List<T> result = new ArrayList<>();
        for (Widget widget : store.values()) {
            T entity = type.cast(widget);
            if (filter.test(entity)) {
                result.add(entity);
            }
        }
        return result;
    }

    @Override
    public void stageInsert(Object entity) {
        stage(Kind.INSERT, entity);
    }

    @Override
    public void stageUpdate(Object entity) {
        stage(Kind.UPDATE, entity);
    }

    @Override
    public void stageRemoval(Object entity) {
        stage(Kind.REMOVE, entity);
    }

    private void stage(Kind kind, Object entity) {
        calls.add("stage" + kind);
        if (!(entity instanceof Widget widget)) {
            throw new IllegalArgumentException("Unmapped entity: " + entity);
        }
        staged.add(new Change(kind, widget));
    }

    @Override
    public TransactionHandle beginTransaction() {
        calls.add("begin");
        if (beginFailure != null) {
            throw beginFailure;
        }
        transactionOpen = true;
        return new Handle();
    }

    @Override
    public int saveChanges() {
        calls.add("save");
        List<EntityValidationResult> invalid = new ArrayList<>();
        for (Change change : staged) {
            if (change.kind() != Kind.REMOVE && change.widget().getName() == null) {
                invalid.add(new EntityValidationResult(change.widget(),
                        List.of(new FieldValidationError("name", "must not be null"))));
            }
        }
        if (!invalid.isEmpty()) {
            throw new EntityValidationException(invalid);
        }
        if (saveFailure != null) {
            throw saveFailure;
        }
        int count = staged.size();
        flushed.addAll(staged);
        staged.clear();
        return count;
    }

    @Override
    public void close() {
        calls.add("close");
        closeCount++;
        if (closeFailure != null) {
            throw closeFailure;
        }
    }

    private final class Handle implements TransactionHandle {
        private boolean completed;

        @Override
        public void commit() {
            calls.add("commit");
            if (commitFailure != null) {
                throw commitFailure;
            }
            for (Change change : flushed) {
                if (change.kind() == Kind.REMOVE) {
                    store.remove(change.widget().getId());
                } else {
                    store.put(change.widget().getId(), change.widget());
                }
            }
            flushed.clear();
            completed = true;
            transactionOpen = false;
        }

        @Override
        public void rollback() {
            calls.add("rollback");
            if (rollbackFailure != null) {
                throw rollbackFailure;
            }
            flushed.clear();
            staged.clear();
            completed = true;
            transactionOpen = false;
        }

        @Override
        public void close() {
            calls.add("handleClose");
            handleCloseCount++;
            if (handleCloseFailure != null) {
                throw handleCloseFailure;
            }
            if (!completed) {
                rollback();
            }
        }
    }
}
