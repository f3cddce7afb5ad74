package io.easyrepo.jdbc;

import io.easyrepo.jdbc.dialect.H2Dialect;
import io.easyrepo.spi.EntityValidationException;
import io.easyrepo.spi.TransactionHandle;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JdbcPersistenceContextTest {
    private JdbcDataSource dataSource;
    private AtomicInteger connectionsOpened;
    private JdbcPersistenceContext context;

    @BeforeEach
    void setUp() throws Exception {
        dataSource = TestSchema.createDataSource("ctx");
        connectionsOpened = new AtomicInteger();
        context = new JdbcPersistenceContext(() -> {
            connectionsOpened.incrementAndGet();
            return dataSource.getConnection();
        }, TestSchema.MAPPINGS, new H2Dialect());
    }

    @AfterEach
    void tearDown() {
        context.close();
    }

    @Test
    void constructorRejectsNullArguments() {
        assertThrows(NullPointerException.class,
                () -> new JdbcPersistenceContext(null, TestSchema.MAPPINGS, new H2Dialect()));
        assertThrows(NullPointerException.class,
                () -> new JdbcPersistenceContext(dataSource::getConnection, null, new H2Dialect()));
        assertThrows(NullPointerException.class,
                () -> new JdbcPersistenceContext(dataSource::getConnection, TestSchema.MAPPINGS, null));
    }

    @Test
    void connectionIsObtainedLazilyAndReused() {
        assertEquals(0, connectionsOpened.get());

        context.list(Customer.class, c -> true, List.of());
        context.find(Customer.class, 1L);
        context.beginTransaction().rollback();

        assertEquals(1, connectionsOpened.get());
    }

    @Test
    void stagedChangesAreWrittenOnlyBySaveChanges() throws Exception {
        TransactionHandle tx = context.beginTransaction();
        context.stageInsert(new Customer("alice", null));
        context.stageInsert(new Sku(7L, "S-7"));

        assertEquals(2, context.pendingChanges());
        assertEquals(2, context.saveChanges());
        assertEquals(0, context.pendingChanges());
        tx.commit();

        assertEquals(1, TestSchema.count(dataSource, "customer"));
        assertEquals(1, TestSchema.count(dataSource, "sku"));
    }

    @Test
    void saveChangesWithNothingStagedReturnsZero() {
        assertEquals(0, context.saveChanges());
    }

    @Test
    void findSeesStagedEntitiesBeforeSave() {
        Sku sku = new Sku(5L, "S-5");
        context.stageInsert(sku);

        assertSame(sku, context.find(Sku.class, 5L).orElseThrow());
    }

    @Test
    void removingStagedInsertCancelsIt() {
        Sku sku = new Sku(5L, "S-5");
        context.stageInsert(sku);
        context.stageRemoval(sku);

        assertEquals(0, context.pendingChanges());
    }

    @Test
    void validationRejectsBeforeAnyWrite() throws Exception {
        TransactionHandle tx = context.beginTransaction();
        context.stageInsert(new Sku(1L, "OK"));
        context.stageInsert(new Sku(2L, ""));

        EntityValidationException ex = assertThrows(EntityValidationException.class, context::saveChanges);
        tx.rollback();

        assertEquals(1, ex.results().size());
        assertEquals("code", ex.results().get(0).errors().get(0).property());
        assertEquals(0, TestSchema.count(dataSource, "sku"));
    }

    @Test
    void rollbackDiscardsWrittenAndStagedChanges() throws Exception {
        TransactionHandle tx = context.beginTransaction();
        context.stageInsert(new Sku(1L, "A"));
        context.saveChanges();
        context.stageInsert(new Sku(2L, "B"));

        tx.rollback();

        assertEquals(0, context.pendingChanges());
        assertEquals(0, TestSchema.count(dataSource, "sku"));
    }

    @Test
    void closingHandleWithoutCommitRollsBack() throws Exception {
        try (TransactionHandle tx = context.beginTransaction()) {
            context.stageInsert(new Sku(1L, "A"));
            context.saveChanges();
        }

        assertEquals(0, TestSchema.count(dataSource, "sku"));
    }

    @Test
    void handleRestoresAutoCommitWhenFinished() throws Exception {
        context.beginTransaction().commit();

        context.stageInsert(new Sku(1L, "A"));
        context.saveChanges();

        assertEquals(1, TestSchema.count(dataSource, "sku"));
    }

    @Test
    void secondBeginWhileActiveIsRejected() {
        context.beginTransaction();

        assertThrows(DataStoreException.class, context::beginTransaction);
    }

    @Test
    void updateOfMissingRowFails() {
        context.stageUpdate(new Sku(404L, "NONE"));

        DataStoreException ex = assertThrows(DataStoreException.class, context::saveChanges);
        assertTrue(ex.getMessage().contains("sku"));
    }

    @Test
    void stagingUnmappedTypeFails() {
        assertThrows(DataStoreException.class, () -> context.stageInsert("not an entity"));
        assertThrows(DataStoreException.class, () -> context.find(String.class, 1L));
    }

    @Test
    void subclassInstancesUseSuperclassMapping() throws Exception {
        context.stageInsert(new Sku(9L, "SUB") {
        });
        context.saveChanges();

        assertEquals(1, TestSchema.count(dataSource, "sku"));
    }

    @Test
    void closeRollsBackOpenTransactionAndIsIdempotent() throws Exception {
        context.beginTransaction();
        context.stageInsert(new Sku(1L, "A"));
        context.saveChanges();

        context.close();
        context.close();

        assertEquals(0, TestSchema.count(dataSource, "sku"));
        assertThrows(DataStoreException.class, () -> context.find(Sku.class, 1L));
    }

    @Test
    void closeReleasesConnection() throws Exception {
        Connection[] opened = new Connection[1];
        JdbcPersistenceContext tracked = new JdbcPersistenceContext(() -> {
            opened[0] = dataSource.getConnection();
            return opened[0];
        }, TestSchema.MAPPINGS, new H2Dialect());
        tracked.list(Sku.class, s -> true, List.of());

        tracked.close();

        assertTrue(opened[0].isClosed());
    }

    @Test
    void closeWithoutConnectionDoesNothing() {
        context.close();

        assertEquals(0, connectionsOpened.get());
    }
}
