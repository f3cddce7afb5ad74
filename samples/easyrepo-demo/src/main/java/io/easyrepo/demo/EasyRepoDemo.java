package io.easyrepo.demo;

import io.easyrepo.CommitResult;
import io.easyrepo.Include;
import io.easyrepo.UnitOfWork;
import io.easyrepo.jdbc.JdbcUnitOfWorkFactory;
import io.easyrepo.jdbc.mapping.Constraint;
import io.easyrepo.jdbc.mapping.EntityMapping;
import org.h2.jdbcx.JdbcDataSource;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;

/**
 * Simple demo showing repository and unit-of-work usage without Spring.
 * <p>
 * Run with: mvn -pl samples/easyrepo-demo exec:java
 */
public final class EasyRepoDemo {

    public static void main(String[] args) throws Exception {
        // 1. Setup H2 in-memory database
        JdbcDataSource dataSource = new JdbcDataSource();
        dataSource.setURL("jdbc:h2:mem:demo;MODE=MySQL;DB_CLOSE_DELAY=-1");

        createSchema(dataSource);

        // 2. Describe the tables
        EntityMapping<Customer> customers = EntityMapping.builder(Customer.class, "customer")
                .factory(Customer::new)
                .generatedId("id", Long.class, Customer::getId, Customer::setId)
                .column("name", String.class, Customer::getName, Customer::setName,
                        Constraint.required(), Constraint.maxLength(100))
                .column("email", String.class, Customer::getEmail, Customer::setEmail, Constraint.maxLength(200))
                .oneToMany("orders", PurchaseOrder.class, "customer_id", Customer::setOrders)
                .build();
        EntityMapping<PurchaseOrder> orders = EntityMapping.builder(PurchaseOrder.class, "purchase_order")
                .factory(PurchaseOrder::new)
                .generatedId("id", Long.class, PurchaseOrder::getId, PurchaseOrder::setId)
                .column("customer_id", Long.class, PurchaseOrder::getCustomerId, PurchaseOrder::setCustomerId,
                        Constraint.required())
                .column("product", String.class, PurchaseOrder::getProduct, PurchaseOrder::setProduct,
                        Constraint.required())
                .column("quantity", Integer.class, PurchaseOrder::getQuantity, PurchaseOrder::setQuantity,
                        Constraint.required())
                .build();

        // 3. Build the factory; the dialect is detected from the DataSource
        JdbcUnitOfWorkFactory<Long> factory = JdbcUnitOfWorkFactory.builder(Long.class)
                .dataSource(dataSource)
                .mapping(customers)
                .mapping(orders)
                .build();

        System.out.println("=== easyrepo Demo (dialect: " + factory.dialect().name() + ") ===\n");

        // 4. Add a customer and two orders in one transaction
        Customer alice = new Customer("Alice", "alice@example.com");
        try (UnitOfWork<Long> uow = factory.create()) {
            uow.beginTransaction();
            uow.repository().add(alice);
            uow.commitTransaction();

            uow.beginTransaction();
            uow.repository().add(new PurchaseOrder(alice.getId(), "Keyboard", 1));
            uow.repository().add(new PurchaseOrder(alice.getId(), "Cable", 3));
            uow.commitTransaction();
            System.out.println("Committed customer " + alice.getId() + " with 2 orders");
        }

        // 5. A rolled back transaction leaves nothing behind
        try (UnitOfWork<Long> uow = factory.create()) {
            uow.beginTransaction();
            uow.repository().add(new Customer("Bob", null));
            uow.rollbackTransaction();
            System.out.println("Rolled back Bob; customers named Bob: "
                    + uow.repository().getList(Customer.class, c -> c.getName().equals("Bob")).size());
        }

        // 6. Invalid entities are reported per field
        try (UnitOfWork<Long> uow = factory.create()) {
            uow.beginTransaction();
            uow.repository().add(new Customer(null, "nobody@example.com"));
            CommitResult result = uow.tryCommit();
            if (result instanceof CommitResult.ValidationFailed failed) {
                System.out.println("\nValidation failed:\n" + failed.message());
            }
        }

        // 7. Read customers with their orders
        try (UnitOfWork<Long> uow = factory.create()) {
            List<Customer> all = uow.repository()
                    .getListIncluding(Customer.class, c -> true, Include.named("orders"));
            System.out.println("=== Customers ===");
            for (Customer customer : all) {
                System.out.printf("%-4d | %-10s | %d orders%n",
                        customer.getId(), customer.getName(), customer.getOrders().size());
                for (PurchaseOrder order : customer.getOrders()) {
                    System.out.printf("       - %s x%d%n", order.getProduct(), order.getQuantity());
                }
            }

            // 8. Delete an order
            PurchaseOrder first = all.get(0).getOrders().get(0);
            uow.beginTransaction();
            uow.repository().delete(PurchaseOrder.class, first.getId());
            uow.commitTransaction();
            System.out.println("\nDeleted order " + first.getId() + "; remaining orders: "
                    + uow.repository().getList(PurchaseOrder.class).size());
        }

        System.out.println("\nDemo complete.");
    }

    private static void createSchema(JdbcDataSource dataSource) throws SQLException, IOException {
        String ddl;
        try (InputStream is = EasyRepoDemo.class.getResourceAsStream("/schema/h2.sql")) {
            if (is == null) throw new IllegalStateException("Schema resource /schema/h2.sql not found");
            ddl = new String(is.readAllBytes(), StandardCharsets.UTF_8);
        }
        try (Connection conn = dataSource.getConnection();
             var stmt = conn.createStatement()) {
            for (String sql : ddl.split(";")) {
                String trimmed = sql.trim();
                if (!trimmed.isEmpty()) {
                    stmt.execute(trimmed);
                }
            }
        }
    }
}
