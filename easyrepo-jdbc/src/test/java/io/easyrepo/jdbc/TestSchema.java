package io.easyrepo.jdbc;

import io.easyrepo.jdbc.mapping.Constraint;
import io.easyrepo.jdbc.mapping.EntityMapping;
import io.easyrepo.jdbc.mapping.EntityMappings;
import org.h2.jdbcx.JdbcDataSource;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.UUID;

final class TestSchema {
    static final EntityMapping<Customer> CUSTOMERS = EntityMapping.builder(Customer.class, "customer")
            .factory(Customer::new)
            .generatedId("id", Long.class, Customer::getId, Customer::setId)
            .column("name", String.class, Customer::getName, Customer::setName,
                    Constraint.required(), Constraint.maxLength(50))
            .column("email", String.class, Customer::getEmail, Customer::setEmail)
            .oneToMany("orders", PurchaseOrder.class, "customer_id", Customer::setOrders)
            .build();

    static final EntityMapping<PurchaseOrder> ORDERS = EntityMapping.builder(PurchaseOrder.class, "purchase_order")
            .factory(PurchaseOrder::new)
            .generatedId("id", Long.class, PurchaseOrder::getId, PurchaseOrder::setId)
            .column("customer_id", Long.class, PurchaseOrder::getCustomerId, PurchaseOrder::setCustomerId,
                    Constraint.required())
            .column("product", String.class, PurchaseOrder::getProduct, PurchaseOrder::setProduct,
                    Constraint.required())
            .manyToOne("customer", Customer.class, PurchaseOrder::getCustomerId, PurchaseOrder::setCustomer)
            .build();

    static final EntityMapping<Sku> SKUS = EntityMapping.builder(Sku.class, "sku")
            .factory(Sku::new)
            .id("id", Long.class, Sku::getId, Sku::setId)
            .column("code", String.class, Sku::getCode, Sku::setCode, Constraint.required())
            .build();

    static final EntityMappings MAPPINGS = EntityMappings.of(CUSTOMERS, ORDERS, SKUS);

    private TestSchema() {}

    static JdbcDataSource createDataSource(String name) throws SQLException {
        JdbcDataSource dataSource = new JdbcDataSource();
        dataSource.setURL("jdbc:h2:mem:" + name + "_" + UUID.randomUUID() + ";MODE=MySQL;DB_CLOSE_DELAY=-1");
        try (Connection conn = dataSource.getConnection(); Statement stmt = conn.createStatement()) {
            stmt.execute("CREATE TABLE customer (" +
                    "id BIGINT AUTO_INCREMENT PRIMARY KEY, " +
                    "name VARCHAR(50) NOT NULL, " +
                    "email VARCHAR(100))");
            stmt.execute("CREATE TABLE purchase_order (" +
                    "id BIGINT AUTO_INCREMENT PRIMARY KEY, " +
                    "customer_id BIGINT NOT NULL, " +
                    "product VARCHAR(100) NOT NULL)");
            stmt.execute("CREATE TABLE sku (id BIGINT PRIMARY KEY, code VARCHAR(20) NOT NULL)");
        }
        return dataSource;
    }

    static int count(JdbcDataSource dataSource, String table) throws SQLException {
        try (Connection conn = dataSource.getConnection(); Statement stmt = conn.createStatement();
             var rs = stmt.executeQuery("SELECT COUNT(*) FROM " + table)) {
            rs.next();
            return rs.getInt(1);
        }
    }
}
