package io.easyrepo.jdbc.mapping;

import io.easyrepo.jdbc.Identifiers;
import io.easyrepo.spi.FieldValidationError;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BiConsumer;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Maps an entity class to a table.
 *
 * <pre>{@code
 * EntityMapping<Customer> customers = EntityMapping.builder(Customer.class, "customer")
 *     .factory(Customer::new)
 *     .generatedId("id", Long.class, Customer::getId, Customer::setId)
 *     .column("name", String.class, Customer::getName, Customer::setName,
 *         Constraint.required(), Constraint.maxLength(100))
 *     .oneToMany("orders", PurchaseOrder.class, "customer_id", Customer::setOrders)
 *     .build();
 * }</pre>
 *
 * @param <T> the entity type
 */
public final class EntityMapping<T> {
    private final Class<T> type;
    private final String table;
    private final Supplier<T> factory;
    private final Column<T> id;
    private final boolean idGenerated;
    private final List<Column<T>> columns;
    private final Map<String, Association<T, ?>> associations;

    private EntityMapping(Builder<T> builder) {
        this.type = builder.type;
        this.table = builder.table;
        this.factory = Objects.requireNonNull(builder.factory, "factory");
        this.id = Objects.requireNonNull(builder.id, "id");
        this.idGenerated = builder.idGenerated;
        this.columns = List.copyOf(builder.columns);
        this.associations = Map.copyOf(builder.associations);
    }

    public static <T> Builder<T> builder(Class<T> type, String table) {
        return new Builder<>(type, table);
    }

    public Class<T> type() {
        return type;
    }

    public String table() {
        return table;
    }

    public Column<T> idColumn() {
        return id;
    }

    public boolean isIdGenerated() {
        return idGenerated;
    }

    /** Non-id columns, in declaration order. */
    public List<Column<T>> columns() {
        return columns;
    }

    /** Id column followed by every other column. */
    public List<Column<T>> allColumns() {
        List<Column<T>> all = new ArrayList<>(columns.size() + 1);
        all.add(id);
        all.addAll(columns);
        return all;
    }

    /** Finds a column, including the id column, by name (case-insensitive). */
    public Optional<Column<T>> column(String name) {
        return allColumns().stream().filter(c -> c.name().equalsIgnoreCase(name)).findFirst();
    }

    public Optional<Association<T, ?>> association(String name) {
        return Optional.ofNullable(associations.get(name));
    }

    public Object idOf(T entity) {
        return id.get(entity);
    }

    /** Creates an entity populated from the current row. */
    public T read(ResultSet rs) throws SQLException {
        T entity = factory.get();
        for (Column<T> column : allColumns()) {
            column.read(rs, entity);
        }
        return entity;
    }

    /**
     * Checks an entity against the column constraints. A missing id is reported
     * unless the database generates it.
     */
    public List<FieldValidationError> validate(T entity) {
        List<FieldValidationError> errors = new ArrayList<>();
        if (!idGenerated && idOf(entity) == null) {
            errors.add(new FieldValidationError(id.name(), "is required"));
        }
        for (Column<T> column : columns) {
            for (String message : column.violations(entity)) {
                errors.add(new FieldValidationError(column.name(), message));
            }
        }
        return errors;
    }

    /** Builder for {@link EntityMapping}. */
    public static final class Builder<T> {
        private final Class<T> type;
        private final String table;
        private Supplier<T> factory;
        private Column<T> id;
        private boolean idGenerated;
        private final List<Column<T>> columns = new ArrayList<>();
        private final Map<String, Association<T, ?>> associations = new LinkedHashMap<>();

        private Builder(Class<T> type, String table) {
            this.type = Objects.requireNonNull(type, "type");
            this.table = Identifiers.validate(table);
        }

        /** Creates empty instances that rows are read into. */
        public Builder<T> factory(Supplier<T> factory) {
            this.factory = factory;
            return this;
        }

        /** Id assigned by the application before insert. */
        public <V> Builder<T> id(String name, Class<V> javaType, Function<T, V> getter, BiConsumer<T, V> setter) {
            this.id = Column.of(name, javaType, getter, setter, List.of());
            this.idGenerated = false;
            return this;
        }

        /** Id generated by the database on insert and written back to the entity. */
        public <V> Builder<T> generatedId(String name, Class<V> javaType, Function<T, V> getter,
                                          BiConsumer<T, V> setter) {
            this.id = Column.of(name, javaType, getter, setter, List.of());
            this.idGenerated = true;
            return this;
        }

        public <V> Builder<T> column(String name, Class<V> javaType, Function<T, V> getter, BiConsumer<T, V> setter,
                                     Constraint... constraints) {
            columns.add(Column.of(name, javaType, getter, setter, List.of(constraints)));
            return this;
        }

        /**
         * Related entities whose table has {@code foreignKeyColumn} referencing this entity's id.
         * The column must be mapped on the related entity.
         */
        public <R> Builder<T> oneToMany(String name, Class<R> target, String foreignKeyColumn,
                                        BiConsumer<T, List<R>> setter) {
            return association(Association.oneToMany(name, target, foreignKeyColumn, setter));
        }

        /** A single related entity whose id this entity holds. */
        public <R> Builder<T> manyToOne(String name, Class<R> target, Function<T, ?> foreignKey,
                                        BiConsumer<T, R> setter) {
            return association(Association.manyToOne(name, target, foreignKey, setter));
        }

        private Builder<T> association(Association<T, ?> association) {
            if (associations.putIfAbsent(association.name(), association) != null) {
                throw new IllegalArgumentException("Duplicate association: " + association.name());
            }
            return this;
        }

        public EntityMapping<T> build() {
            if (id == null) {
                throw new IllegalStateException("An id column is required for " + type.getName());
            }
            List<String> names = new ArrayList<>();
            names.add(id.name().toLowerCase());
            for (Column<T> column : columns) {
                String lower = column.name().toLowerCase();
                if (names.contains(lower)) {
                    throw new IllegalStateException("Duplicate column: " + column.name());
                }
                names.add(lower);
            }
            return new EntityMapping<>(this);
        }
    }
}
