package io.easyrepo.jdbc.mapping;

import io.easyrepo.jdbc.Identifiers;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * A mapped column: its name, Java type, accessors and constraints.
 *
 * @param <T> the owning entity type
 */
public final class Column<T> {
    private final String name;
    private final Class<?> javaType;
    private final Function<T, ?> getter;
    private final BiConsumer<T, Object> setter;
    private final List<Constraint> constraints;

    private <V> Column(String name, Class<V> javaType, Function<T, V> getter, BiConsumer<T, V> setter,
                       List<Constraint> constraints) {
        this.name = Identifiers.validate(name);
        this.javaType = Objects.requireNonNull(javaType, "javaType");
        this.getter = Objects.requireNonNull(getter, "getter");
        Objects.requireNonNull(setter, "setter");
        this.setter = (entity, value) -> setter.accept(entity, javaType.cast(value));
        this.constraints = List.copyOf(constraints);
    }

    static <T, V> Column<T> of(String name, Class<V> javaType, Function<T, V> getter, BiConsumer<T, V> setter,
                               List<Constraint> constraints) {
        return new Column<>(name, javaType, getter, setter, constraints);
    }

    public String name() {
        return name;
    }

    public Class<?> javaType() {
        return javaType;
    }

    public List<Constraint> constraints() {
        return constraints;
    }

    public Object get(T entity) {
        return getter.apply(entity);
    }

    public void set(T entity, Object value) {
        setter.accept(entity, value);
    }

    /** Reads this column from the current row and assigns it to {@code entity}. */
    void read(ResultSet rs, T entity) throws SQLException {
        set(entity, rs.getObject(name, javaType));
    }

    /** Messages of every constraint the entity's value violates. */
    List<String> violations(T entity) {
        Object value = get(entity);
        List<String> messages = new ArrayList<>();
        for (Constraint constraint : constraints) {
            Optional<String> message = constraint.check(value);
            message.ifPresent(messages::add);
        }
        return messages;
    }
}
