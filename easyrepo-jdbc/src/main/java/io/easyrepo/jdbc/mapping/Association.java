package io.easyrepo.jdbc.mapping;

import io.easyrepo.Include;

import java.util.List;
import java.util.Objects;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * A relation from an entity to other mapped entities that can be eager-loaded.
 *
 * <p>Associations are declared on {@link EntityMapping.Builder} and passed to
 * {@link io.easyrepo.Repository#getListIncluding} as includes. Only the
 * {@linkplain #name() name} is needed to resolve them, so {@link Include#named(String)}
 * works as well.
 *
 * @param <T> owning entity type
 * @param <R> related entity type
 */
public final class Association<T, R> implements Include<T> {

    public enum Kind {
        /** Related rows carry a foreign key column pointing at the owner's id. */
        ONE_TO_MANY,
        /** The owner carries the related entity's id. */
        MANY_TO_ONE
    }

    private final String name;
    private final Kind kind;
    private final Class<R> target;
    private final String foreignKeyColumn;
    private final Function<T, ?> foreignKey;
    private final BiConsumer<T, List<R>> collectionSetter;
    private final BiConsumer<T, R> referenceSetter;

    private Association(String name, Kind kind, Class<R> target, String foreignKeyColumn,
                        Function<T, ?> foreignKey, BiConsumer<T, List<R>> collectionSetter,
                        BiConsumer<T, R> referenceSetter) {
        this.name = Objects.requireNonNull(name, "name");
        this.kind = kind;
        this.target = Objects.requireNonNull(target, "target");
        this.foreignKeyColumn = foreignKeyColumn;
        this.foreignKey = foreignKey;
        this.collectionSetter = collectionSetter;
        this.referenceSetter = referenceSetter;
    }

    static <T, R> Association<T, R> oneToMany(String name, Class<R> target, String foreignKeyColumn,
                                              BiConsumer<T, List<R>> setter) {
        return new Association<>(name, Kind.ONE_TO_MANY, target,
                Objects.requireNonNull(foreignKeyColumn, "foreignKeyColumn"), null,
                Objects.requireNonNull(setter, "setter"), null);
    }

    static <T, R> Association<T, R> manyToOne(String name, Class<R> target, Function<T, ?> foreignKey,
                                              BiConsumer<T, R> setter) {
        return new Association<>(name, Kind.MANY_TO_ONE, target, null,
                Objects.requireNonNull(foreignKey, "foreignKey"), null,
                Objects.requireNonNull(setter, "setter"));
    }

    @Override
    public String name() {
        return name;
    }

    public Kind kind() {
        return kind;
    }

    public Class<R> target() {
        return target;
    }

    /** Column on the related table holding the owner's id. Only for {@link Kind#ONE_TO_MANY}. */
    public String foreignKeyColumn() {
        return foreignKeyColumn;
    }

    /** The owner's reference to the related id. Only for {@link Kind#MANY_TO_ONE}. */
    public Object foreignKeyOf(T owner) {
        return foreignKey.apply(owner);
    }

    public void assignCollection(T owner, List<R> related) {
        collectionSetter.accept(owner, related);
    }

    public void assignReference(T owner, R related) {
        referenceSetter.accept(owner, related);
    }
}
