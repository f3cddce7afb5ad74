package io.easyrepo;

import java.util.Objects;

/**
 * Names a related property of {@code T} to eager-load alongside each returned entity.
 *
 * <p>Engines resolve includes by {@link #name()}; they may also offer typed
 * implementations carrying their own association metadata.
 *
 * @param <T> the owning entity type
 * @see Repository#getListIncluding(Class, java.util.function.Predicate, Include[])
 */
public interface Include<T> {

    /**
     * Name of the related property.
     */
    String name();

    /**
     * Creates an include that refers to a related property by name.
     */
    static <T> Include<T> named(String name) {
        Objects.requireNonNull(name, "name");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        return new Named<>(name);
    }

    record Named<T>(String name) implements Include<T> {
    }
}
