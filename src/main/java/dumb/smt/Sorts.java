package dumb.smt;

import org.jetbrains.annotations.Nullable;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Variable name to {@link Sort} environment.
 * <p>
 * The global scope is filled by {@link #declare}. Local scopes come from
 * {@link #extend}: a child holding only the new bindings and falling back to
 * its parent on lookup. The parent is never modified.
 */
public final class Sorts {
    private final Map<String, Sort> sorts;
    @Nullable
    private final Sorts parent;

    private Sorts(Map<String, Sort> sorts, @Nullable Sorts parent) {
        this.sorts = sorts;
        this.parent = parent;
    }

    public static Sorts global() {
        return new Sorts(new HashMap<>(), null);
    }

    /** Only valid on the global scope. */
    public void declare(String name, Sort sort) {
        if (parent != null)
            throw new IllegalStateException("Cannot declare '" + name + "' in a local scope");
        sorts.put(requireNonNull(name), requireNonNull(sort));
    }

    public Sorts extend(Map<String, Sort> bindings) {
        return new Sorts(Map.copyOf(bindings), this);
    }

    public Optional<Sort> lookup(String name) {
        for (var s = this; s != null; s = s.parent) {
            var sort = s.sorts.get(name);
            if (sort != null) return Optional.of(sort);
        }
        return Optional.empty();
    }
}
