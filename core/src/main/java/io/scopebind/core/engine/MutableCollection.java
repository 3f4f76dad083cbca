package io.scopebind.core.engine;

import io.scopebind.core.model.StoreCollection;
import io.scopebind.core.spi.TransactionListener.EntityChange;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Mutable working copy of one collection, handed to a transaction mutator. Writes are only
 * visible inside the transaction until it commits. Once the transaction ends, every method
 * throws {@link IllegalStateException}, so a leaked view cannot write to the store.
 *
 * <p>
 * Not thread-safe: confined to the mutator that received it.
 *
 * @param <T> entity type
 */
public final class MutableCollection<T> {

    private final StoreCollection collection;
    private final Function<T, String> idOf;
    private final Map<String, T> original;
    private final Map<String, T> working;
    private boolean open = true;

    MutableCollection(StoreCollection collection, Map<String, T> original, Function<T, String> idOf) {
        this.collection = collection;
        this.original = original;
        this.working = new LinkedHashMap<>(original);
        this.idOf = idOf;
    }

    /** Returns the entity with the given id, or {@code null} if absent. */
    public T get(String id) {
        checkOpen();
        return working.get(id);
    }

    /** Returns {@code true} if an entity with the given id exists. */
    public boolean has(String id) {
        checkOpen();
        return working.containsKey(id);
    }

    /**
     * Inserts or replaces an entity.
     *
     * @param id     the entity id; must equal the entity's own id
     * @param entity the entity
     * @throws IllegalArgumentException if the id does not match the entity
     */
    public void set(String id, T entity) {
        checkOpen();
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(entity, "entity must not be null");
        if (!id.equals(idOf.apply(entity))) {
            throw new IllegalArgumentException(
                    "Key '" + id + "' does not match entity id '" + idOf.apply(entity) + "' in " + collection.collectionName());
        }
        working.put(id, entity);
    }

    /**
     * Deletes an entity.
     *
     * @param id the entity id
     * @return {@code true} if an entity was removed
     */
    public boolean delete(String id) {
        checkOpen();
        return working.remove(id) != null;
    }

    /** Unmodifiable view of the current entities. */
    public Collection<T> values() {
        checkOpen();
        return Collections.unmodifiableCollection(working.values());
    }

    /** Number of entities. */
    public int size() {
        checkOpen();
        return working.size();
    }

    /** Returns {@code true} if the working copy differs from the original. */
    boolean isChanged() {
        return !working.equals(original);
    }

    Map<String, T> working() {
        return working;
    }

    /** Computes the entity deltas: updates and deletes in original order, then inserts. */
    List<EntityChange> changes() {
        List<EntityChange> changes = new ArrayList<>();
        original.forEach((id, before) -> {
            T after = working.get(id);
            if (!before.equals(after)) {
                changes.add(new EntityChange(collection, id, before, after));
            }
        });
        working.forEach((id, after) -> {
            if (!original.containsKey(id)) {
                changes.add(new EntityChange(collection, id, null, after));
            }
        });
        return changes;
    }

    void close() {
        open = false;
    }

    private void checkOpen() {
        if (!open) {
            throw new IllegalStateException(
                    "Transaction has ended; " + collection.collectionName() + " can no longer be accessed");
        }
    }
}
