package io.github.cyfko.typemap;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * A slot of a {@link TypeMap} that holds no value.
 *
 * @param <V> value type bound to the entry's key type
 */
public final class VacantEntry<V> implements Entry<V> {

    private final TypeMap map;
    private final KeyBinding binding;
    private final Class<? extends Key<V>> key;

    VacantEntry(TypeMap map, KeyBinding binding, Class<? extends Key<V>> key) {
        this.map = map;
        this.binding = binding;
        this.key = key;
    }

    @Override
    public Class<? extends Key<V>> key() {
        return key;
    }

    @Override
    public boolean isOccupied() {
        return false;
    }

    /**
     * Stores {@code value} in the slot.
     *
     * @return the occupied view of the slot
     * @throws IllegalStateException if the slot was filled since this entry was obtained
     */
    public OccupiedEntry<V> insert(V value) {
        Objects.requireNonNull(value, "value cannot be null");
        if (map.slot(key) != null) {
            throw new IllegalStateException("Entry for " + key.getName() + " was filled in the meantime");
        }
        Slot slot = map.fill(key, binding.erase(value));
        return new OccupiedEntry<>(map, binding, key, slot);
    }

    @Override
    public V orInsert(V defaultValue) {
        return insert(defaultValue).get();
    }

    @Override
    public V orInsertWith(Supplier<? extends V> defaultValue) {
        Objects.requireNonNull(defaultValue, "defaultValue cannot be null");
        return insert(defaultValue.get()).get();
    }

    @Override
    public String toString() {
        return key.getSimpleName() + "=<vacant>";
    }
}
