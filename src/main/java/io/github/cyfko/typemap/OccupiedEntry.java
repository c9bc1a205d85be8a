package io.github.cyfko.typemap;

import java.util.Objects;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * A slot of a {@link TypeMap} that holds a value.
 * <p>
 * Also serves as the mutable reference returned by {@link TypeMap#getMut(Class)}: every
 * write goes straight to the map and is seen by later lookups. Once the value is removed,
 * through {@link #take()} or through the map itself, the entry is stale and any further use
 * throws {@link IllegalStateException}, even if the slot has been filled again since.
 * </p>
 *
 * @param <V> value type bound to the entry's key type
 */
public final class OccupiedEntry<V> implements Entry<V> {

    private final TypeMap map;
    private final KeyBinding binding;
    private final Class<? extends Key<V>> key;
    private final Slot slot;

    OccupiedEntry(TypeMap map, KeyBinding binding, Class<? extends Key<V>> key, Slot slot) {
        this.map = map;
        this.binding = binding;
        this.key = key;
        this.slot = slot;
    }

    @Override
    public Class<? extends Key<V>> key() {
        return key;
    }

    @Override
    public boolean isOccupied() {
        return true;
    }

    /** Returns the stored value. */
    public V get() {
        return binding.recover(present().value);
    }

    /**
     * Replaces the stored value.
     *
     * @return the previous value
     */
    public V set(V value) {
        Objects.requireNonNull(value, "value cannot be null");
        Slot current = present();
        Object previous = current.value;
        current.value = binding.erase(value);
        return binding.recover(previous);
    }

    /**
     * Replaces the stored value with the result of applying {@code update} to it.
     *
     * @return the new value
     */
    public V update(UnaryOperator<V> update) {
        Objects.requireNonNull(update, "update cannot be null");
        Slot current = present();
        V updated = Objects.requireNonNull(update.apply(binding.recover(current.value)), "update cannot produce null");
        current.value = binding.erase(updated);
        return updated;
    }

    /** Removes the value from the map and returns it; the entry is stale afterwards. */
    public V take() {
        Slot removed = present();
        map.evict(key);
        return binding.recover(removed.value);
    }

    @Override
    public V orInsert(V defaultValue) {
        Objects.requireNonNull(defaultValue, "defaultValue cannot be null");
        return get();
    }

    @Override
    public V orInsertWith(Supplier<? extends V> defaultValue) {
        Objects.requireNonNull(defaultValue, "defaultValue cannot be null");
        return get();
    }

    /** The slot this entry was taken on, provided the map still holds that same occupancy. */
    private Slot present() {
        if (map.slot(key) != slot) {
            throw new IllegalStateException("Entry for " + key.getName() + " is no longer present");
        }
        return slot;
    }

    @Override
    public String toString() {
        return key.getSimpleName() + "=" + (map.slot(key) == slot ? slot.value : "<removed>");
    }
}
