package io.github.cyfko.typemap;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * A map keyed by types, holding at most one value per key type.
 *
 * <p>
 * Each slot is designated by a key type implementing {@link Key}{@code <V>}; the type argument
 * fixes, once for the whole program, the type {@code V} stored in that slot. Operations take
 * the key type's class literal and the compiler infers {@code V} from it, so a value of the
 * wrong type can neither be stored nor be read back.
 * </p>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * final class Age implements Key<Integer> {}
 * final class Nickname implements Key<String> {}
 *
 * TypeMap map = new TypeMap();
 * map.insert(Age.class, 42);
 * map.insert(Nickname.class, "Bob");
 *
 * int age = map.get(Age.class).orElse(0);
 * map.getMut(Age.class).ifPresent(slot -> slot.update(a -> a + 1));
 * map.entry(Nickname.class).orInsert("anonymous");
 * }</pre>
 *
 * <h2>Absence</h2>
 * <p>
 * Lookups and removals never fail: a missing slot is reported as an empty {@link Optional}
 * or {@code false}. {@code null} keys and values are rejected.
 * </p>
 *
 * <h2>Threading</h2>
 * <p>
 * Like {@link HashMap}, a {@code TypeMap} is not synchronized. Concurrent access must be
 * guarded by the caller.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class TypeMap {

    private final Map<Class<?>, Slot> data;

    /** Creates an empty map. */
    public TypeMap() {
        this.data = new HashMap<>();
    }

    /**
     * Creates a shallow copy of {@code other}: stored values are shared, slots are not.
     *
     * @param other map to copy; must not be {@code null}
     */
    public TypeMap(TypeMap other) {
        Objects.requireNonNull(other, "other cannot be null");
        this.data = new HashMap<>();
        other.data.forEach((key, slot) -> data.put(key, new Slot(slot.value)));
    }

    /**
     * Stores {@code value} in the slot of {@code key}, replacing any previous value.
     *
     * @param key   key type designating the slot
     * @param value value to store; must not be {@code null}
     * @param <V>   value type bound to {@code key}
     * @return the previous value, or an empty {@link Optional} if the slot was vacant
     * @throws NullPointerException if {@code key} or {@code value} is {@code null}
     */
    public <V> Optional<V> insert(Class<? extends Key<V>> key, V value) {
        KeyBinding binding = bindingOf(key);
        Objects.requireNonNull(value, "value cannot be null");
        Object erased = binding.erase(value);
        Slot slot = data.get(key);
        if (slot == null) {
            fill(key, erased);
            return Optional.empty();
        }
        Object previous = slot.value;
        slot.value = erased;
        return Optional.of(binding.recover(previous));
    }

    /**
     * Returns the value stored in the slot of {@code key}.
     *
     * @param key key type designating the slot
     * @param <V> value type bound to {@code key}
     * @return the value, or an empty {@link Optional} if the slot is vacant
     * @throws NullPointerException if {@code key} is {@code null}
     */
    public <V> Optional<V> get(Class<? extends Key<V>> key) {
        KeyBinding binding = bindingOf(key);
        Slot slot = data.get(key);
        return slot == null ? Optional.empty() : Optional.of(binding.recover(slot.value));
    }

    /**
     * Returns a mutable handle on the slot of {@code key}.
     * <p>
     * Writes through the handle are visible to later lookups. The handle must not be used
     * after its value has been removed from the map.
     * </p>
     *
     * @param key key type designating the slot
     * @param <V> value type bound to {@code key}
     * @return the occupied slot, or an empty {@link Optional} if the slot is vacant
     * @throws NullPointerException if {@code key} is {@code null}
     */
    public <V> Optional<OccupiedEntry<V>> getMut(Class<? extends Key<V>> key) {
        KeyBinding binding = bindingOf(key);
        Slot slot = data.get(key);
        if (slot == null) {
            return Optional.empty();
        }
        return Optional.of(new OccupiedEntry<>(this, binding, key, slot));
    }

    /**
     * @deprecated renamed to {@link #get(Class)}
     */
    @Deprecated
    public <V> Optional<V> find(Class<? extends Key<V>> key) {
        return get(key);
    }

    /**
     * @deprecated renamed to {@link #getMut(Class)}
     */
    @Deprecated
    public <V> Optional<OccupiedEntry<V>> findMut(Class<? extends Key<V>> key) {
        return getMut(key);
    }

    /**
     * Returns {@code true} if the slot of {@code key} holds a value.
     *
     * @param key key type designating the slot
     * @throws NullPointerException if {@code key} is {@code null}
     */
    public boolean contains(Class<? extends Key<?>> key) {
        bindingOf(key);
        return data.containsKey(key);
    }

    /**
     * Removes the value stored in the slot of {@code key}.
     * <p>
     * Entries previously obtained for that slot become stale.
     * </p>
     *
     * @param key key type designating the slot
     * @param <V> value type bound to {@code key}
     * @return the removed value, or an empty {@link Optional} if the slot was already vacant
     * @throws NullPointerException if {@code key} is {@code null}
     */
    public <V> Optional<V> remove(Class<? extends Key<V>> key) {
        KeyBinding binding = bindingOf(key);
        Slot removed = data.remove(key);
        return removed == null ? Optional.empty() : Optional.of(binding.recover(removed.value));
    }

    /**
     * Returns a view of the slot of {@code key} for in-place manipulation.
     *
     * @param key key type designating the slot
     * @param <V> value type bound to {@code key}
     * @return an {@link OccupiedEntry} if the slot currently holds a value, a {@link VacantEntry} otherwise
     * @throws NullPointerException if {@code key} is {@code null}
     */
    public <V> Entry<V> entry(Class<? extends Key<V>> key) {
        KeyBinding binding = bindingOf(key);
        Slot slot = data.get(key);
        if (slot != null) {
            return new OccupiedEntry<>(this, binding, key, slot);
        }
        return new VacantEntry<>(this, binding, key);
    }

    /** Number of occupied slots. */
    public int size() {
        return data.size();
    }

    public boolean isEmpty() {
        return data.isEmpty();
    }

    /** Removes every value from the map; all outstanding entries become stale. */
    public void clear() {
        data.clear();
    }

    Slot slot(Class<?> key) {
        return data.get(key);
    }

    /** Starts a new occupancy of the vacant slot of {@code key}. */
    Slot fill(Class<?> key, Object erased) {
        Slot slot = new Slot(erased);
        data.put(key, slot);
        return slot;
    }

    void evict(Class<?> key) {
        data.remove(key);
    }

    private static KeyBinding bindingOf(Class<?> key) {
        Objects.requireNonNull(key, "key cannot be null");
        return KeyBinding.of(key);
    }

    @Override
    public String toString() {
        return data.entrySet()
                .stream()
                .map(e -> e.getKey().getSimpleName() + "=" + e.getValue().value)
                .collect(Collectors.joining(", ", "TypeMap{", "}"));
    }
}
