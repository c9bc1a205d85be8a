package io.github.cyfko.typemap;

import java.util.function.Supplier;

/**
 * View onto the slot a key type designates in a {@link TypeMap}, for in-place manipulation.
 * <p>
 * Obtained from {@link TypeMap#entry(Class)}; the slot is either an {@link OccupiedEntry}
 * or a {@link VacantEntry} at the time the view was taken.
 * </p>
 *
 * @param <V> value type bound to the entry's key type
 */
public sealed interface Entry<V> permits OccupiedEntry, VacantEntry {

    /** Key type designating this slot. */
    Class<? extends Key<V>> key();

    boolean isOccupied();

    /**
     * Returns the stored value, storing {@code defaultValue} first if the slot is vacant.
     *
     * @throws NullPointerException if {@code defaultValue} is {@code null}
     */
    V orInsert(V defaultValue);

    /**
     * Returns the stored value, storing the supplied one first if the slot is vacant.
     * The supplier is only called for a vacant slot.
     *
     * @throws NullPointerException if the supplier is {@code null} or returns {@code null}
     */
    V orInsertWith(Supplier<? extends V> defaultValue);
}
