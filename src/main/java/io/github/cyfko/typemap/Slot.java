package io.github.cyfko.typemap;

/**
 * Holder of one occupancy of a {@link TypeMap} slot.
 * <p>
 * A new holder is created each time a vacant slot is filled and kept while the value is
 * overwritten, so an {@link OccupiedEntry} can tell its own occupancy from a later one.
 * </p>
 */
final class Slot {

    Object value;

    Slot(Object value) {
        this.value = value;
    }
}
