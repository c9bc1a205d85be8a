package io.github.cyfko.typemap;

/**
 * Binds a key type to the single value type that may be stored under it in a {@link TypeMap}.
 * <p>
 * A key type is a marker: it is never instantiated as stored data, only its {@link Class}
 * literal is passed to the map. Implementing {@code Key<V>} is the one and only declaration
 * of which type {@code V} the slot designated by that key type holds.
 * </p>
 *
 * <h3>Semantics</h3>
 * <ul>
 *   <li>Each key type designates <strong>exactly one</strong> slot in a map.</li>
 *   <li>The value type is fixed by the type argument. The compiler refuses a type that
 *       inherits {@code Key} with two different arguments, so a key type can never be
 *       bound to two value types anywhere in the program.</li>
 *   <li>Two distinct key types may share a value type; their slots stay independent.</li>
 * </ul>
 *
 * <h3>Typical Usage</h3>
 * <pre>{@code
 * @MapKey
 * public final class SessionUser implements Key<User> {
 *     private SessionUser() {}
 * }
 *
 * TypeMap map = new TypeMap();
 * map.insert(SessionUser.class, user);           // only a User is accepted
 * Optional<User> found = map.get(SessionUser.class);
 * }</pre>
 *
 * <p>
 * Annotating key types with {@link MapKey} lets the bundled annotation processor reject
 * malformed declarations (non-final classes, raw or generic bindings) at compile time.
 * </p>
 *
 * @param <V> the value type bound to the implementing key type
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface Key<V> {
}
