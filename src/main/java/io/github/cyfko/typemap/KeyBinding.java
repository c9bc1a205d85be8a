package io.github.cyfko.typemap;

import java.lang.reflect.Array;
import java.lang.reflect.GenericArrayType;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.lang.reflect.TypeVariable;
import java.lang.reflect.WildcardType;
import java.util.HashMap;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Runtime view of the {@code Key<V>} binding declared by a key type.
 * <p>
 * This is the type-erasure boundary of {@link TypeMap}: every value goes through
 * {@link #erase(Object)} on the way in and {@link #recover(Object)} on the way out, both
 * against the binding of the same key type.
 * </p>
 */
final class KeyBinding {

    private static final Logger log = Logger.getLogger(KeyBinding.class.getName());

    private static final ClassValue<KeyBinding> BINDINGS = new ClassValue<>() {
        @Override
        protected KeyBinding computeValue(Class<?> keyType) {
            return resolve(keyType);
        }
    };

    private final Class<?> keyType;
    private final Class<?> valueType;

    private KeyBinding(Class<?> keyType, Class<?> valueType) {
        this.keyType = keyType;
        this.valueType = valueType;
    }

    /**
     * Returns the binding declared by {@code keyType}.
     *
     * @throws IllegalArgumentException if {@code keyType} does not implement {@link Key}
     */
    static KeyBinding of(Class<?> keyType) {
        return BINDINGS.get(keyType);
    }

    Class<?> keyType() {
        return keyType;
    }

    /** Raw class of the bound value type. */
    Class<?> valueType() {
        return valueType;
    }

    /**
     * Checks a value entering the map under this key.
     * <p>
     * Well-typed callers can never fail here; a mismatch means the generic signature was
     * bypassed with raw types or an unchecked cast.
     * </p>
     *
     * @throws ClassCastException if {@code value} is not an instance of the bound value type
     */
    Object erase(Object value) {
        if (!valueType.isInstance(value)) {
            throw new ClassCastException("Key " + keyType.getName() + " is bound to "
                    + valueType.getName() + ", cannot store " + value.getClass().getName());
        }
        return value;
    }

    /** Recovers a value stored under this key; {@code erased} must come from {@link #erase(Object)}. */
    <V> V recover(Object erased) {
        assert valueType.isInstance(erased)
                : "Slot of " + keyType.getName() + " holds " + erased.getClass().getName()
                + ", bound type is " + valueType.getName();
        @SuppressWarnings("unchecked")
        V value = (V) erased;
        return value;
    }

    private static KeyBinding resolve(Class<?> keyType) {
        Type bound = findKeyArgument(keyType, Map.of());
        if (bound == null) {
            throw new IllegalArgumentException(keyType.getName() + " does not implement " + Key.class.getName());
        }

        Class<?> valueType = erasure(bound);
        if (bound instanceof TypeVariable<?> || bound instanceof WildcardType) {
            log.warning(() -> "Key " + keyType.getName() + " binds an unresolved type " + bound.getTypeName()
                    + "; values are only checked against " + valueType.getName());
        } else {
            log.fine(() -> "Bound key " + keyType.getName() + " to " + bound.getTypeName());
        }
        return new KeyBinding(keyType, valueType);
    }

    /**
     * Searches the supertypes of {@code type} for {@code Key}, substituting the type variables
     * assigned by the subtype that led here.
     */
    private static Type findKeyArgument(Class<?> type, Map<TypeVariable<?>, Type> assigned) {
        for (Type iface : type.getGenericInterfaces()) {
            Type found = inspect(iface, assigned);
            if (found != null) return found;
        }
        Type superclass = type.getGenericSuperclass();
        return superclass == null ? null : inspect(superclass, assigned);
    }

    private static Type inspect(Type supertype, Map<TypeVariable<?>, Type> assigned) {
        if (supertype instanceof Class<?> raw) {
            // raw Key: nothing was declared, anything goes
            if (raw == Key.class) return Object.class;
            return findKeyArgument(raw, Map.of());
        }

        if (supertype instanceof ParameterizedType parameterized) {
            Class<?> raw = (Class<?>) parameterized.getRawType();
            Type[] arguments = parameterized.getActualTypeArguments().clone();
            for (int i = 0; i < arguments.length; i++) {
                arguments[i] = assigned.getOrDefault(arguments[i], arguments[i]);
            }
            if (raw == Key.class) return arguments[0];

            TypeVariable<?>[] parameters = raw.getTypeParameters();
            Map<TypeVariable<?>, Type> next = new HashMap<>();
            for (int i = 0; i < parameters.length; i++) {
                next.put(parameters[i], arguments[i]);
            }
            return findKeyArgument(raw, next);
        }

        return null;
    }

    private static Class<?> erasure(Type type) {
        if (type instanceof Class<?> cls) return cls;
        if (type instanceof ParameterizedType parameterized) return erasure(parameterized.getRawType());
        if (type instanceof GenericArrayType array) {
            Class<?> component = erasure(array.getGenericComponentType());
            return Array.newInstance(component, 0).getClass();
        }
        if (type instanceof TypeVariable<?> variable) return erasure(variable.getBounds()[0]);
        if (type instanceof WildcardType wildcard) return erasure(wildcard.getUpperBounds()[0]);
        return Object.class;
    }
}
