package io.github.cyfko.typemap;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a type as a {@link TypeMap} key type so its declaration is checked at compile time.
 *
 * <h3>Validation Rules</h3>
 * <p>
 * The {@code MapKeyProcessor} enforces the following constraints:
 * </p>
 * <ul>
 *   <li>{@code @MapKey} can only be applied to classes and enums.</li>
 *   <li>Annotated classes must be {@code final}.</li>
 *   <li>The type must not declare type parameters; its value type is fixed.</li>
 *   <li>The type must implement {@link Key} with an explicit value type, never the raw type.</li>
 *   <li>Instance fields are reported as warnings: key types are markers and carry no data.</li>
 * </ul>
 *
 * <p>
 * The retention policy is {@link RetentionPolicy#SOURCE}; the annotation has no runtime presence
 * and {@link TypeMap} does not depend on it.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.SOURCE)
public @interface MapKey {
}
