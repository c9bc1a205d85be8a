package io.github.cyfko.typemap.processor;

import com.google.auto.service.AutoService;
import io.github.cyfko.typemap.MapKey;

import javax.annotation.processing.*;
import javax.lang.model.SourceVersion;
import javax.lang.model.element.*;
import javax.lang.model.type.DeclaredType;
import javax.lang.model.type.TypeKind;
import javax.lang.model.type.TypeMirror;
import javax.lang.model.util.Types;
import javax.tools.Diagnostic;
import java.util.*;

/**
 * Annotation processor validating the declarations of {@link MapKey} key types.
 * <p>
 * The processor validates:
 * <ul>
 *     <li>that @MapKey is used only on classes and enums</li>
 *     <li>that annotated classes are final</li>
 *     <li>that key types declare no type parameters</li>
 *     <li>that key types implement {@code Key} with an explicit value type</li>
 * </ul>
 * Instance fields on a key type only raise a warning.
 * <p>
 * Binding the same key type to two value types needs no check here: javac already refuses
 * a type inheriting {@code Key} with different arguments.
 * <p>
 * Compilation will fail if any validation errors are detected.
 */
@AutoService(Processor.class)
@SupportedAnnotationTypes("io.github.cyfko.typemap.MapKey")
public final class MapKeyProcessor extends AbstractProcessor {

    private static final String KEY_TYPE = "io.github.cyfko.typemap.Key";

    private final Set<String> validated = new LinkedHashSet<>();
    private boolean hasErrors = false;

    @Override
    public SourceVersion getSupportedSourceVersion() {
        return SourceVersion.latestSupported();
    }

    @Override
    public boolean process(Set<? extends TypeElement> annotations, RoundEnvironment env) {
        Messager log = processingEnv.getMessager();

        for (Element element : env.getElementsAnnotatedWith(MapKey.class)) {
            if (element.getKind() != ElementKind.CLASS && element.getKind() != ElementKind.ENUM) {
                log.printMessage(Diagnostic.Kind.ERROR,
                        "@MapKey can only be applied to classes or enums", element);
                hasErrors = true;
                continue;
            }

            TypeElement type = (TypeElement) element;
            String name = type.getQualifiedName().toString();

            if (validate(type, name, log)) {
                validated.add(name);
            } else {
                hasErrors = true;
            }
        }

        if (env.processingOver()) {
            if (hasErrors) {
                log.printMessage(Diagnostic.Kind.ERROR,
                        "Invalid @MapKey declarations. Fix the errors above and recompile.");
            } else if (!validated.isEmpty()) {
                log.printMessage(Diagnostic.Kind.NOTE,
                        "Validated " + validated.size() + " @MapKey types");
            }
        }

        return !annotations.isEmpty();
    }

    /** Reports every rule {@code type} breaks; returns {@code true} if none. */
    private boolean validate(TypeElement type, String name, Messager log) {
        boolean valid = true;

        if (type.getKind() == ElementKind.CLASS && !type.getModifiers().contains(Modifier.FINAL)) {
            log.printMessage(Diagnostic.Kind.ERROR,
                    "@MapKey class " + name + " must be final", type);
            valid = false;
        }

        if (!type.getTypeParameters().isEmpty()) {
            log.printMessage(Diagnostic.Kind.ERROR,
                    "@MapKey type " + name + " must not declare type parameters", type);
            valid = false;
        }

        DeclaredType binding = findKeySupertype(type.asType());
        if (binding == null) {
            log.printMessage(Diagnostic.Kind.ERROR,
                    "@MapKey type " + name + " does not implement " + KEY_TYPE, type);
            valid = false;
        } else if (binding.getTypeArguments().isEmpty()) {
            log.printMessage(Diagnostic.Kind.ERROR,
                    "@MapKey type " + name + " implements raw " + KEY_TYPE
                            + "; declare its value type", type);
            valid = false;
        }

        for (Element member : type.getEnclosedElements()) {
            if (member.getKind() == ElementKind.FIELD && !member.getModifiers().contains(Modifier.STATIC)) {
                log.printMessage(Diagnostic.Kind.WARNING,
                        "@MapKey type " + name + " declares instance field '" + member.getSimpleName()
                                + "'; key types are markers and carry no data", member);
            }
        }

        return valid;
    }

    /** Depth-first search of the supertypes of {@code type} for {@code Key}, as seen from {@code type}. */
    private DeclaredType findKeySupertype(TypeMirror type) {
        Types types = processingEnv.getTypeUtils();

        for (TypeMirror supertype : types.directSupertypes(type)) {
            if (supertype.getKind() != TypeKind.DECLARED) {
                continue;
            }
            DeclaredType declared = (DeclaredType) supertype;
            TypeElement element = (TypeElement) declared.asElement();
            if (element.getQualifiedName().contentEquals(KEY_TYPE)) {
                return declared;
            }
            DeclaredType found = findKeySupertype(declared);
            if (found != null) {
                return found;
            }
        }
        return null;
    }
}
