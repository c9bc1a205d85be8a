package io.github.cyfko.example;

import io.github.cyfko.typemap.Key;
import io.github.cyfko.typemap.MapKey;

import java.util.Set;

@MapKey
public enum Role implements Key<Set<String>> {
    ;

    static final String DEFAULT_ROLE = "reader";
}
