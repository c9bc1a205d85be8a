package io.github.cyfko.example;

import io.github.cyfko.typemap.Key;
import io.github.cyfko.typemap.MapKey;

@MapKey
public final class Age implements Key<Integer> {
    private Age() {
    }
}
