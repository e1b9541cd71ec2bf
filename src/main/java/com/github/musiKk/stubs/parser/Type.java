package com.github.musiKk.stubs.parser;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Canonical type expressions. Every value is fully normalized: unions are
 * flat and deduplicated, and sugar such as {@code T or U} or {@code [T]} no
 * longer exists.
 */
public sealed interface Type {

    Type ANYTHING = new Anything();
    Type NOTHING = new Nothing();

    static Name name(String name) {
        return new Name(name);
    }

    record Name(String name) implements Type {
        public boolean isQualified() {
            return name.indexOf('.') > 0;
        }
        public String qualifier() {
            return name.substring(0, name.lastIndexOf('.'));
        }
    }

    record Generic(Type base, List<Type> parameters) implements Type {
        public Generic {
            parameters = List.copyOf(parameters);
        }
    }

    record Union(List<Type> members) implements Type {
        public Union {
            members = List.copyOf(members);
        }
    }

    // homogeneous: one element type, any number of values
    record Tuple(List<Type> elements, boolean homogeneous) implements Type {
        public Tuple {
            elements = List.copyOf(elements);
        }
        public static Tuple homogeneous(Type element) {
            return new Tuple(List.of(element), true);
        }
    }

    record Anything() implements Type {}

    record Nothing() implements Type {}

    record ClassReference(String name) implements Type {}

    static Type unionOf(List<Type> members) {
        Set<Type> flat = new LinkedHashSet<>();
        for (var member : members) {
            if (member instanceof Union u) {
                flat.addAll(u.members());
            } else {
                flat.add(member);
            }
        }
        if (flat.isEmpty()) {
            throw new IllegalArgumentException("union without members");
        }
        if (flat.size() == 1) {
            return flat.iterator().next();
        }
        return new Union(new ArrayList<>(flat));
    }

    static Type unionOf(Type... members) {
        return unionOf(List.of(members));
    }

}
