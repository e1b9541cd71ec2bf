package com.github.musiKk.stubs.parser;

import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * The public interface of one stub file after conditional evaluation and
 * normalization. Immutable; equal modules print to the same text.
 */
public record Module(
        List<Import> imports,
        List<Alias> aliases,
        List<Constant> constants,
        List<Function> functions,
        List<ClassDef> classes) {

    public Module {
        imports = List.copyOf(imports);
        aliases = List.copyOf(aliases);
        constants = List.copyOf(constants);
        functions = List.copyOf(functions);
        classes = List.copyOf(classes);
    }

    public SortedSet<String> requiredImports() {
        return Collections.unmodifiableSortedSet(imports.stream()
                .map(Import::module)
                .collect(Collectors.toCollection(TreeSet::new)));
    }

    public Optional<ClassDef> lookupClass(String name) {
        return classes.stream().filter(c -> c.name().equals(name)).findFirst();
    }

    public List<Function> lookupFunctions(String name) {
        return functions.stream().filter(f -> f.name().equals(name)).toList();
    }

    public sealed interface Declaration {
        String name();
    }

    public record Import(String module) {}

    public record Alias(String name, Type value) implements Declaration {}

    public record Constant(String name, Type type) implements Declaration {}

    public record Function(
            String name,
            List<Parameter> parameters,
            Type returnType,
            List<Type> raises,
            Kind kind,
            boolean external,
            List<Mutator> mutators) implements Declaration {

        public enum Kind { METHOD, STATICMETHOD, CLASSMETHOD }

        public Function {
            parameters = List.copyOf(parameters);
            raises = List.copyOf(raises);
            mutators = List.copyOf(mutators);
        }

        public static Function external(String name) {
            return new Function(name, List.of(), Type.ANYTHING, List.of(), Kind.METHOD, true, List.of());
        }
    }

    public record Parameter(String name, Optional<Type> type, boolean hasDefault, Kind kind) {

        public enum Kind { POSITIONAL, BARE_STAR, VAR_POSITIONAL, KEYWORD_ONLY, VAR_KEYWORD }

        public static final String BARE_STAR_NAME = "*";

        public static Parameter bareStar() {
            return new Parameter(BARE_STAR_NAME, Optional.empty(), false, Kind.BARE_STAR);
        }
    }

    public record Mutator(String parameter, Type type) {}

    public record ClassDef(
            String name,
            List<Type> bases,
            Optional<Type> metaclass,
            List<Constant> constants,
            List<Function> methods) implements Declaration {

        public ClassDef {
            bases = List.copyOf(bases);
            constants = List.copyOf(constants);
            methods = List.copyOf(methods);
        }
    }

}
