package com.github.musiKk.stubs.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.github.musiKk.stubs.ParseError;
import com.github.musiKk.stubs.parser.Module.Constant;
import com.github.musiKk.stubs.parser.StubSource.AlternationNode;
import com.github.musiKk.stubs.parser.StubSource.AnythingNode;
import com.github.musiKk.stubs.parser.StubSource.EllipsisNode;
import com.github.musiKk.stubs.parser.StubSource.GenericTypeNode;
import com.github.musiKk.stubs.parser.StubSource.ImpliedTupleNode;
import com.github.musiKk.stubs.parser.StubSource.NamedTupleNode;
import com.github.musiKk.stubs.parser.StubSource.NamedTypeNode;
import com.github.musiKk.stubs.parser.StubSource.TypeNode;
import com.github.musiKk.stubs.parser.Type.ClassReference;
import com.github.musiKk.stubs.parser.Type.Generic;
import com.github.musiKk.stubs.parser.Type.Tuple;

import lombok.RequiredArgsConstructor;

/**
 * Rewrites raw type syntax into canonical {@link Type}s.
 *
 * <p>Name resolution happens in this order: local classes, the from-import
 * alias table, then PEP 484 lowering of bare container names. Inline
 * NamedTuple literals are handed to the {@link NamedTupleSynthesizer}.
 */
@RequiredArgsConstructor
public class TypeNormalizer {

    static final Map<String, String> PEP484_NAMES = Map.of(
            "List", "list",
            "Dict", "dict",
            "Tuple", "tuple",
            "Set", "set",
            "FrozenSet", "frozenset",
            "Type", "type",
            "Generator", "generator");

    private final Set<String> localClasses;
    private final Map<String, String> importAliases;
    private final NamedTupleSynthesizer synthesizer;

    public Type normalize(TypeNode node, int line) {
        if (node instanceof AnythingNode || node instanceof EllipsisNode) {
            return Type.ANYTHING;
        } else if (node instanceof NamedTypeNode named) {
            return normalizeName(named.name());
        } else if (node instanceof GenericTypeNode generic) {
            return normalizeGeneric(generic, line);
        } else if (node instanceof AlternationNode alternation) {
            return Type.unionOf(normalizeAll(alternation.alternatives(), line));
        } else if (node instanceof ImpliedTupleNode tuple) {
            return new Tuple(normalizeAll(tuple.elements(), line), false);
        } else if (node instanceof NamedTupleNode namedTuple) {
            List<Constant> fields = new ArrayList<>();
            for (var field : namedTuple.fields()) {
                fields.add(new Constant(field.name(), normalize(field.type(), line)));
            }
            return synthesizer.synthesize(namedTuple.name(), fields);
        }
        throw new IllegalArgumentException("unknown type node " + node);
    }

    public List<Type> normalizeAll(List<TypeNode> nodes, int line) {
        List<Type> types = new ArrayList<>();
        for (var node : nodes) {
            types.add(normalize(node, line));
        }
        return types;
    }

    private Type normalizeName(String name) {
        switch (name) {
            case "nothing":
                return Type.NOTHING;
            case "Any", "typing.Any":
                return Type.ANYTHING;
            case "NamedTuple", "typing.NamedTuple":
                return Type.name("tuple");
            default:
                break;
        }
        var resolved = resolve(name);
        if (resolved instanceof Type.Name n) {
            var simple = n.name().startsWith("typing.") ? n.name().substring("typing.".length()) : n.name();
            var lowered = PEP484_NAMES.get(simple);
            if (lowered != null) {
                return Type.name(lowered);
            }
        }
        return resolved;
    }

    private Type resolve(String name) {
        if (localClasses.contains(name)) {
            return new ClassReference(name);
        }
        int dot = name.indexOf('.');
        var head = dot < 0 ? name : name.substring(0, dot);
        var target = importAliases.get(head);
        if (target != null) {
            return Type.name(dot < 0 ? target : target + name.substring(dot));
        }
        return Type.name(name);
    }

    private Type normalizeGeneric(GenericTypeNode generic, int line) {
        var baseName = generic.base();
        var base = resolve(baseName);
        var unqualified = baseName.startsWith("typing.") ? baseName.substring("typing.".length()) : baseName;
        // neither shadowed by a local class nor rebound by an import
        boolean builtin = base.equals(Type.name(baseName));

        if (builtin && unqualified.equals("Callable")) {
            return base;
        }

        var rawParameters = generic.parameters();
        boolean trailingEllipsis = rawParameters.size() == 2 && rawParameters.get(1) instanceof EllipsisNode;
        if (trailingEllipsis) {
            if (rawParameters.get(0) instanceof EllipsisNode) {
                throw ParseError.syntax(line, "[..., ...] not supported");
            }
            rawParameters = rawParameters.subList(0, 1);
        }
        var parameters = normalizeAll(rawParameters, line);

        if (builtin) {
            switch (unqualified) {
                case "Union":
                    return parameters.isEmpty() ? Type.NOTHING : Type.unionOf(parameters);
                case "Optional":
                    List<Type> members = new ArrayList<>(parameters);
                    members.add(Type.name("None"));
                    return Type.unionOf(members);
                case "Tuple":
                    return parameters.isEmpty()
                            ? new Tuple(List.of(), false)
                            : Tuple.homogeneous(Type.unionOf(parameters));
                default:
                    break;
            }
        }
        return new Generic(base, parameters);
    }

}
