package com.github.musiKk.stubs;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.regex.Pattern;

import com.github.musiKk.stubs.parser.Module;
import com.github.musiKk.stubs.parser.Module.Alias;
import com.github.musiKk.stubs.parser.Module.ClassDef;
import com.github.musiKk.stubs.parser.Module.Constant;
import com.github.musiKk.stubs.parser.Module.Function;
import com.github.musiKk.stubs.parser.Module.Parameter;
import com.github.musiKk.stubs.parser.Type;

/**
 * Renders a {@link Module} as canonical stub text. Parsing the output again
 * gives back an equal module.
 */
public class StubPrinter {

    // printed bare, imported from typing
    static final Set<String> TYPING_NAMES = Set.of(
            "Any", "AnyStr", "Callable", "Dict", "FrozenSet", "Generator", "Generic", "Iterable",
            "Iterator", "List", "Mapping", "Optional", "Sequence", "Set", "Tuple", "Type", "TypeVar", "Union");

    private static final Pattern DOTTED_IDENTIFIER =
            Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)*");

    private static final String INDENT = "    ";

    private final SortedSet<String> typingNames = new TreeSet<>();

    public static String print(Module module) {
        return new StubPrinter().emit(module);
    }

    private String emit(Module module) {
        // the body decides which typing names the prologue has to import
        List<String> sections = new ArrayList<>();
        addSection(sections, module.aliases().stream().map(this::emitAlias).toList());
        addSection(sections, module.constants().stream().map(this::emitConstant).toList());
        addSection(sections, module.functions().stream().map(f -> emitFunction(f, "")).toList());
        if (!module.classes().isEmpty()) {
            sections.add(String.join("\n\n", module.classes().stream().map(this::emitClass).toList()));
        }

        List<String> prologue = new ArrayList<>();
        module.imports().forEach(i -> prologue.add("import " + i.module()));
        if (!typingNames.isEmpty()) {
            prologue.add("from typing import " + String.join(", ", typingNames));
        }
        if (!prologue.isEmpty()) {
            sections.add(0, String.join("\n", prologue));
        }

        return sections.isEmpty() ? "" : String.join("\n\n", sections) + "\n";
    }

    private static void addSection(List<String> sections, List<String> lines) {
        if (!lines.isEmpty()) {
            sections.add(String.join("\n", lines));
        }
    }

    private String emitAlias(Alias alias) {
        if (alias.value() instanceof Type.Name name && name.isQualified()) {
            var imported = name.name().substring(name.qualifier().length() + 1);
            var line = "from " + name.qualifier() + " import " + imported;
            return imported.equals(alias.name()) ? line : line + " as " + alias.name();
        }
        return quote(alias.name()) + " = " + emitType(alias.value());
    }

    private String emitConstant(Constant constant) {
        return quote(constant.name()) + " = ...  # type: " + emitType(constant.type());
    }

    private String emitFunction(Function function, String indent) {
        var text = new StringBuilder();
        switch (function.kind()) {
            case STATICMETHOD -> text.append(indent).append("@staticmethod\n");
            case CLASSMETHOD -> text.append(indent).append("@classmethod\n");
            case METHOD -> {
            }
        }
        text.append(indent).append("def ").append(quote(function.name()));
        if (function.external()) {
            return text.append(" PYTHONCODE").toString();
        }

        List<String> parameters = new ArrayList<>();
        for (var parameter : function.parameters()) {
            parameters.add(emitParameter(parameter));
        }
        text.append('(').append(String.join(", ", parameters)).append(") -> ").append(emitType(function.returnType()));
        if (!function.raises().isEmpty()) {
            text.append(" raises ").append(String.join(", ", function.raises().stream().map(this::emitType).toList()));
        }

        if (function.mutators().isEmpty()) {
            return text.append(": ...").toString();
        }
        text.append(':');
        for (var mutator : function.mutators()) {
            text.append('\n').append(indent).append(INDENT)
                    .append(mutator.parameter()).append(" := ").append(emitType(mutator.type()));
        }
        return text.toString();
    }

    private String emitParameter(Parameter parameter) {
        var prefix = switch (parameter.kind()) {
            case BARE_STAR -> "";
            case VAR_POSITIONAL -> "*";
            case VAR_KEYWORD -> "**";
            case POSITIONAL, KEYWORD_ONLY -> "";
        };
        var text = new StringBuilder(prefix).append(parameter.name());
        parameter.type().ifPresent(t -> text.append(": ").append(emitType(t)));
        if (parameter.hasDefault()) {
            text.append(" = ...");
        }
        return text.toString();
    }

    private String emitClass(ClassDef classDef) {
        var text = new StringBuilder("class ").append(quote(classDef.name()));
        List<String> arguments = new ArrayList<>();
        classDef.bases().forEach(b -> arguments.add(emitType(b)));
        classDef.metaclass().ifPresent(m -> arguments.add("metaclass=" + emitType(m)));
        if (!arguments.isEmpty()) {
            text.append('(').append(String.join(", ", arguments)).append(')');
        }
        text.append(":\n");

        if (classDef.constants().isEmpty() && classDef.methods().isEmpty()) {
            text.append(INDENT).append("pass\n");
        }
        for (var constant : classDef.constants()) {
            text.append(INDENT).append(emitConstant(constant)).append('\n');
        }
        for (var method : classDef.methods()) {
            text.append(emitFunction(method, INDENT)).append('\n');
        }
        // drop the last newline, the section join adds it back
        return text.substring(0, text.length() - 1);
    }

    String emitType(Type type) {
        if (type instanceof Type.Name name) {
            if (TYPING_NAMES.contains(name.name())) {
                typingNames.add(name.name());
            }
            return quote(name.name());
        } else if (type instanceof Type.ClassReference reference) {
            return quote(reference.name());
        } else if (type instanceof Type.Generic generic) {
            return emitType(generic.base()) + "[" + emitTypes(generic.parameters()) + "]";
        } else if (type instanceof Type.Union union) {
            typingNames.add("Union");
            return "Union[" + emitTypes(union.members()) + "]";
        } else if (type instanceof Type.Tuple tuple) {
            if (tuple.homogeneous()) {
                typingNames.add("Tuple");
                return "Tuple[" + emitType(tuple.elements().get(0)) + ", ...]";
            }
            return "[" + emitTypes(tuple.elements()) + "]";
        } else if (type instanceof Type.Anything) {
            typingNames.add("Any");
            return "Any";
        } else if (type instanceof Type.Nothing) {
            return "nothing";
        }
        throw new IllegalArgumentException("unknown type " + type);
    }

    private String emitTypes(List<Type> types) {
        return String.join(", ", types.stream().map(this::emitType).toList());
    }

    private static String quote(String name) {
        return DOTTED_IDENTIFIER.matcher(name).matches() ? name : "`" + name + "`";
    }

}
