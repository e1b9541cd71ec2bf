package com.github.musiKk.stubs.parser;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

import com.github.musiKk.stubs.ParseError;
import com.github.musiKk.stubs.parser.Module.Alias;
import com.github.musiKk.stubs.parser.Module.ClassDef;
import com.github.musiKk.stubs.parser.Module.Constant;
import com.github.musiKk.stubs.parser.Module.Declaration;
import com.github.musiKk.stubs.parser.Module.Function;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;
import lombok.experimental.Accessors;

/**
 * The declarations of one scope, the module or a single class body, in the
 * order they were registered.
 *
 * <p>A name may be declared once, except that functions may repeat: every
 * further function of the same name is an overload variant. Collisions are
 * collected rather than thrown so that one error can name all of them.
 */
@RequiredArgsConstructor
@ToString
public class ScopeTable {

    public enum Level { MODULE, CLASS }

    private final Level level;

    @Getter
    @Accessors(fluent = true)
    private final List<Alias> aliases = new ArrayList<>();
    @Getter
    @Accessors(fluent = true)
    private final List<Constant> constants = new ArrayList<>();
    @Getter
    @Accessors(fluent = true)
    private final List<Function> functions = new ArrayList<>();
    @Getter
    @Accessors(fluent = true)
    private final List<ClassDef> classes = new ArrayList<>();

    // true for function names, false for everything else
    private final Map<String, Boolean> declared = new HashMap<>();
    private final SortedSet<String> duplicates = new TreeSet<>();

    public void add(Declaration declaration) {
        register(declaration.name(), declaration instanceof Function);
        if (declaration instanceof Alias alias) {
            aliases.add(alias);
        } else if (declaration instanceof Constant constant) {
            constants.add(constant);
        } else if (declaration instanceof Function function) {
            functions.add(function);
        } else if (declaration instanceof ClassDef classDef) {
            classes.add(classDef);
        }
    }

    private void register(String name, boolean function) {
        var previous = declared.get(name);
        if (previous == null) {
            declared.put(name, function);
        } else if (!(previous && function)) {
            duplicates.add(name);
        }
    }

    public boolean isDeclared(String name) {
        return declared.containsKey(name);
    }

    // line is ignored for the module scope
    public void checkDuplicates(int line) {
        if (duplicates.isEmpty()) {
            return;
        }
        var names = String.join(", ", duplicates);
        throw switch (level) {
            case MODULE -> ParseError.moduleWide(ParseError.Kind.DUPLICATE_IDENTIFIER,
                    "Duplicate top-level identifier(s): " + names);
            case CLASS -> ParseError.at(ParseError.Kind.DUPLICATE_IDENTIFIER, line,
                    "Duplicate identifier(s): " + names);
        };
    }

}
