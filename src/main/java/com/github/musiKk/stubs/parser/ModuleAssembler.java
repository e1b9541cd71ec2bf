package com.github.musiKk.stubs.parser;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.musiKk.stubs.ParseError;
import com.github.musiKk.stubs.parser.DecoratorResolver.PropertyRole;
import com.github.musiKk.stubs.parser.Module.Alias;
import com.github.musiKk.stubs.parser.Module.ClassDef;
import com.github.musiKk.stubs.parser.Module.Constant;
import com.github.musiKk.stubs.parser.Module.Declaration;
import com.github.musiKk.stubs.parser.Module.Function;
import com.github.musiKk.stubs.parser.Module.Import;
import com.github.musiKk.stubs.parser.Module.Mutator;
import com.github.musiKk.stubs.parser.Module.Parameter;
import com.github.musiKk.stubs.parser.StubSource.ClassDefinition;
import com.github.musiKk.stubs.parser.StubSource.ConstantDefinition;
import com.github.musiKk.stubs.parser.StubSource.EllipsisExpr;
import com.github.musiKk.stubs.parser.StubSource.FromImportStatement;
import com.github.musiKk.stubs.parser.StubSource.FunctionDefinition;
import com.github.musiKk.stubs.parser.StubSource.IfStatement;
import com.github.musiKk.stubs.parser.StubSource.ImportStatement;
import com.github.musiKk.stubs.parser.StubSource.MutatorStatement;
import com.github.musiKk.stubs.parser.StubSource.NameExpr;
import com.github.musiKk.stubs.parser.StubSource.NamedTypeNode;
import com.github.musiKk.stubs.parser.StubSource.Statement;
import com.github.musiKk.stubs.parser.StubSource.StringExpr;

import lombok.RequiredArgsConstructor;

/**
 * Builds the {@link Module} of one stub source. An instance assembles a
 * single module: its scope table and NamedTuple registry live exactly as
 * long as the parse.
 *
 * <p>Only statements of live branches are ever registered. The names of the
 * live module classes are collected before the first type is normalized,
 * which makes class shadowing independent of declaration order. The
 * conditionals themselves are resolved again in source order while
 * assembling, so a bad condition is reported after any earlier error.
 */
@RequiredArgsConstructor
public class ModuleAssembler {

    private static final Logger log = LoggerFactory.getLogger(ModuleAssembler.class);

    private final ConditionEvaluator evaluator;

    private final ScopeTable scope = new ScopeTable(ScopeTable.Level.MODULE);
    private final NamedTupleSynthesizer synthesizer = new NamedTupleSynthesizer();
    private final DecoratorResolver decorators = new DecoratorResolver();
    private final SortedSet<String> explicitImports = new TreeSet<>();
    private final Set<String> moduleProperties = new LinkedHashSet<>();

    private TypeNormalizer normalizer;
    private ParameterBuilder parameters;

    public Module assemble(StubSource source) {
        // ends at a bad conditional, which fails the parse when it is reached
        var live = evaluator.liveStatements(source.statements());

        normalizer = new TypeNormalizer(collectClassNames(live), collectAliases(live), synthesizer);
        parameters = new ParameterBuilder(normalizer);

        assembleStatements(source.statements());

        if (!moduleProperties.isEmpty()) {
            throw ParseError.moduleWide(ParseError.Kind.INVALID_DECORATOR,
                    "Module-level functions with property decorators: " + String.join(", ", moduleProperties));
        }
        synthesizer.classes().forEach(scope::add);
        scope.checkDuplicates(0);

        SortedSet<String> imports = new TreeSet<>(explicitImports);
        imports.addAll(requiredModules(scope));
        return new Module(
                imports.stream().map(Import::new).toList(),
                scope.aliases(),
                scope.constants(),
                scope.functions(),
                scope.classes());
    }

    private void assembleStatements(List<Statement> statements) {
        for (var statement : statements) {
            if (statement instanceof IfStatement ifStatement) {
                assembleStatements(evaluator.selectBranch(ifStatement));
            } else {
                assembleStatement(statement);
            }
        }
    }

    private void assembleStatement(Statement statement) {
        if (statement instanceof ImportStatement importStatement) {
            for (var item : importStatement.items()) {
                if (item.asName().isPresent()) {
                    throw ParseError.syntax(importStatement.line(), "Renaming of modules not supported");
                }
                explicitImports.add(item.name());
            }
        } else if (statement instanceof FromImportStatement fromImport) {
            assembleFromImport(fromImport);
        } else if (statement instanceof ConstantDefinition constant) {
            scope.add(constantOrAlias(constant, ScopeTable.Level.MODULE));
        } else if (statement instanceof FunctionDefinition definition) {
            var resolution = decorators.resolve(definition);
            if (resolution.isProperty()) {
                moduleProperties.add(definition.name());
            } else {
                scope.add(function(definition, resolution.kind()));
            }
        } else if (statement instanceof ClassDefinition definition) {
            scope.add(classDef(definition));
        } else {
            throw new IllegalStateException("unexpected statement " + statement);
        }
    }

    // from typing import X binds nothing; X is known without it
    private void assembleFromImport(FromImportStatement fromImport) {
        for (var item : fromImport.items()) {
            if (item.name().equals("*")) {
                continue;
            }
            if (fromImport.module().equals("typing") && item.asName().isEmpty()) {
                continue;
            }
            var name = item.asName().orElse(item.name());
            scope.add(new Alias(name, Type.name(fromImport.module() + "." + item.name())));
        }
    }

    private Declaration constantOrAlias(ConstantDefinition definition, ScopeTable.Level level) {
        var name = definition.name();
        int line = definition.line();
        if (definition.typeComment().isPresent()) {
            return new Constant(name, normalizer.normalize(definition.typeComment().get(), line));
        }

        var value = definition.value();
        if (value instanceof EllipsisExpr) {
            return new Constant(name, Type.ANYTHING);
        } else if (value instanceof StringExpr) {
            return new Constant(name, Type.name("str"));
        }
        var literal = ParameterBuilder.inferType(value);
        if (literal.isPresent()) {
            return new Constant(name, literal.get());
        }
        if (value instanceof NameExpr reference) {
            if (level == ScopeTable.Level.CLASS) {
                throw ParseError.syntax(line, "Aliases are not allowed in class bodies");
            }
            return new Alias(name, normalizer.normalize(new NamedTypeNode(reference.name()), line));
        }
        throw ParseError.syntax(line, "syntax error, unsupported value for " + name);
    }

    private Function function(FunctionDefinition definition, Function.Kind kind) {
        int line = definition.line();
        if (definition.external()) {
            return new Function(definition.name(), List.of(), Type.ANYTHING, List.of(), kind, true, List.of());
        }

        var params = parameters.build(definition.parameters(), line);
        var returnType = definition.returnType()
                .map(t -> normalizer.normalize(t, line))
                .orElse(Type.ANYTHING);
        var raises = normalizer.normalizeAll(definition.raises(), line);

        Set<String> names = new HashSet<>();
        params.stream()
                .filter(p -> p.kind() != Parameter.Kind.BARE_STAR)
                .forEach(p -> names.add(p.name()));
        List<Mutator> mutators = new ArrayList<>();
        for (var statement : definition.body()) {
            // raise statements document behavior only
            if (statement instanceof MutatorStatement mutator) {
                if (!names.contains(mutator.name())) {
                    throw ParseError.at(ParseError.Kind.UNKNOWN_MUTATED_PARAMETER, line,
                            "No parameter named " + mutator.name());
                }
                mutators.add(new Mutator(mutator.name(), normalizer.normalize(mutator.type(), mutator.line())));
            }
        }
        return new Function(definition.name(), params, returnType, raises, kind, false, mutators);
    }

    private ClassDef classDef(ClassDefinition definition) {
        int line = definition.line();
        var bases = normalizer.normalizeAll(definition.bases(), line).stream()
                .filter(base -> !base.equals(Type.NOTHING))
                .toList();
        var metaclass = definition.metaclass().map(t -> normalizer.normalize(t, line));

        var classScope = new ScopeTable(ScopeTable.Level.CLASS);
        assembleClassBody(definition.name(), definition.body(), classScope);
        classScope.checkDuplicates(line);

        return new ClassDef(definition.name(), bases, metaclass, classScope.constants(), classScope.functions());
    }

    private void assembleClassBody(String className, List<Statement> body, ScopeTable classScope) {
        for (var statement : body) {
            if (statement instanceof IfStatement ifStatement) {
                assembleClassBody(className, evaluator.selectBranch(ifStatement), classScope);
            } else if (statement instanceof ConstantDefinition constant) {
                classScope.add(constantOrAlias(constant, ScopeTable.Level.CLASS));
            } else if (statement instanceof FunctionDefinition method) {
                var resolution = decorators.resolve(method);
                if (resolution.property() == PropertyRole.GETTER) {
                    var getter = function(method, resolution.kind());
                    log.debug("{}.{}: property becomes a constant", className, method.name());
                    classScope.add(new Constant(method.name(), getter.returnType()));
                } else if (resolution.property() == PropertyRole.NONE) {
                    classScope.add(function(method, resolution.kind()));
                }
            } else {
                throw ParseError.syntax(statement.line(), "syntax error, not allowed in a class body");
            }
        }
    }

    private static Set<String> collectClassNames(List<Statement> statements) {
        Set<String> names = new HashSet<>();
        for (var statement : statements) {
            if (statement instanceof ClassDefinition definition) {
                names.add(definition.name());
            }
        }
        return names;
    }

    // from-imports and aliases such as x = foo.Bar, in source order
    private static Map<String, String> collectAliases(List<Statement> statements) {
        Map<String, String> aliases = new HashMap<>();
        for (var statement : statements) {
            if (statement instanceof FromImportStatement fromImport) {
                for (var item : fromImport.items()) {
                    if (item.name().equals("*") || (fromImport.module().equals("typing") && item.asName().isEmpty())) {
                        continue;
                    }
                    aliases.put(item.asName().orElse(item.name()), fromImport.module() + "." + item.name());
                }
            } else if (statement instanceof ConstantDefinition constant
                    && constant.typeComment().isEmpty()
                    && constant.value() instanceof NameExpr reference) {
                var value = reference.name();
                int dot = value.indexOf('.');
                var head = dot < 0 ? value : value.substring(0, dot);
                if (aliases.containsKey(head)) {
                    value = aliases.get(head) + (dot < 0 ? "" : value.substring(dot));
                }
                if (value.indexOf('.') > 0) {
                    aliases.put(constant.name(), value);
                }
            }
        }
        return aliases;
    }

    private static Set<String> requiredModules(ScopeTable scope) {
        Set<String> modules = new HashSet<>();
        scope.constants().forEach(c -> collectModules(c.type(), modules));
        scope.functions().forEach(f -> collectModules(f, modules));
        for (var classDef : scope.classes()) {
            classDef.bases().forEach(b -> collectModules(b, modules));
            classDef.metaclass().ifPresent(m -> collectModules(m, modules));
            classDef.constants().forEach(c -> collectModules(c.type(), modules));
            classDef.methods().forEach(f -> collectModules(f, modules));
        }
        return modules;
    }

    private static void collectModules(Function function, Set<String> modules) {
        function.parameters().forEach(p -> p.type().ifPresent(t -> collectModules(t, modules)));
        collectModules(function.returnType(), modules);
        function.raises().forEach(r -> collectModules(r, modules));
        function.mutators().forEach(m -> collectModules(m.type(), modules));
    }

    static void collectModules(Type type, Set<String> modules) {
        if (type instanceof Type.Name name) {
            if (name.isQualified()) {
                modules.add(name.qualifier());
            }
        } else if (type instanceof Type.Generic generic) {
            collectModules(generic.base(), modules);
            generic.parameters().forEach(p -> collectModules(p, modules));
        } else if (type instanceof Type.Union union) {
            union.members().forEach(m -> collectModules(m, modules));
        } else if (type instanceof Type.Tuple tuple) {
            tuple.elements().forEach(e -> collectModules(e, modules));
        }
    }

}
