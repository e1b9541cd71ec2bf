package com.github.musiKk.stubs.parser;

import java.util.List;
import java.util.Optional;

/**
 * The raw tree of a stub file, exactly as written. Nothing here has been
 * evaluated or normalized: conditionals still hold all of their branches and
 * type syntax still carries every sugared form.
 */
public record StubSource(List<Statement> statements) {

    public sealed interface Statement {
        int line();
    }

    public record ImportStatement(int line, List<ImportItem> items) implements Statement {}
    public record FromImportStatement(int line, String module, List<ImportItem> items) implements Statement {}
    public record ImportItem(String name, Optional<String> asName) {
        public ImportItem(String name) {
            this(name, Optional.empty());
        }
    }

    public record IfStatement(int line, List<ConditionalBranch> branches, Optional<List<Statement>> elseBody) implements Statement {}
    public record ConditionalBranch(Condition condition, List<Statement> body) {}
    public record Condition(int line, String left, String operator, Expr right) {}

    public record ConstantDefinition(int line, String name, Expr value, Optional<TypeNode> typeComment) implements Statement {}

    public record FunctionDefinition(
            int line,
            String name,
            List<Decorator> decorators,
            List<Param> parameters,
            Optional<TypeNode> returnType,
            List<TypeNode> raises,
            List<BodyStatement> body,
            boolean external) implements Statement {}

    public record Decorator(int line, String name, Optional<String> qualifier) {
        public Decorator(int line, String name) {
            this(line, name, Optional.empty());
        }
        public String text() {
            return qualifier.map(q -> name + "." + q).orElse(name);
        }
    }

    public record ClassDefinition(
            int line,
            String name,
            List<TypeNode> bases,
            Optional<TypeNode> metaclass,
            List<Statement> body) implements Statement {}

    public sealed interface Param {}
    public record NamedParam(String name, Optional<TypeNode> type, Optional<Expr> defaultValue) implements Param {
        public NamedParam(String name) {
            this(name, Optional.empty(), Optional.empty());
        }
    }
    // no name: the bare * marker
    public record StarParam(Optional<String> name, Optional<TypeNode> type) implements Param {}
    public record KwargsParam(String name, Optional<TypeNode> type) implements Param {}
    public record EllipsisParam() implements Param {}

    public sealed interface BodyStatement {
        int line();
    }
    public record MutatorStatement(int line, String name, TypeNode type) implements BodyStatement {}
    public record RaiseStatement(int line, TypeNode exception) implements BodyStatement {}

    public sealed interface Expr {}
    public record EllipsisExpr() implements Expr {}
    public record NumberExpr(String text) implements Expr {
        public boolean isInteger() {
            return text.indexOf('.') < 0;
        }
    }
    public record StringExpr(String value) implements Expr {}
    public record NameExpr(String name) implements Expr {}
    public record TupleExpr(List<Expr> elements) implements Expr {}

    public sealed interface TypeNode {}
    public record AnythingNode() implements TypeNode {}
    public record EllipsisNode() implements TypeNode {}
    public record NamedTypeNode(String name) implements TypeNode {}
    public record GenericTypeNode(String base, List<TypeNode> parameters) implements TypeNode {}
    public record AlternationNode(List<TypeNode> alternatives) implements TypeNode {}
    public record ImpliedTupleNode(List<TypeNode> elements) implements TypeNode {}
    public record NamedTupleNode(String name, List<NamedTupleField> fields) implements TypeNode {}
    public record NamedTupleField(String name, TypeNode type) {}

}
