package com.github.musiKk.stubs.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.github.musiKk.stubs.ParseError;
import com.github.musiKk.stubs.Tokenizer.Token;
import com.github.musiKk.stubs.Tokenizer.TokenType;
import com.github.musiKk.stubs.Tokenizer.Tokens;
import com.github.musiKk.stubs.parser.StubSource.AlternationNode;
import com.github.musiKk.stubs.parser.StubSource.AnythingNode;
import com.github.musiKk.stubs.parser.StubSource.BodyStatement;
import com.github.musiKk.stubs.parser.StubSource.ClassDefinition;
import com.github.musiKk.stubs.parser.StubSource.Condition;
import com.github.musiKk.stubs.parser.StubSource.ConditionalBranch;
import com.github.musiKk.stubs.parser.StubSource.ConstantDefinition;
import com.github.musiKk.stubs.parser.StubSource.Decorator;
import com.github.musiKk.stubs.parser.StubSource.EllipsisExpr;
import com.github.musiKk.stubs.parser.StubSource.EllipsisNode;
import com.github.musiKk.stubs.parser.StubSource.EllipsisParam;
import com.github.musiKk.stubs.parser.StubSource.Expr;
import com.github.musiKk.stubs.parser.StubSource.FromImportStatement;
import com.github.musiKk.stubs.parser.StubSource.FunctionDefinition;
import com.github.musiKk.stubs.parser.StubSource.GenericTypeNode;
import com.github.musiKk.stubs.parser.StubSource.IfStatement;
import com.github.musiKk.stubs.parser.StubSource.ImpliedTupleNode;
import com.github.musiKk.stubs.parser.StubSource.ImportItem;
import com.github.musiKk.stubs.parser.StubSource.ImportStatement;
import com.github.musiKk.stubs.parser.StubSource.KwargsParam;
import com.github.musiKk.stubs.parser.StubSource.MutatorStatement;
import com.github.musiKk.stubs.parser.StubSource.NameExpr;
import com.github.musiKk.stubs.parser.StubSource.NamedParam;
import com.github.musiKk.stubs.parser.StubSource.NamedTupleField;
import com.github.musiKk.stubs.parser.StubSource.NamedTupleNode;
import com.github.musiKk.stubs.parser.StubSource.NamedTypeNode;
import com.github.musiKk.stubs.parser.StubSource.NumberExpr;
import com.github.musiKk.stubs.parser.StubSource.Param;
import com.github.musiKk.stubs.parser.StubSource.RaiseStatement;
import com.github.musiKk.stubs.parser.StubSource.StarParam;
import com.github.musiKk.stubs.parser.StubSource.Statement;
import com.github.musiKk.stubs.parser.StubSource.StringExpr;
import com.github.musiKk.stubs.parser.StubSource.TupleExpr;
import com.github.musiKk.stubs.parser.StubSource.TypeNode;

public class Parser {

    enum Context { MODULE, CLASS }

    public StubSource parseStubSource(Tokens tokens) {
        List<Statement> statements = new ArrayList<>();

        while (!tokens.matches(TokenType.EOF)) {
            parseStatement(tokens, Context.MODULE).ifPresent(statements::add);
        }

        return new StubSource(statements);
    }

    Optional<Statement> parseStatement(Tokens tokens, Context context) {
        var token = tokens.peek();

        return switch (token.type()) {
            case IMPORT -> Optional.of(parseImportStatement(tokens, context));
            case FROM -> Optional.of(parseFromImportStatement(tokens, context));
            case IF -> Optional.of(parseIfStatement(tokens, context));
            case AT, DEF -> Optional.of(parseFunctionDefinition(tokens));
            case CLASS -> Optional.of(parseClassDefinition(tokens, context));
            case IDENTIFIER -> Optional.of(parseConstantDefinition(tokens));
            case PASS, ELLIPSIS, STRING -> {
                // pass, ... and docstrings declare nothing
                tokens.next();
                tokens.next(TokenType.NEWLINE);
                yield Optional.empty();
            }
            default -> throw Tokens.unexpected(token);
        };
    }

    // <> import dotted [as name] ("," dotted [as name])*
    private ImportStatement parseImportStatement(Tokens tokens, Context context) {
        var importToken = tokens.next(TokenType.IMPORT);
        requireModuleLevel(importToken, context);

        List<ImportItem> items = new ArrayList<>();
        do {
            items.add(parseImportItem(tokens, parseDottedName(tokens)));
        } while (consume(tokens, TokenType.COMMA));
        tokens.next(TokenType.NEWLINE);
        return new ImportStatement(importToken.line(), items);
    }

    // <> from dotted import ("*" | items | "(" items [","] ")")
    private FromImportStatement parseFromImportStatement(Tokens tokens, Context context) {
        var fromToken = tokens.next(TokenType.FROM);
        requireModuleLevel(fromToken, context);
        var module = parseDottedName(tokens);
        tokens.next(TokenType.IMPORT);

        List<ImportItem> items = new ArrayList<>();
        if (consume(tokens, TokenType.STAR)) {
            items.add(new ImportItem("*"));
        } else if (consume(tokens, TokenType.LPAREN)) {
            while (!tokens.matches(TokenType.RPAREN)) {
                items.add(parseImportItem(tokens, tokens.next(TokenType.IDENTIFIER).image()));
                if (!consume(tokens, TokenType.COMMA)) {
                    break;
                }
            }
            tokens.next(TokenType.RPAREN);
        } else {
            do {
                items.add(parseImportItem(tokens, tokens.next(TokenType.IDENTIFIER).image()));
            } while (consume(tokens, TokenType.COMMA));
        }
        tokens.next(TokenType.NEWLINE);
        return new FromImportStatement(fromToken.line(), module, items);
    }

    private ImportItem parseImportItem(Tokens tokens, String name) {
        if (consume(tokens, TokenType.AS)) {
            return new ImportItem(name, Optional.of(tokens.next(TokenType.IDENTIFIER).image()));
        }
        return new ImportItem(name);
    }

    // <> if condition ":" block (elif condition ":" block)* [else ":" block]
    private IfStatement parseIfStatement(Tokens tokens, Context context) {
        var ifToken = tokens.next(TokenType.IF);
        List<ConditionalBranch> branches = new ArrayList<>();

        var condition = parseCondition(tokens);
        tokens.next(TokenType.COLON);
        branches.add(new ConditionalBranch(condition, parseBlock(tokens, context)));

        while (consume(tokens, TokenType.ELIF)) {
            var elifCondition = parseCondition(tokens);
            tokens.next(TokenType.COLON);
            branches.add(new ConditionalBranch(elifCondition, parseBlock(tokens, context)));
        }

        Optional<List<Statement>> elseBody = Optional.empty();
        if (consume(tokens, TokenType.ELSE)) {
            tokens.next(TokenType.COLON);
            elseBody = Optional.of(parseBlock(tokens, context));
        }
        return new IfStatement(ifToken.line(), branches, elseBody);
    }

    // <> dotted ["[" number "]"] comparison expr
    private Condition parseCondition(Tokens tokens) {
        var line = tokens.peek().line();
        var left = parseDottedName(tokens);
        if (consume(tokens, TokenType.LBRACKET)) {
            left += "[" + tokens.next(TokenType.NUMBER).image() + "]";
            tokens.next(TokenType.RBRACKET);
        }
        var operator = tokens.next();
        switch (operator.type()) {
            case EQUALS_EQUALS, NOT_EQUALS, LT, LE, GT, GE -> {
            }
            default -> throw Tokens.unexpected(operator);
        }
        return new Condition(line, left, operator.image(), parseExpr(tokens));
    }

    private List<Statement> parseBlock(Tokens tokens, Context context) {
        List<Statement> statements = new ArrayList<>();
        if (consume(tokens, TokenType.NEWLINE)) {
            tokens.next(TokenType.INDENT);
            while (!tokens.matches(TokenType.DEDENT)) {
                parseStatement(tokens, context).ifPresent(statements::add);
            }
            tokens.next(TokenType.DEDENT);
        } else {
            parseStatement(tokens, context).ifPresent(statements::add);
        }
        return statements;
    }

    // <> name "=" value [# type: type]
    private ConstantDefinition parseConstantDefinition(Tokens tokens) {
        var nameToken = tokens.next(TokenType.IDENTIFIER);
        tokens.next(TokenType.EQUALS);

        var valueToken = tokens.peek();
        if (valueToken.type() == TokenType.LPAREN) {
            throw Tokens.unexpected(valueToken);
        }
        var value = parseExpr(tokens);

        Optional<TypeNode> typeComment = Optional.empty();
        if (consume(tokens, TokenType.TYPECOMMENT)) {
            typeComment = Optional.of(parseType(tokens));
        }
        tokens.next(TokenType.NEWLINE);
        return new ConstantDefinition(nameToken.line(), nameToken.image(), value, typeComment);
    }

    // <> ("@" dotted)* def name "(" params ")" ["->" type] [raises type ("," type)*] [":" body]
    private FunctionDefinition parseFunctionDefinition(Tokens tokens) {
        List<Decorator> decorators = new ArrayList<>();
        while (tokens.matches(TokenType.AT)) {
            var atToken = tokens.next();
            var name = parseDottedName(tokens);
            tokens.next(TokenType.NEWLINE);
            int dot = name.lastIndexOf('.');
            decorators.add(dot < 0
                    ? new Decorator(atToken.line(), name)
                    : new Decorator(atToken.line(), name.substring(0, dot), Optional.of(name.substring(dot + 1))));
        }

        var defToken = tokens.next(TokenType.DEF);
        var name = tokens.next(TokenType.IDENTIFIER).image();

        if (consume(tokens, TokenType.PYTHONCODE)) {
            tokens.next(TokenType.NEWLINE);
            return new FunctionDefinition(defToken.line(), name, decorators, List.of(), Optional.empty(), List.of(), List.of(), true);
        }

        tokens.next(TokenType.LPAREN);
        List<Param> parameters = new ArrayList<>();
        while (!tokens.matches(TokenType.RPAREN)) {
            parameters.add(parseParameter(tokens));
            if (!consume(tokens, TokenType.COMMA)) {
                break;
            }
        }
        tokens.next(TokenType.RPAREN);

        Optional<TypeNode> returnType = Optional.empty();
        if (consume(tokens, TokenType.ARROW)) {
            returnType = Optional.of(parseType(tokens));
        }

        List<TypeNode> raises = new ArrayList<>();
        if (consume(tokens, TokenType.RAISES)) {
            do {
                raises.add(parseType(tokens));
            } while (consume(tokens, TokenType.COMMA));
        }

        return new FunctionDefinition(defToken.line(), name, decorators, parameters, returnType, raises, parseFunctionBody(tokens), false);
    }

    private Param parseParameter(Tokens tokens) {
        var token = tokens.peek();

        return switch (token.type()) {
            case ELLIPSIS -> {
                tokens.next();
                yield new EllipsisParam();
            }
            case STAR -> {
                tokens.next();
                if (!tokens.matches(TokenType.IDENTIFIER)) {
                    yield new StarParam(Optional.empty(), Optional.empty());
                }
                var name = tokens.next().image();
                yield new StarParam(Optional.of(name), parseOptionalAnnotation(tokens));
            }
            case DOUBLE_STAR -> {
                tokens.next();
                var name = tokens.next(TokenType.IDENTIFIER).image();
                yield new KwargsParam(name, parseOptionalAnnotation(tokens));
            }
            case IDENTIFIER -> {
                var name = tokens.next().image();
                var type = parseOptionalAnnotation(tokens);
                Optional<Expr> defaultValue = Optional.empty();
                if (consume(tokens, TokenType.EQUALS)) {
                    defaultValue = Optional.of(parseExpr(tokens));
                }
                yield new NamedParam(name, type, defaultValue);
            }
            default -> throw Tokens.unexpected(token);
        };
    }

    private Optional<TypeNode> parseOptionalAnnotation(Tokens tokens) {
        if (consume(tokens, TokenType.COLON)) {
            return Optional.of(parseType(tokens));
        }
        return Optional.empty();
    }

    private List<BodyStatement> parseFunctionBody(Tokens tokens) {
        List<BodyStatement> body = new ArrayList<>();
        // a signature without ":" has an empty body
        if (consume(tokens, TokenType.NEWLINE)) {
            return body;
        }
        tokens.next(TokenType.COLON);
        if (consume(tokens, TokenType.NEWLINE)) {
            tokens.next(TokenType.INDENT);
            while (!tokens.matches(TokenType.DEDENT)) {
                parseBodyStatement(tokens).ifPresent(body::add);
            }
            tokens.next(TokenType.DEDENT);
        } else {
            parseBodyStatement(tokens).ifPresent(body::add);
        }
        return body;
    }

    private Optional<BodyStatement> parseBodyStatement(Tokens tokens) {
        var token = tokens.peek();

        return switch (token.type()) {
            case ELLIPSIS, PASS, STRING -> {
                tokens.next();
                tokens.next(TokenType.NEWLINE);
                yield Optional.empty();
            }
            case RAISE -> {
                tokens.next();
                var exception = parseType(tokens);
                if (consume(tokens, TokenType.LPAREN)) {
                    tokens.next(TokenType.RPAREN);
                }
                tokens.next(TokenType.NEWLINE);
                yield Optional.of(new RaiseStatement(token.line(), exception));
            }
            case IDENTIFIER -> {
                tokens.next();
                tokens.next(TokenType.COLON_EQUALS);
                var type = parseType(tokens);
                tokens.next(TokenType.NEWLINE);
                yield Optional.of(new MutatorStatement(token.line(), token.image(), type));
            }
            default -> throw Tokens.unexpected(token);
        };
    }

    // <> class name ["(" [type ("," type)*] ["," metaclass "=" type] ")"] ":" block
    private ClassDefinition parseClassDefinition(Tokens tokens, Context context) {
        var classToken = tokens.next(TokenType.CLASS);
        requireModuleLevel(classToken, context);
        var name = tokens.next(TokenType.IDENTIFIER).image();

        List<TypeNode> bases = new ArrayList<>();
        Optional<TypeNode> metaclass = Optional.empty();
        if (consume(tokens, TokenType.LPAREN)) {
            while (!tokens.matches(TokenType.RPAREN)) {
                if (tokens.matches(TokenType.IDENTIFIER) && tokens.peek(1).type() == TokenType.EQUALS) {
                    var keyword = tokens.next().image();
                    tokens.next(TokenType.EQUALS);
                    var value = parseType(tokens);
                    if (!keyword.equals("metaclass")) {
                        throw ParseError.syntax(classToken.line(), "Only 'metaclass' allowed as classdef kwarg");
                    }
                    if (metaclass.isPresent()) {
                        throw ParseError.syntax(classToken.line(), "metaclass must be last argument");
                    }
                    metaclass = Optional.of(value);
                } else {
                    if (metaclass.isPresent()) {
                        throw ParseError.syntax(classToken.line(), "metaclass must be last argument");
                    }
                    bases.add(parseType(tokens));
                }
                if (!consume(tokens, TokenType.COMMA)) {
                    break;
                }
            }
            tokens.next(TokenType.RPAREN);
        }
        tokens.next(TokenType.COLON);

        var body = parseBlock(tokens, Context.CLASS);
        return new ClassDefinition(classToken.line(), name, bases, metaclass, body);
    }

    // <> primary ("or" primary)*
    TypeNode parseType(Tokens tokens) {
        var first = parsePrimaryType(tokens);
        if (!tokens.matches(TokenType.OR)) {
            return first;
        }
        List<TypeNode> alternatives = new ArrayList<>();
        alternatives.add(first);
        while (consume(tokens, TokenType.OR)) {
            alternatives.add(parsePrimaryType(tokens));
        }
        return new AlternationNode(alternatives);
    }

    private TypeNode parsePrimaryType(Tokens tokens) {
        var token = tokens.peek();

        return switch (token.type()) {
            case QUESTION -> {
                tokens.next();
                yield new AnythingNode();
            }
            case LPAREN -> {
                tokens.next();
                var inner = parseType(tokens);
                tokens.next(TokenType.RPAREN);
                yield inner;
            }
            case LBRACKET -> {
                tokens.next();
                var elements = parseTypeList(tokens, TokenType.RBRACKET, false);
                tokens.next(TokenType.RBRACKET);
                yield new ImpliedTupleNode(elements);
            }
            case IDENTIFIER -> {
                var name = parseDottedName(tokens);
                if (isNamedTuple(name) && tokens.matches(TokenType.LPAREN)) {
                    yield parseNamedTuple(tokens);
                }
                if (consume(tokens, TokenType.LBRACKET)) {
                    var parameters = parseTypeList(tokens, TokenType.RBRACKET, true);
                    tokens.next(TokenType.RBRACKET);
                    yield new GenericTypeNode(name, parameters);
                }
                yield new NamedTypeNode(name);
            }
            default -> throw Tokens.unexpected(token);
        };
    }

    private List<TypeNode> parseTypeList(Tokens tokens, TokenType closing, boolean allowEllipsis) {
        List<TypeNode> types = new ArrayList<>();
        while (!tokens.matches(closing)) {
            if (allowEllipsis && consume(tokens, TokenType.ELLIPSIS)) {
                types.add(new EllipsisNode());
            } else {
                types.add(parseType(tokens));
            }
            if (!consume(tokens, TokenType.COMMA)) {
                break;
            }
        }
        return types;
    }

    // <> NamedTuple "(" name "," "[" ("(" field "," type [","] ")")* "]" [","] ")"
    private NamedTupleNode parseNamedTuple(Tokens tokens) {
        tokens.next(TokenType.LPAREN);
        var name = tokens.next(TokenType.IDENTIFIER).image();
        tokens.next(TokenType.COMMA);
        tokens.next(TokenType.LBRACKET);

        List<NamedTupleField> fields = new ArrayList<>();
        while (!tokens.matches(TokenType.RBRACKET)) {
            tokens.next(TokenType.LPAREN);
            var fieldName = tokens.next(TokenType.IDENTIFIER).image();
            tokens.next(TokenType.COMMA);
            var fieldType = parseType(tokens);
            consume(tokens, TokenType.COMMA);
            tokens.next(TokenType.RPAREN);
            fields.add(new NamedTupleField(fieldName, fieldType));
            if (!consume(tokens, TokenType.COMMA)) {
                break;
            }
        }
        tokens.next(TokenType.RBRACKET);
        consume(tokens, TokenType.COMMA);
        tokens.next(TokenType.RPAREN);
        return new NamedTupleNode(name, fields);
    }

    Expr parseExpr(Tokens tokens) {
        var token = tokens.peek();

        return switch (token.type()) {
            case ELLIPSIS -> {
                tokens.next();
                yield new EllipsisExpr();
            }
            case NUMBER -> new NumberExpr(tokens.next().image());
            case MINUS -> {
                tokens.next();
                yield new NumberExpr("-" + tokens.next(TokenType.NUMBER).image());
            }
            case STRING -> new StringExpr(tokens.next().image());
            case IDENTIFIER -> new NameExpr(parseDottedName(tokens));
            case LPAREN -> {
                tokens.next();
                List<Expr> elements = new ArrayList<>();
                boolean comma = false;
                while (!tokens.matches(TokenType.RPAREN)) {
                    elements.add(parseExpr(tokens));
                    if (!consume(tokens, TokenType.COMMA)) {
                        break;
                    }
                    comma = true;
                }
                tokens.next(TokenType.RPAREN);
                // (x) is just x
                yield elements.size() == 1 && !comma ? elements.get(0) : new TupleExpr(elements);
            }
            default -> throw Tokens.unexpected(token);
        };
    }

    private String parseDottedName(Tokens tokens) {
        var name = new StringBuilder(tokens.next(TokenType.IDENTIFIER).image());
        while (consume(tokens, TokenType.DOT)) {
            name.append('.').append(tokens.next(TokenType.IDENTIFIER).image());
        }
        return name.toString();
    }

    private static boolean isNamedTuple(String name) {
        return name.equals("NamedTuple") || name.equals("typing.NamedTuple");
    }

    private static void requireModuleLevel(Token token, Context context) {
        if (context != Context.MODULE) {
            throw Tokens.unexpected(token);
        }
    }

    private static boolean consume(Tokens tokens, TokenType type) {
        if (tokens.matches(type)) {
            tokens.next();
            return true;
        }
        return false;
    }

}
