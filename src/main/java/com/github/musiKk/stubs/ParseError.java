package com.github.musiKk.stubs;

import java.util.OptionalInt;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * The one failure a parse can end in. There is no partial result: a caller
 * either gets a complete module or exactly one of these.
 */
public class ParseError extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public enum Kind {
        SYNTAX_ERROR,
        UNSUPPORTED_CONDITION,
        DUPLICATE_IDENTIFIER,
        INVALID_DECORATOR,
        INVALID_PARAMETER_FORM,
        UNKNOWN_MUTATED_PARAMETER
    }

    @Accessors(fluent = true)
    @Getter
    private final Kind kind;
    @Accessors(fluent = true)
    @Getter
    private final OptionalInt line;

    public ParseError(Kind kind, String message, OptionalInt line) {
        super(message);
        this.kind = kind;
        this.line = line;
    }

    public static ParseError at(Kind kind, int line, String message) {
        return new ParseError(kind, message, OptionalInt.of(line));
    }

    public static ParseError moduleWide(Kind kind, String message) {
        return new ParseError(kind, message, OptionalInt.empty());
    }

    public static ParseError syntax(int line, String message) {
        return at(Kind.SYNTAX_ERROR, line, message);
    }

    // file:line: message, the way compilers report it
    public String describe(String file) {
        return line.isPresent()
                ? file + ":" + line.getAsInt() + ": " + getMessage()
                : file + ": " + getMessage();
    }
}
