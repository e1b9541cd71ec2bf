package com.github.musiKk.stubs;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;

public class Tokenizer {

    private static final int TABSIZE = 8;

    List<Pattern> patterns = new ArrayList<>();
    Map<String, TokenType> keywords = new HashMap<>();

    {
        for (var tokenType : TokenType.values()) {
            if (tokenType.constantPattern == null) {
                continue;
            }
            if (Character.isLetter(tokenType.constantPattern.charAt(0))) {
                keywords.put(tokenType.constantPattern, tokenType);
            } else {
                patterns.add(new StaticPattern(tokenType.constantPattern, tokenType));
            }
        }

        patterns.add(new CommentPattern());
        patterns.add(new IdentifierPattern(keywords));
        patterns.add(new QuotedNamePattern());
        patterns.add(new NumberPattern());
        patterns.add(new StringPattern());

        // "..." must win over "." and "->" over "-"
        patterns.sort(Comparator.comparingInt(
            (Pattern p) -> p instanceof StaticPattern sp ? sp.pattern.length() : Integer.MAX_VALUE).reversed());
    }

    public Tokens tokenize(String source) {
        List<Token> tokens = new ArrayList<>();
        Deque<Integer> indentation = new ArrayDeque<>();
        indentation.push(0);

        int index = 0;
        int line = 1;
        int depth = 0;
        boolean atLineStart = true;
        while (index < source.length()) {
            if (atLineStart && depth == 0) {
                int col = 0;
                while (index < source.length()) {
                    char c = source.charAt(index);
                    if (c == ' ') {
                        col++;
                    } else if (c == '\t') {
                        col = (col / TABSIZE + 1) * TABSIZE;
                    } else if (c == '\f') {
                        col = 0;
                    } else {
                        break;
                    }
                    index++;
                }
                if (index >= source.length()) {
                    break;
                }
                char c = source.charAt(index);
                if (c == '\r') {
                    index++;
                    continue;
                }
                if (c == '\n') {
                    // blank lines never change the indentation
                    index++;
                    line++;
                    continue;
                }
                if (c == '#') {
                    while (index < source.length() && source.charAt(index) != '\n') {
                        index++;
                    }
                    continue;
                }
                if (col > indentation.peek()) {
                    indentation.push(col);
                    tokens.add(new Token(TokenType.INDENT, "", index, index, line));
                } else {
                    while (col < indentation.peek()) {
                        indentation.pop();
                        tokens.add(new Token(TokenType.DEDENT, "", index, index, line));
                    }
                    if (col != indentation.peek()) {
                        throw ParseError.syntax(line, "unindent does not match any outer indentation level");
                    }
                }
                atLineStart = false;
            }

            char c = source.charAt(index);
            if (c == '\n') {
                if (depth == 0) {
                    addNewline(tokens, index, line);
                    atLineStart = true;
                }
                index++;
                line++;
                continue;
            }
            if (c == '\\' && index + 1 < source.length() && source.charAt(index + 1) == '\n') {
                index += 2;
                line++;
                continue;
            }
            if (Character.isWhitespace(c)) {
                index++;
                continue;
            }

            Token token = null;
            for (var pattern : patterns) {
                var result = pattern.match(source, index, line);
                if (result.isPresent()) {
                    token = result.get();
                    break;
                }
            }
            if (token == null) {
                throw ParseError.syntax(line, "syntax error, invalid character '" + c + "'");
            }

            switch (token.type()) {
                case LPAREN, LBRACKET -> depth++;
                case RPAREN, RBRACKET -> depth = Math.max(0, depth - 1);
                default -> {
                }
            }
            if (token.type() != TokenType.COMMENT) {
                tokens.add(token);
            }
            line += countNewlines(source, token.start(), token.end());
            index = token.end();
        }

        addNewline(tokens, index, line);
        while (indentation.peek() > 0) {
            indentation.pop();
            tokens.add(new Token(TokenType.DEDENT, "", index, index, line));
        }
        tokens.add(new Token(TokenType.EOF, "", index, index, line));

        return new Tokens(tokens);
    }

    private static void addNewline(List<Token> tokens, int index, int line) {
        if (tokens.isEmpty()) {
            return;
        }
        var last = tokens.get(tokens.size() - 1).type();
        if (last != TokenType.NEWLINE && last != TokenType.DEDENT) {
            tokens.add(new Token(TokenType.NEWLINE, "", index, index, line));
        }
    }

    private static int countNewlines(String source, int start, int end) {
        int count = 0;
        for (int i = start; i < end; i++) {
            if (source.charAt(i) == '\n') {
                count++;
            }
        }
        return count;
    }

    interface Pattern {
        Optional<Token> match(String source, int index, int line);
    }

    static class StaticPattern implements Pattern {
        String pattern;
        TokenType tokenType;

        public StaticPattern(String pattern, TokenType tokenType) {
            this.pattern = pattern;
            this.tokenType = tokenType;
        }

        @Override
        public Optional<Token> match(String source, int index, int line) {
            if (source.startsWith(pattern, index)) {
                return Optional.of(new Token(tokenType, pattern, index, index + pattern.length(), line));
            } else {
                return Optional.empty();
            }
        }
    }

    static class NumberPattern implements Pattern {
        @Override
        public Optional<Token> match(String source, int index, int line) {
            if (!Character.isDigit(source.charAt(index))) {
                return Optional.empty();
            }
            int start = index;
            while (index < source.length() && Character.isDigit(source.charAt(index))) {
                index++;
            }
            if (index + 1 < source.length() && source.charAt(index) == '.' && Character.isDigit(source.charAt(index + 1))) {
                index++;
                while (index < source.length() && Character.isDigit(source.charAt(index))) {
                    index++;
                }
            }
            return Optional.of(new Token(TokenType.NUMBER, source.substring(start, index), start, index, line));
        }
    }

    static class IdentifierPattern implements Pattern {
        final Map<String, TokenType> keywords;

        IdentifierPattern(Map<String, TokenType> keywords) {
            this.keywords = keywords;
        }

        @Override
        public Optional<Token> match(String source, int index, int line) {
            char c = source.charAt(index);
            if (!(Character.isLetter(c) || c == '_')) {
                return Optional.empty();
            }
            int start = index;
            while (index < source.length()
                    && (Character.isLetterOrDigit(source.charAt(index)) || source.charAt(index) == '_')) {
                index++;
            }
            var image = source.substring(start, index);
            var type = keywords.getOrDefault(image, TokenType.IDENTIFIER);
            return Optional.of(new Token(type, image, start, index, line));
        }
    }

    // `foo~1` is how synthesized names come back from the printer
    static class QuotedNamePattern implements Pattern {
        @Override
        public Optional<Token> match(String source, int index, int line) {
            if (source.charAt(index) != '`') {
                return Optional.empty();
            }
            int end = source.indexOf('`', index + 1);
            int newline = source.indexOf('\n', index + 1);
            if (end < 0 || (newline >= 0 && newline < end) || end == index + 1) {
                throw ParseError.syntax(line, "syntax error, unterminated quoted name");
            }
            return Optional.of(new Token(TokenType.IDENTIFIER, source.substring(index + 1, end), index, end + 1, line));
        }
    }

    static class StringPattern implements Pattern {
        @Override
        public Optional<Token> match(String source, int index, int line) {
            char quote = source.charAt(index);
            if (quote != '"' && quote != '\'') {
                return Optional.empty();
            }
            var delimiter = String.valueOf(quote);
            if (source.startsWith(delimiter.repeat(3), index)) {
                delimiter = delimiter.repeat(3);
            }
            int start = index;
            index += delimiter.length();
            int contentStart = index;
            while (index < source.length()) {
                char cur = source.charAt(index);
                if (cur == '\\') {
                    index += 2;
                    continue;
                }
                if (cur == '\n' && delimiter.length() == 1) {
                    break;
                }
                if (source.startsWith(delimiter, index)) {
                    var content = source.substring(contentStart, index);
                    index += delimiter.length();
                    return Optional.of(new Token(TokenType.STRING, content, start, index, line));
                }
                index++;
            }
            throw ParseError.syntax(line, "syntax error, unterminated string literal");
        }
    }

    static class CommentPattern implements Pattern {
        private static final java.util.regex.Pattern TYPE_COMMENT = java.util.regex.Pattern.compile("#\\s*type\\s*:");

        @Override
        public Optional<Token> match(String source, int index, int line) {
            if (source.charAt(index) != '#') {
                return Optional.empty();
            }
            Matcher matcher = TYPE_COMMENT.matcher(source).region(index, source.length());
            if (matcher.lookingAt()) {
                return Optional.of(new Token(TokenType.TYPECOMMENT, matcher.group(), index, matcher.end(), line));
            }
            int start = index;
            while (index < source.length() && source.charAt(index) != '\n') {
                index++;
            }
            return Optional.of(new Token(TokenType.COMMENT, source.substring(start, index), start, index, line));
        }
    }

    public record Token(TokenType type, String image, int start, int end, int line) {
        public String describe() {
            return switch (type) {
                case NEWLINE -> "end of line";
                case INDENT -> "indent";
                case DEDENT -> "dedent";
                case EOF -> "end of file";
                default -> "'" + image + "'";
            };
        }
    }

    public enum TokenType {
        IMPORT("import"),
        FROM("from"),
        AS("as"),
        DEF("def"),
        CLASS("class"),
        IF("if"),
        ELIF("elif"),
        ELSE("else"),
        PASS("pass"),
        RAISE("raise"),
        RAISES("raises"),
        OR("or"),
        PYTHONCODE("PYTHONCODE"),

        NUMBER,
        STRING,

        COMMENT,
        TYPECOMMENT,

        ARROW("->"),
        COLON_EQUALS(":="),
        ELLIPSIS("..."),
        EQUALS_EQUALS("=="), NOT_EQUALS("!="),
        LE("<="), GE(">="), LT("<"), GT(">"),
        DOUBLE_STAR("**"), STAR("*"),
        MINUS("-"),
        QUESTION("?"),
        AT("@"),

        LPAREN("("),
        RPAREN(")"),
        LBRACKET("["),
        RBRACKET("]"),

        COLON(":"),
        EQUALS("="),
        IDENTIFIER,
        DOT("."),
        COMMA(","),

        NEWLINE,
        INDENT,
        DEDENT,
        EOF;

        String constantPattern;

        private TokenType() {
            this(null);
        }
        private TokenType(String constantPattern) {
            this.constantPattern = constantPattern;
        }
    }

    public static class Tokens {
        final List<Token> tokens;
        int index;

        Tokens(List<Token> tokens) {
            this.tokens = tokens;
        }

        public Token next() {
            var token = tokens.get(index);
            if (token.type() != TokenType.EOF) {
                index++;
            }
            return token;
        }

        public Token peek() {
            return tokens.get(index);
        }

        public Token peek(int ahead) {
            return tokens.get(Math.min(index + ahead, tokens.size() - 1));
        }

        public boolean matches(TokenType... types) {
            TokenType peekType = peek().type();
            for (var type : types) {
                if (peekType == type) {
                    return true;
                }
            }
            return false;
        }

        public Token next(TokenType type) {
            var token = peek();
            if (token.type() != type) {
                throw unexpected(token);
            }
            return next();
        }

        public List<TokenType> types() {
            return tokens.stream().map(Token::type).toList();
        }

        public static ParseError unexpected(Token token) {
            return ParseError.syntax(token.line(), "syntax error, unexpected " + token.describe());
        }
    }

}
