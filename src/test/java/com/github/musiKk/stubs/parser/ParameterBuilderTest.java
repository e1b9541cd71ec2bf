package com.github.musiKk.stubs.parser;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import com.github.musiKk.stubs.ParseError;
import com.github.musiKk.stubs.Tokenizer;
import com.github.musiKk.stubs.parser.Module.Parameter;
import com.github.musiKk.stubs.parser.Module.Parameter.Kind;
import com.github.musiKk.stubs.parser.StubSource.FunctionDefinition;

public class ParameterBuilderTest {

    private static final Type INT = Type.name("int");
    private static final Type STR = Type.name("str");
    private static final Type NONE = Type.name("None");

    private final ParameterBuilder builder = new ParameterBuilder(
            new TypeNormalizer(Set.of(), Map.of(), new NamedTupleSynthesizer()));

    @ParameterizedTest
    @MethodSource("parameters")
    public void testBuild(String params, List<Parameter> expected) {
        assertEquals(expected, build(params));
    }

    @ParameterizedTest
    @MethodSource("errors")
    public void testErrors(String params, String message) {
        var e = assertThrows(ParseError.class, () -> build(params));
        assertEquals(ParseError.Kind.INVALID_PARAMETER_FORM, e.kind());
        assertEquals(1, e.line().getAsInt());
        assertEquals(message, e.getMessage());
    }

    private List<Parameter> build(String params) {
        var tokens = new Tokenizer().tokenize("def foo(" + params + ") -> int: ...");
        var definition = (FunctionDefinition) new Parser().parseStatement(tokens, Parser.Context.MODULE).orElseThrow();
        return builder.build(definition.parameters(), definition.line());
    }

    private static Parameter positional(String name, Type type, boolean hasDefault) {
        return new Parameter(name, Optional.ofNullable(type), hasDefault, Kind.POSITIONAL);
    }

    private static Object[][] parameters() {
        return new Object[][] {
            { "", List.of() },
            { "x", List.of(positional("x", null, false)) },
            { "x: int, y: str", List.of(positional("x", INT, false), positional("y", STR, false)) },
            { "x = 123", List.of(positional("x", INT, true)) },
            { "x = -1", List.of(positional("x", INT, true)) },
            { "x = 12.3", List.of(positional("x", Type.name("float"), true)) },
            { "x = True", List.of(positional("x", Type.name("bool"), true)) },
            { "x = None", List.of(positional("x", NONE, true)) },
            { "x = xyz", List.of(positional("x", null, true)) },
            { "x = ...", List.of(positional("x", null, true)) },
            { "x = 'a'", List.of(positional("x", null, true)) },
            { "x: str = None", List.of(positional("x", Type.unionOf(STR, NONE), true)) },
            { "x: None = None", List.of(positional("x", NONE, true)) },
            { "x: str = 123", List.of(positional("x", STR, true)) },
            {
                "*, x",
                List.of(Parameter.bareStar(), new Parameter("x", Optional.empty(), false, Kind.KEYWORD_ONLY))
            }, {
                "x: int, *args: float, y, **kwargs: str",
                List.of(
                        positional("x", INT, false),
                        new Parameter("args", Optional.of(Type.name("float")), false, Kind.VAR_POSITIONAL),
                        new Parameter("y", Optional.empty(), false, Kind.KEYWORD_ONLY),
                        new Parameter("kwargs", Optional.of(STR), false, Kind.VAR_KEYWORD))
            }, {
                "...",
                List.of(
                        new Parameter("args", Optional.empty(), false, Kind.VAR_POSITIONAL),
                        new Parameter("kwargs", Optional.empty(), false, Kind.VAR_KEYWORD))
            }, {
                "x: int, ...",
                List.of(
                        positional("x", INT, false),
                        new Parameter("args", Optional.empty(), false, Kind.VAR_POSITIONAL),
                        new Parameter("kwargs", Optional.empty(), false, Kind.VAR_KEYWORD))
            }
        };
    }

    private static Object[][] errors() {
        return new Object[][] {
            { "*", "Named arguments must follow bare *" },
            { "*, **kw", "Named arguments must follow bare *" },
            { "*x, *y", "Unexpected second *" },
            { "**x, *y", "**x must be last parameter" },
            { "..., x", "ellipsis (...) must be last parameter" },
            { "*, ...", "ellipsis (...) not compatible with bare *" },
            { "*args, ...", "Unexpected second *" },
        };
    }

}
