package com.github.musiKk.stubs.parser;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import com.github.musiKk.stubs.ParseError;
import com.github.musiKk.stubs.Tokenizer;
import com.github.musiKk.stubs.parser.Module.ClassDef;
import com.github.musiKk.stubs.parser.Module.Constant;
import com.github.musiKk.stubs.parser.Type.ClassReference;
import com.github.musiKk.stubs.parser.Type.Generic;
import com.github.musiKk.stubs.parser.Type.Tuple;

public class TypeNormalizerTest {

    private static final Type INT = Type.name("int");
    private static final Type STR = Type.name("str");
    private static final Type NONE = Type.name("None");

    private final NamedTupleSynthesizer synthesizer = new NamedTupleSynthesizer();
    private final TypeNormalizer normalizer = new TypeNormalizer(
            Set.of("Set", "Local"), Map.of("Foo", "somewhere.Foo", "pkg", "a.b"), synthesizer);

    @ParameterizedTest
    @MethodSource("types")
    public void testNormalize(String code, Type expected) {
        assertEquals(expected, normalize(code));
    }

    @Test
    public void testDoubleEllipsis() {
        var e = assertThrows(ParseError.class, () -> normalize("List[..., ...]"));
        assertEquals(ParseError.Kind.SYNTAX_ERROR, e.kind());
        assertEquals(5, e.line().getAsInt());
        assertEquals("[..., ...] not supported", e.getMessage());
    }

    @Test
    public void testNamedTupleBecomesClass() {
        var type = normalize("NamedTuple(point, [(x, int), (y, List)])");
        assertEquals(new ClassReference("point"), type);
        assertEquals(
                List.of(new ClassDef("point", List.of(Tuple.homogeneous(Type.unionOf(INT, Type.name("list")))), Optional.empty(),
                        List.of(new Constant("x", INT), new Constant("y", Type.name("list"))), List.of())),
                synthesizer.classes());
    }

    private Type normalize(String code) {
        var tokens = new Tokenizer().tokenize(code);
        return normalizer.normalize(new Parser().parseType(tokens), 5);
    }

    private static Object[][] types() {
        return new Object[][] {
            { "?", Type.ANYTHING },
            { "Any", Type.ANYTHING },
            { "typing.Any", Type.ANYTHING },
            { "nothing", Type.NOTHING },
            { "NamedTuple", Type.name("tuple") },
            { "List", Type.name("list") },
            { "typing.Dict", Type.name("dict") },
            { "FrozenSet", Type.name("frozenset") },
            // a local class shadows the PEP 484 name
            { "Set", new ClassReference("Set") },
            { "Local", new ClassReference("Local") },
            { "Foo", Type.name("somewhere.Foo") },
            { "pkg.Bar", Type.name("a.b.Bar") },
            { "other.Foo", Type.name("other.Foo") },
            { "int or str or int", Type.unionOf(INT, STR) },
            { "int or (str or None)", Type.unionOf(INT, STR, NONE) },
            { "Union[int, str]", Type.unionOf(INT, STR) },
            { "typing.Union[int]", INT },
            { "Union[]", Type.NOTHING },
            { "Optional[int]", Type.unionOf(INT, NONE) },
            { "Callable[[int], str]", Type.name("Callable") },
            { "typing.Callable[int]", Type.name("typing.Callable") },
            { "List[int]", new Generic(Type.name("List"), List.of(INT)) },
            { "List[int, ...]", new Generic(Type.name("List"), List.of(INT)) },
            { "Dict[str, ?]", new Generic(Type.name("Dict"), List.of(STR, Type.ANYTHING)) },
            { "Foo[int]", new Generic(Type.name("somewhere.Foo"), List.of(INT)) },
            { "Set[int]", new Generic(new ClassReference("Set"), List.of(INT)) },
            { "Tuple[int]", Tuple.homogeneous(INT) },
            { "Tuple[int, ...]", Tuple.homogeneous(INT) },
            { "Tuple[int, str]", Tuple.homogeneous(Type.unionOf(INT, STR)) },
            { "Tuple[int, str, ...]", Tuple.homogeneous(Type.unionOf(INT, STR, Type.ANYTHING)) },
            { "Tuple[]", new Tuple(List.of(), false) },
            { "[]", new Tuple(List.of(), false) },
            { "[int, Foo]", new Tuple(List.of(INT, Type.name("somewhere.Foo")), false) },
        };
    }

}
