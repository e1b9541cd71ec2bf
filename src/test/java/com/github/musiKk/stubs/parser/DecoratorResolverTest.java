package com.github.musiKk.stubs.parser;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import com.github.musiKk.stubs.ParseError;
import com.github.musiKk.stubs.parser.DecoratorResolver.PropertyRole;
import com.github.musiKk.stubs.parser.DecoratorResolver.Resolution;
import com.github.musiKk.stubs.parser.Module.Function;
import com.github.musiKk.stubs.parser.StubSource.Decorator;
import com.github.musiKk.stubs.parser.StubSource.FunctionDefinition;

public class DecoratorResolverTest {

    @ParameterizedTest
    @MethodSource("resolutions")
    public void testResolve(List<Decorator> decorators, Resolution expected) {
        assertEquals(expected, new DecoratorResolver().resolve(function(decorators)));
    }

    @ParameterizedTest
    @MethodSource("errors")
    public void testErrors(List<Decorator> decorators, int line, String message) {
        var e = assertThrows(ParseError.class, () -> new DecoratorResolver().resolve(function(decorators)));
        assertEquals(ParseError.Kind.INVALID_DECORATOR, e.kind());
        assertEquals(line, e.line().getAsInt());
        assertEquals(message, e.getMessage());
    }

    // the def follows its decorators, on line 10
    private static FunctionDefinition function(List<Decorator> decorators) {
        return new FunctionDefinition(10, "foo", decorators, List.of(), Optional.empty(), List.of(), List.of(), false);
    }

    private static List<Decorator> decorators(String... texts) {
        return Arrays.stream(texts).map(text -> {
            int dot = text.indexOf('.');
            return dot < 0
                    ? new Decorator(1, text)
                    : new Decorator(2, text.substring(0, dot), Optional.of(text.substring(dot + 1)));
        }).toList();
    }

    private static Object[][] resolutions() {
        return new Object[][] {
            { decorators(), new Resolution(Function.Kind.METHOD, PropertyRole.NONE) },
            { decorators("overload"), new Resolution(Function.Kind.METHOD, PropertyRole.NONE) },
            { decorators("abstractmethod", "overload"), new Resolution(Function.Kind.METHOD, PropertyRole.NONE) },
            { decorators("staticmethod"), new Resolution(Function.Kind.STATICMETHOD, PropertyRole.NONE) },
            { decorators("overload", "classmethod"), new Resolution(Function.Kind.CLASSMETHOD, PropertyRole.NONE) },
            { decorators("property"), new Resolution(Function.Kind.METHOD, PropertyRole.GETTER) },
            { decorators("foo.setter"), new Resolution(Function.Kind.METHOD, PropertyRole.ACCESSOR) },
            { decorators("foo.deleter"), new Resolution(Function.Kind.METHOD, PropertyRole.ACCESSOR) },
        };
    }

    private static Object[][] errors() {
        return new Object[][] {
            { decorators("classmethod", "staticmethod"), 10, "Too many decorators for foo" },
            { decorators("property", "foo.setter"), 10, "Too many decorators for foo" },
            { decorators("cached"), 1, "Unsupported decorator @cached for foo" },
            { decorators("foo.getter"), 2, "Unsupported decorator @foo.getter for foo" },
            { decorators("bar.setter"), 2, "Invalid property decorator @bar.setter for foo" },
        };
    }

}
