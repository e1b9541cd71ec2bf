package com.github.musiKk.stubs.parser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.musiKk.stubs.ParseError;
import com.github.musiKk.stubs.parser.Module.Function;
import com.github.musiKk.stubs.parser.StubSource.Decorator;
import com.github.musiKk.stubs.parser.StubSource.FunctionDefinition;

/**
 * Interprets the decorator stack of a function definition. Only the
 * decorators that change what a function is survive; {@code @overload} and
 * {@code @abstractmethod} are dropped.
 */
public class DecoratorResolver {

    private static final Logger log = LoggerFactory.getLogger(DecoratorResolver.class);

    public enum PropertyRole {
        NONE,
        // @property, the method becomes a constant
        GETTER,
        // @x.setter or @x.deleter, dropped
        ACCESSOR
    }

    public record Resolution(Function.Kind kind, PropertyRole property) {
        public boolean isProperty() {
            return property != PropertyRole.NONE;
        }
    }

    public Resolution resolve(FunctionDefinition function) {
        var kind = Function.Kind.METHOD;
        var property = PropertyRole.NONE;
        int behavioral = 0;

        for (var decorator : function.decorators()) {
            if (decorator.qualifier().isPresent()) {
                property = PropertyRole.ACCESSOR;
                checkAccessor(decorator, function.name());
                behavioral++;
                continue;
            }
            switch (decorator.name()) {
                case "overload", "abstractmethod" -> log.debug("line {}: dropped @{} on {}",
                        decorator.line(), decorator.name(), function.name());
                case "staticmethod" -> {
                    kind = Function.Kind.STATICMETHOD;
                    behavioral++;
                }
                case "classmethod" -> {
                    kind = Function.Kind.CLASSMETHOD;
                    behavioral++;
                }
                case "property" -> {
                    property = PropertyRole.GETTER;
                    behavioral++;
                }
                default -> throw unsupported(decorator, function.name());
            }
        }

        if (behavioral > 1) {
            throw ParseError.at(ParseError.Kind.INVALID_DECORATOR, function.line(),
                    "Too many decorators for " + function.name());
        }
        return new Resolution(kind, property);
    }

    private static void checkAccessor(Decorator decorator, String functionName) {
        var qualifier = decorator.qualifier().get();
        if (!qualifier.equals("setter") && !qualifier.equals("deleter")) {
            throw unsupported(decorator, functionName);
        }
        if (!decorator.name().equals(functionName)) {
            throw ParseError.at(ParseError.Kind.INVALID_DECORATOR, decorator.line(),
                    "Invalid property decorator @" + decorator.text() + " for " + functionName);
        }
    }

    private static ParseError unsupported(Decorator decorator, String functionName) {
        return ParseError.at(ParseError.Kind.INVALID_DECORATOR, decorator.line(),
                "Unsupported decorator @" + decorator.text() + " for " + functionName);
    }

}
