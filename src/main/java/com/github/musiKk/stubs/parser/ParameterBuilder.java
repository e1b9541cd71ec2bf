package com.github.musiKk.stubs.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.github.musiKk.stubs.ParseError;
import com.github.musiKk.stubs.parser.Module.Parameter;
import com.github.musiKk.stubs.parser.StubSource.EllipsisParam;
import com.github.musiKk.stubs.parser.StubSource.Expr;
import com.github.musiKk.stubs.parser.StubSource.KwargsParam;
import com.github.musiKk.stubs.parser.StubSource.NameExpr;
import com.github.musiKk.stubs.parser.StubSource.NamedParam;
import com.github.musiKk.stubs.parser.StubSource.NumberExpr;
import com.github.musiKk.stubs.parser.StubSource.Param;
import com.github.musiKk.stubs.parser.StubSource.StarParam;

import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
public class ParameterBuilder {

    private static final Type NONE = Type.name("None");

    private final TypeNormalizer normalizer;

    public List<Parameter> build(List<Param> params, int line) {
        List<Parameter> parameters = new ArrayList<>();
        boolean seenStar = false;
        boolean bareStar = false;

        for (int i = 0; i < params.size(); i++) {
            var param = params.get(i);
            boolean last = i == params.size() - 1;

            if (param instanceof NamedParam named) {
                var kind = seenStar ? Parameter.Kind.KEYWORD_ONLY : Parameter.Kind.POSITIONAL;
                parameters.add(new Parameter(named.name(), parameterType(named, line), named.defaultValue().isPresent(), kind));
            } else if (param instanceof StarParam star) {
                if (seenStar) {
                    throw invalid(line, "Unexpected second *");
                }
                seenStar = true;
                if (star.name().isEmpty()) {
                    var next = last ? null : params.get(i + 1);
                    if (next instanceof EllipsisParam) {
                        throw invalid(line, "ellipsis (...) not compatible with bare *");
                    }
                    if (!(next instanceof NamedParam)) {
                        throw invalid(line, "Named arguments must follow bare *");
                    }
                    bareStar = true;
                    parameters.add(Parameter.bareStar());
                } else {
                    var type = star.type().map(t -> normalizer.normalize(t, line));
                    parameters.add(new Parameter(star.name().get(), type, false, Parameter.Kind.VAR_POSITIONAL));
                }
            } else if (param instanceof KwargsParam kwargs) {
                if (!last) {
                    throw invalid(line, "**" + kwargs.name() + " must be last parameter");
                }
                var type = kwargs.type().map(t -> normalizer.normalize(t, line));
                parameters.add(new Parameter(kwargs.name(), type, false, Parameter.Kind.VAR_KEYWORD));
            } else if (param instanceof EllipsisParam) {
                if (!last) {
                    throw invalid(line, "ellipsis (...) must be last parameter");
                }
                if (bareStar) {
                    throw invalid(line, "ellipsis (...) not compatible with bare *");
                }
                if (seenStar) {
                    throw invalid(line, "Unexpected second *");
                }
                parameters.add(new Parameter("args", Optional.empty(), false, Parameter.Kind.VAR_POSITIONAL));
                parameters.add(new Parameter("kwargs", Optional.empty(), false, Parameter.Kind.VAR_KEYWORD));
            }
        }
        return parameters;
    }

    // a None default widens the declared type
    private Optional<Type> parameterType(NamedParam param, int line) {
        var inferred = param.defaultValue().flatMap(ParameterBuilder::inferType);
        if (param.type().isEmpty()) {
            return inferred;
        }
        var declared = normalizer.normalize(param.type().get(), line);
        if (inferred.isPresent() && inferred.get().equals(NONE) && !declared.equals(NONE)) {
            return Optional.of(Type.unionOf(declared, NONE));
        }
        return Optional.of(declared);
    }

    static Optional<Type> inferType(Expr value) {
        if (value instanceof NumberExpr number) {
            return Optional.of(Type.name(number.isInteger() ? "int" : "float"));
        }
        if (value instanceof NameExpr name) {
            switch (name.name()) {
                case "True", "False":
                    return Optional.of(Type.name("bool"));
                case "None":
                    return Optional.of(NONE);
                default:
                    return Optional.empty();
            }
        }
        return Optional.empty();
    }

    private static ParseError invalid(int line, String message) {
        return ParseError.at(ParseError.Kind.INVALID_PARAMETER_FORM, line, message);
    }

}
