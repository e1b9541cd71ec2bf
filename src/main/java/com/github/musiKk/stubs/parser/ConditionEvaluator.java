package com.github.musiKk.stubs.parser;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.musiKk.stubs.ParseError;
import com.github.musiKk.stubs.parser.StubSource.Condition;
import com.github.musiKk.stubs.parser.StubSource.IfStatement;
import com.github.musiKk.stubs.parser.StubSource.NumberExpr;
import com.github.musiKk.stubs.parser.StubSource.Statement;
import com.github.musiKk.stubs.parser.StubSource.StringExpr;
import com.github.musiKk.stubs.parser.StubSource.TupleExpr;

import lombok.RequiredArgsConstructor;

/**
 * Selects the live branch of {@code if}/{@code elif}/{@code else} chains.
 * Selection is pure; statements of losing branches are dropped unseen, so
 * nothing they declare is ever registered.
 */
@RequiredArgsConstructor
public class ConditionEvaluator {

    private static final Logger log = LoggerFactory.getLogger(ConditionEvaluator.class);

    private static final int MAX_VERSION_LENGTH = 3;

    private final ParseTarget target;

    // ends at the first conditional that cannot be evaluated
    public List<Statement> liveStatements(List<Statement> statements) {
        List<Statement> live = new ArrayList<>();
        collectLive(statements, live);
        return live;
    }

    private boolean collectLive(List<Statement> statements, List<Statement> live) {
        for (var statement : statements) {
            if (statement instanceof IfStatement ifStatement) {
                List<Statement> branch;
                try {
                    branch = selectBranch(ifStatement);
                } catch (ParseError e) {
                    log.debug("line {}: live statements end here: {}", statement.line(), e.getMessage());
                    return false;
                }
                if (!collectLive(branch, live)) {
                    return false;
                }
            } else {
                live.add(statement);
            }
        }
        return true;
    }

    public List<Statement> selectBranch(IfStatement statement) {
        var branches = statement.branches();
        for (int i = 0; i < branches.size(); i++) {
            var branch = branches.get(i);
            if (evaluate(branch.condition())) {
                log.debug("line {}: branch {} taken for {}", statement.line(), i + 1, target);
                return branch.body();
            }
        }
        if (statement.elseBody().isPresent()) {
            log.debug("line {}: else branch taken for {}", statement.line(), target);
            return statement.elseBody().get();
        }
        log.debug("line {}: no branch taken for {}", statement.line(), target);
        return List.of();
    }

    public boolean evaluate(Condition condition) {
        return switch (condition.left()) {
            case "sys.version_info" -> evaluateVersion(condition);
            case "sys.platform" -> evaluatePlatform(condition);
            default -> throw unsupported(condition, "Unsupported condition: '" + condition.left() + "'");
        };
    }

    private boolean evaluateVersion(Condition condition) {
        if (!(condition.right() instanceof TupleExpr tuple)) {
            throw unsupported(condition, "sys.version_info must be compared to a tuple");
        }
        List<Integer> expected = new ArrayList<>();
        for (var element : tuple.elements()) {
            if (!(element instanceof NumberExpr number) || !number.isInteger()) {
                throw unsupported(condition, "only integers are allowed in version tuples");
            }
            try {
                expected.add(Integer.parseInt(number.text()));
            } catch (NumberFormatException e) {
                throw unsupported(condition, "version number out of range: " + number.text());
            }
        }
        if (expected.isEmpty() || expected.size() > MAX_VERSION_LENGTH) {
            throw unsupported(condition, "version tuples must have 1 to 3 elements");
        }
        return holds(condition.operator(), compareVersions(target.version(), expected));
    }

    private boolean evaluatePlatform(Condition condition) {
        var operator = condition.operator();
        if (!operator.equals("==") && !operator.equals("!=")) {
            throw unsupported(condition, "sys.platform must be compared using == or !=");
        }
        if (!(condition.right() instanceof StringExpr platform)) {
            throw unsupported(condition, "sys.platform must be compared to a string");
        }
        return holds(operator, target.platform().compareTo(platform.value()));
    }

    // the target is cut to the length of expected
    static int compareVersions(List<Integer> actual, List<Integer> expected) {
        for (int i = 0; i < expected.size(); i++) {
            int component = i < actual.size() ? actual.get(i) : 0;
            int result = Integer.compare(component, expected.get(i));
            if (result != 0) {
                return result;
            }
        }
        return 0;
    }

    private static boolean holds(String operator, int comparison) {
        return switch (operator) {
            case "==" -> comparison == 0;
            case "!=" -> comparison != 0;
            case "<" -> comparison < 0;
            case "<=" -> comparison <= 0;
            case ">" -> comparison > 0;
            case ">=" -> comparison >= 0;
            default -> throw new IllegalArgumentException("not a comparison: " + operator);
        };
    }

    private static ParseError unsupported(Condition condition, String message) {
        return ParseError.at(ParseError.Kind.UNSUPPORTED_CONDITION, condition.line(), message);
    }

}
