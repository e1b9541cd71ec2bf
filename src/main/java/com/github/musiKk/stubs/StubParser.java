package com.github.musiKk.stubs;

import com.github.musiKk.stubs.parser.ConditionEvaluator;
import com.github.musiKk.stubs.parser.Module;
import com.github.musiKk.stubs.parser.ModuleAssembler;
import com.github.musiKk.stubs.parser.ParseTarget;
import com.github.musiKk.stubs.parser.Parser;

/**
 * Entry point for turning stub text into a {@link Module}. Every call works
 * on its own tables, so parses may run concurrently.
 */
public final class StubParser {

    private StubParser() {
    }

    /**
     * @throws ParseError for the first problem found in the source
     */
    public static Module parse(String source, ParseTarget target) {
        var tokens = new Tokenizer().tokenize(source);
        var stubSource = new Parser().parseStubSource(tokens);
        return new ModuleAssembler(new ConditionEvaluator(target)).assemble(stubSource);
    }

    public static Module parse(String source) {
        return parse(source, ParseTarget.DEFAULT);
    }

}
