package com.github.musiKk.stubs.parser;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.musiKk.stubs.parser.Module.ClassDef;
import com.github.musiKk.stubs.parser.Module.Constant;
import com.github.musiKk.stubs.parser.Type.ClassReference;

import lombok.ToString;

/**
 * Turns inline {@code NamedTuple(name, [...])} literals into classes. The
 * first literal of a name keeps it, later ones are suffixed {@code ~1},
 * {@code ~2} and so on, in source order.
 */
@ToString
public class NamedTupleSynthesizer {

    private static final Logger log = LoggerFactory.getLogger(NamedTupleSynthesizer.class);

    private final Map<String, Integer> uses = new HashMap<>();
    private final List<ClassDef> classes = new ArrayList<>();

    public ClassReference synthesize(String name, List<Constant> fields) {
        var className = nextName(name);
        var base = fields.isEmpty()
                ? Type.ANYTHING
                : Type.unionOf(fields.stream().map(Constant::type).toList());
        classes.add(new ClassDef(className, List.of(Type.Tuple.homogeneous(base)), Optional.empty(), fields, List.of()));
        log.debug("synthesized class {} with {} field(s)", className, fields.size());
        return new ClassReference(className);
    }

    private String nextName(String name) {
        int count = uses.merge(name, 1, Integer::sum) - 1;
        return count == 0 ? name : name + "~" + count;
    }

    public List<ClassDef> classes() {
        return List.copyOf(classes);
    }

}
