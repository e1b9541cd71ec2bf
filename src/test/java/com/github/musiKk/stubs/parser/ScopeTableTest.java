package com.github.musiKk.stubs.parser;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.Test;

import com.github.musiKk.stubs.ParseError;
import com.github.musiKk.stubs.parser.Module.Alias;
import com.github.musiKk.stubs.parser.Module.ClassDef;
import com.github.musiKk.stubs.parser.Module.Constant;
import com.github.musiKk.stubs.parser.Module.Function;

public class ScopeTableTest {

    @Test
    public void testFunctionsMayRepeat() {
        var scope = new ScopeTable(ScopeTable.Level.MODULE);
        scope.add(Function.external("foo"));
        scope.add(Function.external("foo"));
        scope.checkDuplicates(0);
        assertEquals(2, scope.functions().size());
        assertTrue(scope.isDeclared("foo"));
        assertFalse(scope.isDeclared("bar"));
    }

    @Test
    public void testDeclarationsKeepOrderPerKind() {
        var scope = new ScopeTable(ScopeTable.Level.MODULE);
        var b = new Constant("b", Type.name("int"));
        var a = new Constant("a", Type.name("str"));
        var alias = new Alias("x", Type.name("foo.x"));
        var cls = new ClassDef("C", List.of(), Optional.empty(), List.of(), List.of());
        scope.add(b);
        scope.add(cls);
        scope.add(alias);
        scope.add(a);
        assertEquals(List.of(b, a), scope.constants());
        assertEquals(List.of(alias), scope.aliases());
        assertEquals(List.of(cls), scope.classes());
    }

    @Test
    public void testModuleDuplicatesAreListedSorted() {
        var scope = new ScopeTable(ScopeTable.Level.MODULE);
        scope.add(new Constant("foo", Type.name("int")));
        scope.add(Function.external("foo"));
        scope.add(new Alias("bar", Type.name("x.bar")));
        scope.add(new Constant("bar", Type.name("int")));
        scope.add(new Constant("bar", Type.name("str")));

        var e = assertThrows(ParseError.class, () -> scope.checkDuplicates(0));
        assertEquals(ParseError.Kind.DUPLICATE_IDENTIFIER, e.kind());
        assertTrue(e.line().isEmpty());
        assertEquals("Duplicate top-level identifier(s): bar, foo", e.getMessage());
    }

    @Test
    public void testFunctionAfterConstantIsDuplicate() {
        var scope = new ScopeTable(ScopeTable.Level.CLASS);
        scope.add(Function.external("bar"));
        scope.add(new Constant("bar", Type.name("str")));

        var e = assertThrows(ParseError.class, () -> scope.checkDuplicates(3));
        assertEquals(3, e.line().getAsInt());
        assertEquals("Duplicate identifier(s): bar", e.getMessage());
    }

}
