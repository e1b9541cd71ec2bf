package com.github.musiKk.stubs.parser;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.github.musiKk.stubs.parser.Type.Union;

public class TypeTest {

    private static final Type A = Type.name("A");
    private static final Type B = Type.name("B");
    private static final Type C = Type.name("C");

    @Test
    public void testUnionIsAssociative() {
        var left = Type.unionOf(Type.unionOf(A, B), C);
        var right = Type.unionOf(A, Type.unionOf(B, C));
        assertEquals(new Union(List.of(A, B, C)), left);
        assertEquals(left, right);
    }

    @Test
    public void testUnionDropsRepeatedMembers() {
        assertEquals(new Union(List.of(A, B)), Type.unionOf(A, B, A, Type.unionOf(B, A)));
    }

    @Test
    public void testSingleMemberUnionCollapses() {
        assertEquals(A, Type.unionOf(A));
        assertEquals(A, Type.unionOf(A, A));
        assertThrows(IllegalArgumentException.class, () -> Type.unionOf(List.of()));
    }

    @Test
    public void testQualifiedNames() {
        var name = new Type.Name("foo.bar.Baz");
        assertTrue(name.isQualified());
        assertEquals("foo.bar", name.qualifier());
        assertFalse(new Type.Name("Baz").isQualified());
    }

}
