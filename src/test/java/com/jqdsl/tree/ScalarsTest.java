package com.jqdsl.tree;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ScalarsTest {

    @Test
    public void testNumbersCompareAcrossTypes() {
        assertTrue(Scalars.equal(1L, 1.0));
        assertTrue(Scalars.equal(3, 3L));
        assertFalse(Scalars.equal("1", 1L));
        assertTrue(Scalars.compare(2L, 2.5) < 0);
    }

    @Test
    public void testNullEquality() {
        assertTrue(Scalars.equal(null, null));
        assertFalse(Scalars.equal(null, "x"));
        assertFalse(Scalars.equal("x", null));
    }

    @Test
    public void testMixedKindsDoNotCompare() {
        assertThrows(ClassCastException.class, () -> Scalars.compare("a", 1L));
        assertThrows(ClassCastException.class, () -> Scalars.compare(null, 1L));
    }

    @Test
    public void testTotalOrderGroupsKinds() {
        List<Object> values = new ArrayList<>(Arrays.asList("b", 2L, null, true, "a", 1.5, false));
        values.sort(Scalars.ORDER);

        assertEquals(Arrays.asList(null, false, true, 1.5, 2L, "a", "b"), values);
    }

    @Test
    public void testRender() {
        assertEquals("\"say \\\"hi\\\"\"", Scalars.render("say \"hi\""));
        assertEquals("3", Scalars.render(3L));
        assertEquals("true", Scalars.render(true));
        assertEquals("null", Scalars.render(null));
    }
}
