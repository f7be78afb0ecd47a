package analysis.dataflow.util;

import java.util.Arrays;
import java.util.Collections;

import junit.framework.TestCase;

public class TestSetAbsVal extends TestCase {

    private static SetAbsVal<String> set(String... s) {
        return SetAbsVal.of(Arrays.asList(s));
    }

    public void testMinusNothingRemovedKeepsInstance() {
        SetAbsVal<String> s = set("x", "y");
        assertSame(s, s.minus(Arrays.asList("z", "w")));
        assertSame(s, s.minus(Collections.<String> emptySet()));
    }

    public void testMinus() {
        SetAbsVal<String> s = set("x", "y");
        assertEquals(set("y"), s.minus(Collections.singleton("x")));
        assertEquals(set("x", "y"), s);
        assertTrue(s.minus(Arrays.asList("x", "y")).isBottom());
    }

    public void testPlusAndJoin() {
        SetAbsVal<String> s = set("x");
        assertSame(s, s.plus(Collections.singleton("x")));
        assertEquals(set("x", "y"), s.plus(Collections.singleton("y")));
        assertEquals(set("x", "y"), s.join(set("y")));
        assertSame(s, s.join(SetAbsVal.<String> empty()));
        assertTrue(s.leq(set("x", "y")));
        assertFalse(set("x", "y").leq(s));
    }
}
