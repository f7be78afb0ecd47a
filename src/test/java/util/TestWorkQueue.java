package util;

import java.util.Arrays;

import junit.framework.TestCase;

public class TestWorkQueue extends TestCase {

    public void testFifoWithoutDuplicates() {
        WorkQueue<String> q = new WorkQueue<>(Arrays.asList("a", "b", "a", "c"));
        assertEquals(3, q.size());
        assertFalse(q.add("b"));
        assertEquals("a", q.poll());
        assertTrue(q.add("a"));
        assertEquals("b", q.poll());
        assertEquals("c", q.poll());
        assertEquals("a", q.poll());
        assertNull(q.poll());
        assertTrue(q.isEmpty());
        assertEquals(4, q.getPolledCount());
    }

    public void testContains() {
        WorkQueue<Integer> q = new WorkQueue<>();
        q.add(1);
        assertTrue(q.contains(1));
        q.poll();
        assertFalse(q.contains(1));
        assertFalse(q.addAll(Arrays.<Integer> asList()));
    }
}
