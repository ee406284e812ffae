package com.farmerworking.skiplist.in.java.data.structure.skiplist;

import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.*;

public class SkipListIteratorTest {
    private SkipList<Integer> list;

    @Before
    public void setUp() throws Exception {
        list = SkipList.of(10, 20, 30);
    }

    @Test(expected = IndexOutOfBoundsException.class)
    public void testKeyAtEnd() {
        list.end().key();
    }

    @Test
    public void testKeyAfterLastEntry() {
        ISkipListIterator<Integer> iter = list.find(30);
        assertTrue(iter.valid());
        iter.next();
        assertFalse(iter.valid());
        assertEquals(list.end(), iter);

        try {
            iter.key();
            fail("key() at end should be rejected");
        } catch (IndexOutOfBoundsException e) {
            assertEquals("skip list iterator out of range", e.getMessage());
        }
    }

    @Test
    public void testNextAtEndStaysAtEnd() {
        ISkipListIterator<Integer> iter = list.end();
        iter.next();
        assertFalse(iter.valid());
        assertEquals(list.end(), iter);
    }

    @Test
    public void testWalk() {
        ISkipListIterator<Integer> iter = list.begin();
        int expected = 10;
        while (!iter.equals(list.end())) {
            assertEquals(Integer.valueOf(expected), iter.key());
            expected += 10;
            iter.next();
        }
        assertEquals(40, expected);
    }

    @Test
    public void testSeek() {
        ISkipListIterator<Integer> iter = list.end();

        iter.seek(15);
        assertEquals(Integer.valueOf(20), iter.key());
        iter.seek(20);
        assertEquals(Integer.valueOf(20), iter.key());
        iter.seek(5);
        assertEquals(list.begin(), iter);
        iter.seek(31);
        assertFalse(iter.valid());

        iter.seekToFirst();
        assertEquals(Integer.valueOf(10), iter.key());
    }

    @Test
    public void testEquality() {
        assertEquals(list.find(20), list.lowerBound(11));
        assertEquals(list.find(20).hashCode(), list.lowerBound(11).hashCode());
        assertNotEquals(list.find(20), list.find(10));
        assertNotEquals(list.begin(), list.end());

        // end positions of different lists are interchangeable
        assertEquals(list.end(), SkipList.<Integer>of().begin());
    }

    @Test
    public void testPositionsAreIndependent() {
        ISkipListIterator<Integer> a = list.begin();
        ISkipListIterator<Integer> b = list.begin();
        a.next();
        assertEquals(Integer.valueOf(20), a.key());
        assertEquals(Integer.valueOf(10), b.key());
    }

    @Test
    public void testInsertedPositionTraversal() {
        ISkipListIterator<Integer> iter = list.insert(25).getLeft();
        assertEquals(Integer.valueOf(25), iter.key());
        iter.next();
        assertEquals(Integer.valueOf(30), iter.key());
    }

    @Test
    public void testToString() {
        assertEquals("SkipListIterator(10)", list.begin().toString());
        assertEquals("SkipListIterator(end)", list.end().toString());
    }
}
