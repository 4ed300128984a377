package com.yongkangl.branchsites.substitution;

import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;

public class TagFrequencyTableTest {

    @Test
    public void testCountsAreSortedWithinTag() {
        TagFrequencyTable table = new TagFrequencyTable();
        table.increment("test", "G");
        table.increment("test", "A");
        table.increment("test", "A");
        table.increment("test", "A");

        assertEquals(3, table.getCount("test", "A"));
        assertEquals(4, table.getTotal("test"));
        assertEquals("A:3,G:1", table.format("test"));
        assertEquals(Arrays.asList("A", "G"), Arrays.asList(table.counts("test").keySet().toArray()));
    }

    @Test
    public void testUnknownTag() {
        TagFrequencyTable table = new TagFrequencyTable();
        assertEquals(0, table.getCount("foreground", "A"));
        assertEquals(0, table.getTotal("foreground"));
        assertTrue(table.counts("foreground").isEmpty());
        assertTrue(table.modes("foreground").isEmpty());
        assertEquals(TagFrequencyTable.EMPTY, table.format("foreground"));
        assertEquals(TagFrequencyTable.NOT_AVAILABLE, table.formatAll());
    }

    @Test
    public void testMarkDoesNotAccumulate() {
        TagFrequencyTable table = new TagFrequencyTable();
        table.mark("test->background", TagFrequencyTable.TRANSITION);
        table.mark("test->background", TagFrequencyTable.TRANSITION);
        assertEquals(1, table.getCount("test->background", TagFrequencyTable.TRANSITION));
    }

    @Test
    public void testFormatAllSkipsTransitions() {
        TagFrequencyTable table = new TagFrequencyTable();
        table.increment("foreground", "I:M");
        table.increment("foreground", "I:M");
        table.mark("test->foreground", TagFrequencyTable.TRANSITION);
        table.increment("background", "A:V");
        assertEquals("I:M:2,A:V:1", table.formatAll());
    }

    @Test
    public void testTagsKeepInsertionOrder() {
        TagFrequencyTable table = new TagFrequencyTable();
        table.increment("test", "A");
        table.increment("background", "A");
        table.increment("foreground", "A");
        assertEquals("[test, background, foreground]", table.getTags().toString());
    }

    @Test
    public void testPooled() {
        TagFrequencyTable table = new TagFrequencyTable();
        table.increment("foreground", "M");
        table.increment("background", "M");
        table.increment("background", "I");
        TagFrequencyTable pooled = table.pooled("all");
        assertEquals(Collections.singleton("all"), pooled.getTags());
        assertEquals("I:1,M:2", pooled.format("all"));
        assertEquals(1, table.getCount("foreground", "M"));
    }

    @Test
    public void testModes() {
        TagFrequencyTable table = new TagFrequencyTable();
        table.increment("test", "V");
        table.increment("test", "L");
        table.increment("test", "V");
        table.increment("test", "L");
        table.increment("test", "A");
        assertEquals(Arrays.asList("L", "V"), table.modes("test"));
    }

    @Test
    public void testEquality() {
        TagFrequencyTable a = new TagFrequencyTable();
        TagFrequencyTable b = new TagFrequencyTable();
        a.increment("test", "M");
        b.increment("test", "M");
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        b.increment("test", "M");
        assertNotEquals(a, b);
    }

    @Test(expected = NullPointerException.class)
    public void testNullTagIsRejected() {
        new TagFrequencyTable().increment(null, "M");
    }
}
