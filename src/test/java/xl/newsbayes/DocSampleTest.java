package xl.newsbayes;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

public class DocSampleTest
{
    @Test
    public void testCountsTerms()
    {
        DocSample sample = new DocSample(Arrays.asList("oil", "crude", "oil"));
        assertEquals(2, sample.size());
        assertEquals(2, sample.count("oil"));
        assertEquals(1, sample.count("crude"));
        assertEquals(0, sample.count("wheat"));
        assertFalse(sample.contains("wheat"));
        assertEquals(3, sample.totalCount());
    }

    @Test
    public void testIncrement()
    {
        DocSample sample = new DocSample();
        assertTrue(sample.isEmpty());
        sample.increment("grain");
        sample.increment("grain", 4);
        assertEquals(5, sample.count("grain"));
        assertThrows(IllegalArgumentException.class, () -> sample.increment("grain", 0));
        assertThrows(IllegalArgumentException.class, () -> sample.increment(""));
    }

    @Test
    public void testIteratesInTermOrder()
    {
        DocSample sample = new DocSample(Arrays.asList("zinc", "barley", "oil", "barley"));
        List<String> terms = new ArrayList<String>();
        for (Map.Entry<String, Integer> entry : sample)
        {
            terms.add(entry.getKey());
        }
        assertEquals(Arrays.asList("barley", "oil", "zinc"), terms);
    }

    @Test
    public void testIteratorIsReadOnly()
    {
        Iterator<Map.Entry<String, Integer>> it = new DocSample(Arrays.asList("oil")).iterator();
        it.next();
        assertThrows(UnsupportedOperationException.class, it::remove);
    }

    @Test
    public void testRetainSortedLeavesOriginal()
    {
        DocSample sample = new DocSample(Arrays.asList("oil", "crude", "oil", "opec"));
        DocSample pruned = sample.retainSorted(Arrays.asList("crude", "oil"));
        assertEquals(2, pruned.size());
        assertEquals(2, pruned.count("oil"));
        assertEquals(3, sample.size());
        assertTrue(sample.contains("opec"));
    }

    @Test
    public void testCopyAndEquality()
    {
        DocSample sample = new DocSample(Arrays.asList("a", "b", "b"));
        DocSample copy = sample.copy();
        assertNotSame(sample, copy);
        assertEquals(sample, copy);
        assertEquals(sample.hashCode(), copy.hashCode());
        copy.increment("c");
        assertFalse(sample.contains("c"));
    }
}
