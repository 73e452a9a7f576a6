package xl.newsbayes;

import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Bag of terms for a single document.  Each term maps to the number of times it occurs, counts are
 * always positive and a missing term means zero.  Iteration is in term order so dumps are stable.
 */
public class DocSample implements Iterable<Map.Entry<String, Integer>>
{
    private final TreeMap<String, Integer> counts = new TreeMap<String, Integer>();

    public DocSample()
    {
    }

    public DocSample(Collection<String> terms)
    {
        for (String term : terms)
        {
            increment(term);
        }
    }

    /**
     * Copy of a term count table, mostly for tests and readers
     */
    public static DocSample of(Map<String, Integer> termCounts)
    {
        DocSample sample = new DocSample();
        for (Map.Entry<String, Integer> entry : termCounts.entrySet())
        {
            sample.increment(entry.getKey(), entry.getValue());
        }
        return sample;
    }

    public void increment(String term)
    {
        increment(term, 1);
    }

    public void increment(String term, int by)
    {
        if (term == null || term.isEmpty())
        {
            throw new IllegalArgumentException("Terms may not be empty");
        }
        if (by < 1)
        {
            throw new IllegalArgumentException("Count for " + term + " must be positive, got " + by);
        }
        counts.merge(term, by, Integer::sum);
    }

    public int count(String term)
    {
        Integer x = counts.get(term);
        return x == null ? 0 : x;
    }

    public boolean contains(String term)
    {
        return counts.containsKey(term);
    }

    /**
     * Number of distinct terms
     */
    public int size()
    {
        return counts.size();
    }

    public boolean isEmpty()
    {
        return counts.isEmpty();
    }

    /**
     * Sum of all the counts, i.e. the document length after normalization
     */
    public long totalCount()
    {
        long total = 0;
        for (int c : counts.values())
        {
            total += c;
        }
        return total;
    }

    public Set<String> terms()
    {
        return Collections.unmodifiableSet(counts.keySet());
    }

    public DocSample copy()
    {
        DocSample copy = new DocSample();
        copy.counts.putAll(counts);
        return copy;
    }

    /**
     * Build a new sample holding only the terms found in {@code keep}, which must be sorted.  This
     * sample is left alone.
     *
     * @param keep Sorted list of terms to retain
     * @return The pruned copy
     */
    public DocSample retainSorted(List<String> keep)
    {
        DocSample pruned = new DocSample();
        for (Map.Entry<String, Integer> entry : counts.entrySet())
        {
            if (Collections.binarySearch(keep, entry.getKey()) >= 0)
            {
                pruned.counts.put(entry.getKey(), entry.getValue());
            }
        }
        return pruned;
    }

    @Override
    public Iterator<Map.Entry<String, Integer>> iterator()
    {
        return Collections.unmodifiableMap(counts).entrySet().iterator();
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o)
        {
            return true;
        }
        if (!(o instanceof DocSample))
        {
            return false;
        }
        return counts.equals(((DocSample) o).counts);
    }

    @Override
    public int hashCode()
    {
        return counts.hashCode();
    }

    @Override
    public String toString()
    {
        return counts.toString();
    }
}
