package xl.newsbayes;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;

/**
 * Mutual Information feature selection.
 * <p>
 * For a term w and a class c, MI measures how much knowing whether w occurs in a document tells us
 * about whether the document is in c:
 * <pre>
 *   MI(w, c) = sum over e_w, e_c in {0,1} of N(e_w,e_c)/N * log2( N * N(e_w,e_c) / (N(e_w,.) * N(.,e_c)) )
 * </pre>
 * Cells with a zero count contribute nothing (0 log 0 = 0).
 * </p>
 */
public final class FeatureSelection
{
    private static final Logger log = LoggerFactory.getLogger(FeatureSelection.class);

    private FeatureSelection()
    {
    }

    /**
     * A term with its score.  Natural order puts the highest score first, equal scores by term.
     */
    static final class ScoredTerm implements Comparable<ScoredTerm>
    {
        final String term;
        final double score;

        ScoredTerm(String term, double score)
        {
            this.term = term;
            this.score = score;
        }

        @Override
        public int compareTo(ScoredTerm o)
        {
            int c = Double.compare(o.score, score);
            return c != 0 ? c : term.compareTo(o.term);
        }
    }

    /**
     * Mutual information of a 2x2 contingency table.
     *
     * @param n11 Documents containing the term and in the target class
     * @param n10 Documents containing the term, not in the target class
     * @param n01 Documents without the term, in the target class
     * @param n00 Documents without the term, not in the target class
     * @return MI in bits, never negative
     */
    public static double mutualInfo(long n11, long n10, long n01, long n00)
    {
        final long[][] count = { { n00, n01 }, { n10, n11 } };
        final double total = (double) n11 + n10 + n01 + n00;
        if (total == 0)
        {
            return 0;
        }

        double mi = 0;
        for (int i = 0; i < 2; ++i)
        {
            for (int j = 0; j < 2; ++j)
            {
                if (count[i][j] == 0)
                {
                    continue;
                }
                double nij = count[i][j];
                double rowSum = count[i][0] + count[i][1];
                double colSum = count[0][j] + count[1][j];
                mi += (nij / total) * log2((total * nij) / (rowSum * colSum));
            }
        }
        // rounding can leave an independent table a hair below zero
        return Math.max(0, mi);
    }

    private static double log2(double x)
    {
        return Math.log(x) / Math.log(2);
    }

    /**
     * Compute the MI between every term in {@code x} and the event "document is in {@code target}".
     * Absent counts are derived from the class totals, so the corpus is only walked once.
     *
     * @param x Document samples
     * @param y Their classes
     * @param target The class to score against
     * @return MI per term, in no particular order
     */
    public static Map<String, Double> mutualInfo(List<DocSample> x, List<DocClass> y, DocClass target)
    {
        checkLengths(x, y);
        final int numSamples = x.size();

        // term -> { docs with term outside target, docs with term in target }
        Map<String, int[]> present = new HashMap<String, int[]>();
        int numTarget = 0;
        for (int i = 0; i < numSamples; ++i)
        {
            boolean inTarget = y.get(i) == target;
            if (inTarget)
            {
                numTarget++;
            }
            for (String term : x.get(i).terms())
            {
                int[] counts = present.get(term);
                if (counts == null)
                {
                    counts = new int[2];
                    present.put(term, counts);
                }
                counts[inTarget ? 1 : 0]++;
            }
        }

        Map<String, Double> mi = new HashMap<String, Double>(present.size() * 2);
        for (Map.Entry<String, int[]> entry : present.entrySet())
        {
            int n11 = entry.getValue()[1];
            int n10 = entry.getValue()[0];
            int n01 = numTarget - n11;
            int n00 = (numSamples - numTarget) - n10;
            mi.put(entry.getKey(), mutualInfo(n11, n10, n01, n00));
        }
        return mi;
    }

    /**
     * Pick the {@code k} terms with the highest MI for each class.  Scores come out of a hash map
     * unordered, are heapified in linear time and only {@code k} of them are popped, so the whole
     * vocabulary is never sorted.  Only the {@code k} winners are sorted at the end.
     * If a class has fewer than {@code k} candidate terms, all of them are returned.
     *
     * @param x Training samples
     * @param y Training classes
     * @param classes The classes to select terms for
     * @param k How many terms to keep per class
     * @return For each class, its top terms sorted alphabetically
     */
    public static Map<DocClass, List<String>> topWordsPerClass(List<DocSample> x, List<DocClass> y,
                                                               Collection<DocClass> classes, int k)
    {
        if (k <= 0)
        {
            throw new IllegalArgumentException("Number of features must be positive, got " + k);
        }
        checkLengths(x, y);

        Map<DocClass, List<String>> topWords = new EnumMap<DocClass, List<String>>(DocClass.class);
        for (DocClass docClass : classes)
        {
            Map<String, Double> mi = mutualInfo(x, y, docClass);
            List<ScoredTerm> scored = new ArrayList<ScoredTerm>(mi.size());
            for (Map.Entry<String, Double> entry : mi.entrySet())
            {
                scored.add(new ScoredTerm(entry.getKey(), entry.getValue()));
            }

            PriorityQueue<ScoredTerm> heap = new PriorityQueue<ScoredTerm>(scored);
            List<String> top = new ArrayList<String>(Math.min(k, heap.size()));
            while (top.size() < k && !heap.isEmpty())
            {
                top.add(heap.poll().term);
            }
            if (top.size() < k)
            {
                log.warn("Only " + top.size() + " terms available for " + docClass + ", wanted " + k);
            }
            Collections.sort(top);
            topWords.put(docClass, top);
        }
        return topWords;
    }

    /**
     * Prune every sample down to the top terms of its own class.  The input samples are not touched,
     * a new list of pruned samples is returned.  Samples whose class has no entry in
     * {@code topWordsPerClass} are copied as they are.
     *
     * @param x Training samples
     * @param y Training classes
     * @param topWordsPerClass Selected terms per class, as returned by {@link #topWordsPerClass}
     * @return Pruned samples, parallel to {@code x}
     */
    public static List<DocSample> removeUnimportantWords(List<DocSample> x, List<DocClass> y,
                                                         Map<DocClass, List<String>> topWordsPerClass)
    {
        checkLengths(x, y);

        Map<DocClass, List<String>> sorted = new EnumMap<DocClass, List<String>>(DocClass.class);
        for (Map.Entry<DocClass, List<String>> entry : topWordsPerClass.entrySet())
        {
            List<String> words = new ArrayList<String>(entry.getValue());
            Collections.sort(words);
            sorted.put(entry.getKey(), words);
        }

        List<DocSample> pruned = new ArrayList<DocSample>(x.size());
        for (int i = 0; i < x.size(); ++i)
        {
            DocSample sample = x.get(i);
            List<String> keep = sorted.get(y.get(i));
            if (keep == null)
            {
                pruned.add(sample.copy());
                continue;
            }
            pruned.add(sample.retainSorted(keep));
        }
        return pruned;
    }

    private static void checkLengths(List<DocSample> x, List<DocClass> y)
    {
        if (x.size() != y.size())
        {
            throw new IllegalArgumentException("Got " + x.size() + " samples but " + y.size() + " labels");
        }
    }
}
