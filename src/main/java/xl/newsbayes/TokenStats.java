package xl.newsbayes;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Corpus statistics collected while tokenizing, before and after normalization
 */
public class TokenStats
{
    public static final int TOP_TERM_COUNT = 20;

    private final long totalUnnormalizedTokens;
    private final long totalNormalizedTokens;
    private final int totalUnnormalizedTerms;
    private final int totalNormalizedTerms;
    private final List<String> topUnnormalizedTerms;
    private final List<String> topNormalizedTerms;

    public TokenStats(long totalUnnormalizedTokens, long totalNormalizedTokens,
                      int totalUnnormalizedTerms, int totalNormalizedTerms,
                      List<String> topUnnormalizedTerms, List<String> topNormalizedTerms)
    {
        this.totalUnnormalizedTokens = totalUnnormalizedTokens;
        this.totalNormalizedTokens = totalNormalizedTokens;
        this.totalUnnormalizedTerms = totalUnnormalizedTerms;
        this.totalNormalizedTerms = totalNormalizedTerms;
        this.topUnnormalizedTerms = Collections.unmodifiableList(topUnnormalizedTerms);
        this.topNormalizedTerms = Collections.unmodifiableList(topNormalizedTerms);
    }

    // Most frequent first, ties by term
    static List<String> top(Map<String, Long> frequencies, int n)
    {
        List<Map.Entry<String, Long>> entries = new ArrayList<Map.Entry<String, Long>>(frequencies.entrySet());
        Collections.sort(entries, new Comparator<Map.Entry<String, Long>>()
        {
            @Override
            public int compare(Map.Entry<String, Long> o1, Map.Entry<String, Long> o2)
            {
                int c = o2.getValue().compareTo(o1.getValue());
                return c != 0 ? c : o1.getKey().compareTo(o2.getKey());
            }
        });
        List<String> top = new ArrayList<String>(Math.min(n, entries.size()));
        for (int i = 0; i < n && i < entries.size(); ++i)
        {
            top.add(entries.get(i).getKey());
        }
        return top;
    }

    /**
     * Number of tokens in the corpus before normalization
     */
    public long getTotalUnnormalizedTokens()
    {
        return totalUnnormalizedTokens;
    }

    /**
     * Number of tokens that survived normalization
     */
    public long getTotalNormalizedTokens()
    {
        return totalNormalizedTokens;
    }

    /**
     * Number of distinct raw tokens
     */
    public int getTotalUnnormalizedTerms()
    {
        return totalUnnormalizedTerms;
    }

    /**
     * Number of distinct terms after normalization
     */
    public int getTotalNormalizedTerms()
    {
        return totalNormalizedTerms;
    }

    public List<String> getTopUnnormalizedTerms()
    {
        return topUnnormalizedTerms;
    }

    public List<String> getTopNormalizedTerms()
    {
        return topNormalizedTerms;
    }
}
