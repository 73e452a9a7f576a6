package xl.newsbayes;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.StringTokenizer;

/**
 * Turns raw story text into normalized terms.  A token is any maximal run of non-whitespace,
 * normalizing it means:
 * <ol>
 *     <li>punctuation removal (quotes, commas and angle brackets anywhere, anything non-alphanumeric at either end)</li>
 *     <li>case folding</li>
 *     <li>stopword removal</li>
 *     <li>stemming</li>
 * </ol>
 * The tokenizer also keeps corpus-wide frequency counts of what it has seen, see {@link #stats()}.
 * It is not thread safe.
 */
public class Tokenizer
{
    static final String DELIMITERS = " \t\n\r\u000B\f";

    // quotes, commas and angle brackets get folded into this, then everything carrying it goes
    private static final char PLACEHOLDER = '\'';

    private final Stopwords stopwords;
    private final Stemmer stemmer;

    private final Map<String, Long> unnormalizedTerms = new HashMap<String, Long>();
    private final Map<String, Long> normalizedTerms = new HashMap<String, Long>();
    private long totalUnnormalizedTokens = 0;
    private long totalNormalizedTokens = 0;

    /**
     * A token and its index in the token sequence of its document
     */
    public static final class Token
    {
        final String text;
        final int position;

        public Token(String text, int position)
        {
            this.text = text;
            this.position = position;
        }

        public String getText()
        {
            return text;
        }

        public int getPosition()
        {
            return position;
        }

        @Override
        public String toString()
        {
            return text + "@" + position;
        }
    }

    public Tokenizer(Stopwords stopwords, Stemmer stemmer)
    {
        this.stopwords = stopwords;
        this.stemmer = stemmer;
    }

    /**
     * Tokenizer with the bundled stopwords and the Porter stemmer
     */
    public Tokenizer()
    {
        this(Stopwords.defaults(), new PorterWordStemmer());
    }

    /**
     * Split on whitespace.  Runs of delimiters never produce empty tokens.
     *
     * @param text Raw text
     * @return The tokens paired with their positions
     */
    public List<Token> tokenize(String text)
    {
        List<Token> tokens = new ArrayList<Token>();
        StringTokenizer tokenizer = new StringTokenizer(text, DELIMITERS);
        int position = 0;
        while (tokenizer.hasMoreTokens())
        {
            tokens.add(new Token(tokenizer.nextToken(), position++));
        }
        totalUnnormalizedTokens += tokens.size();
        return tokens;
    }

    /**
     * Drop {@code " , < > '} from anywhere in the token, then strip non-alphanumerics from both ends.
     * A token made only of punctuation comes back empty.
     */
    public String removePunctuation(String token)
    {
        StringBuilder result = new StringBuilder(token.length());
        for (int i = 0, sz = token.length(); i < sz; ++i)
        {
            char c = token.charAt(i);
            if (c == '"' || c == ',' || c == '<' || c == '>')
            {
                c = PLACEHOLDER;
            }
            if (c != PLACEHOLDER)
            {
                result.append(c);
            }
        }

        int start = 0;
        int end = result.length();
        while (start < end && !Character.isLetterOrDigit(result.charAt(start)))
        {
            start++;
        }
        while (end > start && !Character.isLetterOrDigit(result.charAt(end - 1)))
        {
            end--;
        }
        return result.substring(start, end);
    }

    public boolean isStopword(String word)
    {
        return stopwords.contains(word);
    }

    /**
     * Normalize a single token.
     *
     * @return The stemmed term, or an empty string if nothing is left or the token is a stopword
     */
    public String normalize(String token)
    {
        String result = removePunctuation(token).toLowerCase(Locale.ROOT);
        if (result.isEmpty() || isStopword(result))
        {
            return "";
        }
        return stemmer.stem(result);
    }

    /**
     * Normalize every token, dropping the ones that end up empty
     */
    public List<String> normalizeAll(List<String> tokens)
    {
        List<String> terms = new ArrayList<String>(tokens.size());
        for (String token : tokens)
        {
            String term = normalize(token);
            if (!term.isEmpty())
            {
                terms.add(term);
            }
        }
        return terms;
    }

    /**
     * Tokenize and normalize a raw document and count its terms
     *
     * @param doc Raw document text
     * @return The document's bag of terms, empty if nothing survived normalization
     */
    public DocSample getDocTerms(String doc)
    {
        DocSample sample = new DocSample();
        for (Token token : tokenize(doc))
        {
            unnormalizedTerms.merge(token.text, 1L, Long::sum);

            String term = normalize(token.text);
            if (term.isEmpty())
            {
                continue;
            }
            normalizedTerms.merge(term, 1L, Long::sum);
            totalNormalizedTokens++;
            sample.increment(term);
        }
        return sample;
    }

    /**
     * Snapshot of the statistics gathered by {@link #getDocTerms(String)} so far
     */
    public TokenStats stats()
    {
        return new TokenStats(totalUnnormalizedTokens, totalNormalizedTokens,
                unnormalizedTerms.size(), normalizedTerms.size(),
                TokenStats.top(unnormalizedTerms, TokenStats.TOP_TERM_COUNT),
                TokenStats.top(normalizedTerms, TokenStats.TOP_TERM_COUNT));
    }
}
