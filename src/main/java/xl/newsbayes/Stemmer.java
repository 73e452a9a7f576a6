package xl.newsbayes;

/**
 * Reduces a lowercase word to its stem.  Implementations only ever shorten or rewrite the word's
 * suffix, using the same alphabet.
 */
public interface Stemmer
{
    String stem(String word);
}
