package xl.newsbayes;

import org.tartarus.snowball.ext.PorterStemmer;

/**
 * The original Porter algorithm, as shipped with Lucene's snowball stemmers.
 * Instances keep a mutable buffer, so one per tokenizer.
 */
public class PorterWordStemmer implements Stemmer
{
    private final PorterStemmer stemmer = new PorterStemmer();

    @Override
    public String stem(String word)
    {
        if (word.isEmpty())
        {
            return word;
        }
        stemmer.setCurrent(word);
        stemmer.stem();
        return stemmer.getCurrent();
    }
}
