package xl.newsbayes;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collection;
import java.util.Locale;
import java.util.StringTokenizer;
import java.util.TreeSet;

/**
 * Immutable stopword list.  Words are kept in a sorted array and looked up with a binary search.
 * A list that can't be read, or that turns out empty, is a fatal configuration error.
 */
public final class Stopwords
{
    public static final String DEFAULT_RESOURCE = "/stopwords.txt";

    private final String[] words;

    private Stopwords(TreeSet<String> words)
    {
        if (words.isEmpty())
        {
            throw new IllegalStateException("Stopword list is empty");
        }
        this.words = words.toArray(new String[0]);
    }

    /**
     * The list bundled with the jar
     */
    public static Stopwords defaults()
    {
        return fromClasspath(DEFAULT_RESOURCE);
    }

    public static Stopwords fromClasspath(String resource)
    {
        InputStream in = Stopwords.class.getResourceAsStream(resource);
        if (in == null)
        {
            throw new IllegalStateException("Stopword resource not found: " + resource);
        }
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8))
        {
            return read(reader);
        }
        catch (IOException ex)
        {
            throw new IllegalStateException("Could not read stopword resource " + resource, ex);
        }
    }

    public static Stopwords load(Path file)
    {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8))
        {
            return read(reader);
        }
        catch (IOException ex)
        {
            throw new IllegalStateException("Could not read stopword file " + file, ex);
        }
    }

    public static Stopwords of(Collection<String> words)
    {
        TreeSet<String> out = new TreeSet<String>();
        for (String word : words)
        {
            if (word != null && !word.isBlank())
            {
                out.add(word.strip().toLowerCase(Locale.ROOT));
            }
        }
        return new Stopwords(out);
    }

    // Words are separated by any whitespace, lines starting with # are comments
    private static Stopwords read(Reader in) throws IOException
    {
        TreeSet<String> out = new TreeSet<String>();
        BufferedReader reader = new BufferedReader(in);
        String line;
        while ((line = reader.readLine()) != null)
        {
            if (line.startsWith("#"))
            {
                continue;
            }
            StringTokenizer tokenizer = new StringTokenizer(line);
            while (tokenizer.hasMoreTokens())
            {
                out.add(tokenizer.nextToken().toLowerCase(Locale.ROOT));
            }
        }
        return new Stopwords(out);
    }

    public boolean contains(String word)
    {
        return Arrays.binarySearch(words, word) >= 0;
    }

    public int size()
    {
        return words.length;
    }
}
