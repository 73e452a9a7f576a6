package xl.newsbayes;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.StringTokenizer;
import java.util.TreeMap;

/**
 * Multinomial Naive Bayes over bags of terms, with add-one smoothing.
 * <p>
 * A freshly constructed classifier is untrained.  {@link #fit} or {@link #read} make it usable, and
 * every {@code fit} throws away what was there before.  Tables are indexed by
 * {@link DocClass#ordinal()}.
 * </p>
 * <p>
 * Scores are log posteriors.  For a term the model never saw with a class, p(term|class) falls back
 * to 1/|V|.  When two classes score exactly the same, the one with the lower ordinal wins.
 * </p>
 */
public class NaiveBayesClassifier
{
    private static final Logger log = LoggerFactory.getLogger(NaiveBayesClassifier.class);

    private static final int NUM_CLASSES = DocClass.values().length;

    private final EnumSet<DocClass> classes = EnumSet.noneOf(DocClass.class);
    private final double[] prior = new double[NUM_CLASSES];

    // term -> p(term|class) by ordinal, 0 where nothing was recorded
    private final Map<String, double[]> likelihood = new HashMap<String, double[]>();

    public NaiveBayesClassifier()
    {
    }

    public boolean isFitted()
    {
        return !classes.isEmpty();
    }

    /**
     * Estimate priors and smoothed likelihoods from a labeled training set.
     * <p>
     * All the documents of a class are summed into one class document, then
     * p(w|c) = (count(w,c) + 1) / (total(c) + |V|), where V is the vocabulary of the whole training set.
     * </p>
     *
     * @param x Training samples
     * @param y Their classes
     * @return this, fitted
     */
    public NaiveBayesClassifier fit(List<DocSample> x, List<DocClass> y)
    {
        if (x.size() != y.size())
        {
            throw new IllegalArgumentException("Got " + x.size() + " samples but " + y.size() + " labels");
        }
        if (x.isEmpty())
        {
            throw new IllegalArgumentException("Cannot fit on an empty training set");
        }

        long start = System.currentTimeMillis();

        classes.clear();
        likelihood.clear();
        Arrays.fill(prior, 0);

        final int numSamples = y.size();
        long[] docsPerClass = new long[NUM_CLASSES];

        // Class mega documents
        List<Map<String, Long>> megadocs = new ArrayList<Map<String, Long>>(NUM_CLASSES);
        for (int i = 0; i < NUM_CLASSES; ++i)
        {
            megadocs.add(new HashMap<String, Long>());
        }
        long[] totalTerms = new long[NUM_CLASSES];
        Set<String> vocabulary = new HashSet<String>();

        for (int i = 0; i < numSamples; ++i)
        {
            DocClass docClass = y.get(i);
            int c = docClass.ordinal();
            classes.add(docClass);
            docsPerClass[c]++;

            Map<String, Long> megadoc = megadocs.get(c);
            for (Map.Entry<String, Integer> entry : x.get(i))
            {
                megadoc.merge(entry.getKey(), (long) entry.getValue(), Long::sum);
                totalTerms[c] += entry.getValue();
                vocabulary.add(entry.getKey());
            }
        }

        for (DocClass docClass : classes)
        {
            int c = docClass.ordinal();
            prior[c] = docsPerClass[c] / (double) numSamples;

            double denominator = totalTerms[c] + vocabulary.size();
            for (Map.Entry<String, Long> entry : megadocs.get(c).entrySet())
            {
                double[] probs = likelihood.get(entry.getKey());
                if (probs == null)
                {
                    probs = new double[NUM_CLASSES];
                    likelihood.put(entry.getKey(), probs);
                }
                probs[c] = (entry.getValue() + 1) / denominator;
            }
        }

        double fitSeconds = (System.currentTimeMillis() - start) / 1000.0;
        log.info(String.format("Fitted %d classes on %d documents, %d terms in vocabulary, in %.02fs",
                classes.size(), numSamples, vocabulary.size(), fitSeconds));
        return this;
    }

    /**
     * Log posterior (up to the shared evidence term) of every class the model knows
     *
     * @param sample The document to score
     * @return Score per class, in ordinal order
     */
    public Map<DocClass, Double> scores(DocSample sample)
    {
        if (!isFitted())
        {
            throw new IllegalStateException("Classifier has not been fitted");
        }

        // With an empty vocabulary every term falls back to the same value for all classes
        final int vocabularySize = likelihood.size();
        final double unseen = vocabularySize == 0 ? 1.0 : 1.0 / vocabularySize;

        Map<DocClass, Double> posterior = new EnumMap<DocClass, Double>(DocClass.class);
        for (DocClass docClass : classes)
        {
            int c = docClass.ordinal();
            double score = Math.log(prior[c]);
            for (Map.Entry<String, Integer> entry : sample)
            {
                double[] probs = likelihood.get(entry.getKey());
                double p = probs == null || probs[c] == 0 ? unseen : probs[c];
                score += entry.getValue() * Math.log(p);
            }
            posterior.put(docClass, score);
        }
        return posterior;
    }

    /**
     * Predict the maximum a posteriori class of a sample
     *
     * @param sample The document to classify
     * @return The best scoring class, lowest ordinal on ties
     */
    public DocClass predict(DocSample sample)
    {
        DocClass best = null;
        double bestScore = Double.NEGATIVE_INFINITY;
        // EnumMap iterates in ordinal order, so only a strictly better score replaces
        for (Map.Entry<DocClass, Double> entry : scores(sample).entrySet())
        {
            if (best == null || entry.getValue() > bestScore)
            {
                best = entry.getKey();
                bestScore = entry.getValue();
            }
        }
        return best;
    }

    /**
     * Predict each sample independently
     */
    public List<DocClass> predict(List<DocSample> samples)
    {
        List<DocClass> predictions = new ArrayList<DocClass>(samples.size());
        for (DocSample sample : samples)
        {
            predictions.add(predict(sample));
        }
        return predictions;
    }

    /**
     * Classes seen while fitting, in ordinal order
     */
    public Set<DocClass> classes()
    {
        return Collections.unmodifiableSet(classes);
    }

    /**
     * Prior probability of each fitted class
     */
    public Map<DocClass, Double> prior()
    {
        Map<DocClass, Double> out = new EnumMap<DocClass, Double>(DocClass.class);
        for (DocClass docClass : classes)
        {
            out.put(docClass, prior[docClass.ordinal()]);
        }
        return Collections.unmodifiableMap(out);
    }

    /**
     * Every recorded p(term|class), terms in alphabetical order
     */
    public Map<String, Map<DocClass, Double>> likelihood()
    {
        Map<String, Map<DocClass, Double>> out = new TreeMap<String, Map<DocClass, Double>>();
        for (Map.Entry<String, double[]> entry : likelihood.entrySet())
        {
            Map<DocClass, Double> perClass = new EnumMap<DocClass, Double>(DocClass.class);
            for (DocClass docClass : DocClass.values())
            {
                double p = entry.getValue()[docClass.ordinal()];
                if (p != 0)
                {
                    perClass.put(docClass, p);
                }
            }
            out.put(entry.getKey(), Collections.unmodifiableMap(perClass));
        }
        return Collections.unmodifiableMap(out);
    }

    /**
     * The stored p(term|class), or 0 if the pair was never seen in training
     */
    public double likelihood(String term, DocClass docClass)
    {
        double[] probs = likelihood.get(term);
        return probs == null ? 0 : probs[docClass.ordinal()];
    }

    public int vocabularySize()
    {
        return likelihood.size();
    }

    /**
     * Write the model as text: one {@code class prior} line per class, a blank line, then one
     * {@code term class likelihood} line per recorded pair.  Doubles are written in their shortest
     * exact form so reading the file back gives identical values.
     */
    public void write(Writer writer) throws IOException
    {
        for (DocClass docClass : classes)
        {
            writer.write(docClass.key() + " " + Double.toString(prior[docClass.ordinal()]) + "\n");
        }
        writer.write("\n");

        List<String> terms = new ArrayList<String>(likelihood.keySet());
        Collections.sort(terms);
        for (String term : terms)
        {
            double[] probs = likelihood.get(term);
            for (DocClass docClass : DocClass.values())
            {
                double p = probs[docClass.ordinal()];
                if (p != 0)
                {
                    writer.write(term + " " + docClass.key() + " " + Double.toString(p) + "\n");
                }
            }
        }
        writer.flush();
    }

    /**
     * Read a model written by {@link #write(Writer)}
     *
     * @param in The model text
     * @return A fitted classifier
     * @throws IOException If the text is not a valid model
     */
    public static NaiveBayesClassifier read(Reader in) throws IOException
    {
        NaiveBayesClassifier clf = new NaiveBayesClassifier();
        BufferedReader reader = new BufferedReader(in);
        String line;
        int lineNumber = 0;

        // priors, up to the blank line
        while ((line = reader.readLine()) != null)
        {
            ++lineNumber;
            if (line.isEmpty())
            {
                break;
            }
            String[] fields = fields(line, 2, lineNumber);
            DocClass docClass = parseClass(fields[0], lineNumber);
            double p = parseDouble(fields[1], lineNumber);
            if (!(p > 0 && p <= 1))
            {
                throw new IOException("Prior out of range on line " + lineNumber + ": " + p);
            }
            clf.classes.add(docClass);
            clf.prior[docClass.ordinal()] = p;
        }

        while ((line = reader.readLine()) != null)
        {
            ++lineNumber;
            if (line.isEmpty())
            {
                continue;
            }
            String[] fields = fields(line, 3, lineNumber);
            DocClass docClass = parseClass(fields[1], lineNumber);
            double p = parseDouble(fields[2], lineNumber);
            if (!(p > 0 && p <= 1))
            {
                throw new IOException("Likelihood out of range on line " + lineNumber + ": " + p);
            }
            double[] probs = clf.likelihood.get(fields[0]);
            if (probs == null)
            {
                probs = new double[NUM_CLASSES];
                clf.likelihood.put(fields[0], probs);
            }
            probs[docClass.ordinal()] = p;
        }

        if (!clf.isFitted())
        {
            throw new IOException("Model has no class priors");
        }
        return clf;
    }

    public void save(Path file) throws IOException
    {
        try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8))
        {
            write(writer);
        }
        log.info("Model written to " + file);
    }

    public static NaiveBayesClassifier load(Path file) throws IOException
    {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8))
        {
            NaiveBayesClassifier clf = read(reader);
            log.info("Loaded model with " + clf.classes.size() + " classes and " + clf.vocabularySize()
                    + " terms from " + file);
            return clf;
        }
    }

    private static String[] fields(String line, int expected, int lineNumber) throws IOException
    {
        StringTokenizer tokenizer = new StringTokenizer(line, " \t");
        if (tokenizer.countTokens() != expected)
        {
            throw new IOException("Expected " + expected + " fields on line " + lineNumber + ": " + line);
        }
        String[] fields = new String[expected];
        for (int i = 0; i < expected; ++i)
        {
            fields[i] = tokenizer.nextToken();
        }
        return fields;
    }

    private static DocClass parseClass(String key, int lineNumber) throws IOException
    {
        try
        {
            return DocClass.fromKey(key);
        }
        catch (IllegalArgumentException ex)
        {
            throw new IOException("Unknown class on line " + lineNumber + ": " + key, ex);
        }
    }

    private static double parseDouble(String value, int lineNumber) throws IOException
    {
        try
        {
            return Double.parseDouble(value);
        }
        catch (NumberFormatException ex)
        {
            throw new IOException("Bad number on line " + lineNumber + ": " + value, ex);
        }
    }
}
