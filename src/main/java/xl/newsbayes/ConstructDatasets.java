package xl.newsbayes;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Build the training and test sets from the Reuters-21578 SGML files.
 * <p>
 * Only stories with exactly one of the target topics (earn, acq, money-fx, grain, crude) are kept,
 * and they go to the training or test set following their LEWISSPLIT attribute.  The title and body
 * of each story are tokenized and normalized into term counts.
 * </p>
 */
public class ConstructDatasets
{
    private static final Logger log = LoggerFactory.getLogger(ConstructDatasets.class);

    public static class Params
    {
        @Parameter(description = "Directory holding the .sgm files", names = {"--data-dir", "-d"})
        public String dataDir = "Dataset";

        @Parameter(description = "Stopword list, whitespace separated (defaults to the bundled list)", names = {"--stopwords"})
        public String stopwords;

        @Parameter(description = "Training set to write", names = {"--train", "-t"})
        public String train = "train.txt";

        @Parameter(description = "Test set to write", names = {"--test", "-e"})
        public String test = "test.txt";

        @Parameter(description = "Log tokenizer statistics", names = "--stats")
        public Boolean stats = false;

        @Parameter(description = "Print usage", names = {"--help", "-h"}, help = true)
        public Boolean help = false;
    }

    /**
     * Training and test documents, ready to be written
     */
    public static class Split
    {
        final List<Instance> train = new ArrayList<Instance>();
        final List<Instance> test = new ArrayList<Instance>();

        public List<Instance> getTrain()
        {
            return train;
        }

        public List<Instance> getTest()
        {
            return test;
        }
    }

    public static void main(String[] args)
    {
        Params params = new Params();
        JCommander jc = new JCommander(params);
        jc.setProgramName(ConstructDatasets.class.getSimpleName());
        try
        {
            jc.parse(args);
        }
        catch (ParameterException ex)
        {
            System.err.println(ex.getMessage());
            jc.usage();
            System.exit(2);
        }
        if (params.help)
        {
            jc.usage();
            return;
        }

        try
        {
            Stopwords stopwords = params.stopwords == null ? Stopwords.defaults() : Stopwords.load(Paths.get(params.stopwords));
            Tokenizer tokenizer = new Tokenizer(stopwords, new PorterWordStemmer());

            long start = System.currentTimeMillis();
            List<Path> files = Datasets.listDataFiles(Paths.get(params.dataDir));
            if (files.isEmpty())
            {
                throw new IOException("No " + Datasets.SGM_EXTENSION + " files in " + params.dataDir);
            }
            Split split = build(files, tokenizer);
            double seconds = (System.currentTimeMillis() - start) / 1000.0;
            log.info(String.format("Parsed and normalized %d files in %.02fs", files.size(), seconds));

            Datasets.save(Paths.get(params.train), split.train);
            Datasets.save(Paths.get(params.test), split.test);
            log.info(split.train.size() + " documents written to the training set at " + params.train);
            log.info(split.test.size() + " documents written to the test set at " + params.test);

            if (params.stats)
            {
                logStats(tokenizer.stats());
            }
        }
        catch (Exception ex)
        {
            log.error("Failed", ex);
            System.exit(1);
        }
    }

    public static Split build(List<Path> files, Tokenizer tokenizer) throws IOException
    {
        Split split = new Split();
        for (Path file : files)
        {
            List<ReutersDocument> docs = ReutersParser.parse(file);
            log.debug(docs.size() + " documents in " + file);
            for (ReutersDocument doc : docs)
            {
                add(split, doc, tokenizer);
            }
        }
        return split;
    }

    static void add(Split split, ReutersDocument doc, Tokenizer tokenizer)
    {
        DocClass label = singleLabel(doc);
        if (label == null || doc.split == ReutersDocument.Split.OTHER)
        {
            return;
        }
        Instance instance = new Instance(doc.id, label, tokenizer.getDocTerms(doc.text));
        if (doc.split == ReutersDocument.Split.TRAIN)
        {
            split.train.add(instance);
        }
        else
        {
            split.test.add(instance);
        }
    }

    /**
     * The one target topic of a story, or null when it has none or several
     */
    static DocClass singleLabel(ReutersDocument doc)
    {
        DocClass label = null;
        for (DocClass topic : doc.topics)
        {
            if (topic == DocClass.OTHER)
            {
                continue;
            }
            if (label != null)
            {
                return null;
            }
            label = topic;
        }
        return label;
    }

    private static void logStats(TokenStats stats)
    {
        log.info("Tokens before normalization: " + stats.getTotalUnnormalizedTokens());
        log.info("Tokens after normalization: " + stats.getTotalNormalizedTokens());
        log.info("Terms before normalization: " + stats.getTotalUnnormalizedTerms());
        log.info("Terms after normalization: " + stats.getTotalNormalizedTerms());
        log.info("Most frequent terms before normalization: " + String.join(" ", stats.getTopUnnormalizedTerms()));
        log.info("Most frequent terms after normalization: " + String.join(" ", stats.getTopNormalizedTerms()));
    }
}
