package xl.newsbayes;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import com.beust.jcommander.validators.PositiveInteger;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.*;

/**
 * Fit a Multinomial Naive Bayes topic classifier on a training set, or predict the classes of a test
 * set with a model fitted earlier (or both in one go).
 *
 * Datasets are the files written by {@link ConstructDatasets}:
 *
 * 1 earn
 * profit 3
 * qtr 2
 *
 * 5 grain
 * wheat 4
 *
 * <p>
 * With {@code --num-features N}, only the N terms with the highest mutual information with each class
 * are kept in the training documents of that class before fitting.
 * </p>
 */
public class NaiveBayes
{
    private static final Logger log = LoggerFactory.getLogger(NaiveBayes.class);

    public static class Params
    {
        @Parameter(description = "Training set; fit a model and save it to --model", names = {"--train", "-t"})
        public String train;

        @Parameter(description = "Test set; predict it with the model in --model", names = {"--eval", "-e"})
        public String eval;

        @Parameter(description = "Model file", names = {"--model", "-s"}, required = true)
        public String model;

        // 0 keeps every term
        @Parameter(description = "Number of features (terms) per class, chosen by mutual information", names = {"--num-features", "-n"},
                validateWith = PositiveInteger.class)
        public Integer numFeatures = 0;

        @Parameter(description = "Write the selected features per class as JSON", names = {"--features-out"})
        public String featuresOut;

        @Parameter(description = "Write the evaluation report as JSON", names = {"--report"})
        public String report;

        @Parameter(description = "Print usage", names = {"--help", "-h"}, help = true)
        public Boolean help = false;
    }

    public static void main(String[] args)
    {
        Params params = new Params();
        JCommander jc = new JCommander(params);
        jc.setProgramName(NaiveBayes.class.getSimpleName());
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
        if (params.help || (params.train == null && params.eval == null))
        {
            jc.usage();
            System.exit(params.help ? 0 : 2);
        }

        try
        {
            if (params.train != null)
            {
                fit(new File(params.train), Paths.get(params.model), params.numFeatures,
                        params.featuresOut == null ? null : Paths.get(params.featuresOut));
            }
            if (params.eval != null)
            {
                EvaluationReport report = predict(new File(params.eval), Paths.get(params.model));
                if (params.report != null)
                {
                    report.writeJson(Paths.get(params.report));
                    log.info("Report written to " + params.report);
                }
            }
        }
        catch (Exception ex)
        {
            log.error("Failed", ex);
            System.exit(1);
        }
    }

    /**
     * Fit a classifier on a training set and save it
     *
     * @param trainFile Training set
     * @param modelFile Where to save the model
     * @param numFeatures Terms to keep per class, 0 for all
     * @param featuresOut Optional JSON dump of the selected terms
     * @return The fitted classifier
     */
    public static NaiveBayesClassifier fit(File trainFile, Path modelFile, int numFeatures, Path featuresOut) throws IOException
    {
        if (numFeatures < 0)
        {
            throw new IllegalArgumentException("Number of features cannot be negative, got " + numFeatures);
        }
        List<Instance> instances = Datasets.load(trainFile);
        log.info(instances.size() + " training documents read from " + trainFile);

        List<DocSample> x = new ArrayList<DocSample>(instances.size());
        List<DocClass> y = new ArrayList<DocClass>(instances.size());
        Set<DocClass> classes = EnumSet.noneOf(DocClass.class);
        for (Instance instance : instances)
        {
            x.add(instance.sample);
            y.add(instance.label);
            classes.add(instance.label);
        }

        if (numFeatures > 0)
        {
            long selectStart = System.currentTimeMillis();
            Map<DocClass, List<String>> topWords = FeatureSelection.topWordsPerClass(x, y, classes, numFeatures);
            double selectSeconds = (System.currentTimeMillis() - selectStart) / 1000.0;
            log.info(String.format("Selected %d features for each of %d classes in %.02fs",
                    numFeatures, classes.size(), selectSeconds));
            for (Map.Entry<DocClass, List<String>> entry : topWords.entrySet())
            {
                log.info(entry.getKey() + ": " + String.join(" ", entry.getValue()));
            }
            if (featuresOut != null)
            {
                ObjectMapper objectMapper = new ObjectMapper();
                objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
                objectMapper.writeValue(featuresOut.toFile(), topWords);
            }
            x = FeatureSelection.removeUnimportantWords(x, y, topWords);
        }

        NaiveBayesClassifier clf = new NaiveBayesClassifier().fit(x, y);
        clf.save(modelFile);
        return clf;
    }

    /**
     * Predict a test set with a saved model, print one line per document followed by the statistics
     *
     * @param testFile Test set
     * @param modelFile A model written by {@link #fit}
     * @return The evaluation of the predictions
     */
    public static EvaluationReport predict(File testFile, Path modelFile) throws IOException
    {
        NaiveBayesClassifier clf = NaiveBayesClassifier.load(modelFile);

        List<Instance> instances = Datasets.load(testFile);
        List<DocSample> x = new ArrayList<DocSample>(instances.size());
        List<DocClass> y = new ArrayList<DocClass>(instances.size());
        for (Instance instance : instances)
        {
            x.add(instance.sample);
            y.add(instance.label);
        }

        long start = System.currentTimeMillis();
        List<DocClass> predictions = clf.predict(x);
        double seconds = (System.currentTimeMillis() - start) / 1000.0;
        log.info(String.format("Predicted %d documents in %.02fs", instances.size(), seconds));

        for (int i = 0; i < instances.size(); ++i)
        {
            System.out.println(String.format("ID: %5d | Test: %10s | Pred: %10s",
                    instances.get(i).id, y.get(i), predictions.get(i)));
        }
        System.out.println();

        EvaluationReport report = new EvaluationReport(y, predictions);
        report.print(System.out);
        return report;
    }
}
