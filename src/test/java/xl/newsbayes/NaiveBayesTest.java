package xl.newsbayes;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.ParameterException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

public class NaiveBayesTest
{
    @TempDir
    Path tmp;

    private static Instance instance(int id, DocClass label, String... terms)
    {
        return new Instance(id, label, new DocSample(Arrays.asList(terms)));
    }

    private Path write(String name, List<Instance> instances) throws IOException
    {
        Path file = tmp.resolve(name);
        Datasets.save(file, instances);
        return file;
    }

    @Test
    public void testFitThenPredict() throws IOException
    {
        Path train = write("train.txt", Arrays.asList(
                instance(1, DocClass.EARN, "profit", "profit", "qtr"),
                instance(2, DocClass.EARN, "profit", "share"),
                instance(3, DocClass.GRAIN, "wheat", "wheat", "corn"),
                instance(4, DocClass.GRAIN, "wheat", "share")));
        Path test = write("test.txt", Arrays.asList(
                instance(10, DocClass.EARN, "profit"),
                instance(11, DocClass.GRAIN, "wheat", "corn")));
        Path model = tmp.resolve("model.txt");

        NaiveBayesClassifier clf = NaiveBayes.fit(train.toFile(), model, 0, null);
        assertTrue(Files.exists(model));
        assertEquals(5, clf.vocabularySize());

        EvaluationReport report = NaiveBayes.predict(test.toFile(), model);
        assertEquals(2, report.getNumDocuments());
        assertEquals(1.0, report.getAccuracy(), 0.0);
        assertEquals(1.0, report.getMacro().getF1(), 0.0);
    }

    @Test
    public void testFeatureSelection() throws IOException
    {
        Path train = write("train.txt", Arrays.asList(
                instance(1, DocClass.EARN, "profit", "said"),
                instance(2, DocClass.EARN, "profit", "said"),
                instance(3, DocClass.GRAIN, "wheat", "said"),
                instance(4, DocClass.GRAIN, "wheat", "said"),
                instance(5, DocClass.CRUDE, "oil", "said"),
                instance(6, DocClass.CRUDE, "oil", "said")));
        Path model = tmp.resolve("model.txt");
        Path features = tmp.resolve("features.json");

        NaiveBayesClassifier clf = NaiveBayes.fit(train.toFile(), model, 1, features);
        // "said" is everywhere, so it carries no information and gets pruned
        assertEquals(3, clf.vocabularySize());
        assertEquals(0.0, clf.likelihood("said", DocClass.EARN), 0.0);
        assertTrue(clf.likelihood("profit", DocClass.EARN) > 0);

        JsonNode root = new ObjectMapper().readTree(features.toFile());
        assertEquals(3, root.size());
        Set<String> selected = new HashSet<String>();
        for (JsonNode terms : root)
        {
            assertEquals(1, terms.size());
            selected.add(terms.get(0).asText());
        }
        assertEquals(new HashSet<String>(Arrays.asList("profit", "wheat", "oil")), selected);
    }

    @Test
    public void testNoFeaturesFileUnlessAsked() throws IOException
    {
        Path train = write("train.txt", Arrays.asList(
                instance(1, DocClass.EARN, "profit"),
                instance(2, DocClass.ACQ, "stake")));
        NaiveBayes.fit(train.toFile(), tmp.resolve("model.txt"), 1, null);
        assertFalse(Files.exists(tmp.resolve("features.json")));
    }

    @Test
    public void testNegativeFeatureCount() throws IOException
    {
        Path train = write("train.txt", Arrays.asList(instance(1, DocClass.EARN, "profit")));
        Path model = tmp.resolve("model.txt");
        assertThrows(IllegalArgumentException.class, () -> NaiveBayes.fit(train.toFile(), model, -1, null));
        assertFalse(Files.exists(model));
    }

    @Test
    public void testNegativeFeatureCountOnCommandLine()
    {
        NaiveBayes.Params params = new NaiveBayes.Params();
        new JCommander(params).parse("--model", "model.txt", "--num-features", "5");
        assertEquals(Integer.valueOf(5), params.numFeatures);

        assertThrows(ParameterException.class,
                () -> new JCommander(new NaiveBayes.Params()).parse("--model", "model.txt", "--num-features", "-1"));
    }

    @Test
    public void testPredictWithoutModel() throws IOException
    {
        Path test = write("test.txt", Arrays.asList(instance(10, DocClass.EARN, "profit")));
        assertThrows(IOException.class, () -> NaiveBayes.predict(test.toFile(), tmp.resolve("missing.txt")));
    }
}
