package xl.newsbayes;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

public class ConstructDatasetsTest
{
    @TempDir
    Path tmp;

    private static String story(int id, String split, String topics, String title, String body)
    {
        return "<REUTERS TOPICS=\"YES\" LEWISSPLIT=\"" + split + "\" CGISPLIT=\"TRAINING-SET\" NEWID=\"" + id + "\">\n"
                + "<TOPICS>" + topics + "</TOPICS>\n"
                + "<TEXT><TITLE>" + title + "</TITLE>\n"
                + "<BODY>" + body + "</BODY></TEXT>\n"
                + "</REUTERS>\n";
    }

    private static ReutersDocument doc(DocClass... topics)
    {
        return new ReutersDocument(1, ReutersDocument.Split.TRAIN, Arrays.asList(topics), "");
    }

    @Test
    public void testSingleLabel()
    {
        assertEquals(DocClass.EARN, ConstructDatasets.singleLabel(doc(DocClass.EARN)));
        assertEquals(DocClass.GRAIN, ConstructDatasets.singleLabel(doc(DocClass.OTHER, DocClass.GRAIN, DocClass.OTHER)));
        assertNull(ConstructDatasets.singleLabel(doc()));
        assertNull(ConstructDatasets.singleLabel(doc(DocClass.OTHER)));
        assertNull(ConstructDatasets.singleLabel(doc(DocClass.GRAIN, DocClass.CRUDE)));
    }

    @Test
    public void testBuild() throws IOException
    {
        String first = "<!DOCTYPE lewis SYSTEM \"lewis.dtd\">\n"
                + story(1, "TRAIN", "<D>crude</D>", "OIL PRICES", "Oil prices rose, the oil minister said.")
                + story(2, "TEST", "<D>earn</D><D>cocoa</D>", "PROFIT UP", "Net profit was up.")
                + story(3, "TRAIN", "<D>grain</D><D>crude</D>", "WHEAT AND OIL", "Both moved.")
                + story(4, "NOT-USED", "<D>earn</D>", "IGNORED", "Never used.");
        String second = story(5, "TRAIN", "", "NO TOPICS", "Nothing here.")
                + story(6, "TRAIN", "<D>money-fx</D>", "YEN", "The yen fell.");
        Path a = tmp.resolve("reut2-000.sgm");
        Path b = tmp.resolve("reut2-001.sgm");
        Files.write(a, first.getBytes(StandardCharsets.ISO_8859_1));
        Files.write(b, second.getBytes(StandardCharsets.ISO_8859_1));

        Tokenizer tokenizer = new Tokenizer(Stopwords.of(Arrays.asList("the", "was")), new PorterWordStemmer());
        ConstructDatasets.Split split = ConstructDatasets.build(Datasets.listDataFiles(tmp), tokenizer);

        List<Instance> train = split.getTrain();
        assertEquals(2, train.size());
        assertEquals(1, train.get(0).getId());
        assertEquals(DocClass.CRUDE, train.get(0).getLabel());
        assertEquals(3, train.get(0).getSample().count("oil"));
        assertFalse(train.get(0).getSample().contains("the"));
        assertEquals(6, train.get(1).getId());
        assertEquals(DocClass.MONEY_FX, train.get(1).getLabel());

        List<Instance> test = split.getTest();
        assertEquals(1, test.size());
        assertEquals(2, test.get(0).getId());
        assertEquals(DocClass.EARN, test.get(0).getLabel());
        assertEquals(2, test.get(0).getSample().count("profit"));

        // only kept stories go through the tokenizer
        assertEquals(9 + 6 + 4, tokenizer.stats().getTotalUnnormalizedTokens());
    }

    @Test
    public void testBuildNothing() throws IOException
    {
        ConstructDatasets.Split split = ConstructDatasets.build(Collections.<Path>emptyList(), new Tokenizer());
        assertTrue(split.getTrain().isEmpty());
        assertTrue(split.getTest().isEmpty());
    }
}
