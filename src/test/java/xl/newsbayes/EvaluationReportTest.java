package xl.newsbayes;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static xl.newsbayes.DocClass.ACQ;
import static xl.newsbayes.DocClass.EARN;
import static xl.newsbayes.DocClass.GRAIN;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

public class EvaluationReportTest
{
    private static final List<DocClass> Y_TRUE = Arrays.asList(EARN, EARN, ACQ, GRAIN);
    private static final List<DocClass> Y_PRED = Arrays.asList(EARN, ACQ, ACQ, EARN);

    @TempDir
    Path tmp;

    @Test
    public void testScores()
    {
        EvaluationReport report = new EvaluationReport(Y_TRUE, Y_PRED);
        assertEquals(4, report.getNumDocuments());
        assertEquals(0.5, report.getAccuracy(), 0.0);
        assertEquals(0.5, report.getMicro().getF1(), 0.0);
        assertEquals(0.5, report.getMacro().getRecall(), 1e-12);
        assertEquals(Arrays.asList(EARN, ACQ, GRAIN), new ArrayList<DocClass>(report.getPerClass().keySet()));
        assertTrue(Double.isNaN(report.getPerClass().get(GRAIN).getPrecision()));
    }

    @Test
    public void testConfusion()
    {
        EvaluationReport report = new EvaluationReport(Y_TRUE, Y_PRED);
        assertEquals(Integer.valueOf(1), report.getConfusion().get(EARN).get(EARN));
        assertEquals(Integer.valueOf(1), report.getConfusion().get(EARN).get(ACQ));
        assertEquals(Integer.valueOf(1), report.getConfusion().get(ACQ).get(ACQ));
        assertEquals(Integer.valueOf(1), report.getConfusion().get(GRAIN).get(EARN));
        assertEquals(3, report.getConfusion().size());
    }

    @Test
    public void testPrint()
    {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        new EvaluationReport(Y_TRUE, Y_PRED).print(new PrintStream(bytes, true, StandardCharsets.UTF_8));
        List<String> lines = Arrays.asList(new String(bytes.toByteArray(), StandardCharsets.UTF_8).split("\\R"));

        String half = String.format("%.4f", 0.5);
        assertEquals("Micro Averaged Stats", lines.get(0));
        assertEquals("Precision:" + pad(half), lines.get(2));
        assertEquals("Recall:   " + pad(half), lines.get(3));
        assertEquals("F1 score: " + pad(half), lines.get(4));
        assertTrue(lines.contains("Macro Averaged Stats"));
        assertTrue(lines.contains("Unaveraged Stats"));
        assertTrue(lines.contains("earn:"));
        assertFalse(lines.contains("money-fx:"));
        assertTrue(lines.contains("    Precision: undefined"));
    }

    private static String pad(String value)
    {
        return String.format("%10s", value);
    }

    @Test
    public void testWriteJson() throws IOException
    {
        Path file = tmp.resolve("report.json");
        new EvaluationReport(Y_TRUE, Y_PRED).writeJson(file);

        JsonNode root = new ObjectMapper().readTree(file.toFile());
        assertEquals(4, root.get("numDocuments").asInt());
        assertEquals(0.5, root.get("accuracy").asDouble(), 0.0);
        assertEquals(0.5, root.get("micro").get("precision").asDouble(), 0.0);
        assertEquals(3, root.get("perClass").size());
        assertEquals(3, root.get("confusion").size());
    }
}
