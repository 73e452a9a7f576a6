package xl.newsbayes;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Everything we report about a test run, printable as text or dumpable as JSON
 */
public class EvaluationReport
{
    private static final int VALUE_WIDTH = 10;

    public static class Scores
    {
        private final double precision;
        private final double recall;
        private final double f1;

        Scores(double precision, double recall, double f1)
        {
            this.precision = precision;
            this.recall = recall;
            this.f1 = f1;
        }

        public double getPrecision()
        {
            return precision;
        }

        public double getRecall()
        {
            return recall;
        }

        public double getF1()
        {
            return f1;
        }
    }

    private final int numDocuments;
    private final double accuracy;
    private final Scores micro;
    private final Scores macro;
    private final Map<DocClass, Scores> perClass = new EnumMap<DocClass, Scores>(DocClass.class);
    // true class -> predicted class -> count
    private final Map<DocClass, Map<DocClass, Integer>> confusion = new EnumMap<DocClass, Map<DocClass, Integer>>(DocClass.class);

    public EvaluationReport(List<DocClass> yTrue, List<DocClass> yPred)
    {
        numDocuments = yTrue.size();
        accuracy = Metrics.accuracy(yTrue, yPred);
        micro = new Scores(Metrics.precision(Metrics.Average.MICRO, yTrue, yPred),
                Metrics.recall(Metrics.Average.MICRO, yTrue, yPred),
                Metrics.fScore(Metrics.Average.MICRO, yTrue, yPred));
        macro = new Scores(Metrics.precision(Metrics.Average.MACRO, yTrue, yPred),
                Metrics.recall(Metrics.Average.MACRO, yTrue, yPred),
                Metrics.fScore(Metrics.Average.MACRO, yTrue, yPred));

        Map<DocClass, Double> precision = Metrics.precision(yTrue, yPred);
        Map<DocClass, Double> recall = Metrics.recall(yTrue, yPred);
        Map<DocClass, Double> f1 = Metrics.fScore(yTrue, yPred);
        for (DocClass docClass : precision.keySet())
        {
            perClass.put(docClass, new Scores(precision.get(docClass), recall.get(docClass), f1.get(docClass)));
        }

        for (int i = 0; i < yTrue.size(); ++i)
        {
            Map<DocClass, Integer> row = confusion.get(yTrue.get(i));
            if (row == null)
            {
                row = new EnumMap<DocClass, Integer>(DocClass.class);
                confusion.put(yTrue.get(i), row);
            }
            row.merge(yPred.get(i), 1, Integer::sum);
        }
    }

    public int getNumDocuments()
    {
        return numDocuments;
    }

    public double getAccuracy()
    {
        return accuracy;
    }

    public Scores getMicro()
    {
        return micro;
    }

    public Scores getMacro()
    {
        return macro;
    }

    public Map<DocClass, Scores> getPerClass()
    {
        return perClass;
    }

    public Map<DocClass, Map<DocClass, Integer>> getConfusion()
    {
        return confusion;
    }

    public void print(PrintStream out)
    {
        out.println("Micro Averaged Stats");
        out.println("--------------------");
        printScores(out, "", micro);
        out.println();

        out.println("Macro Averaged Stats");
        out.println("--------------------");
        printScores(out, "", macro);
        out.println();

        out.println("Unaveraged Stats");
        out.println("----------------");
        for (Map.Entry<DocClass, Scores> entry : perClass.entrySet())
        {
            out.println(entry.getKey() + ":");
            printScores(out, "    ", entry.getValue());
        }
        out.flush();
    }

    private static void printScores(PrintStream out, String indent, Scores scores)
    {
        printAligned(out, indent, "Precision:", scores.precision);
        printAligned(out, indent, "Recall:", scores.recall);
        printAligned(out, indent, "F1 score:", scores.f1);
    }

    private static void printAligned(PrintStream out, String indent, String name, double value)
    {
        String formatted = Double.isNaN(value) ? "undefined" : String.format("%.4f", value);
        out.println(String.format("%s%-" + VALUE_WIDTH + "s%" + VALUE_WIDTH + "s", indent, name, formatted));
    }

    public void writeJson(Path file) throws IOException
    {
        ObjectMapper objectMapper = new ObjectMapper();
        objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        objectMapper.writeValue(file.toFile(), this);
    }
}
