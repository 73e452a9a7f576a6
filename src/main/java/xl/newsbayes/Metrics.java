package xl.newsbayes;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Precision, recall and F scores for single label, multi-class predictions.
 * <p>
 * Per-class values are reported for every class that shows up either as a true label or as a
 * prediction.  Precision of a class that was never predicted, and recall of a class that never
 * occurs in the truth, are undefined and come back as {@link Double#NaN}; macro averages skip them.
 * A class that is never predicted still gets an F score of 0 when it has true documents.
 * </p>
 */
public final class Metrics
{
    public enum Average { MICRO, MACRO, NONE }

    private static final int NUM_CLASSES = DocClass.values().length;

    private Metrics()
    {
    }

    /**
     * Diagonal, row and column totals of the confusion matrix
     */
    static final class Counts
    {
        final long[] truePositives = new long[NUM_CLASSES];
        final long[] predicted = new long[NUM_CLASSES];
        final long[] actual = new long[NUM_CLASSES];
        long correct;
        final int total;

        Counts(List<DocClass> yTrue, List<DocClass> yPred)
        {
            if (yTrue.size() != yPred.size())
            {
                throw new IllegalArgumentException("Got " + yTrue.size() + " true labels but "
                        + yPred.size() + " predictions");
            }
            if (yTrue.isEmpty())
            {
                throw new IllegalArgumentException("Nothing to evaluate");
            }
            total = yTrue.size();
            for (int i = 0; i < total; ++i)
            {
                int t = yTrue.get(i).ordinal();
                int p = yPred.get(i).ordinal();
                actual[t]++;
                predicted[p]++;
                if (t == p)
                {
                    truePositives[t]++;
                    correct++;
                }
            }
        }

        boolean observed(int c)
        {
            return actual[c] > 0 || predicted[c] > 0;
        }

        double precision(int c)
        {
            return predicted[c] == 0 ? Double.NaN : truePositives[c] / (double) predicted[c];
        }

        double recall(int c)
        {
            return actual[c] == 0 ? Double.NaN : truePositives[c] / (double) actual[c];
        }
    }

    /**
     * Weighted harmonic mean of precision and recall, (1 + b^2)PR / (b^2 P + R).
     * Gives back P itself when P == R, and 0 as soon as either side is 0, even if the other one is
     * undefined.  Only an undefined side with no zero to settle it makes the result undefined.
     */
    public static double fBeta(double precision, double recall, double beta)
    {
        if (precision == recall)
        {
            return precision;
        }
        if (precision == 0 || recall == 0)
        {
            return 0;
        }
        if (Double.isNaN(precision) || Double.isNaN(recall))
        {
            return Double.NaN;
        }
        double b2 = beta * beta;
        double denominator = b2 * precision + recall;
        if (denominator == 0)
        {
            return 0;
        }
        return (1 + b2) * precision * recall / denominator;
    }

    public static double fBeta(double precision, double recall)
    {
        return fBeta(precision, recall, 1);
    }

    /**
     * Fraction of predictions that match the truth
     */
    public static double accuracy(List<DocClass> yTrue, List<DocClass> yPred)
    {
        Counts counts = new Counts(yTrue, yPred);
        return counts.correct / (double) counts.total;
    }

    public static Map<DocClass, Double> precision(List<DocClass> yTrue, List<DocClass> yPred)
    {
        Counts counts = new Counts(yTrue, yPred);
        Map<DocClass, Double> out = new EnumMap<DocClass, Double>(DocClass.class);
        for (DocClass docClass : DocClass.values())
        {
            if (counts.observed(docClass.ordinal()))
            {
                out.put(docClass, counts.precision(docClass.ordinal()));
            }
        }
        return out;
    }

    public static Map<DocClass, Double> recall(List<DocClass> yTrue, List<DocClass> yPred)
    {
        Counts counts = new Counts(yTrue, yPred);
        Map<DocClass, Double> out = new EnumMap<DocClass, Double>(DocClass.class);
        for (DocClass docClass : DocClass.values())
        {
            if (counts.observed(docClass.ordinal()))
            {
                out.put(docClass, counts.recall(docClass.ordinal()));
            }
        }
        return out;
    }

    public static Map<DocClass, Double> fScore(List<DocClass> yTrue, List<DocClass> yPred, double beta)
    {
        Counts counts = new Counts(yTrue, yPred);
        Map<DocClass, Double> out = new EnumMap<DocClass, Double>(DocClass.class);
        for (DocClass docClass : DocClass.values())
        {
            int c = docClass.ordinal();
            if (counts.observed(c))
            {
                out.put(docClass, fBeta(counts.precision(c), counts.recall(c), beta));
            }
        }
        return out;
    }

    public static Map<DocClass, Double> fScore(List<DocClass> yTrue, List<DocClass> yPred)
    {
        return fScore(yTrue, yPred, 1);
    }

    /**
     * Averaged precision.  Micro averaging over single label predictions is plain accuracy.
     */
    public static double precision(Average average, List<DocClass> yTrue, List<DocClass> yPred)
    {
        switch (checkAveraged(average))
        {
            case MICRO:
                return accuracy(yTrue, yPred);
            default:
                return mean(precision(yTrue, yPred));
        }
    }

    public static double recall(Average average, List<DocClass> yTrue, List<DocClass> yPred)
    {
        switch (checkAveraged(average))
        {
            case MICRO:
                return accuracy(yTrue, yPred);
            default:
                return mean(recall(yTrue, yPred));
        }
    }

    public static double fScore(Average average, List<DocClass> yTrue, List<DocClass> yPred, double beta)
    {
        switch (checkAveraged(average))
        {
            case MICRO:
                return fBeta(precision(Average.MICRO, yTrue, yPred), recall(Average.MICRO, yTrue, yPred), beta);
            default:
                return mean(fScore(yTrue, yPred, beta));
        }
    }

    public static double fScore(Average average, List<DocClass> yTrue, List<DocClass> yPred)
    {
        return fScore(average, yTrue, yPred, 1);
    }

    private static Average checkAveraged(Average average)
    {
        if (average == Average.NONE)
        {
            throw new IllegalArgumentException("Use the per-class overload for unaveraged scores");
        }
        return average;
    }

    // Unweighted mean of the defined values
    private static double mean(Map<DocClass, Double> values)
    {
        double total = 0;
        int n = 0;
        for (double v : values.values())
        {
            if (!Double.isNaN(v))
            {
                total += v;
                n++;
            }
        }
        return n == 0 ? Double.NaN : total / n;
    }
}
