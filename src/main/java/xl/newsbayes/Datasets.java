package xl.newsbayes;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Reading, writing and locating the files that feed the classifier
 */
public final class Datasets
{
    public static final String SGM_EXTENSION = ".sgm";

    private Datasets()
    {
    }

    /**
     * All the Reuters {@code .sgm} files directly under a directory, sorted by name
     */
    public static List<Path> listDataFiles(Path dir) throws IOException
    {
        List<Path> files = new ArrayList<Path>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, "*" + SGM_EXTENSION))
        {
            for (Path file : stream)
            {
                if (Files.isRegularFile(file))
                {
                    files.add(file);
                }
            }
        }
        Collections.sort(files);
        return files;
    }

    /**
     * Write documents in the dataset format read by {@link FileIterator}
     */
    public static void write(Writer writer, List<Instance> instances) throws IOException
    {
        for (Instance instance : instances)
        {
            writer.write(instance.id + " " + instance.label.key() + "\n");
            for (Map.Entry<String, Integer> entry : instance.sample)
            {
                writer.write(entry.getKey() + " " + entry.getValue() + "\n");
            }
            writer.write("\n");
        }
        writer.flush();
    }

    public static void save(Path file, List<Instance> instances) throws IOException
    {
        try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8))
        {
            write(writer, instances);
        }
    }

    public static List<Instance> load(File file) throws IOException
    {
        List<Instance> instances = new ArrayList<Instance>();
        try (FileIterator iterator = new FileIterator(file))
        {
            while (iterator.hasNext())
            {
                instances.add(iterator.next());
            }
        }
        catch (UncheckedIOException ex)
        {
            throw ex.getCause();
        }
        return instances;
    }
}
