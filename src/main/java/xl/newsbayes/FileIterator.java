package xl.newsbayes;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.StringTokenizer;

/**
 * Iterator that reads a dataset file and makes one labeled document available at a time.
 * Each document is a header line {@code id class}, followed by {@code term count} lines,
 * and ends at a blank line (or at the end of the file).
 */
public class FileIterator implements Iterator<Instance>, Closeable
{
    BufferedReader reader;
    Instance instance;
    int lineNumber = 0;

    public FileIterator(File file) throws IOException
    {
        this(Files.newBufferedReader(file.toPath(), StandardCharsets.UTF_8));
    }

    public FileIterator(Reader reader) throws IOException
    {
        this.reader = new BufferedReader(reader);
        try
        {
            advance();
        }
        catch (IOException | RuntimeException ex)
        {
            // nobody else holds the reader yet
            this.reader.close();
            throw ex;
        }
    }

    public boolean hasNext()
    {
        return instance != null;
    }

    public Instance next()
    {
        if (instance == null)
        {
            throw new NoSuchElementException();
        }
        Instance last = instance;
        try
        {
            advance();
        }
        catch (IOException ex)
        {
            throw new UncheckedIOException("Dataset error near line " + lineNumber, ex);
        }
        return last;
    }

    public int getLineNumber()
    {
        return lineNumber;
    }

    private void advance() throws IOException
    {
        String line = reader.readLine();
        ++lineNumber;
        // blank lines between documents
        while (line != null && line.isBlank())
        {
            line = reader.readLine();
            ++lineNumber;
        }
        if (line == null)
        {
            instance = null;
            return;
        }

        StringTokenizer header = new StringTokenizer(line);
        if (header.countTokens() != 2)
        {
            throw new IOException("Expected 'id class' on line " + lineNumber + ": " + line);
        }
        int id;
        DocClass label;
        try
        {
            id = Integer.parseInt(header.nextToken());
            label = DocClass.fromKey(header.nextToken());
        }
        catch (IllegalArgumentException ex)
        {
            throw new IOException("Bad document header on line " + lineNumber + ": " + line, ex);
        }

        DocSample sample = new DocSample();
        while ((line = reader.readLine()) != null)
        {
            ++lineNumber;
            if (line.isBlank())
            {
                break;
            }
            StringTokenizer fields = new StringTokenizer(line);
            if (fields.countTokens() != 2)
            {
                throw new IOException("Expected 'term count' on line " + lineNumber + ": " + line);
            }
            String term = fields.nextToken();
            try
            {
                sample.increment(term, Integer.parseInt(fields.nextToken()));
            }
            catch (IllegalArgumentException ex)
            {
                throw new IOException("Bad term count on line " + lineNumber + ": " + line, ex);
            }
        }
        instance = new Instance(id, label, sample);
    }

    @Override
    public void close() throws IOException
    {
        reader.close();
    }
}
