package xl.newsbayes;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Pulls stories out of the Reuters-21578 {@code .sgm} files.  This is a tag scanner, not a real SGML
 * parser: it relies on every story starting with a {@code <REUTERS ...>} line and ending with
 * {@code </REUTERS>}, which holds for the whole collection.
 */
public final class ReutersParser
{
    static final String DOC_HEADER = "<REUTERS";
    static final String DOC_END = "</REUTERS>";
    static final String ID_FIELD = "NEWID=\"";
    static final String SPLIT_FIELD = "LEWISSPLIT=\"";
    static final String TOPICS_BEG = "<TOPICS>";
    static final String TOPICS_END = "</TOPICS>";
    static final String CLASS_BEG = "<D>";
    static final String CLASS_END = "</D>";
    static final String TITLE_BEG = "<TITLE>";
    static final String TITLE_END = "</TITLE>";
    static final String BODY_BEG = "<BODY>";
    static final String BODY_END = "</BODY>";

    private ReutersParser()
    {
    }

    // The collection is not valid UTF-8 everywhere, Latin-1 reads every byte
    public static List<ReutersDocument> parse(Path file) throws IOException
    {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.ISO_8859_1))
        {
            return parse(reader);
        }
    }

    public static List<ReutersDocument> parse(Reader in) throws IOException
    {
        List<ReutersDocument> docs = new ArrayList<ReutersDocument>();
        BufferedReader reader = new BufferedReader(in);
        StringBuilder block = null;
        String line;
        while ((line = reader.readLine()) != null)
        {
            if (block == null)
            {
                if (line.startsWith(DOC_HEADER))
                {
                    block = new StringBuilder(line).append('\n');
                }
                continue;
            }
            block.append(line).append('\n');
            if (line.contains(DOC_END))
            {
                docs.add(parseDocument(block.toString()));
                block = null;
            }
        }
        if (block != null)
        {
            throw new IOException("Unterminated document: " + block.substring(0, block.indexOf("\n")));
        }
        return docs;
    }

    static ReutersDocument parseDocument(String block) throws IOException
    {
        String header = block.substring(0, block.indexOf('\n'));
        String id = attribute(header, ID_FIELD);
        if (id == null)
        {
            throw new IOException("Document without NEWID: " + header);
        }
        int docId;
        try
        {
            docId = Integer.parseInt(id);
        }
        catch (NumberFormatException ex)
        {
            throw new IOException("Bad NEWID: " + header, ex);
        }

        String title = textBetween(block, TITLE_BEG, TITLE_END, docId);
        String body = textBetween(block, BODY_BEG, BODY_END, docId);
        String text = HtmlEntities.convert(title + "\n" + body);

        return new ReutersDocument(docId, split(attribute(header, SPLIT_FIELD)), topics(block, docId), text);
    }

    private static ReutersDocument.Split split(String value)
    {
        if ("TRAIN".equals(value))
        {
            return ReutersDocument.Split.TRAIN;
        }
        if ("TEST".equals(value))
        {
            return ReutersDocument.Split.TEST;
        }
        return ReutersDocument.Split.OTHER;
    }

    private static String attribute(String header, String field)
    {
        int beg = header.indexOf(field);
        if (beg < 0)
        {
            return null;
        }
        beg += field.length();
        int end = header.indexOf('"', beg);
        return end < 0 ? null : header.substring(beg, end);
    }

    private static List<DocClass> topics(String block, int docId) throws IOException
    {
        List<DocClass> topics = new ArrayList<DocClass>();
        String list = textBetween(block, TOPICS_BEG, TOPICS_END, docId);
        int beg = list.indexOf(CLASS_BEG);
        while (beg >= 0)
        {
            int end = list.indexOf(CLASS_END, beg);
            if (end < 0)
            {
                throw new IOException("Unclosed topic in document " + docId);
            }
            topics.add(DocClass.fromTopic(list.substring(beg + CLASS_BEG.length(), end)));
            beg = list.indexOf(CLASS_BEG, end);
        }
        return topics;
    }

    /**
     * Text between the first {@code beg} and the following {@code end}, or empty if {@code beg} is missing
     */
    static String textBetween(String text, String beg, String end, int docId) throws IOException
    {
        int begPos = text.indexOf(beg);
        if (begPos < 0)
        {
            return "";
        }
        begPos += beg.length();
        int endPos = text.indexOf(end, begPos);
        if (endPos < 0)
        {
            throw new IOException("Missing " + end + " in document " + docId);
        }
        return text.substring(begPos, endPos);
    }
}
