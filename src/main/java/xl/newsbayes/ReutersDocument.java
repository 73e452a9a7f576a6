package xl.newsbayes;

import java.util.Collections;
import java.util.List;

/**
 * One story from a Reuters-21578 SGML file: its NEWID, which side of the ModLewis split it is on,
 * its topics and its raw text (title and body)
 */
public class ReutersDocument
{
    public enum Split { TRAIN, TEST, OTHER }

    final int id;
    final Split split;
    final List<DocClass> topics;
    final String text;

    public ReutersDocument(int id, Split split, List<DocClass> topics, String text)
    {
        this.id = id;
        this.split = split;
        this.topics = Collections.unmodifiableList(topics);
        this.text = text;
    }

    public int getId()
    {
        return id;
    }

    public Split getSplit()
    {
        return split;
    }

    public List<DocClass> getTopics()
    {
        return topics;
    }

    public String getText()
    {
        return text;
    }
}
