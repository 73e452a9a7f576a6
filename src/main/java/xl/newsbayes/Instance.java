package xl.newsbayes;

/**
 * Simple view of a single labeled document containing only
 * its id, its gold class and its normalized terms
 */
public class Instance
{
    final int id;
    final DocClass label;
    final DocSample sample;

    public Instance(int id, DocClass label, DocSample sample)
    {
        this.id = id;
        this.label = label;
        this.sample = sample;
    }

    public int getId()
    {
        return id;
    }

    public DocClass getLabel()
    {
        return label;
    }

    public DocSample getSample()
    {
        return sample;
    }
}
