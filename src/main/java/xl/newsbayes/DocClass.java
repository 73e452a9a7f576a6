package xl.newsbayes;

/**
 * Topic labels we classify Reuters stories into.  Anything outside the five
 * target topics collapses to {@link #OTHER}.
 */
public enum DocClass
{
    EARN("earn"),
    ACQ("acq"),
    MONEY_FX("money-fx"),
    GRAIN("grain"),
    CRUDE("crude"),
    OTHER("other");

    private final String key;

    DocClass(String key)
    {
        this.key = key;
    }

    /**
     * The lowercase name used in the SGML topic lists, dataset headers and model files
     */
    public String key()
    {
        return key;
    }

    /**
     * Map a topic name to its class.
     *
     * @param key A topic name such as {@code money-fx}
     * @return The matching class, or {@link #OTHER} for topics we don't model
     */
    public static DocClass fromTopic(String key)
    {
        for (DocClass docClass : values())
        {
            if (docClass.key.equals(key))
            {
                return docClass;
            }
        }
        return OTHER;
    }

    /**
     * Strict variant of {@link #fromTopic(String)} for our own file formats, where an unknown
     * key means the file is corrupt
     */
    public static DocClass fromKey(String key)
    {
        for (DocClass docClass : values())
        {
            if (docClass.key.equals(key))
            {
                return docClass;
            }
        }
        throw new IllegalArgumentException("Unknown class: " + key);
    }

    @Override
    public String toString()
    {
        return key;
    }
}
