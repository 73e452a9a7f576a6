package xl.newsbayes;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Undo the character references the Reuters SGML uses inside story text.  Each sequence is replaced
 * by the same number of characters: spaces followed by the decoded character, so token positions
 * are not shifted.
 */
public final class HtmlEntities
{
    private static final Map<String, Character> ENTITIES = new LinkedHashMap<String, Character>();

    static
    {
        ENTITIES.put("&#1;", ' ');
        ENTITIES.put("&#2;", ' ');
        ENTITIES.put("&#3;", ' ');
        ENTITIES.put("&#5;", (char) 5);
        ENTITIES.put("&#22;", ' ');
        ENTITIES.put("&#27;", ' ');
        ENTITIES.put("&#30;", (char) 30);
        ENTITIES.put("&#31;", (char) 31);
        ENTITIES.put("&#127;", ' ');
        ENTITIES.put("&amp;", '&');
        ENTITIES.put("&lt;", '<');
        ENTITIES.put("&gt;", '>');
    }

    private HtmlEntities()
    {
    }

    public static String convert(String text)
    {
        String result = text;
        for (Map.Entry<String, Character> entry : ENTITIES.entrySet())
        {
            String entity = entry.getKey();
            if (!result.contains(entity))
            {
                continue;
            }
            StringBuilder replacement = new StringBuilder(entity.length());
            for (int i = 0; i < entity.length() - 1; ++i)
            {
                replacement.append(' ');
            }
            replacement.append(entry.getValue().charValue());
            result = result.replace(entity, replacement);
        }
        return result;
    }
}
