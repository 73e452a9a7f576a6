package xl.newsbayes;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

public class HtmlEntitiesTest
{
    @Test
    public void testConvert()
    {
        assertEquals("   <ACME   >", HtmlEntities.convert("&lt;ACME&gt;"));
        assertEquals("AT    &T", HtmlEntities.convert("AT&amp;T"));
        assertEquals("    text    ", HtmlEntities.convert("&#2;text&#3;"));
    }

    @Test
    public void testKeepsLength()
    {
        String raw = "&#1;&#5;&#22;&#27;&#30;&#31;&#127;";
        String converted = HtmlEntities.convert(raw);
        assertEquals(raw.length(), converted.length());
        assertEquals((char) 5, converted.charAt(7));
    }

    @Test
    public void testPlainTextUntouched()
    {
        assertEquals("no entities & here;", HtmlEntities.convert("no entities & here;"));
    }
}
