package com.docloom.site;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HtmlStripperTest {

    @Test
    void shouldRemoveScriptStyleAndTagsAndDecodeAmpersand() {
        String html = """
                <html><head><title>Ignored head</title></head>
                <body class="main">
                  <script type="text/javascript">var secret = "<b>tracking</b>";</script>
                  <STYLE>.hidden { display: none; }</STYLE>
                  <h1>Fish &amp; Chips</h1>
                  <p>Served&nbsp;daily</p>
                </body></html>
                """;

        String text = HtmlStripper.strip(HtmlStripper.isolateBody(html));

        assertEquals("Fish & Chips Served daily", text);
        assertFalse(text.contains("<"));
        assertFalse(text.contains(">"));
        assertFalse(text.contains("secret"));
        assertFalse(text.contains("display"));
        assertFalse(text.contains("Ignored head"));
    }

    @Test
    void shouldDecodeAmpersandLast() {
        assertEquals("&lt; is literal, < is not", HtmlStripper.strip("&amp;lt; is literal, &lt; is not"));
    }

    @Test
    void shouldUseWholeDocumentWhenBodyIsMissingOrUnclosed() {
        assertEquals("<p>fragment</p>", HtmlStripper.isolateBody("<p>fragment</p>"));
        assertEquals("<body><p>open", HtmlStripper.isolateBody("<body><p>open"));
        assertTrue(HtmlStripper.isolateBody("<head></head><BODY>x</BODY>").startsWith("<BODY>"));
    }

    @Test
    void shouldCollapseWhitespaceRuns() {
        assertEquals("a b c", HtmlStripper.strip("  a\n\n\tb   <br/>  c  "));
    }
}
