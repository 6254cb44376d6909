package com.docloom.site;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Mechanical markup removal ahead of model extraction. Not an HTML parser.
 */
public final class HtmlStripper {
    private static final Pattern BODY_OPEN = Pattern.compile("<body", Pattern.CASE_INSENSITIVE);
    private static final Pattern BODY_CLOSE = Pattern.compile("</body>", Pattern.CASE_INSENSITIVE);
    private static final Pattern SCRIPT = Pattern.compile("<script[^>]*>[\\s\\S]*?</script>", Pattern.CASE_INSENSITIVE);
    private static final Pattern STYLE = Pattern.compile("<style[^>]*>[\\s\\S]*?</style>", Pattern.CASE_INSENSITIVE);
    private static final Pattern TAG = Pattern.compile("<[^>]+>");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private HtmlStripper() {
    }

    /**
     * Returns the {@code <body>} element including its tags, or the whole document when either tag
     * is missing.
     */
    public static String isolateBody(String html) {
        Matcher open = BODY_OPEN.matcher(html);
        if (!open.find()) {
            return html;
        }
        Matcher close = BODY_CLOSE.matcher(html);
        if (!close.find(open.start())) {
            return html;
        }
        return html.substring(open.start(), close.end());
    }

    public static String strip(String html) {
        String text = SCRIPT.matcher(html).replaceAll("");
        text = STYLE.matcher(text).replaceAll("");
        text = TAG.matcher(text).replaceAll(" ");
        // &amp; last so "&amp;lt;" stays the literal "&lt;"
        text = text.replace("&nbsp;", " ")
                .replace("&lt;", "<")
                .replace("&gt;", ">")
                .replace("&amp;", "&");
        return WHITESPACE.matcher(text).replaceAll(" ").trim();
    }
}
