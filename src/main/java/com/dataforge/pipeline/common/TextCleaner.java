package com.dataforge.pipeline.common;

import java.text.Normalizer;
import java.util.List;
import java.util.regex.Pattern;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.NodeTraversor;
import org.jsoup.select.NodeVisitor;

/**
 * Pure per-cell cleaning chain. Stages always run in the same order: encoding repair, HTML stripping, unicode
 * normalization, control characters, whitespace, URLs, then custom patterns.
 */
final class TextCleaner {
    private static final Pattern INVISIBLE = Pattern.compile("[\\u200b\\u200c\\u200d\\ufeff\\u00ad]");
    private static final Pattern CONTROL = Pattern.compile("[\\x00-\\x08\\x0b\\x0c\\x0e-\\x1f\\x7f]");
    private static final Pattern HORIZONTAL_SPACE = Pattern.compile("[ \\t]+");
    private static final Pattern SPACE_AROUND_NEWLINE = Pattern.compile(" ?\\n ?");
    private static final Pattern EXCESS_NEWLINES = Pattern.compile("\\n{3,}");
    private static final Pattern HTTP_URL = Pattern.compile("https?://[^\\s<>\"']+");
    private static final Pattern WWW_URL = Pattern.compile("www\\.[^\\s<>\"']+");

    private final NoiseRemovalStep.Settings settings;
    private final List<Pattern> customPatterns;

    TextCleaner(NoiseRemovalStep.Settings settings, List<Pattern> customPatterns) {
        this.settings = settings;
        this.customPatterns = customPatterns;
    }

    Cleaned clean(String text) {
        String cleaned = text;
        boolean encodingFixed = false;
        boolean htmlStripped = false;

        if (settings.fixEncoding()) {
            String fixed = EncodingRepair.repair(cleaned);
            if (!fixed.equals(cleaned)) {
                encodingFixed = true;
                cleaned = fixed;
            }
        }
        if (settings.stripHtml() && cleaned.indexOf('<') >= 0 && cleaned.indexOf('>') >= 0) {
            String stripped = visibleText(cleaned);
            if (!stripped.equals(cleaned)) {
                htmlStripped = true;
                cleaned = stripped;
            }
        }
        if (settings.normalizeUnicode()) {
            cleaned = Normalizer.normalize(cleaned, Normalizer.Form.NFC);
            cleaned = INVISIBLE.matcher(cleaned).replaceAll("");
        }
        if (settings.removeControlChars()) {
            cleaned = CONTROL.matcher(cleaned).replaceAll("");
        }
        if (settings.normalizeWhitespace()) {
            cleaned = HORIZONTAL_SPACE.matcher(cleaned).replaceAll(" ");
            cleaned = SPACE_AROUND_NEWLINE.matcher(cleaned).replaceAll("\n");
            cleaned = EXCESS_NEWLINES.matcher(cleaned).replaceAll("\n\n");
            cleaned = cleaned.strip();
        }
        if (settings.stripUrls()) {
            cleaned = HTTP_URL.matcher(cleaned).replaceAll("");
            cleaned = WWW_URL.matcher(cleaned).replaceAll("");
        }
        for (Pattern pattern : customPatterns) {
            cleaned = pattern.matcher(cleaned).replaceAll("");
        }
        return new Cleaned(cleaned, encodingFixed, htmlStripped);
    }

    /**
     * Text content of an HTML fragment with the source's own line breaks kept. Block boundaries and {@code <br>}
     * become whitespace so adjacent blocks do not run together.
     */
    static String visibleText(String html) {
        StringBuilder out = new StringBuilder(html.length());
        int[] separatorEnd = { -1 };
        NodeTraversor.traverse(new NodeVisitor() {
            @Override
            public void head(Node node, int depth) {
                if (node instanceof TextNode textNode) {
                    out.append(textNode.getWholeText());
                } else if (node instanceof Element element && element.normalName().equals("br")) {
                    out.append('\n');
                } else if (node instanceof Element element && element.isBlock()) {
                    separate();
                }
            }

            @Override
            public void tail(Node node, int depth) {
                if (node instanceof Element element && element.isBlock()) {
                    separate();
                }
            }

            private void separate() {
                if (out.length() > 0 && !Character.isWhitespace(out.charAt(out.length() - 1))) {
                    out.append(' ');
                    separatorEnd[0] = out.length();
                }
            }
        }, Jsoup.parse(html));
        if (separatorEnd[0] == out.length()) {
            out.setLength(out.length() - 1);
        }
        return out.toString();
    }

    record Cleaned(String text, boolean encodingFixed, boolean htmlStripped) {
    }
}
