package io.github.sigwasm.core.dom;

import io.github.sigwasm.core.signal.SignalGetter;

import java.util.*;

/**
 * Renders an output tree to HTML, marking every keyed node with a {@code data-hk} attribute.
 */
public class HtmlRenderer {
    private static final Set<String> VOID_ELEMENTS = new HashSet<>(Arrays.asList(
            "area", "base", "br", "col", "embed", "hr", "img", "input", "link",
            "meta", "param", "source", "track", "wbr"
    ));
    private static final Set<String> BOOLEAN_ATTRIBUTES = new HashSet<>(Arrays.asList(
            "async", "autofocus", "autoplay", "checked", "controls", "default",
            "defer", "disabled", "formnovalidate", "hidden", "ismap", "loop",
            "multiple", "muted", "nomodule", "novalidate", "open", "playsinline",
            "readonly", "required", "reversed", "selected"
    ));

    /**
     * Render a tree to a string.
     *
     * @param root The tree.
     * @return The HTML.
     */
    public static String render(Object root) {
        StringBuilder sb = new StringBuilder();
        TreeWalker.walk(root, new TreeWalker.Visitor() {
            @Override
            public void visitElement(Element element, int key) {
                sb.append('<').append(element.getTag()).append(" data-hk=\"").append(key).append('"');
                renderProps(sb, element.getProps());
                sb.append(VOID_ELEMENTS.contains(element.getTag()) ? " />" : ">");
            }

            @Override
            public void visitElementEnd(Element element, int key) {
                if (!VOID_ELEMENTS.contains(element.getTag())) {
                    sb.append("</").append(element.getTag()).append('>');
                }
            }

            @Override
            public void visitShow(Show show, int key) {
                sb.append("<span data-hk=\"").append(key).append("\" data-show=\"true\"");
                if (!show.isInitialVisible()) sb.append(" style=\"display:none\"");
                sb.append('>');
            }

            @Override
            public void visitShowEnd(Show show, int key) {
                sb.append("</span>");
            }

            @Override
            public void visitLeaf(Object value, int parentKey) {
                renderLeaf(sb, value);
            }
        });
        return sb.toString();
    }

    private static void renderLeaf(StringBuilder sb, Object value) {
        if (value instanceof SignalGetter) {
            value = ((SignalGetter) value).value();
        }
        if (value instanceof CharSequence || value instanceof Character) {
            sb.append(escape(value.toString()));
        } else if (value instanceof Number) {
            sb.append(value);
        }
        // booleans and anything else render as nothing
    }

    private static void renderProps(StringBuilder sb, Map<String, Object> props) {
        for (Map.Entry<String, Object> entry : props.entrySet()) {
            String key = entry.getKey();
            Object value = entry.getValue();
            if (key.startsWith("on_") || key.equals("dark_mode")) continue;
            if (value instanceof SignalGetter) {
                value = ((SignalGetter) value).value();
            }
            if (BOOLEAN_ATTRIBUTES.contains(key)) {
                if (Boolean.TRUE.equals(value)) {
                    sb.append(' ').append(key);
                }
            } else if (key.equals("style") && value instanceof Map) {
                sb.append(" style=\"").append(escape(renderStyle((Map<?, ?>) value))).append('"');
            } else if (value != null && !Boolean.FALSE.equals(value)) {
                sb.append(' ').append(key.replace('_', '-'))
                        .append("=\"").append(escape(String.valueOf(value))).append('"');
            }
        }
    }

    private static String renderStyle(Map<?, ?> style) {
        StringJoiner sj = new StringJoiner("; ");
        for (Map.Entry<?, ?> entry : style.entrySet()) {
            String cssKey = String.valueOf(entry.getKey())
                    .replaceAll("([A-Z])", "-$1")
                    .toLowerCase(Locale.ROOT);
            sj.add(cssKey + ": " + entry.getValue());
        }
        return sj.toString();
    }

    /**
     * Escape HTML special characters.
     *
     * @param s The text.
     * @return The escaped text.
     */
    public static String escape(String s) {
        StringBuilder sb = new StringBuilder(s.length());
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '&':
                    sb.append("&amp;");
                    break;
                case '<':
                    sb.append("&lt;");
                    break;
                case '>':
                    sb.append("&gt;");
                    break;
                case '"':
                    sb.append("&quot;");
                    break;
                case '\'':
                    sb.append("&#39;");
                    break;
                default:
                    sb.append(c);
            }
        }
        return sb.toString();
    }
}
