package org.calista.arasaka.tot.search;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * SearchLogFmt: рендер параметров и результатов поиска в "коробку" для логов и консоли.
 *
 * <p>Длинные значения переносятся по ширине, многострочный текст (цепочка рассуждений)
 * выводится построчно.</p>
 */
public final class SearchLogFmt {

    public static final int DEFAULT_MAX_WIDTH = 96;
    private static final String SEP = "\u0000--";

    private SearchLogFmt() {}

    public static String box(String title, Consumer<BoxBuilder> fill) {
        return box(title, DEFAULT_MAX_WIDTH, fill);
    }

    public static String box(String title, int maxWidth, Consumer<BoxBuilder> fill) {
        Objects.requireNonNull(title, "title");
        Objects.requireNonNull(fill, "fill");

        BoxBuilder b = new BoxBuilder(Math.max(24, maxWidth));
        fill.accept(b);
        return render(title, b.lines, b.maxWidth);
    }

    public static final class BoxBuilder {
        private final List<String> lines = new ArrayList<>(32);
        private final int maxWidth;

        private BoxBuilder(int maxWidth) {
            this.maxWidth = maxWidth;
        }

        public BoxBuilder kv(String key, Object value) {
            String k = (key == null) ? "" : key;
            wrapInto(k + ": " + oneLine(String.valueOf(value)), "  ");
            return this;
        }

        /** Multi-line text, each source line wrapped on its own. */
        public BoxBuilder text(String text) {
            if (text == null) return this;
            for (String l : text.split("\n", -1)) wrapInto(l, "");
            return this;
        }

        public BoxBuilder sep() {
            lines.add(SEP);
            return this;
        }

        private void wrapInto(String s, String indent) {
            int w = maxWidth - 2;
            if (s.length() <= w) {
                lines.add(s);
                return;
            }
            int i = 0;
            boolean first = true;
            while (i < s.length()) {
                String prefix = first ? "" : indent;
                int take = Math.min(s.length() - i, w - prefix.length());
                lines.add(prefix + s.substring(i, i + take));
                i += take;
                first = false;
            }
        }

        private static String oneLine(String s) {
            return s.replace('\r', ' ').replace('\n', ' ');
        }
    }

    private static String render(String title, List<String> lines, int maxWidth) {
        int contentWidth = title.length();
        for (String l : lines) {
            if (SEP.equals(l)) continue;
            contentWidth = Math.max(contentWidth, l.length());
        }
        int w = Math.min(Math.max(24, contentWidth + 2), maxWidth);

        StringBuilder out = new StringBuilder((lines.size() + 5) * (w + 8));
        out.append('┌').append("─".repeat(w)).append("┐\n");
        out.append("│ ").append(padRight(title, w - 1)).append("│\n");
        out.append('├').append("─".repeat(w)).append("┤\n");
        for (String l : lines) {
            if (SEP.equals(l)) {
                out.append('│').append("─".repeat(w)).append("│\n");
                continue;
            }
            out.append("│ ").append(padRight(l, w - 1)).append("│\n");
        }
        out.append('└').append("─".repeat(w)).append('┘');
        return out.toString();
    }

    private static String padRight(String s, int width) {
        if (s.length() >= width) return s;
        return s + " ".repeat(width - s.length());
    }
}
