package org.calista.qualia.io;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * LogFmt — рамка для сводок в логе (старт движка, итог прогона по корпусу).
 */
public final class LogFmt {

    private static final String SEP = "--";
    private static final int MIN_WIDTH = 24;

    private LogFmt() {}

    public static String box(String title, Consumer<BoxBuilder> fill) {
        Objects.requireNonNull(title, "title");
        Objects.requireNonNull(fill, "fill");

        BoxBuilder b = new BoxBuilder();
        fill.accept(b);
        return render(title, b.lines);
    }

    // ---------------- builder ----------------

    public static final class BoxBuilder {
        private final List<String> lines = new ArrayList<>(32);
        private int keyWidth = 0;

        /** Aligns keys of subsequent {@link #kv} lines to this width. */
        public BoxBuilder align(int width) {
            this.keyWidth = Math.max(0, width);
            return this;
        }

        public BoxBuilder kv(String key, Object value) {
            String k = key == null ? "" : key;
            if (k.length() < keyWidth) k = k + " ".repeat(keyWidth - k.length());
            lines.add(k + ": " + value);
            return this;
        }

        /** Formats with {@link Locale#ROOT} so decimals are stable across machines. */
        public BoxBuilder kvf(String key, String format, Object... args) {
            return kv(key, String.format(Locale.ROOT, format, args));
        }

        public BoxBuilder line(String text) {
            lines.add(text == null ? "" : text);
            return this;
        }

        public BoxBuilder sep() {
            lines.add(SEP);
            return this;
        }
    }

    // ---------------- rendering ----------------

    private static String render(String title, List<String> lines) {
        int content = title.length();
        for (String l : lines) {
            if (!SEP.equals(l)) content = Math.max(content, l.length());
        }
        int w = Math.max(MIN_WIDTH, content + 2);
        String bar = "─".repeat(w);

        StringBuilder out = new StringBuilder((lines.size() + 4) * (w + 4));
        out.append('┌').append(bar).append("┐\n");
        out.append("│ ").append(pad(title, w - 1)).append("│\n");
        out.append('├').append(bar).append("┤\n");
        for (String l : lines) {
            if (SEP.equals(l)) {
                out.append('│').append(bar).append("│\n");
            } else {
                out.append("│ ").append(pad(l, w - 1)).append("│\n");
            }
        }
        out.append('└').append(bar).append('┘');
        return out.toString();
    }

    private static String pad(String s, int width) {
        return s.length() >= width ? s : s + " ".repeat(width - s.length());
    }
}
