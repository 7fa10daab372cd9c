package com.pbpreminder.bot.util;

import java.util.ArrayList;
import java.util.List;

public final class TextChunker {

    private TextChunker() {}

    public static List<String> splitByLines(String text, int maxLen) {
        List<String> out = new ArrayList<>();
        if (text == null) return out;
        if (text.length() <= maxLen) {
            out.add(text);
            return out;
        }
        StringBuilder pending = new StringBuilder();
        int start = 0;
        while (start <= text.length()) {
            int nl = text.indexOf('\n', start);
            int end = nl < 0 ? text.length() : nl;
            String line = text.substring(start, end);
            int needed = pending.length() == 0 ? line.length() : pending.length() + 1 + line.length();
            if (needed > maxLen) {
                flush(pending, out);
                int cut = 0;
                while (line.length() - cut > maxLen) {
                    out.add(line.substring(cut, cut + maxLen));
                    cut += maxLen;
                }
                line = line.substring(cut);
            }
            if (pending.length() > 0) pending.append('\n');
            pending.append(line);
            if (nl < 0) break;
            start = nl + 1;
        }
        flush(pending, out);
        return out;
    }

    private static void flush(StringBuilder pending, List<String> out) {
        if (pending.length() > 0) out.add(pending.toString());
        pending.setLength(0);
    }
}
