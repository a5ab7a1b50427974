package com.e2eq.conformance.turtle;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Isolates the Turtle body from raw transducer output. When the output holds a fenced block its
 * content is taken, otherwise stray fences are removed. Commentary before the first
 * {@code @prefix} line is dropped and the result is trimmed.
 */
public final class TurtleExtractor {

    private static final Pattern FENCED_BLOCK = Pattern.compile("```(?:turtle|ttl)?[ \\t]*\\r?\\n(.*?)```", Pattern.DOTALL);
    private static final Pattern FENCE = Pattern.compile("```(?:turtle|ttl)?\\s*");

    private TurtleExtractor() {}

    public static String extract(String raw) {
        if (raw == null) return "";
        Matcher block = FENCED_BLOCK.matcher(raw);
        String content = block.find() ? block.group(1) : FENCE.matcher(raw).replaceAll("");

        String[] lines = content.split("\n", -1);
        int start = 0;
        for (int i = 0; i < lines.length; i++) {
            if (lines[i].strip().startsWith("@prefix")) {
                start = i;
                break;
            }
        }
        StringBuilder sb = new StringBuilder();
        for (int i = start; i < lines.length; i++) {
            if (i > start) sb.append('\n');
            sb.append(lines[i]);
        }
        return sb.toString().strip();
    }
}
