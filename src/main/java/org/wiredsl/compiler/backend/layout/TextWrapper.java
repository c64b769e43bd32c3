package org.wiredsl.compiler.backend.layout;

import org.wiredsl.compiler.style.TextMetrics;

import java.util.ArrayList;
import java.util.List;

/**
 * Greedy word wrapping on an estimated fixed glyph width. Words longer than a line are hard-split.
 */
final class TextWrapper {

    private TextWrapper() {}

    /**
     * @param text     The text, may contain line breaks.
     * @param maxWidth The available line width in pixels.
     * @param fontSize The font size in pixels.
     * @return The wrapped lines; never empty.
     */
    static List<String> wrap(String text, double maxWidth, int fontSize) {
        double charWidth = fontSize * TextMetrics.CHAR_WIDTH_RATIO;
        double safeWidth = Math.max(maxWidth, charWidth);
        int maxChars = Math.max(1, (int) Math.floor(safeWidth / charWidth));
        List<String> lines = new ArrayList<>();

        for (String paragraph : text.replace("\r\n", "\n").split("\n", -1)) {
            if (paragraph.isBlank()) {
                lines.add("");
                continue;
            }
            StringBuilder current = new StringBuilder();
            for (String word : paragraph.trim().split("\\s+")) {
                int candidateLength = current.length() == 0 ? word.length() : current.length() + 1 + word.length();
                if (candidateLength <= maxChars) {
                    if (current.length() > 0) current.append(' ');
                    current.append(word);
                    continue;
                }
                if (current.length() > 0) {
                    lines.add(current.toString());
                    current.setLength(0);
                }
                if (word.length() <= maxChars) {
                    current.append(word);
                    continue;
                }
                for (int i = 0; i < word.length(); i += maxChars) {
                    lines.add(word.substring(i, Math.min(word.length(), i + maxChars)));
                }
            }
            if (current.length() > 0) {
                lines.add(current.toString());
            }
        }
        if (lines.isEmpty()) lines.add("");
        return lines;
    }
}
