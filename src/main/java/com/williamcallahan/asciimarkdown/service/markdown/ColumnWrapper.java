package com.williamcallahan.asciimarkdown.service.markdown;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Breaks a logical line into physical lines that fit a column budget.
 *
 * <p>Breaks prefer the last ASCII space that fits; the space itself is dropped. Text without a
 * usable space (CJK runs, long URLs) is broken between code points. A single code point wider
 * than the budget is placed on a line of its own.</p>
 *
 * <p>Text matching an optional zero-width pattern (debug markers) occupies no columns and is
 * never split.</p>
 */
final class ColumnWrapper {

    private static final int SPACE = ' ';

    private ColumnWrapper() {}

    /**
     * Wraps one line of text.
     *
     * @param line text without line terminators
     * @param maxColumns column budget, values below 1 are treated as 1
     * @return physical lines in order, never empty
     */
    static List<String> wrap(String line, int maxColumns) {
        return wrap(line, maxColumns, null);
    }

    /**
     * Wraps one line of text whose zero-width runs do not count against the budget.
     *
     * @param line text without line terminators
     * @param maxColumns column budget, values below 1 are treated as 1
     * @param zeroWidth pattern of runs that take no columns, or null
     * @return physical lines in order, never empty
     */
    static List<String> wrap(String line, int maxColumns, Pattern zeroWidth) {
        int budget = Math.max(1, maxColumns);
        if (visibleWidth(line, zeroWidth) <= budget) {
            return List.of(line);
        }

        Matcher marker = zeroWidth == null ? null : zeroWidth.matcher(line);
        List<String> lines = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        int currentWidth = 0;
        int lastSpace = -1;

        for (int index = 0; index < line.length(); ) {
            if (marker != null && marker.region(index, line.length()).lookingAt()) {
                current.append(marker.group());
                index = marker.end();
                continue;
            }
            int codePoint = line.codePointAt(index);
            index += Character.charCount(codePoint);
            int codePointWidth = DisplayWidth.of(codePoint);

            if (currentWidth + codePointWidth > budget && currentWidth > 0) {
                if (codePoint == SPACE) {
                    lines.add(stripTrailingSpaces(current));
                    current.setLength(0);
                    currentWidth = 0;
                    lastSpace = -1;
                    continue;
                }
                if (lastSpace > 0 && visibleWidth(current.substring(0, lastSpace), zeroWidth) > 0) {
                    lines.add(stripTrailingSpaces(current.substring(0, lastSpace)));
                    String carried = current.substring(lastSpace + 1);
                    current.setLength(0);
                    current.append(carried);
                    currentWidth = visibleWidth(carried, zeroWidth);
                    lastSpace = carried.lastIndexOf(SPACE);
                } else {
                    lines.add(current.toString());
                    current.setLength(0);
                    currentWidth = 0;
                    lastSpace = -1;
                }
                if (currentWidth + codePointWidth > budget && currentWidth > 0) {
                    lines.add(current.toString());
                    current.setLength(0);
                    currentWidth = 0;
                    lastSpace = -1;
                }
            }

            if (codePoint == SPACE) {
                if (currentWidth == 0 && !lines.isEmpty()) {
                    continue;
                }
                lastSpace = current.length();
            }
            current.appendCodePoint(codePoint);
            currentWidth += codePointWidth;
        }

        if (currentWidth > 0 || lines.isEmpty()) {
            lines.add(current.toString());
        } else if (current.length() > 0) {
            // trailing zero-width runs stay on the last line
            int last = lines.size() - 1;
            lines.set(last, lines.get(last) + current);
        }
        return lines;
    }

    /**
     * Display width of text, ignoring runs that match {@code zeroWidth}.
     */
    static int visibleWidth(String text, Pattern zeroWidth) {
        return DisplayWidth.of(zeroWidth == null ? text : zeroWidth.matcher(text).replaceAll(""));
    }

    private static String stripTrailingSpaces(CharSequence text) {
        int end = text.length();
        while (end > 0 && text.charAt(end - 1) == SPACE) {
            end--;
        }
        return text.subSequence(0, end).toString();
    }
}
