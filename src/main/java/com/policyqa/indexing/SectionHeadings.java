package com.policyqa.indexing;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Finds heading-like lines ("4.2 Waiting Period", "EXCLUSIONS") and their offsets within a page.
 */
final class SectionHeadings {

    private static final Pattern NUMBERED = Pattern.compile("^(?:section\\s+)?\\d+(?:\\.\\d+)*\\.?\\s+[A-Z][^.:;]{1,80}$",
        Pattern.CASE_INSENSITIVE);
    private static final Pattern UPPERCASE = Pattern.compile("^[A-Z][A-Z0-9 &/,'()-]{2,80}$");
    private static final int MAX_WORDS = 10;

    record Heading(int offset, String title) {}

    private SectionHeadings() {
    }

    static List<Heading> find(String pageText) {
        List<Heading> headings = new ArrayList<>();
        int offset = 0;
        for (String line : pageText.split("\n", -1)) {
            String trimmed = line.strip();
            if (isHeading(trimmed)) {
                headings.add(new Heading(offset, trimmed));
            }
            offset += line.length() + 1;
        }
        return headings;
    }

    static boolean isHeading(String line) {
        if (line.isEmpty() || line.split("\\s+").length > MAX_WORDS || line.endsWith(".")) {
            return false;
        }
        return NUMBERED.matcher(line).matches() || UPPERCASE.matcher(line).matches();
    }

    /**
     * Nearest heading at or before {@code position}, or null.
     */
    static String at(List<Heading> headings, int position) {
        String current = null;
        for (Heading heading : headings) {
            if (heading.offset() > position) {
                break;
            }
            current = heading.title();
        }
        return current;
    }
}
