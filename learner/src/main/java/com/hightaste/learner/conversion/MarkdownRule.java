package com.hightaste.learner.conversion;

/**
 * Header fields of a hand-written markdown rule: the first line (or first
 * {@code #} heading) is the title, {@code **ID**:} and {@code **Category**:}
 * lines carry the id and category. Missing fields are empty strings.
 */
public record MarkdownRule(String title, String id, String category) {

    private static final String ID_MARKER = "**ID**:";
    private static final String CATEGORY_MARKER = "**Category**:";

    public static MarkdownRule parse(String markdown) {
        String[] lines = markdown.strip().split("\n", -1);

        String title = "";
        if (lines.length > 0) {
            title = lines[0].startsWith("#")
                    ? lines[0].replaceFirst("^#+", "").strip()
                    : lines[0].strip();
        }

        return new MarkdownRule(title, field(lines, ID_MARKER), field(lines, CATEGORY_MARKER));
    }

    private static String field(String[] lines, String marker) {
        for (String line : lines) {
            if (line.startsWith(marker)) {
                return line.substring(marker.length()).strip();
            }
        }
        return "";
    }

    public boolean hasId() {
        return !id.isBlank();
    }
}
