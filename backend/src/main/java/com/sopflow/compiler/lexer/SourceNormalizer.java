package com.sopflow.compiler.lexer;

public class SourceNormalizer {

    private static final char BOM = '\uFEFF';

    private final int tabWidth;

    public SourceNormalizer(int tabWidth) {
        if (tabWidth <= 0) {
            throw new IllegalArgumentException("Tab width must be positive: " + tabWidth);
        }
        this.tabWidth = tabWidth;
    }

    public String normalize(String source) {
        if (source == null || source.isEmpty()) {
            return "";
        }

        String content = source;
        if (content.charAt(0) == BOM) {
            content = content.substring(1);
        }

        content = content
                .replace("\0", "")
                .replace("\r\n", "\n")
                .replace("\r", "\n");

        String[] lines = content.split("\n", -1);
        StringBuilder out = new StringBuilder(content.length());
        for (int i = 0; i < lines.length; i++) {
            if (i > 0) {
                out.append('\n');
            }
            out.append(stripTrailing(expandTabs(lines[i])));
        }
        return out.toString();
    }

    private String expandTabs(String line) {
        if (line.indexOf('\t') < 0) {
            return line;
        }
        StringBuilder sb = new StringBuilder(line.length() + tabWidth);
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == '\t') {
                int pad = tabWidth - (sb.length() % tabWidth);
                sb.append(" ".repeat(pad));
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    private static String stripTrailing(String line) {
        return line.stripTrailing();
    }
}
