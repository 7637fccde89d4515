package com.company.scheduler.util;

public final class HtmlEscaper {

    private HtmlEscaper() {
    }

    public static String escape(String value) {
        if (value == null) return "";
        StringBuilder out = new StringBuilder(value.length() + 16);
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '&' -> out.append("&amp;");
                case '<' -> out.append("&lt;");
                case '>' -> out.append("&gt;");
                case '"' -> out.append("&quot;");
                case '\'' -> out.append("&#039;");
                default -> out.append(c);
            }
        }
        return out.toString();
    }

    /**
     * Escapes and converts any line ending to a line break element.
     */
    public static String escapeWithLineBreaks(String value) {
        return escape(value)
                .replace("\r\n", "\n")
                .replace("\r", "\n")
                .replace("\n", "<br />");
    }
}
