package com.disease.coding.similarity;

/**
 * Default string processing applied before fuzzy scoring:
 * lower-cases, replaces every character that is not a letter or digit with a space,
 * and trims the result.
 */
public final class StringPreprocessor {

    private StringPreprocessor() {
        // utility class
    }

    public static String process(String s) {
        if (s == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder(s.length());
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            sb.append(Character.isLetterOrDigit(c) ? Character.toLowerCase(c) : ' ');
        }
        return sb.toString().trim();
    }
}
