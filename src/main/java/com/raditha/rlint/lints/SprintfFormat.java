package com.raditha.rlint.lints;

/**
 * What a {@code sprintf()} format string asks for.
 *
 * @param conversions   number of conversion specifications such as {@code %5.2f}
 * @param argumentsUsed arguments consumed, counting {@code *} widths and precisions
 * @param positional    whether any conversion names its argument, as in {@code %2$s}
 * @param maxPosition   highest argument position named
 * @param invalid       whether some {@code %} starts no valid conversion
 * @param literal       the string with every {@code %%} collapsed to {@code %}
 */
record SprintfFormat(int conversions, int argumentsUsed, boolean positional, int maxPosition, boolean invalid,
        String literal) {

    private static final String CONVERSIONS = "dioxXfeEgGaAs";
    private static final String FLAGS = "-+ #0";

    /**
     * Number of arguments the format needs after {@code fmt}.
     */
    int expectedArguments() {
        return positional ? maxPosition : argumentsUsed;
    }

    static SprintfFormat parse(String format) {
        int conversions = 0;
        int argumentsUsed = 0;
        boolean positional = false;
        int maxPosition = 0;
        boolean invalid = false;
        StringBuilder literal = new StringBuilder();

        int i = 0;
        int n = format.length();
        while (i < n) {
            char c = format.charAt(i);
            if (c != '%') {
                literal.append(c);
                i++;
                continue;
            }
            i++;
            while (i < n && Character.isWhitespace(format.charAt(i))) {
                i++;
            }
            if (i >= n) {
                invalid = true;
                break;
            }
            if (format.charAt(i) == '%') {
                literal.append('%');
                i++;
                continue;
            }

            int consumed = 1;
            int digits = skipDigits(format, i);
            if (digits > i && digits - i < 10 && digits < n && format.charAt(digits) == '$') {
                positional = true;
                maxPosition = Math.max(maxPosition, Integer.parseInt(format.substring(i, digits)));
                i = digits + 1;
            }
            while (i < n && FLAGS.indexOf(format.charAt(i)) >= 0) {
                i++;
            }
            if (i < n && format.charAt(i) == '*') {
                consumed++;
                i++;
            } else {
                i = skipDigits(format, i);
            }
            if (i < n && format.charAt(i) == '.') {
                i++;
                if (i < n && format.charAt(i) == '*') {
                    consumed++;
                    i++;
                } else {
                    i = skipDigits(format, i);
                }
            }
            if (i < n && CONVERSIONS.indexOf(format.charAt(i)) >= 0) {
                conversions++;
                argumentsUsed += consumed;
                i++;
            } else {
                invalid = true;
            }
        }
        return new SprintfFormat(conversions, argumentsUsed, positional, maxPosition, invalid, literal.toString());
    }

    private static int skipDigits(String text, int from) {
        int i = from;
        while (i < text.length() && text.charAt(i) >= '0' && text.charAt(i) <= '9') {
            i++;
        }
        return i;
    }
}
