package com.phillippitts.servicelog.logging;

import java.util.Arrays;
import java.util.IllegalFormatException;
import java.util.Locale;
import java.util.StringJoiner;

/**
 * printf-style message expansion that never throws, neither for a bad template nor for an
 * argument whose {@code toString()} fails.
 */
final class MessageFormatter {

    private MessageFormatter() {
    }

    /**
     * Formats {@code template} with {@code args}.
     *
     * <p>With no arguments the template is returned verbatim. If the template does not fit the
     * arguments, the template is returned followed by the argument list. If rendering an
     * argument throws, the template is returned followed by the argument class names and the
     * failure; the failing argument is not rendered again.
     */
    static String format(String template, Object... args) {
        String safeTemplate = template == null ? "null" : template;
        if (args == null || args.length == 0) {
            return safeTemplate;
        }
        try {
            return String.format(Locale.ROOT, safeTemplate, args);
        } catch (IllegalFormatException e) {
            return safeTemplate + " " + renderArguments(args);
        } catch (RuntimeException e) {
            return safeTemplate + " " + describeArguments(args, e);
        }
    }

    private static String renderArguments(Object[] args) {
        try {
            return Arrays.toString(args);
        } catch (RuntimeException e) {
            return describeArguments(args, e);
        }
    }

    private static String describeArguments(Object[] args, RuntimeException failure) {
        StringJoiner types = new StringJoiner(", ", "[", "]");
        for (Object arg : args) {
            types.add(arg == null ? "null" : arg.getClass().getName());
        }
        return types + " (" + failure.getClass().getSimpleName() + ": " + failure.getMessage() + ")";
    }
}
