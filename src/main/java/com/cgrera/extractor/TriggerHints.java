package com.cgrera.extractor;

import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Shape of a trigger locator hint, shared by the extractor that writes hints and the browsing session that
 * resolves them.
 * <ul>
 *   <li>{@code #id}: element id.</li>
 *   <li>{@code tag.class1.class2}: tag carrying at least those classes, narrowed by the trigger's visible
 *   text.</li>
 *   <li>anything else: the trigger's visible text (or value, for button inputs).</li>
 * </ul>
 * A hint is not unique on its own; a trigger index picks the element among all matches in document order.
 */
final class TriggerHints {
    static final String TRIGGER_SELECTOR = "a, button, input[type=button], input[type=submit]";

    private static final Pattern CLASS_HINT = Pattern.compile("^[a-zA-Z][a-zA-Z0-9]*(\\.[\\w-]+)+$");

    private TriggerHints() {}

    static boolean isIdHint(String hint) {
        return hint != null && hint.startsWith("#") && hint.length() > 1;
    }

    static boolean isClassHint(String hint) {
        return hint != null && CLASS_HINT.matcher(hint).matches();
    }

    static String tag(String classHint) {
        return classHint.substring(0, classHint.indexOf('.'));
    }

    static List<String> classes(String classHint) {
        return Arrays.asList(classHint.substring(classHint.indexOf('.') + 1).split("\\."));
    }
}
