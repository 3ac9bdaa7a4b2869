package ini;

import org.apache.commons.lang3.StringUtils;

/**
 * Whitespace and replacement helpers shared by the parser, the interpolator and value extraction.
 * <p>
 * Whitespace is the "C" locale set ({@code ' '}, {@code \t}, {@code \n}, {@code \u000B}, {@code \f},
 * {@code \r}) regardless of the JVM default locale.
 */
final class IniText {

    static final String C_WHITESPACE = " \t\n\u000B\f\r";

    private IniText() {
    }

    static String trim(String s) {
        return StringUtils.strip(s, C_WHITESPACE);
    }

    static String ltrim(String s) {
        return StringUtils.stripStart(s, C_WHITESPACE);
    }

    static String rtrim(String s) {
        return StringUtils.stripEnd(s, C_WHITESPACE);
    }

    /**
     * Replaces every literal occurrence of {@code from}. Scanning resumes after the inserted text,
     * so a replacement containing {@code from} is not expanded again.
     *
     * @return the new text, or {@code null} when {@code from} does not occur
     */
    static String replaceAll(String text, String from, String to) {
        if (StringUtils.isEmpty(from) || !StringUtils.contains(text, from)) {
            return null;
        }
        return StringUtils.replace(text, from, to);
    }
}
