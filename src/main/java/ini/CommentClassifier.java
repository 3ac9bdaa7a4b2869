package ini;

import org.apache.commons.lang3.ArrayUtils;

/**
 * Decides whether a line is a comment from its first non-whitespace character.
 */
@FunctionalInterface
public interface CommentClassifier {

    char DEFAULT_COMMENT = ';';

    CommentClassifier DEFAULT = first -> first == DEFAULT_COMMENT;

    boolean isComment(char first);

    /**
     * Classifier matching any of the given markers, e.g. {@code anyOf(';', '\'')} for Visual Basic style files.
     */
    static CommentClassifier anyOf(char... markers) {
        char[] copy = markers.clone();
        return first -> ArrayUtils.contains(copy, first);
    }
}
