package sqlrunner.classifier;

import sqlrunner.model.ClassifiedStatement;

/**
 * Assigns a category to raw SQL text.
 * Implementations must be pure: the same text always yields the same result.
 */
public interface StatementClassifier {

    /**
     * Normalizes and classifies a statement. Never fails; unrecognized text maps to OTHER.
     *
     * @param sql raw statement text, may be null
     * @return the classified statement
     */
    ClassifiedStatement classify(String sql);
}
