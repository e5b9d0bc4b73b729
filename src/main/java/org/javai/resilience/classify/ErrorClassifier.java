package org.javai.resilience.classify;

import org.javai.resilience.ClassifiedError;

import java.util.List;

/**
 * Normalises arbitrary failures into {@link ClassifiedError}s.
 * Implementations must be deterministic and must never throw.
 */
@FunctionalInterface
public interface ErrorClassifier {

    /**
     * Classifies a failure.
     *
     * @param failure The failure that occurred; returned unchanged if already classified
     * @param context What the caller knows about the failed operation
     * @return A classified error, never null
     */
    ClassifiedError classify(Throwable failure, ClassificationContext context);

    default ClassifiedError classify(Throwable failure) {
        return classify(failure, ClassificationContext.empty());
    }

    /**
     * Names of the external dependencies this classifier recognises. None by default.
     */
    default List<String> dependencies() {
        return List.of();
    }
}
