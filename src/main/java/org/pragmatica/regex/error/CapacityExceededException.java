package org.pragmatica.regex.error;

/**
 * Thrown when a label is longer than allowed, a node is asked to hold more children
 * than its capacity, or rule applications nest deeper than the configured bound.
 */
public final class CapacityExceededException extends RuntimeException {

    public CapacityExceededException(String message) {
        super(message);
    }

    public static CapacityExceededException labelTooLong(String label, int maxLength) {
        return new CapacityExceededException(
            "Label '" + label + "' has " + label.length() + " characters, at most " + maxLength + " allowed");
    }

    public static CapacityExceededException nestingTooDeep(int maxDepth) {
        return new CapacityExceededException(
            "Rule applications nested deeper than " + maxDepth + " levels");
    }

    public static CapacityExceededException tooManyChildren(String parentLabel, int maxChildren) {
        return new CapacityExceededException(
            "Node '" + parentLabel + "' already holds " + maxChildren + " children");
    }
}
