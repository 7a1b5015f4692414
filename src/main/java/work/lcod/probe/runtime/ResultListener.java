package work.lcod.probe.runtime;

/**
 * Receives firings of an activated selector.
 */
@FunctionalInterface
public interface ResultListener {
    void onResult(ResultRecord record);

    /**
     * Called instead of {@link #onResult} when a firing cannot be assembled, e.g. on a
     * {@link CardinalityConflictException}. The engine has already logged the error.
     */
    default void onError(Throwable error) {
    }

    /**
     * Called once when the selector is deactivated.
     */
    default void onComplete() {
    }
}
