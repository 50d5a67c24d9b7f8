package se.artisan_be.streaming;

/**
 * Receives the step announcements of a multi-step write.
 */
@FunctionalInterface
public interface ProgressListener {

    ProgressListener NONE = message -> { };

    void progress(String message);
}
