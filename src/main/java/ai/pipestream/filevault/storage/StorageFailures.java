package ai.pipestream.filevault.storage;

import java.nio.file.FileSystemException;
import java.util.List;
import java.util.Locale;

/**
 * Classification of filesystem failures.
 * <p>
 * The JDK does not expose errno, so out-of-space detection first matches the operating system's
 * own message for ENOSPC / EDQUOT and only then falls back to a loose "disk" / "space" substring
 * match. For a {@link FileSystemException} only {@link FileSystemException#getReason()} is read,
 * never the file names in its message.
 * </p>
 */
public final class StorageFailures {

    private static final List<String> OUT_OF_SPACE_REASONS = List.of(
            "no space left on device",
            "disk quota exceeded",
            "not enough space on the disk",
            "there is not enough space");

    private static final List<String> LOOSE_HINTS = List.of("disk", "space");

    private StorageFailures() {
    }

    /**
     * Whether the failure, or any of its causes, reports an exhausted volume or quota.
     */
    public static boolean isOutOfSpace(Throwable failure) {
        for (Throwable current = failure; current != null; current = current.getCause()) {
            if (mentions(current, OUT_OF_SPACE_REASONS)) {
                return true;
            }
            if (current.getCause() == current) {
                break;
            }
        }
        for (Throwable current = failure; current != null; current = current.getCause()) {
            if (mentions(current, LOOSE_HINTS)) {
                return true;
            }
            if (current.getCause() == current) {
                break;
            }
        }
        return false;
    }

    private static boolean mentions(Throwable failure, List<String> phrases) {
        String text = lower(describedReason(failure));
        if (text.isEmpty()) {
            return false;
        }
        for (String phrase : phrases) {
            if (text.contains(phrase)) {
                return true;
            }
        }
        return false;
    }

    /**
     * The part of a failure that describes what went wrong, without file names.
     * A {@link FileSystemException} message embeds the file path, so only its reason counts.
     * A message copied from the cause is left to the cause.
     */
    private static String describedReason(Throwable failure) {
        if (failure instanceof FileSystemException) {
            return ((FileSystemException) failure).getReason();
        }
        Throwable cause = failure.getCause();
        String message = failure.getMessage();
        if (cause != null && message != null && message.equals(cause.toString())) {
            return null;
        }
        return message;
    }

    private static String lower(String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT);
    }
}
