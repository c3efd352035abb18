package quest.gekko.bidopt.exception;

/** Settings or cooldown ledger backend failure. */
public class StorageException extends OptimizerException {
    public StorageException(String message, Throwable cause) {
        super(message, cause, ErrorCategory.STORAGE, 0, cause != null ? cause.getMessage() : null);
    }
}
