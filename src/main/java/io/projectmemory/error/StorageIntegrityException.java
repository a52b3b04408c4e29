package io.projectmemory.error;

/**
 * The backing store is unreadable or failed its integrity check. Fatal for the running process
 * until an operator reinitializes the file or restores an export.
 */
public class StorageIntegrityException extends MemoryException {

    public StorageIntegrityException(String message) {
        super(ErrorKind.STORAGE_INTEGRITY, message);
    }

    public StorageIntegrityException(String message, Throwable cause) {
        super(ErrorKind.STORAGE_INTEGRITY, message, cause);
    }
}
