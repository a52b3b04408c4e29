package io.projectmemory.error;

/** A storage operation failed without evidence of corruption. The unit of work was rolled back. */
public class StorageException extends MemoryException {

    public StorageException(String message, Throwable cause) {
        super(ErrorKind.STORAGE_ERROR, message, cause);
    }
}
