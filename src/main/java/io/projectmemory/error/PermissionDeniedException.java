package io.projectmemory.error;

/** Write attempted in read-only mode, or a destructive operation without the exact confirmation. */
public class PermissionDeniedException extends MemoryException {

    public PermissionDeniedException(String message) {
        super(ErrorKind.PERMISSION_DENIED, message);
    }
}
