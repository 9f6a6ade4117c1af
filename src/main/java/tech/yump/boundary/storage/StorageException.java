package tech.yump.boundary.storage;

/**
 * Runtime exception raised by {@link SecretStore} implementations when the backing store cannot
 * complete an operation (transport failure, timeout, unexpected status, read-only store).
 */
public class StorageException extends RuntimeException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
