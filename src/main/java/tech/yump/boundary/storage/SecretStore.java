package tech.yump.boundary.storage;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Contract for the places secret values physically live.
 * <p>
 * Secrets are addressed by a logical {@code path} (for example {@code "tenants/acme/database"}) and a
 * {@code key} within that path. Implementations never cache values: every call reflects the current
 * state of the backing store. Every method takes an explicit timeout that bounds the call.
 */
public interface SecretStore {

    /**
     * Reads a single secret value.
     *
     * @param path    The logical path, without leading or trailing slashes. Must not be null or empty.
     * @param key     The key within the path. Must not be null or empty.
     * @param timeout Upper bound for the call.
     * @return The value if present, otherwise Optional.empty().
     * @throws StorageException If the store could not be reached or answered unexpectedly.
     */
    Optional<String> get(String path, String key, Duration timeout) throws StorageException;

    /**
     * Writes a secret value, overwriting any existing value for the same path and key.
     * Concurrent writers to the same path and key race; the last write wins.
     *
     * @throws StorageException If the write fails or the store does not accept writes.
     */
    void put(String path, String key, String value, Duration timeout) throws StorageException;

    /**
     * Deletes a secret value. Deleting a missing key is not an error.
     *
     * @throws StorageException If the delete fails or the store does not accept writes.
     */
    void delete(String path, String key, Duration timeout) throws StorageException;

    /**
     * Lists the keys stored under the given path.
     *
     * @return The key names, empty if the path holds nothing.
     * @throws StorageException If the store could not be reached.
     */
    List<String> list(String path, Duration timeout) throws StorageException;

    /**
     * Probes the store. Implementations report failures through the returned status rather than by throwing.
     */
    StoreHealth health(Duration timeout);
}
