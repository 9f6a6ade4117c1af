package tech.yump.boundary.storage;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Result of a {@link SecretStore#health} probe.
 *
 * @param storeName short name of the store ("remote", "environment").
 * @param healthy   whether the store answered and is able to serve secrets.
 * @param detail    human-readable status, never containing secret material.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StoreHealth(String storeName, boolean healthy, String detail) {

    public static StoreHealth healthy(String storeName, String detail) {
        return new StoreHealth(storeName, true, detail);
    }

    public static StoreHealth unhealthy(String storeName, String detail) {
        return new StoreHealth(storeName, false, detail);
    }
}
