package tech.yump.boundary.storage;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only {@link SecretStore} over process environment variables, used only outside production.
 * <p>
 * A secret at {@code path}/{@code key} is read from {@code SECRET_{PATH}_{KEY}}, upper-cased, with every
 * character outside {@code [A-Z0-9]} replaced by {@code _}. For example {@code tenants/acme/db} and
 * {@code password} map to {@code SECRET_TENANTS_ACME_DB_PASSWORD}.
 */
@Slf4j
public class LocalFallbackStore implements SecretStore {

    public static final String STORE_NAME = "environment";
    static final String VARIABLE_PREFIX = "SECRET_";

    private final Map<String, String> variables;

    public LocalFallbackStore(Map<String, String> variables) {
        this.variables = Map.copyOf(variables);
    }

    public static LocalFallbackStore fromSystemEnvironment() {
        return new LocalFallbackStore(System.getenv());
    }

    @Override
    public Optional<String> get(String path, String key, Duration timeout) {
        return Optional.ofNullable(variables.get(variableName(path, key)))
                .filter(value -> !value.isEmpty());
    }

    @Override
    public void put(String path, String key, String value, Duration timeout) {
        throw new StorageException("Environment fallback store is read-only; cannot write '" + path + "/" + key + "'");
    }

    @Override
    public void delete(String path, String key, Duration timeout) {
        throw new StorageException("Environment fallback store is read-only; cannot delete '" + path + "/" + key + "'");
    }

    @Override
    public List<String> list(String path, Duration timeout) {
        String prefix = VARIABLE_PREFIX + normalize(path) + "_";
        return variables.keySet().stream()
                .filter(name -> name.startsWith(prefix) && name.length() > prefix.length())
                .map(name -> name.substring(prefix.length()).toLowerCase(Locale.ROOT))
                .sorted()
                .toList();
    }

    @Override
    public StoreHealth health(Duration timeout) {
        long count = variables.keySet().stream().filter(name -> name.startsWith(VARIABLE_PREFIX)).count();
        return StoreHealth.healthy(STORE_NAME, count + " secret variable(s) visible");
    }

    public static String variableName(String path, String key) {
        return VARIABLE_PREFIX + normalize(path) + "_" + normalize(key);
    }

    private static String normalize(String segment) {
        return segment.toUpperCase(Locale.ROOT).replaceAll("[^A-Z0-9]", "_");
    }
}
