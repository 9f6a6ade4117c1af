package tech.yump.boundary.storage;

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.util.Assert;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.net.URI;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * {@link SecretStore} backed by a remote KV secrets service reached over HTTP.
 * <p>
 * Each path is stored remotely as one JSON object of string entries at {@code /v1/kv/data/{path}};
 * the secret key is an entry in that object. Requests authenticate with the {@value #TOKEN_HEADER} header.
 * Health is taken from {@code /sys/seal-status}: the store is healthy only when it answers and reports
 * {@code "sealed": false}.
 * <p>
 * Writes are read-modify-write on the path object, so concurrent writers to the same path race and the
 * last write wins.
 */
@Slf4j
public class RemoteHardenedStore implements SecretStore {

    public static final String STORE_NAME = "remote";
    public static final String TOKEN_HEADER = "X-Vault-Token";

    private static final String DATA_PREFIX = "/v1/kv/data/";
    private static final String SEAL_STATUS_PATH = "/sys/seal-status";
    private static final ParameterizedTypeReference<Map<String, String>> ENTRY_MAP = new ParameterizedTypeReference<>() {};
    private static final ParameterizedTypeReference<Map<String, Object>> STATUS_MAP = new ParameterizedTypeReference<>() {};

    private final Function<Duration, RestClient> clientFactory;
    // One client per distinct timeout; in practice a single configured timeout is used.
    private final Map<Duration, RestClient> clients = new ConcurrentHashMap<>();

    /**
     * Creates a store talking to {@code baseUrl} with the given access token.
     *
     * @param connectTimeout bound for establishing connections; read timeouts are taken per call.
     */
    public RemoteHardenedStore(URI baseUrl, String token, Duration connectTimeout) {
        this(forEndpoint(baseUrl, token, connectTimeout));
        log.info("RemoteHardenedStore configured for endpoint {}", baseUrl);
    }

    /**
     * Creates a store from a factory producing a {@link RestClient} bound to a given read timeout.
     */
    public RemoteHardenedStore(Function<Duration, RestClient> clientFactory) {
        this.clientFactory = clientFactory;
    }

    @Override
    public Optional<String> get(String path, String key, Duration timeout) {
        Assert.hasText(key, "Secret key must not be empty");
        return readEntries(path, timeout).map(entries -> entries.get(key));
    }

    @Override
    public void put(String path, String key, String value, Duration timeout) {
        Assert.hasText(key, "Secret key must not be empty");
        Assert.notNull(value, "Secret value must not be null");
        Map<String, String> entries = new HashMap<>(readEntries(path, timeout).orElseGet(Map::of));
        entries.put(key, value);
        writeEntries(path, entries, timeout);
        log.debug("Stored key '{}' at remote path '{}'", key, path);
    }

    @Override
    public void delete(String path, String key, Duration timeout) {
        Assert.hasText(key, "Secret key must not be empty");
        Optional<Map<String, String>> existing = readEntries(path, timeout);
        if (existing.isEmpty() || !existing.get().containsKey(key)) {
            log.debug("Delete of key '{}' at remote path '{}' is a no-op; key not present", key, path);
            return;
        }
        Map<String, String> remaining = new HashMap<>(existing.get());
        remaining.remove(key);
        if (remaining.isEmpty()) {
            try {
                client(timeout).delete().uri(DATA_PREFIX + path).retrieve().toBodilessEntity();
            } catch (RestClientException e) {
                throw new StorageException("Failed to delete remote path '" + path + "'", e);
            }
        } else {
            writeEntries(path, remaining, timeout);
        }
        log.debug("Deleted key '{}' at remote path '{}'", key, path);
    }

    @Override
    public List<String> list(String path, Duration timeout) {
        return readEntries(path, timeout)
                .map(entries -> entries.keySet().stream().sorted().toList())
                .orElseGet(List::of);
    }

    @Override
    public StoreHealth health(Duration timeout) {
        try {
            Map<String, Object> status = client(timeout).get()
                    .uri(SEAL_STATUS_PATH)
                    .accept(MediaType.APPLICATION_JSON)
                    .retrieve()
                    .body(STATUS_MAP);
            Object sealed = status != null ? status.get("sealed") : null;
            if (Boolean.FALSE.equals(sealed)) {
                return StoreHealth.healthy(STORE_NAME, "unsealed");
            }
            if (Boolean.TRUE.equals(sealed)) {
                return StoreHealth.unhealthy(STORE_NAME, "sealed");
            }
            return StoreHealth.unhealthy(STORE_NAME, "unexpected seal status response");
        } catch (RestClientException e) {
            log.warn("Remote secret store health check failed: {}", e.getMessage());
            return StoreHealth.unhealthy(STORE_NAME, "unreachable: " + e.getClass().getSimpleName());
        }
    }

    private Optional<Map<String, String>> readEntries(String path, Duration timeout) {
        Assert.hasText(path, "Secret path must not be empty");
        try {
            Map<String, String> entries = client(timeout).get()
                    .uri(DATA_PREFIX + path)
                    .accept(MediaType.APPLICATION_JSON)
                    .retrieve()
                    .body(ENTRY_MAP);
            return Optional.ofNullable(entries);
        } catch (HttpClientErrorException.NotFound e) {
            return Optional.empty();
        } catch (RestClientException e) {
            throw new StorageException("Failed to read remote path '" + path + "'", e);
        }
    }

    private void writeEntries(String path, Map<String, String> entries, Duration timeout) {
        try {
            client(timeout).put()
                    .uri(DATA_PREFIX + path)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(entries)
                    .retrieve()
                    .toBodilessEntity();
        } catch (RestClientException e) {
            throw new StorageException("Failed to write remote path '" + path + "'", e);
        }
    }

    private RestClient client(Duration timeout) {
        Assert.notNull(timeout, "Timeout must not be null");
        return clients.computeIfAbsent(timeout, clientFactory);
    }

    private static Function<Duration, RestClient> forEndpoint(URI baseUrl, String token, Duration connectTimeout) {
        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .build();
        RestClient.Builder prototype = RestClient.builder()
                .baseUrl(baseUrl.toString())
                .defaultHeader(TOKEN_HEADER, token);
        return readTimeout -> {
            JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
            requestFactory.setReadTimeout(readTimeout);
            return prototype.clone().requestFactory(requestFactory).build();
        };
    }
}
