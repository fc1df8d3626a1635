package com.example.tenantsync.client.external;

import com.example.tenantsync.entity.SyncCollection;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Client for the upstream tenant wrapper API (system of record).
 *
 * GET {base}/api/wrapper/tenants/{tenantId}{path} with the caller's bearer token;
 * the response envelope is {success, data}. The tenant record comes back as an object,
 * every other collection as an array.
 *
 * Must be called OUTSIDE @Transactional.
 */
@Component
@Slf4j
public class WrapperApiClient {

    static final String REQUEST_SOURCE_HEADER = "X-Request-Source";
    static final String REQUEST_SOURCE = "tenant-sync-service";

    private final WebClient wrapperWebClient;
    private final Duration timeout;

    public WrapperApiClient(@Qualifier("wrapperWebClient") WebClient wrapperWebClient,
                            @Value("${tenant-sync.wrapper-api.timeout:30s}") Duration timeout) {
        this.wrapperWebClient = wrapperWebClient;
        this.timeout = timeout;
    }

    /**
     * Fetch all records of one collection for a tenant.
     *
     * @return records as generic JSON maps, never null
     * @throws AuthenticationException on 401/403, not retried
     * @throws WrapperApiException on any other failure
     */
    @Retry(name = "wrapperApi")
    @CircuitBreaker(name = "wrapperApi")
    public List<Map<String, Object>> fetchCollection(String tenantId, String authToken, SyncCollection collection) {
        log.debug("Fetching {} for tenantId={}", collection.getCollectionName(), tenantId);

        Map<String, Object> response;
        try {
            response = wrapperWebClient.get()
                    .uri("/api/wrapper/tenants/{tenantId}" + collection.getUpstreamPath(), tenantId)
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + authToken)
                    .header(REQUEST_SOURCE_HEADER, REQUEST_SOURCE)
                    .accept(MediaType.APPLICATION_JSON)
                    .retrieve()
                    .onStatus(HttpStatusCode::is4xxClientError, clientResponse -> {
                        if (clientResponse.statusCode() == HttpStatus.UNAUTHORIZED
                                || clientResponse.statusCode() == HttpStatus.FORBIDDEN) {
                            log.error("Wrapper API rejected token ({}) for tenantId={}",
                                    clientResponse.statusCode().value(), tenantId);
                            return Mono.error(new AuthenticationException(
                                    "Wrapper API rejected credentials for tenant " + tenantId));
                        }
                        return clientResponse.createException();
                    })
                    .onStatus(HttpStatusCode::is5xxServerError, clientResponse -> {
                        log.error("Wrapper API server error: {}", clientResponse.statusCode());
                        return clientResponse.createException();
                    })
                    .bodyToMono(new ParameterizedTypeReference<Map<String, Object>>() {})
                    .timeout(timeout)
                    .block();
        } catch (AuthenticationException e) {
            throw e;
        } catch (Exception e) {
            log.error("Error fetching {} for tenantId={}: {}", collection.getCollectionName(), tenantId, e.getMessage());
            throw new WrapperApiException("Failed to fetch " + collection.getCollectionName()
                    + " for tenant " + tenantId + ": " + e.getMessage(), e);
        }

        return extractRecords(response, collection);
    }

    @SuppressWarnings("unchecked")
    static List<Map<String, Object>> extractRecords(Map<String, Object> response, SyncCollection collection) {
        if (response == null) {
            throw new WrapperApiException("Empty response for " + collection.getCollectionName(), null);
        }
        if (Boolean.FALSE.equals(response.get("success"))) {
            throw new WrapperApiException("Wrapper API reported failure for " + collection.getCollectionName()
                    + ": " + response.getOrDefault("message", "no message"), null);
        }

        Object data = response.get("data");
        if (data == null) {
            return List.of();
        }
        if (data instanceof List<?> list) {
            return list.stream()
                    .filter(Map.class::isInstance)
                    .map(item -> (Map<String, Object>) item)
                    .toList();
        }
        if (data instanceof Map<?, ?> single) {
            return List.of((Map<String, Object>) single);
        }
        throw new WrapperApiException("Unexpected payload type for " + collection.getCollectionName()
                + ": " + data.getClass().getSimpleName(), null);
    }

    /**
     * Exception for wrapper API failures other than authentication.
     */
    public static class WrapperApiException extends RuntimeException {
        public WrapperApiException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * Exception for rejected credentials. Retrying with the same token cannot succeed.
     */
    public static class AuthenticationException extends RuntimeException {
        public AuthenticationException(String message) {
            super(message);
        }
    }
}
