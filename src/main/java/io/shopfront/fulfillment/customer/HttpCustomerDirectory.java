package io.shopfront.fulfillment.customer;

import java.util.Optional;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import lombok.extern.slf4j.Slf4j;

/**
 * {@link CustomerDirectory} backed by the user service's REST API. Profiles are
 * cached in the {@code customers} cache.
 */
@Component
@Slf4j
public class HttpCustomerDirectory implements CustomerDirectory {
    private final RestClient restClient;

    public HttpCustomerDirectory(RestClient.Builder restClientBuilder,
            @Value("${app.customer-directory.base-url}") String baseUrl) {
        this.restClient = restClientBuilder.baseUrl(baseUrl).build();
    }

    /**
     * Fetches {@code GET /users/{userId}}. A missing user yields an empty result;
     * any other failure is logged and also yields an empty result so that order
     * views still render without the profile.
     */
    @Override
    @Cacheable(cacheNames = "customers", key = "#userId", unless = "#result == null")
    public Optional<CustomerProfile> findProfile(String userId) {
        if (userId == null || userId.isBlank()) {
            return Optional.empty();
        }

        log.debug("Fetching customer profile for user {}", userId);

        try {
            CustomerProfile profile = restClient.get()
                    .uri("/users/{userId}", userId)
                    .retrieve()
                    .body(CustomerProfile.class);

            return Optional.ofNullable(profile);
        } catch (RestClientResponseException e) {
            if (e.getStatusCode().isSameCodeAs(HttpStatus.NOT_FOUND)) {
                log.warn("Customer profile not found for user {}", userId);
            } else {
                log.error("Customer directory returned {} for user {}: {}", e.getStatusCode(), userId,
                        e.getMessage());
            }
            return Optional.empty();
        } catch (RestClientException e) {
            log.error("Customer directory unreachable while fetching user {}: {}", userId, e.getMessage(), e);
            return Optional.empty();
        }
    }
}
