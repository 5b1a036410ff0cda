package com.phillippitts.tastemodel.service.health;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.Objects;

/**
 * Probes a liveness URL with a GET request; any 2xx answer counts as connected.
 */
public class HttpServingProbe implements ServingProbe {

    private static final Logger LOG = LogManager.getLogger(HttpServingProbe.class);

    private final RestClient client;
    private final String url;

    public HttpServingProbe(String url, long timeoutMs) {
        this.url = Objects.requireNonNull(url, "url");
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout((int) timeoutMs);
        factory.setReadTimeout((int) timeoutMs);
        this.client = RestClient.builder().requestFactory(factory).build();
    }

    @Override
    public boolean probe() {
        try {
            return client.get()
                    .uri(url)
                    .retrieve()
                    .toBodilessEntity()
                    .getStatusCode()
                    .is2xxSuccessful();
        } catch (RestClientException e) {
            LOG.debug("Probe of {} failed: {}", url, e.getMessage());
            return false;
        }
    }

    @Override
    public String toString() {
        return "HttpServingProbe[" + url + "]";
    }
}
