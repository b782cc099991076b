package com.example.docexport.client;

import com.example.docexport.aspect.LogExecutionTime;
import com.example.docexport.config.CacheConfig;
import com.example.docexport.config.RenderProperties;
import com.example.docexport.exception.ExternalServiceException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

@Slf4j
@Component
public class RestClientBlobFetcher implements BlobFetcher {

    private final RestClient restClient;

    public RestClientBlobFetcher(RenderProperties properties) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        int timeoutMillis = (int) properties.getFetchTimeout().toMillis();
        requestFactory.setConnectTimeout(timeoutMillis);
        requestFactory.setReadTimeout(timeoutMillis);
        this.restClient = RestClient.builder()
                .requestFactory(requestFactory)
                .build();
    }

    @Override
    @LogExecutionTime("Fetching Remote Resource")
    @Cacheable(value = CacheConfig.REMOTE_BLOBS, key = "#url")
    public byte[] get(String url) {
        if (url == null || url.isBlank()) {
            throw new ExternalServiceException("Cannot fetch an empty URL");
        }
        log.debug("Fetching remote resource: {}", url);
        try {
            byte[] body = restClient.get()
                    .uri(url)
                    .retrieve()
                    .body(byte[].class);
            if (body == null) {
                throw new ExternalServiceException("Empty response from " + url);
            }
            return body;
        } catch (RestClientException e) {
            log.warn("Failed to fetch {}: {}", url, e.getMessage());
            throw new ExternalServiceException("Failed to fetch " + url, e);
        }
    }
}
