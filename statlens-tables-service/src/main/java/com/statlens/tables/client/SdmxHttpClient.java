package com.statlens.tables.client;

import com.statlens.tables.exception.RemoteServiceException;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

@Component
public class SdmxHttpClient {

    private static final Logger log = LoggerFactory.getLogger(SdmxHttpClient.class);

    private static final String JSON = "application/json";
    private static final String STRUCTURE_SPECIFIC_XML =
            "application/vnd.sdmx.structurespecificdata+xml;version=3.0.0, application/xml;q=0.9";

    @Value("${statlens.sdmx.base-url:https://api.imf.org/external/sdmx/3.0}")
    private String baseUrl;

    @Value("${statlens.sdmx.timeout-ms:30000}")
    private long timeoutMs;

    @Value("${statlens.sdmx.user-agent:StatLens/0.0.1}")
    private String userAgent;

    private HttpClient httpClient;

    @PostConstruct
    void init() {
        httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(timeoutMs))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    public String baseUrl() {
        return baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    public String getJson(String url) {
        return sendRequest(url, JSON);
    }

    public String getXml(String url) {
        return sendRequest(url, STRUCTURE_SPECIFIC_XML);
    }

    private String sendRequest(String url, String accept) {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(Duration.ofMillis(timeoutMs))
                .header("User-Agent", userAgent)
                .header("Accept", accept)
                .header("Cache-Control", "no-cache")
                .GET()
                .build();
        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                log.debug("SDMX response {} for {}", response.statusCode(), url);
                throw new RemoteServiceException("SDMX request failed with status " + response.statusCode(),
                        url, response.statusCode());
            }
            return response.body();
        } catch (IOException e) {
            log.warn("SDMX request failed: {}", e.getMessage());
            throw new RemoteServiceException("SDMX request failed: " + e.getMessage(), url, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RemoteServiceException("SDMX request interrupted", url, e);
        }
    }
}
