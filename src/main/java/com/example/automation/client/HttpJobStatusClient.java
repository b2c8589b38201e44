package com.example.automation.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.hc.client5.http.classic.methods.HttpGet;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.util.Timeout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * 通过HTTP接口 {@code GET /api/v1/automations/{jobId}} 拉取任务状态
 */
public class HttpJobStatusClient implements JobStatusSource, Closeable {

    private static final Logger logger = LoggerFactory.getLogger(HttpJobStatusClient.class);

    private static final String STATUS_PATH = "/api/v1/automations/";

    private final CloseableHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String baseUrl;

    public HttpJobStatusClient(String baseUrl, int timeoutMs, ObjectMapper objectMapper) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.objectMapper = objectMapper;

        RequestConfig requestConfig = RequestConfig.custom()
                .setConnectTimeout(Timeout.ofMilliseconds(timeoutMs))
                .setResponseTimeout(Timeout.ofMilliseconds(timeoutMs))
                .build();
        this.httpClient = HttpClients.custom()
                .setDefaultRequestConfig(requestConfig)
                .build();
    }

    @Override
    public Optional<JobSnapshot> fetch(long jobId) {
        HttpGet httpGet = new HttpGet(baseUrl + STATUS_PATH + jobId);
        httpGet.setHeader("Accept", "application/json");

        try {
            return httpClient.execute(httpGet, response -> {
                int statusCode = response.getCode();
                if (statusCode == 404) {
                    EntityUtils.consume(response.getEntity());
                    logger.debug("Automation {} not found yet", jobId);
                    return Optional.<JobSnapshot>empty();
                }
                if (statusCode != 200) {
                    EntityUtils.consume(response.getEntity());
                    throw new StatusUnavailableException(
                            "Status query for automation " + jobId + " returned " + statusCode);
                }
                String body = EntityUtils.toString(response.getEntity(), StandardCharsets.UTF_8);
                return Optional.of(objectMapper.readValue(body, JobSnapshot.class));
            });
        } catch (IOException e) {
            throw new StatusUnavailableException("Status query for automation " + jobId + " failed", e);
        }
    }

    @Override
    public void close() throws IOException {
        httpClient.close();
    }
}
