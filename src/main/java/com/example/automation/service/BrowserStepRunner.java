package com.example.automation.service;

import com.example.automation.config.ExecutorProperties;
import jakarta.annotation.PreDestroy;
import org.apache.hc.client5.http.classic.methods.HttpGet;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.util.Timeout;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.select.Elements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * 单个自动化步骤的执行器：打开页面并提取内容
 *
 * <p>使用HttpClient获取页面，使用Jsoup按CSS选择器提取文本；
 * 未指定选择器时提取页面标题。
 * </p>
 */
@Component
public class BrowserStepRunner {

    private static final Logger logger = LoggerFactory.getLogger(BrowserStepRunner.class);

    private final CloseableHttpClient httpClient;
    private final ExecutorProperties executorProperties;

    public BrowserStepRunner(ExecutorProperties executorProperties) {
        this.executorProperties = executorProperties;

        RequestConfig requestConfig = RequestConfig.custom()
                .setConnectTimeout(Timeout.ofMilliseconds(executorProperties.getConnectTimeoutMs()))
                .setResponseTimeout(Timeout.ofMilliseconds(executorProperties.getResponseTimeoutMs()))
                .build();
        this.httpClient = HttpClients.custom()
                .setDefaultRequestConfig(requestConfig)
                .setUserAgent(executorProperties.getUserAgent())
                .build();
    }

    /**
     * 打开页面并提取内容
     *
     * @param url 页面地址
     * @param selector CSS选择器，可为空
     * @return 提取到的文本
     * @throws IOException 如果请求失败或状态码不是200
     */
    public String navigateAndExtract(String url, String selector) throws IOException {
        HttpGet httpGet = new HttpGet(url);
        httpGet.setHeader("Accept", "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8");

        String html = httpClient.execute(httpGet, response -> {
            int statusCode = response.getCode();
            if (statusCode != 200) {
                throw new IOException("HTTP request failed with status code: " + statusCode);
            }
            return EntityUtils.toString(response.getEntity(), StandardCharsets.UTF_8);
        });

        Document doc = Jsoup.parse(html, url);
        String extracted;
        if (selector == null || selector.isBlank()) {
            extracted = doc.title();
        } else {
            Elements elements = doc.select(selector);
            if (elements.isEmpty()) {
                throw new IOException("No element matches selector '" + selector + "' on " + url);
            }
            extracted = elements.text();
        }
        logger.debug("Extracted {} chars from {}", extracted.length(), url);
        return truncate(extracted);
    }

    private String truncate(String text) {
        int max = executorProperties.getMaxExtractLength();
        return text.length() <= max ? text : text.substring(0, max);
    }

    @PreDestroy
    public void close() throws IOException {
        httpClient.close();
    }
}
