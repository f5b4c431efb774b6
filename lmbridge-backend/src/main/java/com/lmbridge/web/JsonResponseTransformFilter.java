package com.lmbridge.web;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lmbridge.mitm.PayloadContext;
import com.lmbridge.mitm.PayloadTransformRegistry;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.ContentCachingResponseWrapper;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Passes JSON response bodies through the {@link PayloadTransformRegistry}.
 *
 * <p>Only {@code application/json} bodies are considered. Empty bodies, unparseable JSON and
 * unchanged payloads are written back byte for byte; so is the original body when a transform or
 * serialisation fails.
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 20)
public class JsonResponseTransformFilter extends OncePerRequestFilter {

    private final PayloadTransformRegistry registry;
    private final ObjectMapper objectMapper;

    public JsonResponseTransformFilter(PayloadTransformRegistry registry, ObjectMapper objectMapper) {
        this.registry = registry;
        this.objectMapper = objectMapper;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !registry.hasTransforms();
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        ContentCachingResponseWrapper wrapper = new ContentCachingResponseWrapper(response);
        try {
            chain.doFilter(request, wrapper);
            rewrite(request, wrapper);
        } finally {
            wrapper.copyBodyToResponse();
        }
    }

    private void rewrite(HttpServletRequest request, ContentCachingResponseWrapper wrapper) {
        if (!isJson(wrapper.getContentType())) {
            return;
        }
        byte[] body = wrapper.getContentAsByteArray();
        if (body.length == 0) {
            return;
        }

        JsonNode original;
        try {
            original = objectMapper.readTree(body);
        } catch (IOException e) {
            log.debug("LM-Bridge MITM: response body is not JSON, left unchanged");
            return;
        }
        if (original == null || original.isMissingNode()) {
            return;
        }

        try {
            JsonNode working = original.deepCopy();
            JsonNode result = registry.apply(working, contextOf(request));
            if (result == null || result.equals(original)) {
                return;
            }
            byte[] rewritten = objectMapper.writeValueAsBytes(result);
            wrapper.resetBuffer();
            wrapper.getOutputStream().write(rewritten);
            wrapper.setCharacterEncoding(StandardCharsets.UTF_8.name());
        } catch (Exception e) {
            log.error("LM-Bridge MITM: failed to rewrite response for {}", request.getRequestURI(), e);
            restore(wrapper, body);
        }
    }

    private static void restore(ContentCachingResponseWrapper wrapper, byte[] body) {
        try {
            wrapper.resetBuffer();
            wrapper.getOutputStream().write(body);
        } catch (IOException e) {
            log.error("LM-Bridge MITM: failed to restore original response body", e);
        }
    }

    static boolean isJson(String contentType) {
        if (contentType == null || contentType.isBlank()) {
            return false;
        }
        try {
            return MediaType.APPLICATION_JSON.isCompatibleWith(MediaType.parseMediaType(contentType));
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    static PayloadContext contextOf(HttpServletRequest request) {
        Map<String, List<String>> params = new LinkedHashMap<>();
        request.getParameterMap().forEach((k, v) -> params.put(k, Arrays.asList(v)));
        Map<String, String> headers = new LinkedHashMap<>();
        for (String name : Collections.list(request.getHeaderNames())) {
            headers.put(name, request.getHeader(name));
        }
        return PayloadContext.builder()
                .path(request.getRequestURI())
                .method(request.getMethod())
                .queryParams(params)
                .headers(headers)
                .build();
    }
}
