package com.lmbridge.web;

import com.lmbridge.album.CacheStatusTracker;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Starts every request with an empty cache status and clears it afterwards.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class CacheStatusFilter extends OncePerRequestFilter {

    private final CacheStatusTracker tracker;

    public CacheStatusFilter(CacheStatusTracker tracker) {
        this.tracker = tracker;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        tracker.reset();
        try {
            chain.doFilter(request, response);
        } finally {
            tracker.reset();
        }
    }
}
