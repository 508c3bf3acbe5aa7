package com.fitjourney.backend.common.web;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;
import java.util.regex.Pattern;

@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestIdFilter extends OncePerRequestFilter {

    public static final String HEADER = "X-Request-Id";
    public static final String ATTR = "requestId";
    public static final String MDC_KEY = "rid";

    private static final int MAX_LEN = 64;
    private static final Pattern SAFE = Pattern.compile("[A-Za-z0-9._-]+");

    @Override
    protected void doFilterInternal(HttpServletRequest req, HttpServletResponse res, FilterChain chain)
            throws ServletException, IOException {

        String rid = sanitize(req.getHeader(HEADER));
        if (rid == null) rid = UUID.randomUUID().toString();

        req.setAttribute(ATTR, rid);
        // log pattern 會印 %X{rid}，評估 log 才串得起同一個 request
        MDC.put(MDC_KEY, rid);
        res.setHeader(HEADER, rid);

        try {
            chain.doFilter(req, res);
        } finally {
            MDC.remove(MDC_KEY);
        }
    }

    /** client 帶來的 id 只收 [A-Za-z0-9._-]，最多 64 字，其餘一律重發 */
    static String sanitize(String raw) {
        if (raw == null) return null;
        String v = raw.trim();
        if (v.isEmpty() || v.length() > MAX_LEN || !SAFE.matcher(v).matches()) return null;
        return v;
    }

    public static String currentOrNull(HttpServletRequest req) {
        Object v = (req == null) ? null : req.getAttribute(ATTR);
        return (v == null) ? null : String.valueOf(v);
    }
}
