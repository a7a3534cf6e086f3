package com.ztverify.riskauth.config;

import jakarta.servlet.*;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Enumeration;

@Component
@Order(1)
public class RequestLoggingFilter implements Filter {

    private static final Logger log = LoggerFactory.getLogger(RequestLoggingFilter.class);

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {

        HttpServletRequest httpRequest = (HttpServletRequest) request;
        HttpServletResponse httpResponse = (HttpServletResponse) response;

        String method = httpRequest.getMethod();
        String uri = httpRequest.getRequestURI();

        log.info(">> {} {} from {}", method, uri, httpRequest.getRemoteAddr());
        if (log.isDebugEnabled()) {
            Enumeration<String> headerNames = httpRequest.getHeaderNames();
            while (headerNames.hasMoreElements()) {
                String headerName = headerNames.nextElement();
                String headerValue = headerName.toLowerCase().contains("authorization")
                        ? "Bearer ***" : httpRequest.getHeader(headerName);
                log.debug("   header {} = {}", headerName, headerValue);
            }
        }

        long startTime = System.currentTimeMillis();
        try {
            chain.doFilter(request, response);
            log.info("<< {} {} - {} in {}ms", method, uri, httpResponse.getStatus(), System.currentTimeMillis() - startTime);
        } catch (IOException | ServletException | RuntimeException e) {
            log.error("<< {} {} failed after {}ms: {}", method, uri, System.currentTimeMillis() - startTime, e.getMessage(), e);
            throw e;
        }
    }
}
