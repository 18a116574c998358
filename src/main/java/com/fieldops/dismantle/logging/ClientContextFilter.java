package com.fieldops.dismantle.logging;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/** Puts the caller and room of an HTTP request into the logging context. */
@Component
public class ClientContextFilter extends OncePerRequestFilter {

    static final String CLIENT_HEADER = "X-Client-Id";
    static final String ROOM_HEADER   = "X-Room-Id";

    @Override
    protected void doFilterInternal(HttpServletRequest req,
                                    HttpServletResponse res,
                                    FilterChain chain)
            throws ServletException, IOException {

        try {
            String userId = req.getHeader(CLIENT_HEADER);
            String roomId = req.getHeader(ROOM_HEADER);

            if (userId != null) MDC.put("userId", userId);
            if (roomId != null) MDC.put("roomId", roomId);

            chain.doFilter(req, res);
        } finally {
            MDC.remove("userId");
            MDC.remove("roomId");
        }
    }
}
