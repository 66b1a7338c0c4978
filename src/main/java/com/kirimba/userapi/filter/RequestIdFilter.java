package com.kirimba.userapi.filter;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;

/**
 * Присваивает каждому запросу correlation id.
 * Берёт X-Request-ID клиента или генерирует UUID, кладёт его в MDC и в заголовок ответа.
 */
@Component
public class RequestIdFilter extends OncePerRequestFilter {

    public static final String REQUEST_ID_HEADER = "X-Request-ID";
    public static final String REQUEST_ID_MDC_KEY = "requestId";
    public static final String REQUEST_ID_ATTRIBUTE = RequestIdFilter.class.getName() + ".requestId";

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {

        String requestId = request.getHeader(REQUEST_ID_HEADER);
        if (requestId == null || requestId.isBlank()) {
            requestId = UUID.randomUUID().toString();
        }

        MDC.put(REQUEST_ID_MDC_KEY, requestId);
        request.setAttribute(REQUEST_ID_ATTRIBUTE, requestId);
        response.setHeader(REQUEST_ID_HEADER, requestId);

        try {
            chain.doFilter(request, response);
        } finally {
            // потоки сервлет-контейнера переиспользуются
            MDC.remove(REQUEST_ID_MDC_KEY);
        }
    }

    /**
     * Возвращает id текущего запроса: из атрибута запроса, иначе из MDC.
     */
    public static String currentRequestId(HttpServletRequest request) {
        Object attribute = request == null ? null : request.getAttribute(REQUEST_ID_ATTRIBUTE);
        if (attribute != null) {
            return attribute.toString();
        }
        String fromMdc = MDC.get(REQUEST_ID_MDC_KEY);
        return fromMdc == null ? "" : fromMdc;
    }
}
