package com.phillippitts.audiolink.config.web;

import com.phillippitts.audiolink.exception.InvalidRequestException;
import com.phillippitts.audiolink.exception.RequestTooLargeException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Rejects request bodies by their declared length before Spring MVC binds them.
 *
 * <p>Runs after handler mapping and before argument resolution, so a breach never reaches the
 * message converters and is rendered by the global exception handler. Bodies without a declared
 * length are refused.
 */
class RequestSizeInterceptor implements HandlerInterceptor {

    private final long maxBytes;

    RequestSizeInterceptor(long maxBytes) {
        this.maxBytes = maxBytes;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        if (!"POST".equals(request.getMethod())) {
            return true;
        }
        long length = request.getContentLengthLong();
        if (length < 0) {
            throw new InvalidRequestException("Content-Length header is required.");
        }
        if (length > maxBytes) {
            throw new RequestTooLargeException(length, maxBytes);
        }
        return true;
    }
}
