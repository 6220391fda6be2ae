/*
 * Where: Monitor web layer
 * What: Tags admin request logs with correlation fields and the ids in the request path
 * Why: Manual scans and resends must be traceable from the request to the job they enqueued
 */
package com.breachwatch.monitor.config;

import com.breachwatch.common.TraceIds;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.MDC;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;
import org.springframework.web.servlet.HandlerMapping;

@Component
public class RequestMdcInterceptor implements HandlerInterceptor {

  private static final String ATTRIBUTE_KEYS = RequestMdcInterceptor.class.getName() + ".MDC_KEYS";
  private static final String REQUEST_ID_HEADER = "X-Request-Id";
  private static final String FORWARDED_FOR_HEADER = "X-Forwarded-For";

  // admin path variables copied into the MDC under snake_case keys
  private static final Map<String, String> PATH_VARIABLE_KEYS =
      Map.of(
          "identityId", "identity_id",
          "breachEventId", "breach_event_id",
          "jobId", "job_id");

  @Override
  public boolean preHandle(
      HttpServletRequest request, HttpServletResponse response, Object handler) {
    final List<String> keys = new ArrayList<>();
    put(keys, "request_id", resolveRequestId(request));
    put(keys, "http_method", request.getMethod());
    put(keys, "http_path", request.getRequestURI());
    put(keys, "client_ip", resolveClientIp(request));
    if (request.getAttribute(HandlerMapping.URI_TEMPLATE_VARIABLES_ATTRIBUTE)
        instanceof Map<?, ?> variables) {
      PATH_VARIABLE_KEYS.forEach(
          (variable, key) -> {
            if (variables.get(variable) instanceof String value) {
              put(keys, key, value);
            }
          });
    }
    request.setAttribute(ATTRIBUTE_KEYS, keys);
    response.setHeader(REQUEST_ID_HEADER, MDC.get("request_id"));
    return true;
  }

  @Override
  public void afterCompletion(
      HttpServletRequest request,
      HttpServletResponse response,
      Object handler,
      @Nullable Exception ex) {
    if (request.getAttribute(ATTRIBUTE_KEYS) instanceof List<?> rawKeys) {
      rawKeys.stream().filter(String.class::isInstance).map(String.class::cast).forEach(MDC::remove);
    }
  }

  private String resolveRequestId(HttpServletRequest request) {
    return TraceIds.resolve(request.getHeader(REQUEST_ID_HEADER));
  }

  private String resolveClientIp(HttpServletRequest request) {
    final String forwardedFor = request.getHeader(FORWARDED_FOR_HEADER);
    if (isBlank(forwardedFor)) {
      return request.getRemoteAddr();
    }
    return forwardedFor.split(",", 2)[0].trim();
  }

  private void put(List<String> keys, String key, String value) {
    if (isBlank(value)) {
      return;
    }
    MDC.put(key, value);
    keys.add(key);
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
