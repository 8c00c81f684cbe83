package com.linelist.cleaner;

import java.io.IOException;
import java.util.UUID;

import org.slf4j.MDC;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

/**
 * Tags every log line of a request with a correlation id and, when the client names it, the
 * dataset being cleaned. The correlation id is echoed back in the response.
 */
@Component
@Order(1)
public class CleaningRunMdcFilter extends OncePerRequestFilter {

  static final String CORRELATION_ID_MDC_KEY = "correlationId";
  static final String CORRELATION_ID_HEADER = "X-Correlation-Id";
  static final String DATASET_MDC_KEY = "dataset";
  static final String DATASET_HEADER = "X-Dataset-Name";

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    try {
      String correlationId = request.getHeader(CORRELATION_ID_HEADER);
      if (correlationId == null || correlationId.isEmpty()) {
        correlationId = UUID.randomUUID().toString();
      }
      MDC.put(CORRELATION_ID_MDC_KEY, correlationId);
      response.setHeader(CORRELATION_ID_HEADER, correlationId);

      String dataset = request.getHeader(DATASET_HEADER);
      if (dataset != null && !dataset.isEmpty()) {
        MDC.put(DATASET_MDC_KEY, dataset);
      }

      filterChain.doFilter(request, response);
    } finally {
      MDC.remove(CORRELATION_ID_MDC_KEY);
      MDC.remove(DATASET_MDC_KEY);
    }
  }
}
