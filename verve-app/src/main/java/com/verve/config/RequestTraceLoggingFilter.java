package com.verve.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.util.AntPathMatcher;
import org.springframework.util.MultiValueMap;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.UriComponentsBuilder;

import java.io.IOException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;
import java.util.stream.Collectors;

/**
 * 统一 HTTP 链路日志过滤器。
 * <p>
 * 不缓存响应体：SSE 与 DeferredResult 长轮询需要直写响应流。
 * 异步请求在首次分派返回时记录 outcome=async，长轮询不参与慢请求判定。
 * worker 接口额外把 workerId 放入 MDC，便于按 worker 检索日志。
 * </p>
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class RequestTraceLoggingFilter extends OncePerRequestFilter {

    private static final String HEADER_TRACE_ID = "X-Trace-Id";
    private static final String HEADER_REQUEST_ID = "X-Request-Id";
    private static final String HEADER_WORKER_ID = "X-Worker-Id";
    private static final String WORKER_PATH_PATTERN = "/api/v1/agent/**";
    private static final String MDC_TRACE_ID = "traceId";
    private static final String MDC_REQUEST_ID = "requestId";
    private static final String MDC_WORKER_ID = "workerId";

    private final ObservabilityHttpLogProperties properties;
    private final AntPathMatcher pathMatcher = new AntPathMatcher();

    public RequestTraceLoggingFilter(ObservabilityHttpLogProperties properties) {
        this.properties = properties;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        if (!properties.isEnabled()) {
            return true;
        }
        String path = pathOf(request);
        if (matchesAny(path, properties.getExcludePathPatterns())) {
            return true;
        }
        List<String> includes = properties.getIncludePathPatterns();
        return includes != null && !includes.isEmpty() && !matchesAny(path, includes);
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        String traceId = headerOrNewId(request, HEADER_TRACE_ID);
        String requestId = headerOrNewId(request, HEADER_REQUEST_ID);
        String path = pathOf(request);
        String method = request.getMethod();
        String workerId = pathMatcher.match(WORKER_PATH_PATTERN, path) ? resolveWorkerId(request) : null;

        response.setHeader(HEADER_TRACE_ID, traceId);
        response.setHeader(HEADER_REQUEST_ID, requestId);
        MDC.put(MDC_TRACE_ID, traceId);
        MDC.put(MDC_REQUEST_ID, requestId);
        if (workerId != null) {
            MDC.put(MDC_WORKER_ID, workerId);
        }

        boolean sampled = sample();
        if (sampled) {
            log.info("HTTP_IN method={}, path={}, query={}, workerId={}, clientIp={}",
                    method, path, maskedQuery(request.getQueryString()), StringUtils.defaultString(workerId, "-"),
                    clientIp(request));
        }
        long startNs = System.nanoTime();
        try {
            filterChain.doFilter(request, response);
            long costMs = elapsedMs(startNs);
            boolean async = request.isAsyncStarted();
            boolean slow = !async && costMs >= Math.max(properties.getSlowRequestThresholdMs(), 0L);
            if (slow) {
                log.warn("HTTP_OUT method={}, path={}, status={}, costMs={}, outcome=slow",
                        method, path, response.getStatus(), costMs);
            } else if (sampled) {
                log.info("HTTP_OUT method={}, path={}, status={}, costMs={}, outcome={}",
                        method, path, response.getStatus(), costMs, async ? "async" : "success");
            }
        } catch (IOException | ServletException | RuntimeException ex) {
            log.warn("HTTP_OUT method={}, path={}, status={}, costMs={}, outcome=error, errorType={}, errorMessage={}",
                    method, path, response.getStatus(), elapsedMs(startNs), ex.getClass().getSimpleName(),
                    StringUtils.abbreviate(ex.getMessage(), 200));
            throw ex;
        } finally {
            MDC.remove(MDC_WORKER_ID);
            MDC.remove(MDC_REQUEST_ID);
            MDC.remove(MDC_TRACE_ID);
        }
    }

    private String resolveWorkerId(HttpServletRequest request) {
        String fromQuery = StringUtils.trimToNull(request.getParameter(MDC_WORKER_ID));
        return fromQuery != null ? fromQuery : StringUtils.trimToNull(request.getHeader(HEADER_WORKER_ID));
    }

    private String maskedQuery(String queryString) {
        if (StringUtils.isBlank(queryString)) {
            return "-";
        }
        MultiValueMap<String, String> params = UriComponentsBuilder.newInstance()
                .query(queryString)
                .build()
                .getQueryParams();
        return params.entrySet().stream()
                .map(this::maskParam)
                .collect(Collectors.joining("&"));
    }

    private String maskParam(Map.Entry<String, List<String>> param) {
        String name = param.getKey();
        if (isMaskField(name)) {
            return name + "=***";
        }
        String value = param.getValue() == null ? "" : param.getValue().stream()
                .map(v -> StringUtils.abbreviate(StringUtils.defaultString(v), 80))
                .collect(Collectors.joining(","));
        return name + "=" + value;
    }

    private boolean isMaskField(String name) {
        List<String> maskFields = properties.getMaskFields();
        if (maskFields == null || StringUtils.isBlank(name)) {
            return false;
        }
        String normalized = name.toLowerCase(Locale.ROOT);
        return maskFields.stream().anyMatch(field -> normalized.contains(field.toLowerCase(Locale.ROOT)));
    }

    private boolean sample() {
        double rate = properties.getSampleRate();
        return rate >= 1D || (rate > 0D && ThreadLocalRandom.current().nextDouble() < rate);
    }

    private String clientIp(HttpServletRequest request) {
        String forwarded = StringUtils.substringBefore(request.getHeader("X-Forwarded-For"), ",");
        return StringUtils.isNotBlank(forwarded)
                ? forwarded.trim()
                : StringUtils.defaultIfBlank(request.getRemoteAddr(), "unknown");
    }

    private boolean matchesAny(String path, List<String> patterns) {
        return patterns != null && patterns.stream()
                .filter(StringUtils::isNotBlank)
                .anyMatch(pattern -> pathMatcher.match(pattern.trim(), path));
    }

    private static String headerOrNewId(HttpServletRequest request, String header) {
        String value = StringUtils.trimToNull(request.getHeader(header));
        return value != null ? value : UUID.randomUUID().toString().replace("-", "");
    }

    private static String pathOf(HttpServletRequest request) {
        return StringUtils.defaultIfBlank(request.getRequestURI(), "/").trim();
    }

    private static long elapsedMs(long startNs) {
        return (System.nanoTime() - startNs) / 1_000_000L;
    }
}
