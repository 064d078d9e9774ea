package sqlrunner.filter;

import io.micrometer.core.instrument.MeterRegistry;
import io.micronaut.context.annotation.Requires;
import io.micronaut.http.HttpRequest;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.HttpStatus;
import io.micronaut.http.MutableHttpResponse;
import io.micronaut.http.annotation.Filter;
import io.micronaut.http.filter.HttpServerFilter;
import io.micronaut.http.filter.ServerFilterChain;
import jakarta.annotation.PostConstruct;
import org.reactivestreams.Publisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import sqlrunner.config.RunnerProperties;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Limits concurrent statement and schema requests.
 * Returns 429 Too Many Requests when no permit frees up in time, and 504 when a request runs too long.
 */
@Filter({"/query/**", "/tables/**"})
@Requires(property = "runner.backpressure.enabled", value = "true", defaultValue = "true")
public class BackpressureFilter implements HttpServerFilter {

    private static final Logger LOG = LoggerFactory.getLogger(BackpressureFilter.class);
    private static final long ACQUIRE_TIMEOUT_MS = 100;

    private final RunnerProperties.BackpressureConfig config;
    private final MeterRegistry meterRegistry;
    private final Semaphore semaphore;
    private final AtomicInteger activeRequests = new AtomicInteger();
    private final AtomicInteger rejectedRequests = new AtomicInteger();

    public BackpressureFilter(RunnerProperties properties, MeterRegistry meterRegistry) {
        this.config = properties.getBackpressure();
        this.meterRegistry = meterRegistry;
        this.semaphore = new Semaphore(config.getMaxConcurrentRequests(), true);
        LOG.info("Backpressure filter initialized with max concurrent requests: {}",
                config.getMaxConcurrentRequests());
    }

    @PostConstruct
    void registerMetrics() {
        meterRegistry.gauge("runner.backpressure.active_requests", activeRequests);
        meterRegistry.gauge("runner.backpressure.available_permits", semaphore, Semaphore::availablePermits);
        meterRegistry.gauge("runner.backpressure.rejected_total", rejectedRequests);
    }

    @Override
    public Publisher<MutableHttpResponse<?>> doFilter(HttpRequest<?> request, ServerFilterChain chain) {
        boolean acquired;
        try {
            acquired = semaphore.tryAcquire(ACQUIRE_TIMEOUT_MS, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Mono.just(retryLater(HttpStatus.SERVICE_UNAVAILABLE, "Service Unavailable",
                    "Request interrupted"));
        }

        if (!acquired) {
            rejectedRequests.incrementAndGet();
            LOG.warn("Request rejected due to backpressure: {} {} (active={})",
                    request.getMethod(), request.getPath(), activeRequests.get());
            meterRegistry.counter("runner.backpressure.rejections").increment();
            return Mono.just(retryLater(HttpStatus.TOO_MANY_REQUESTS, "Too Many Requests",
                    "Too many requests, please retry later"));
        }

        activeRequests.incrementAndGet();
        return Mono.from(chain.proceed(request))
                .timeout(Duration.ofMillis(config.getRequestTimeoutMs()))
                .doFinally(signal -> {
                    semaphore.release();
                    activeRequests.decrementAndGet();
                })
                .onErrorResume(TimeoutException.class, e -> {
                    LOG.warn("Request timed out: {} {}", request.getMethod(), request.getPath());
                    meterRegistry.counter("runner.backpressure.timeouts").increment();
                    return Mono.just(errorResponse(HttpStatus.GATEWAY_TIMEOUT, "Request Timeout",
                            "Request processing took too long"));
                });
    }

    private static MutableHttpResponse<?> retryLater(HttpStatus status, String error, String message) {
        return HttpResponse.status(status)
                .header("Retry-After", "5")
                .body(Map.of(
                        "success", false,
                        "error", error,
                        "message", message));
    }

    private static MutableHttpResponse<?> errorResponse(HttpStatus status, String error, String message) {
        return HttpResponse.status(status).body(Map.of(
                "success", false,
                "error", error,
                "message", message));
    }

    @Override
    public int getOrder() {
        return -100;
    }
}
