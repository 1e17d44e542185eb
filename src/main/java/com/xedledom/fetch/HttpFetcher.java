package com.xedledom.fetch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * GET client shared by the API resolver, the page fallback and the thumbnail downloader.
 *
 * <p>{@link #fetch} retries up to {@link FetchPolicy#maxAttempts()} times. A 429 trips the
 * host cooldown in {@link HostThrottle}, which every later request to that host waits
 * out; any other failure (non-200, timeout, I/O error) is followed by a short random
 * backoff. There is no pause after the last attempt. When every attempt failed the last
 * outcome is thrown as {@link FetchException}. The timeout bounds the whole exchange,
 * body included.
 */
public class HttpFetcher {

    private static final Logger log = LoggerFactory.getLogger(HttpFetcher.class);

    private final HttpClient http;
    private final String userAgent;
    private final HostThrottle throttle;
    private final FetchPolicy policy;
    private final Sleeper sleeper;

    public HttpFetcher(HttpClient http, String userAgent, HostThrottle throttle, FetchPolicy policy, Sleeper sleeper) {
        this.http = http;
        this.userAgent = userAgent;
        this.throttle = throttle;
        this.policy = policy == null ? FetchPolicy.DEFAULT : policy;
        this.sleeper = sleeper == null ? Sleeper.SYSTEM : sleeper;
    }

    public HttpFetcher(HttpClient http, String userAgent, HostThrottle throttle, FetchPolicy policy) {
        this(http, userAgent, throttle, policy, Sleeper.SYSTEM);
    }

    public FetchResult fetch(String url, Duration timeout) throws FetchException, InterruptedException {
        URI uri = toUri(url);
        String host = uri.getHost();

        FetchResult last = null;
        Exception lastError = null;
        int attempt = 0;
        while (attempt < policy.maxAttempts()) {
            attempt++;
            throttle.awaitTurn(host);
            Attempt outcome = send(uri, timeout);
            last = outcome.result();
            if (outcome.error() != null) {
                lastError = outcome.error();
            }

            boolean finalAttempt = attempt >= policy.maxAttempts();
            switch (last.status()) {
                case SUCCESS -> {
                    return last;
                }
                case RATE_LIMITED -> {
                    log.warn("Rate limited (429) on {}. Pausing {}s before further requests to {}",
                            url, throttle.getCooldown().toSeconds(), host);
                    throttle.tripCooldown(host);
                }
                case TIMEOUT -> {
                    log.warn("Timeout after {}s on {} (attempt {}/{})", timeout.toSeconds(), url, attempt, policy.maxAttempts());
                    if (!finalAttempt) backoff();
                }
                case NETWORK_ERROR -> {
                    log.warn("Network error on {} (attempt {}/{}): {}", url, attempt, policy.maxAttempts(),
                            outcome.error() == null ? "unknown" : outcome.error().getMessage());
                    if (!finalAttempt) backoff();
                }
                default -> {
                    log.warn("HTTP {} for {} (attempt {}/{})", last.statusCode(), url, attempt, policy.maxAttempts());
                    if (!finalAttempt) backoff();
                }
            }
        }

        String reason = last.statusCode() > 0 ? "HTTP " + last.statusCode() : last.status().name().toLowerCase();
        throw new FetchException("Failed to GET " + url + " after " + attempt + " attempts (" + reason + ")", last, lastError);
    }

    /**
     * Single GET with no retries. Still waits for the host throttle and trips the cooldown
     * on 429. The whole body must arrive within {@code timeout}, otherwise a
     * {@link FetchException} with status {@link FetchStatus#TIMEOUT} is thrown.
     * Non-success responses come back with a {@code null} body.
     */
    public FetchedStream open(String url, Duration timeout) throws IOException, InterruptedException {
        URI uri = toUri(url);
        throttle.awaitTurn(uri.getHost());
        HttpResponse<byte[]> resp;
        try {
            resp = exchange(uri, timeout);
        } catch (HttpTimeoutException e) {
            throw new FetchException("Timed out after " + timeout.toMillis() + " ms: " + url,
                    FetchResult.failure(FetchStatus.TIMEOUT), e);
        }
        FetchStatus status = FetchStatus.fromStatusCode(resp.statusCode());
        String contentType = resp.headers().firstValue("Content-Type").orElse("");
        if (status == FetchStatus.SUCCESS) {
            return new FetchedStream(status, resp.statusCode(), contentType, new ByteArrayInputStream(resp.body()));
        }
        if (status == FetchStatus.RATE_LIMITED) {
            log.warn("Rate limited (429) on {}", url);
            throttle.tripCooldown(uri.getHost());
        }
        return new FetchedStream(status, resp.statusCode(), contentType, null);
    }

    private Attempt send(URI uri, Duration timeout) throws InterruptedException {
        try {
            HttpResponse<byte[]> resp = exchange(uri, timeout);
            FetchStatus status = FetchStatus.fromStatusCode(resp.statusCode());
            String contentType = resp.headers().firstValue("Content-Type").orElse("");
            return new Attempt(new FetchResult(status, resp.statusCode(), resp.body(), contentType), null);
        } catch (HttpTimeoutException e) {
            return new Attempt(FetchResult.failure(FetchStatus.TIMEOUT), e);
        } catch (IOException e) {
            return new Attempt(FetchResult.failure(FetchStatus.NETWORK_ERROR), e);
        }
    }

    /**
     * Sends the request and reads the full body. The request timeout only covers the
     * response headers, so the whole exchange is bounded by a timed wait as well.
     */
    private HttpResponse<byte[]> exchange(URI uri, Duration timeout) throws IOException, InterruptedException {
        HttpRequest req = baseRequest(uri).timeout(timeout).GET().build();
        CompletableFuture<HttpResponse<byte[]>> pending = http.sendAsync(req, HttpResponse.BodyHandlers.ofByteArray());
        try {
            return pending.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            pending.cancel(true);
            throw new HttpTimeoutException("Response body not complete within " + timeout.toMillis() + " ms");
        } catch (InterruptedException e) {
            pending.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IOException) {
                throw (IOException) cause;
            }
            throw new IOException(cause == null ? e.getMessage() : cause.getMessage(), cause);
        }
    }

    private void backoff() throws InterruptedException {
        long min = policy.backoffMin().toMillis();
        long max = policy.backoffMax().toMillis();
        long millis = max > min ? ThreadLocalRandom.current().nextLong(min, max + 1) : min;
        sleeper.sleep(Duration.ofMillis(millis));
    }

    private HttpRequest.Builder baseRequest(URI uri) {
        return HttpRequest.newBuilder(uri)
                .header("User-Agent", userAgent);
    }

    private static URI toUri(String url) throws FetchException {
        try {
            URI uri = URI.create(url == null ? "" : url.trim());
            if (uri.getScheme() == null || uri.getHost() == null) {
                throw new IllegalArgumentException("missing scheme or host");
            }
            return uri;
        } catch (IllegalArgumentException e) {
            throw new FetchException("Invalid URL: " + url, FetchResult.failure(FetchStatus.CLIENT_ERROR), e);
        }
    }

    private record Attempt(FetchResult result, Exception error) {}
}
