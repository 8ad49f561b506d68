package ca.gc.cra.portalwatch.infrastructure.http;

import ca.gc.cra.portalwatch.application.port.Cancellable;
import ca.gc.cra.portalwatch.application.port.EventLoopPort;
import ca.gc.cra.portalwatch.application.port.ProbeClient;
import ca.gc.cra.portalwatch.domain.probe.ProbeError;
import ca.gc.cra.portalwatch.domain.probe.ProbeRequest;
import ca.gc.cra.portalwatch.domain.probe.ProbeResponse;
import java.io.IOException;
import java.net.ConnectException;
import java.net.UnknownHostException;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.ByteBuffer;
import java.nio.channels.UnresolvedAddressException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Flow;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import javax.net.ssl.SSLException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Issues probe GETs with the JDK HTTP client and reports outcomes on the event loop.
 * <p><strong>Why:</strong> The validation core needs a response (status, headers, body length) or a typed error;
 * nothing else about HTTP leaks past this adapter.</p>
 * <p><strong>Limitations:</strong> The JDK client resolves names with the system resolver and cannot bind to an
 * interface, so the DNS servers and interface name carried by a request are only logged.</p>
 * <p><strong>Thread-safety:</strong> {@link #issue(ProbeRequest, Callback)} may be called from any thread;
 * callbacks are always posted to the event loop.</p>
 *
 * @since 0.1.0
 */
public final class JdkHttpProbeClient implements ProbeClient {
  private static final Logger log = LoggerFactory.getLogger(JdkHttpProbeClient.class);

  private final HttpClient httpClient;
  private final EventLoopPort eventLoop;
  private final Duration timeout;
  private final AtomicBoolean bindingWarningLogged = new AtomicBoolean();

  /**
   * Creates a client with its own {@link HttpClient}.
   *
   * @param eventLoop loop receiving every callback
   * @param timeout connect timeout and overall request timeout
   */
  public JdkHttpProbeClient(EventLoopPort eventLoop, Duration timeout) {
    this(HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NEVER)
            .connectTimeout(Objects.requireNonNull(timeout, "timeout"))
            .build(),
        eventLoop,
        timeout);
  }

  JdkHttpProbeClient(HttpClient httpClient, EventLoopPort eventLoop, Duration timeout) {
    this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
    this.eventLoop = Objects.requireNonNull(eventLoop, "eventLoop");
    this.timeout = Objects.requireNonNull(timeout, "timeout");
    if (timeout.isZero() || timeout.isNegative()) {
      throw new IllegalArgumentException("timeout must be positive");
    }
  }

  @Override
  public Cancellable issue(ProbeRequest request, Callback callback) {
    Objects.requireNonNull(request, "request");
    Objects.requireNonNull(callback, "callback");
    if (bindingWarningLogged.compareAndSet(false, true)) {
      log.debug("{}: system resolver used instead of {}; interface binding to {} not supported",
          request.loggingTag(), request.dnsServers(), request.interfaceName());
    }
    HttpRequest.Builder builder = HttpRequest.newBuilder(request.url()).GET().timeout(timeout);
    request.headers().forEach(builder::header);

    AtomicBoolean cancelled = new AtomicBoolean();
    CompletableFuture<HttpResponse<Long>> future =
        httpClient.sendAsync(builder.build(), JdkHttpProbeClient::countingBodyHandler);
    future.whenComplete((response, error) -> {
      if (cancelled.get()) {
        return;
      }
      eventLoop.post(() -> {
        if (cancelled.get()) {
          log.debug("{}: dropping completion of cancelled probe", request.loggingTag());
          return;
        }
        if (error == null) {
          callback.onResponse(toProbeResponse(response));
        } else {
          ProbeError probeError = classify(error);
          log.debug("{}: {} ({})", request.loggingTag(), probeError, rootMessage(error));
          callback.onError(probeError);
        }
      });
    });
    return () -> {
      if (cancelled.compareAndSet(false, true)) {
        future.cancel(true);
      }
    };
  }

  private static HttpResponse.BodySubscriber<Long> countingBodyHandler(HttpResponse.ResponseInfo info) {
    return HttpResponse.BodySubscribers.fromSubscriber(new ByteCounter(), ByteCounter::count);
  }

  /**
   * Counts body bytes as they arrive and drops the buffers, so a large portal page is never held in memory.
   */
  static final class ByteCounter implements Flow.Subscriber<List<ByteBuffer>> {
    private final AtomicLong count = new AtomicLong();

    @Override
    public void onSubscribe(Flow.Subscription subscription) {
      subscription.request(Long.MAX_VALUE);
    }

    @Override
    public void onNext(List<ByteBuffer> buffers) {
      long received = 0;
      for (ByteBuffer buffer : buffers) {
        received += buffer.remaining();
      }
      count.addAndGet(received);
    }

    @Override
    public void onError(Throwable error) {
      // the response future completes exceptionally with the same error
      log.trace("Body stream failed after {} bytes", count.get(), error);
    }

    @Override
    public void onComplete() {
      log.trace("Body stream complete: {} bytes", count.get());
    }

    long count() {
      return count.get();
    }
  }

  private static ProbeResponse toProbeResponse(HttpResponse<Long> response) {
    Map<String, String> headers = new LinkedHashMap<>();
    HttpHeaders httpHeaders = response.headers();
    httpHeaders.map().forEach((name, values) -> {
      if (!values.isEmpty()) {
        headers.put(name, values.get(0));
      }
    });
    Long body = response.body();
    return new ProbeResponse(response.statusCode(), headers, body == null ? 0L : body);
  }

  /**
   * Maps a transport failure onto the probe error vocabulary by inspecting the whole cause chain.
   *
   * @param error failure reported by the HTTP client
   * @return typed probe error
   */
  static ProbeError classify(Throwable error) {
    List<Throwable> chain = causeChain(error);
    if (chain.stream().anyMatch(t -> t instanceof HttpTimeoutException)) {
      return ProbeError.HTTP_TIMEOUT;
    }
    if (chain.stream().anyMatch(t -> t instanceof UnknownHostException || t instanceof UnresolvedAddressException)) {
      return ProbeError.DNS_FAILURE;
    }
    if (chain.stream().anyMatch(t -> t instanceof SSLException)) {
      return ProbeError.TLS_FAILURE;
    }
    if (chain.stream().anyMatch(t -> t instanceof ConnectException)) {
      return ProbeError.CONNECTION_FAILURE;
    }
    if (chain.stream().anyMatch(t -> t instanceof IOException)) {
      return ProbeError.IO_ERROR;
    }
    return ProbeError.INTERNAL_ERROR;
  }

  private static List<Throwable> causeChain(Throwable error) {
    List<Throwable> chain = new ArrayList<>();
    Throwable current = error;
    while (current != null && !chain.contains(current)) {
      if (!(current instanceof CompletionException) && !(current instanceof CancellationException)) {
        chain.add(current);
      } else if (chain.isEmpty() && current.getCause() == null) {
        chain.add(current);
      }
      current = current.getCause();
    }
    return chain;
  }

  private static String rootMessage(Throwable error) {
    List<Throwable> chain = causeChain(error);
    Throwable root = chain.isEmpty() ? error : chain.get(chain.size() - 1);
    return root.getClass().getSimpleName() + (root.getMessage() == null ? "" : ": " + root.getMessage());
  }
}
