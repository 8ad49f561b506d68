package ca.gc.cra.portalwatch.infrastructure.http;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.portalwatch.application.port.Cancellable;
import ca.gc.cra.portalwatch.application.port.ProbeClient;
import ca.gc.cra.portalwatch.domain.probe.IpFamily;
import ca.gc.cra.portalwatch.domain.probe.ProbeError;
import ca.gc.cra.portalwatch.domain.probe.ProbeRequest;
import ca.gc.cra.portalwatch.domain.probe.ProbeResponse;
import ca.gc.cra.portalwatch.infrastructure.loop.SingleThreadEventLoop;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.net.ConnectException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.URI;
import java.net.UnknownHostException;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpTimeoutException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Flow;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import javax.net.ssl.SSLHandshakeException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class JdkHttpProbeClientTest {
  private static final int LARGE_CHUNKS = 64;
  private HttpServer server;
  private SingleThreadEventLoop loop;
  private JdkHttpProbeClient client;
  private final CountDownLatch release = new CountDownLatch(1);

  @BeforeEach
  void setUp() throws IOException {
    server = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
    server.createContext("/generate_204", exchange -> {
      exchange.sendResponseHeaders(204, -1);
      exchange.close();
    });
    server.createContext("/redirect", exchange -> {
      exchange.getResponseHeaders().add("Location", "http://portal.example/login");
      exchange.sendResponseHeaders(302, -1);
      exchange.close();
    });
    server.createContext("/portal", exchange -> {
      byte[] body = "<html>sign in</html>".getBytes(StandardCharsets.US_ASCII);
      exchange.sendResponseHeaders(200, body.length);
      try (OutputStream out = exchange.getResponseBody()) {
        out.write(body);
      }
    });
    server.createContext("/large", exchange -> {
      byte[] chunk = new byte[64 * 1024];
      exchange.sendResponseHeaders(200, 0);
      try (OutputStream out = exchange.getResponseBody()) {
        for (int i = 0; i < LARGE_CHUNKS; i++) {
          out.write(chunk);
        }
      }
    });
    server.createContext("/slow", exchange -> {
      try {
        release.await(5, TimeUnit.SECONDS);
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
      }
      exchange.sendResponseHeaders(204, -1);
      exchange.close();
    });
    server.start();
    loop = new SingleThreadEventLoop("probe-test");
    client = new JdkHttpProbeClient(loop, Duration.ofSeconds(5));
  }

  @AfterEach
  void tearDown() {
    release.countDown();
    server.stop(0);
    loop.close();
  }

  private URI url(String path) {
    return URI.create("http://127.0.0.1:" + server.getAddress().getPort() + path);
  }

  private static ProbeRequest request(URI url) {
    return new ProbeRequest(url, Map.of("User-Agent", "portalwatch-test"), List.of(), IpFamily.IPV4, "lo", "test");
  }

  private static final class Capture implements ProbeClient.Callback {
    final CompletableFuture<Object> outcome = new CompletableFuture<>();
    final AtomicBoolean onLoop = new AtomicBoolean();
    private final SingleThreadEventLoop loop;

    Capture(SingleThreadEventLoop loop) {
      this.loop = loop;
    }

    @Override
    public void onResponse(ProbeResponse response) {
      onLoop.set(loop.isLoopThread());
      outcome.complete(response);
    }

    @Override
    public void onError(ProbeError error) {
      onLoop.set(loop.isLoopThread());
      outcome.complete(error);
    }
  }

  @Test
  void noContentResponseIsReportedOnLoop() throws Exception {
    Capture capture = new Capture(loop);
    client.issue(request(url("/generate_204")), capture);

    ProbeResponse response = (ProbeResponse) capture.outcome.get(5, TimeUnit.SECONDS);
    assertEquals(204, response.statusCode());
    assertEquals(0L, response.bodyLength());
    assertTrue(capture.onLoop.get());
  }

  @Test
  void redirectIsNotFollowed() throws Exception {
    Capture capture = new Capture(loop);
    client.issue(request(url("/redirect")), capture);

    ProbeResponse response = (ProbeResponse) capture.outcome.get(5, TimeUnit.SECONDS);
    assertEquals(302, response.statusCode());
    assertEquals("http://portal.example/login", response.header("location").orElseThrow());
  }

  @Test
  void bodyLengthAndContentLengthAreReported() throws Exception {
    Capture capture = new Capture(loop);
    client.issue(request(url("/portal")), capture);

    ProbeResponse response = (ProbeResponse) capture.outcome.get(5, TimeUnit.SECONDS);
    assertEquals(200, response.statusCode());
    assertEquals(20L, response.bodyLength());
    assertEquals("20", response.header("Content-Length").orElseThrow());
  }

  @Test
  void chunkedBodyIsCountedWithoutContentLength() throws Exception {
    Capture capture = new Capture(loop);
    client.issue(request(url("/large")), capture);

    ProbeResponse response = (ProbeResponse) capture.outcome.get(10, TimeUnit.SECONDS);
    assertEquals(200, response.statusCode());
    assertEquals(LARGE_CHUNKS * 64L * 1024L, response.bodyLength());
    assertTrue(response.header("Content-Length").isEmpty());
  }

  @Test
  void byteCounterSumsRemainingBytes() {
    JdkHttpProbeClient.ByteCounter counter = new JdkHttpProbeClient.ByteCounter();
    AtomicLong requested = new AtomicLong();
    counter.onSubscribe(new Flow.Subscription() {
      @Override
      public void request(long n) {
        requested.set(n);
      }

      @Override
      public void cancel() {
        requested.set(-1);
      }
    });
    ByteBuffer partlyRead = ByteBuffer.allocate(10);
    partlyRead.position(4);

    counter.onNext(List.of(ByteBuffer.allocate(100), partlyRead));
    counter.onNext(List.of());
    counter.onNext(List.of(ByteBuffer.wrap(new byte[7])));
    counter.onComplete();

    assertEquals(Long.MAX_VALUE, requested.get());
    assertEquals(113L, counter.count());
  }

  @Test
  void refusedConnectionIsConnectionFailure() throws Exception {
    int port;
    try (ServerSocket socket = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
      port = socket.getLocalPort();
    }
    Capture capture = new Capture(loop);
    client.issue(request(URI.create("http://127.0.0.1:" + port + "/generate_204")), capture);

    assertEquals(ProbeError.CONNECTION_FAILURE, capture.outcome.get(10, TimeUnit.SECONDS));
    assertTrue(capture.onLoop.get());
  }

  @Test
  void cancelledProbeNeverCallsBack() throws Exception {
    Capture capture = new Capture(loop);
    Cancellable handle = client.issue(request(url("/slow")), capture);
    handle.cancel();
    release.countDown();

    CountDownLatch drained = new CountDownLatch(1);
    loop.schedule(Duration.ofMillis(300), drained::countDown);
    assertTrue(drained.await(5, TimeUnit.SECONDS));
    assertFalse(capture.outcome.isDone());
  }

  @Test
  void transportFailuresAreClassifiedByCause() {
    assertEquals(ProbeError.HTTP_TIMEOUT, JdkHttpProbeClient.classify(new HttpTimeoutException("slow")));
    assertEquals(ProbeError.HTTP_TIMEOUT,
        JdkHttpProbeClient.classify(new CompletionException(new HttpConnectTimeoutException("slow"))));
    assertEquals(ProbeError.DNS_FAILURE,
        JdkHttpProbeClient.classify(new CompletionException(new IOException(new UnknownHostException("x")))));
    assertEquals(ProbeError.TLS_FAILURE, JdkHttpProbeClient.classify(new SSLHandshakeException("bad cert")));
    assertEquals(ProbeError.CONNECTION_FAILURE,
        JdkHttpProbeClient.classify(new CompletionException(new ConnectException("refused"))));
    assertEquals(ProbeError.IO_ERROR, JdkHttpProbeClient.classify(new IOException("reset")));
    assertEquals(ProbeError.INTERNAL_ERROR, JdkHttpProbeClient.classify(new IllegalStateException("bug")));
  }

  @Test
  void nonPositiveTimeoutIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> new JdkHttpProbeClient(loop, Duration.ZERO));
  }
}
