package com.codeheadsystems.relay.dropwizard.managed;

import static org.assertj.core.api.Assertions.assertThat;

import com.sun.net.httpserver.HttpServer;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class KeepAlivePingerTest {

  private HttpServer server;
  private final AtomicInteger hits = new AtomicInteger();

  @BeforeEach
  void setUp() throws Exception {
    server = HttpServer.create(new InetSocketAddress("localhost", 0), 0);
    server.createContext("/", exchange -> {
      hits.incrementAndGet();
      exchange.sendResponseHeaders(200, -1);
      exchange.close();
    });
    server.start();
  }

  @AfterEach
  void tearDown() {
    server.stop(0);
  }

  private String url() {
    return "http://localhost:" + server.getAddress().getPort() + "/";
  }

  @Test
  void ping_returnsStatus() {
    KeepAlivePinger pinger = new KeepAlivePinger(url(), Duration.ofMinutes(10));

    assertThat(pinger.ping()).isEqualTo(200);
    assertThat(hits.get()).isEqualTo(1);
  }

  @Test
  void ping_unreachable_returnsMinusOne() throws Exception {
    int port;
    try (ServerSocket socket = new ServerSocket(0)) {
      port = socket.getLocalPort();
    }
    KeepAlivePinger pinger = new KeepAlivePinger("http://localhost:" + port + "/", Duration.ofMinutes(10));

    assertThat(pinger.ping()).isEqualTo(-1);
  }

  @Test
  void start_pingsOnSchedule() throws Exception {
    KeepAlivePinger pinger = new KeepAlivePinger(url(), Duration.ofMillis(50));
    pinger.start();
    try {
      long deadline = System.currentTimeMillis() + 5000;
      while (hits.get() < 2 && System.currentTimeMillis() < deadline) {
        Thread.sleep(20);
      }
    } finally {
      pinger.stop();
    }

    assertThat(hits.get()).isGreaterThanOrEqualTo(2);
  }
}
