package com.codeheadsystems.relay.dropwizard.managed;

import io.dropwizard.lifecycle.Managed;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Periodically sends {@code GET} to a public URL of this service so that hosting platforms that
 * suspend idle instances keep it running. Shares no state with message routing.
 */
public class KeepAlivePinger implements Managed {

  private static final Logger log = LoggerFactory.getLogger(KeepAlivePinger.class);

  private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(10);

  private final URI target;
  private final Duration interval;
  private final HttpClient httpClient;

  private ScheduledExecutorService scheduler;

  /**
   * Instantiates a new Keep alive pinger.
   *
   * @param url      URL to ping
   * @param interval time between pings
   */
  public KeepAlivePinger(String url, Duration interval) {
    this.target = URI.create(url);
    this.interval = interval;
    this.httpClient = HttpClient.newBuilder()
        .connectTimeout(REQUEST_TIMEOUT)
        .followRedirects(HttpClient.Redirect.NORMAL)
        .build();
  }

  @Override
  public void start() {
    scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
      Thread t = new Thread(r, "relay-keep-alive");
      t.setDaemon(true);
      return t;
    });
    long millis = interval.toMillis();
    scheduler.scheduleAtFixedRate(this::ping, millis, millis, TimeUnit.MILLISECONDS);
    log.info("Keep-alive ping to {} every {}", target, interval);
  }

  @Override
  public void stop() {
    if (scheduler != null) {
      scheduler.shutdownNow();
    }
  }

  /**
   * Sends one ping.
   *
   * @return the HTTP status, or -1 when the request failed
   */
  int ping() {
    HttpRequest request = HttpRequest.newBuilder(target).timeout(REQUEST_TIMEOUT).GET().build();
    try {
      int status = httpClient.send(request, HttpResponse.BodyHandlers.discarding()).statusCode();
      log.debug("Keep-alive ping {} -> {}", target, status);
      return status;
    } catch (IOException e) {
      log.warn("Keep-alive ping to {} failed: {}", target, e.getMessage());
      return -1;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return -1;
    }
  }
}
