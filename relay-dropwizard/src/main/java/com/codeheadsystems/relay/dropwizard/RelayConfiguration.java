package com.codeheadsystems.relay.dropwizard;

import com.codeheadsystems.relay.server.manager.DuplicateSessionPolicy;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.dropwizard.core.Configuration;
import io.dropwizard.db.DataSourceFactory;
import io.dropwizard.util.Duration;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

/**
 * Dropwizard configuration for the messaging relay.
 * <p>
 * {@code jwtSecret} is required and must be the secret shared with the service that mints
 * user tokens. When {@code database} is omitted the relay keeps conversations in memory
 * (dev/test only, history is lost on restart).
 */
public class RelayConfiguration extends Configuration {

  /**
   * HMAC-SHA256 secret used to verify user tokens, as a UTF-8 string.
   */
  @NotEmpty
  private String jwtSecret;

  /**
   * Expected issuer claim. Empty accepts tokens from any issuer.
   */
  @NotNull
  private String jwtIssuer = "";

  /**
   * Lifetime of tokens issued by the developer token command.
   */
  @Min(1)
  private long jwtTtlSeconds = 3600;

  @NotNull
  private DuplicateSessionPolicy duplicateSessionPolicy = DuplicateSessionPolicy.REPLACE;

  @Min(1)
  private int maxContentLength = 4000;

  @NotEmpty
  private String websocketPath = "/socket";

  @NotNull
  private Duration websocketIdleTimeout = Duration.minutes(30);

  /**
   * Body of {@code GET /}.
   */
  @NotEmpty
  private String livenessMessage = "Relay server is running";

  /**
   * Relational store for conversations. Omit to use the in-memory store.
   */
  @Valid
  private DataSourceFactory database;

  /**
   * URL pinged periodically to keep hosted instances from idling out. Empty disables it.
   */
  @NotNull
  private String keepAliveUrl = "";

  @NotNull
  private Duration keepAliveInterval = Duration.minutes(10);

  @JsonProperty
  public String getJwtSecret() {
    return jwtSecret;
  }

  @JsonProperty
  public void setJwtSecret(String jwtSecret) {
    this.jwtSecret = jwtSecret;
  }

  @JsonProperty
  public String getJwtIssuer() {
    return jwtIssuer;
  }

  @JsonProperty
  public void setJwtIssuer(String jwtIssuer) {
    this.jwtIssuer = jwtIssuer;
  }

  @JsonProperty
  public long getJwtTtlSeconds() {
    return jwtTtlSeconds;
  }

  @JsonProperty
  public void setJwtTtlSeconds(long jwtTtlSeconds) {
    this.jwtTtlSeconds = jwtTtlSeconds;
  }

  /**
   * What to do when an identity authenticates while already connected elsewhere.
   *
   * @return the policy, {@code REPLACE} by default
   */
  @JsonProperty
  public DuplicateSessionPolicy getDuplicateSessionPolicy() {
    return duplicateSessionPolicy;
  }

  @JsonProperty
  public void setDuplicateSessionPolicy(DuplicateSessionPolicy duplicateSessionPolicy) {
    this.duplicateSessionPolicy = duplicateSessionPolicy;
  }

  /**
   * Longest message content accepted, in characters.
   *
   * @return the limit
   */
  @JsonProperty
  public int getMaxContentLength() {
    return maxContentLength;
  }

  @JsonProperty
  public void setMaxContentLength(int maxContentLength) {
    this.maxContentLength = maxContentLength;
  }

  @JsonProperty
  public String getWebsocketPath() {
    return websocketPath;
  }

  @JsonProperty
  public void setWebsocketPath(String websocketPath) {
    this.websocketPath = websocketPath;
  }

  @JsonProperty
  public Duration getWebsocketIdleTimeout() {
    return websocketIdleTimeout;
  }

  @JsonProperty
  public void setWebsocketIdleTimeout(Duration websocketIdleTimeout) {
    this.websocketIdleTimeout = websocketIdleTimeout;
  }

  @JsonProperty
  public String getLivenessMessage() {
    return livenessMessage;
  }

  @JsonProperty
  public void setLivenessMessage(String livenessMessage) {
    this.livenessMessage = livenessMessage;
  }

  @JsonProperty("database")
  public DataSourceFactory getDataSourceFactory() {
    return database;
  }

  @JsonProperty("database")
  public void setDataSourceFactory(DataSourceFactory database) {
    this.database = database;
  }

  @JsonProperty
  public String getKeepAliveUrl() {
    return keepAliveUrl;
  }

  @JsonProperty
  public void setKeepAliveUrl(String keepAliveUrl) {
    this.keepAliveUrl = keepAliveUrl;
  }

  @JsonProperty
  public Duration getKeepAliveInterval() {
    return keepAliveInterval;
  }

  @JsonProperty
  public void setKeepAliveInterval(Duration keepAliveInterval) {
    this.keepAliveInterval = keepAliveInterval;
  }
}
