package com.codeheadsystems.relay.dropwizard.resource;

import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

/**
 * Plain-text liveness endpoint on the application port, for load balancers and hosting
 * platforms that probe {@code GET /}.
 */
@Path("/")
@Produces(MediaType.TEXT_PLAIN)
public class LivenessResource {

  private final String message;

  public LivenessResource(String message) {
    this.message = message;
  }

  @GET
  public String liveness() {
    return message;
  }
}
