package com.codeheadsystems.relay.testserver.cli;

import com.codeheadsystems.relay.model.IdentityClaims;
import com.codeheadsystems.relay.server.auth.JwtIdentityVerifier;
import java.nio.charset.StandardCharsets;
import java.util.UUID;

/**
 * Command-line tool that mints a user token the relay accepts, for trying the server with a
 * WebSocket client.
 *
 * <pre>
 * Usage:
 *   java -cp relay-testserver.jar com.codeheadsystems.relay.testserver.cli.TokenCli \
 *       [--secret &lt;s&gt;] [--issuer &lt;iss&gt;] [--id &lt;id&gt;] [--role &lt;role&gt;] [--ttl &lt;seconds&gt;] &lt;email&gt;
 * </pre>
 *
 * <p>The secret defaults to the {@code JWT_SECRET} environment variable, the id to a random
 * UUID and the lifetime to one hour.
 */
public class TokenCli {

  private static final long DEFAULT_TTL_SECONDS = 3600;

  /**
   * Main entry point.
   *
   * @param args command-line arguments
   */
  public static void main(String[] args) {
    String secret = System.getenv("JWT_SECRET");
    String issuer = "";
    String id = UUID.randomUUID().toString();
    String role = "user";
    long ttl = DEFAULT_TTL_SECONDS;
    String email = null;

    for (int i = 0; i < args.length; i++) {
      if ("--secret".equals(args[i]) && i + 1 < args.length) {
        secret = args[++i];
      } else if ("--issuer".equals(args[i]) && i + 1 < args.length) {
        issuer = args[++i];
      } else if ("--id".equals(args[i]) && i + 1 < args.length) {
        id = args[++i];
      } else if ("--role".equals(args[i]) && i + 1 < args.length) {
        role = args[++i];
      } else if ("--ttl".equals(args[i]) && i + 1 < args.length) {
        ttl = Long.parseLong(args[++i]);
      } else if (!args[i].startsWith("-")) {
        email = args[i];
      }
    }

    if (email == null || secret == null || secret.isEmpty()) {
      System.err.println("Usage: TokenCli [--secret <s>] [--issuer <iss>] [--id <id>] "
          + "[--role <role>] [--ttl <seconds>] <email>");
      System.err.println();
      System.err.println("  --secret <s>   HMAC secret (default: $JWT_SECRET)");
      System.err.println("  --ttl <secs>   token lifetime (default: " + DEFAULT_TTL_SECONDS + ")");
      System.exit(1);
    }

    JwtIdentityVerifier verifier = new JwtIdentityVerifier(
        secret.getBytes(StandardCharsets.UTF_8), issuer, ttl);
    System.out.println(verifier.issueToken(new IdentityClaims(id, email, role)));
  }
}
