package com.codeheadsystems.warden.server.verifier;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Client for Google's Play Integrity {@code decodeIntegrityToken} endpoint.
 * <p>
 * Google decrypts and verifies the integrity token server side; this class only transports it.
 * The OAuth access token for the service account comes from a supplier so that the embedding
 * application controls credential refresh.
 */
public class PlayIntegrityAccessor {

  private static final Logger log = LoggerFactory.getLogger(PlayIntegrityAccessor.class);

  public static final URI DEFAULT_ENDPOINT = URI.create("https://playintegrity.googleapis.com/v1/");

  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final URI endpoint;
  private final Supplier<String> accessTokenSupplier;
  private final Duration requestTimeout;

  /**
   * Instantiates a new Play Integrity accessor.
   *
   * @param httpClient          the http client
   * @param objectMapper        the object mapper
   * @param endpoint            base URI of the Play Integrity API
   * @param accessTokenSupplier supplies a current OAuth bearer token
   * @param requestTimeout      per-request timeout
   */
  public PlayIntegrityAccessor(final HttpClient httpClient,
                               final ObjectMapper objectMapper,
                               final URI endpoint,
                               final Supplier<String> accessTokenSupplier,
                               final Duration requestTimeout) {
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
    this.endpoint = endpoint;
    this.accessTokenSupplier = accessTokenSupplier;
    this.requestTimeout = requestTimeout;
    log.info("PlayIntegrityAccessor({})", endpoint);
  }

  /**
   * Decodes an integrity token.
   *
   * @param packageName    the app's package name
   * @param integrityToken the token produced on the device
   * @return the decoded verdict
   * @throws PlayIntegrityAccessorException if the call fails or Google rejects the token
   */
  public PlayIntegrityVerdict decode(final String packageName, final String integrityToken) {
    log.trace("decode(packageName={})", packageName);
    try {
      final String requestBody = objectMapper.writeValueAsString(Map.of("integrity_token", integrityToken));
      final HttpRequest httpRequest = HttpRequest.newBuilder()
          .uri(decodeUri(packageName))
          .timeout(requestTimeout)
          .header("Content-Type", "application/json")
          .header("Authorization", "Bearer " + accessTokenSupplier.get())
          .POST(HttpRequest.BodyPublishers.ofString(requestBody))
          .build();

      final HttpResponse<String> httpResponse = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString());
      if (httpResponse.statusCode() >= 400) {
        throw new PlayIntegrityAccessorException(
            "Play Integrity returned HTTP " + httpResponse.statusCode() + " for package: " + packageName, null);
      }
      return objectMapper.readValue(httpResponse.body(), PlayIntegrityVerdict.class);
    } catch (IOException e) {
      throw new PlayIntegrityAccessorException("Play Integrity request failed for package: " + packageName, e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new PlayIntegrityAccessorException("Play Integrity request interrupted for package: " + packageName, e);
    }
  }

  // Not URI.resolve: the package name followed by ':' would parse as a scheme.
  URI decodeUri(final String packageName) {
    final String base = endpoint.toString();
    return URI.create(base + (base.endsWith("/") ? "" : "/") + packageName + ":decodeIntegrityToken");
  }
}
