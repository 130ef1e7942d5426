package com.codeheadsystems.warden.server.resource;

import com.codeheadsystems.warden.model.AssertionRequest;
import com.codeheadsystems.warden.model.AttestationRequest;
import com.codeheadsystems.warden.model.ChallengeRequest;
import com.codeheadsystems.warden.model.ChallengeResponse;
import com.codeheadsystems.warden.server.manager.AttestationManager;
import com.codeheadsystems.warden.server.model.AssertionData;
import com.codeheadsystems.warden.server.model.AttestationData;
import com.codeheadsystems.warden.server.model.Platform;
import com.codeheadsystems.warden.server.model.VerificationResult;
import com.codeheadsystems.warden.server.store.StoreException;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JAX-RS resource for challenge issuance, device attestation and assertion checks.
 * <p>
 * Successful attestation and assertion calls return 204. Rejections are thrown as
 * {@link AttestationFailureException} and rendered by {@link AttestationFailureExceptionMapper}.
 */
@Singleton
@Path("/attestation")
public class AttestationResource {

  private static final Logger log = LoggerFactory.getLogger(AttestationResource.class);

  private final AttestationManager attestationManager;

  /**
   * Instantiates a new attestation resource.
   *
   * @param attestationManager the attestation manager
   */
  @Inject
  public AttestationResource(final AttestationManager attestationManager) {
    this.attestationManager = attestationManager;
    log.info("AttestationResource({})", attestationManager);
  }

  /**
   * Issues a single-use challenge. Responds 503 when the challenge store is full or unreachable.
   *
   * @param request the request
   * @return the challenge
   */
  @POST
  @Path("/challenge")
  @Consumes(MediaType.APPLICATION_JSON)
  @Produces(MediaType.APPLICATION_JSON)
  public ChallengeResponse challenge(final ChallengeRequest request) {
    if (request == null) {
      throw new WebApplicationException("Missing request body", Response.Status.BAD_REQUEST);
    }
    try {
      return new ChallengeResponse(attestationManager.generateChallenge(request.requiredIdentifier()));
    } catch (IllegalArgumentException e) {
      throw new WebApplicationException(e.getMessage(), Response.Status.BAD_REQUEST);
    } catch (IllegalStateException e) {
      throw new WebApplicationException("Too many outstanding challenges", Response.Status.SERVICE_UNAVAILABLE);
    } catch (StoreException e) {
      log.error("Challenge store unavailable", e);
      throw new WebApplicationException("Challenge store unavailable", Response.Status.SERVICE_UNAVAILABLE);
    }
  }

  /**
   * Verifies an initial attestation and registers the device key.
   *
   * @param request the attestation evidence
   */
  @POST
  @Path("/attest")
  @Consumes(MediaType.APPLICATION_JSON)
  @Produces(MediaType.APPLICATION_JSON)
  public void attest(final AttestationRequest request) {
    final AttestationData data = request == null ? null : new AttestationData(
        Platform.fromName(request.platform()),
        request.token(),
        request.keyId(),
        request.identifier(),
        request.challenge(),
        request.boundIdentifier());
    requireVerified(attestationManager.verify(data));
  }

  /**
   * Verifies an assertion from a registered device key. The client data is only decoded when
   * attestation is enabled, so a disabled deployment passes every request through.
   *
   * @param request the assertion
   */
  @POST
  @Path("/assert")
  @Consumes(MediaType.APPLICATION_JSON)
  @Produces(MediaType.APPLICATION_JSON)
  public void assertion(final AssertionRequest request) {
    AssertionData data = null;
    if (request != null && attestationManager.isEnabled()) {
      try {
        data = new AssertionData(request.assertion(), request.clientData(), request.keyId());
      } catch (IllegalArgumentException e) {
        throw new WebApplicationException(e.getMessage(), Response.Status.BAD_REQUEST);
      }
    }
    requireVerified(attestationManager.verifyAssertion(data));
  }

  private void requireVerified(VerificationResult result) {
    result.failureReason().ifPresent(failure -> {
      throw new AttestationFailureException(failure);
    });
  }
}
