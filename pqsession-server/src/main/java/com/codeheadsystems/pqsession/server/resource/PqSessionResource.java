package com.codeheadsystems.pqsession.server.resource;

import com.codeheadsystems.pqsession.common.Outcome;
import com.codeheadsystems.pqsession.model.HealthResponse;
import com.codeheadsystems.pqsession.model.handshake.ClientHelloRequest;
import com.codeheadsystems.pqsession.model.handshake.ClientKeyExchangeRequest;
import com.codeheadsystems.pqsession.model.handshake.ServerFinishedResponse;
import com.codeheadsystems.pqsession.model.handshake.ServerHelloResponse;
import com.codeheadsystems.pqsession.model.keys.PublicKeysResponse;
import com.codeheadsystems.pqsession.model.session.SessionInvalidateResponse;
import com.codeheadsystems.pqsession.model.session.SessionVerifyRequest;
import com.codeheadsystems.pqsession.model.session.SessionVerifyResponse;
import com.codeheadsystems.pqsession.server.manager.PqSessionServerManager;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JAX-RS adapter over {@link PqSessionServerManager}.
 * <p>
 * Endpoints:
 * <ul>
 *   <li>{@code GET /pqc/keys}                    current and retiring public keys</li>
 *   <li>{@code POST /pqc/handshake/hello}        ClientHello, returns ServerHello</li>
 *   <li>{@code POST /pqc/handshake/key-exchange} ClientKeyExchange, returns ServerFinished</li>
 *   <li>{@code POST /pqc/session/verify}         session validity and reason</li>
 *   <li>{@code DELETE /pqc/session/{sessionId}}  invalidate a session</li>
 *   <li>{@code GET /pqc/health}                  subsystem status</li>
 * </ul>
 */
@Singleton
@Path("/pqc")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class PqSessionResource {

  private static final Logger log = LoggerFactory.getLogger(PqSessionResource.class);

  private final PqSessionServerManager manager;

  @Inject
  public PqSessionResource(final PqSessionServerManager manager) {
    this.manager = manager;
    log.info("PqSessionResource({})", manager);
  }

  @GET
  @Path("/keys")
  public PublicKeysResponse keys() {
    return manager.publicKeys();
  }

  @POST
  @Path("/handshake/hello")
  public ServerHelloResponse hello(final ClientHelloRequest request) {
    requireBody(request);
    return unwrap(() -> manager.clientHello(request));
  }

  @POST
  @Path("/handshake/key-exchange")
  public ServerFinishedResponse keyExchange(final ClientKeyExchangeRequest request) {
    requireBody(request);
    return unwrap(() -> manager.clientKeyExchange(request));
  }

  @POST
  @Path("/session/verify")
  public SessionVerifyResponse verify(final SessionVerifyRequest request) {
    requireBody(request);
    return unwrap(() -> manager.verifySession(request.sessionId()));
  }

  @DELETE
  @Path("/session/{sessionId}")
  public SessionInvalidateResponse invalidate(@PathParam("sessionId") final String sessionId) {
    return unwrap(() -> manager.invalidateSession(sessionId));
  }

  /**
   * Always 200 so callers can read the detail; the admin health checks carry the pass/fail signal.
   */
  @GET
  @Path("/health")
  public HealthResponse health() {
    return manager.health();
  }

  private static void requireBody(Object request) {
    if (request == null) {
      throw new WebApplicationException("Missing request body", Response.Status.BAD_REQUEST);
    }
  }

  private static <T> T unwrap(Supplier<Outcome<T>> call) {
    Outcome<T> outcome;
    try {
      outcome = call.get();
    } catch (IllegalArgumentException e) {
      throw new WebApplicationException(e.getMessage(), Response.Status.BAD_REQUEST);
    }
    if (outcome.isSuccess()) {
      return outcome.value();
    }
    log.debug("Request rejected: {} ({})", outcome.error(), outcome.message());
    throw new WebApplicationException(outcome.message(), outcome.error().httpStatus());
  }
}
