package com.codeheadsystems.tether.server.resource;

import com.codeheadsystems.tether.model.CallbackRequest;
import com.codeheadsystems.tether.model.CallbackResponse;
import com.codeheadsystems.tether.model.ConnectionsResponse;
import com.codeheadsystems.tether.model.Provider;
import com.codeheadsystems.tether.model.RegisterStateRequest;
import com.codeheadsystems.tether.server.exceptions.ConnectionNotFoundException;
import com.codeheadsystems.tether.server.manager.ConnectionManager;
import com.codeheadsystems.tether.server.provider.ProviderTokenException;
import jakarta.annotation.security.PermitAll;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.SecurityContext;
import java.security.Principal;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JAX-RS resource for a user's provider connections.
 * <p>
 * Endpoints (all require a bearer token):
 * <ul>
 *   <li>{@code POST /connections/state}         register a CSRF state</li>
 *   <li>{@code POST /connections/callback}      exchange an authorization code</li>
 *   <li>{@code GET /connections}                list connections</li>
 *   <li>{@code DELETE /connections/{provider}}  disconnect a provider</li>
 * </ul>
 * The user is the authenticated principal's name. {@link ConnectionManager} exceptions are
 * translated to HTTP statuses here.
 */
@Path("/connections")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class ConnectionResource {

  private static final Logger log = LoggerFactory.getLogger(ConnectionResource.class);

  private final ConnectionManager manager;

  /**
   * Instantiates a new Connection resource.
   *
   * @param manager the manager
   */
  public ConnectionResource(ConnectionManager manager) {
    log.info("ConnectionResource({})", manager);
    this.manager = manager;
  }

  /**
   * Register state.
   *
   * @param securityContext the security context
   * @param request         the request
   * @return 204
   */
  @POST
  @Path("/state")
  @PermitAll
  public Response registerState(@Context SecurityContext securityContext, RegisterStateRequest request) {
    String userId = userId(securityContext);
    log.debug("registerState(userId={})", userId);
    return handle(() -> {
      manager.registerState(userId, request);
      return Response.noContent().build();
    });
  }

  /**
   * Callback.
   *
   * @param securityContext the security context
   * @param request         the request
   * @return the callback response
   */
  @POST
  @Path("/callback")
  @PermitAll
  public CallbackResponse callback(@Context SecurityContext securityContext, CallbackRequest request) {
    String userId = userId(securityContext);
    log.debug("callback(userId={})", userId);
    return handle(() -> manager.callback(userId, request));
  }

  /**
   * List connections.
   *
   * @param securityContext the security context
   * @return the connections response
   */
  @GET
  @PermitAll
  public ConnectionsResponse list(@Context SecurityContext securityContext) {
    String userId = userId(securityContext);
    log.debug("list(userId={})", userId);
    return handle(() -> manager.list(userId));
  }

  /**
   * Disconnect.
   *
   * @param securityContext the security context
   * @param providerName    the provider name
   * @return 204
   */
  @DELETE
  @Path("/{provider}")
  @PermitAll
  public Response disconnect(@Context SecurityContext securityContext, @PathParam("provider") String providerName) {
    String userId = userId(securityContext);
    log.debug("disconnect(userId={}, provider={})", userId, providerName);
    Provider provider = Provider.fromName(providerName)
        .orElseThrow(() -> new WebApplicationException("Unknown provider", Response.Status.BAD_REQUEST));
    return handle(() -> {
      manager.disconnect(userId, provider);
      return Response.noContent().build();
    });
  }

  // ── Helpers ───────────────────────────────────────────────────────────────

  private static String userId(SecurityContext securityContext) {
    Principal principal = securityContext == null ? null : securityContext.getUserPrincipal();
    if (principal == null || principal.getName() == null) {
      throw new WebApplicationException("Authentication required", Response.Status.UNAUTHORIZED);
    }
    return principal.getName();
  }

  private static <T> T handle(Supplier<T> call) {
    try {
      return call.get();
    } catch (IllegalArgumentException e) {
      throw new WebApplicationException(e.getMessage(), Response.Status.BAD_REQUEST);
    } catch (SecurityException e) {
      throw new WebApplicationException(e.getMessage(), Response.Status.UNAUTHORIZED);
    } catch (ConnectionNotFoundException e) {
      throw new WebApplicationException(e.getMessage(), Response.Status.NOT_FOUND);
    } catch (ProviderTokenException e) {
      log.warn("Provider call failed (status={}): {}", e.statusCode(), e.getMessage());
      throw new WebApplicationException("Provider request failed", Response.Status.BAD_GATEWAY);
    } catch (IllegalStateException e) {
      throw new WebApplicationException(e.getMessage(), Response.Status.SERVICE_UNAVAILABLE);
    }
  }
}
