/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.appleauth.api.rest;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.CookieParam;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.MultivaluedMap;
import jakarta.ws.rs.core.NewCookie;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import villagecompute.appleauth.api.types.AppleAuthResult;
import villagecompute.appleauth.api.types.AppleAuthResultType;
import villagecompute.appleauth.api.types.AuthErrorType;
import villagecompute.appleauth.config.AdapterConfig;
import villagecompute.appleauth.exceptions.AppleAuthException;
import villagecompute.appleauth.exceptions.FailureKind;
import villagecompute.appleauth.exceptions.IdTokenClaimException;
import villagecompute.appleauth.observability.LoggingConfig;
import villagecompute.appleauth.services.AppleAuthAdapter;
import villagecompute.appleauth.services.CallbackOutcome;
import villagecompute.appleauth.services.InMemorySession;
import villagecompute.appleauth.services.SessionStore;

/**
 * HTTP surface of the Sign in with Apple flow.
 *
 * <p>
 * Responsibilities:
 * <ul>
 * <li>{@code GET /auth/apple} - open an auth session and redirect to Apple's authorize page</li>
 * <li>{@code POST /auth/apple/callback} - Apple's form_post delivery, answered with a redirect to the GET callback and
 * no session cookie</li>
 * <li>{@code GET /auth/apple/callback} - verify the callback and return the profile as JSON</li>
 * </ul>
 *
 * <p>
 * Failures are returned as {@link AuthErrorType}: 401 for every authentication failure, 500 for configuration errors.
 */
@Path("/auth/apple")
public class AppleAuthResource {

    private static final Logger LOG = Logger.getLogger(AppleAuthResource.class);

    private static final String PROVIDER = "apple";

    /** Query parameters a browser may use to adjust the authorize request. */
    private static final Set<String> AUTHORIZE_OVERRIDES = Set.of("scope", "response_mode");

    @Inject
    AppleAuthAdapter adapter;

    @Inject
    SessionStore sessionStore;

    @Inject
    AdapterConfig config;

    @Inject
    Tracer tracer;

    @ConfigProperty(
            name = "apple.cookie-secure",
            defaultValue = "true")
    boolean cookieSecure;

    @GET
    public Response login(@CookieParam(SessionStore.COOKIE_NAME) String sessionId, @Context UriInfo uriInfo) {
        Span span = tracer.spanBuilder("apple.authorize").startSpan();
        try (Scope ignored = span.makeCurrent()) {
            enrichLogContext("/auth/apple");
            InMemorySession session = sessionStore.open(sessionId);
            JaxRsRequestContext context = new JaxRsRequestContext("GET", uriInfo.getQueryParameters(), null, session,
                    defaultCallbackUrl(uriInfo));

            Map<String, String> overrides = new LinkedHashMap<>();
            AUTHORIZE_OVERRIDES.forEach(name -> context.param(name).ifPresent(value -> overrides.put(name, value)));

            URI redirect = adapter.authorizationUrl(context, overrides);
            LOG.infof("Redirecting to Apple authorize endpoint: session=%s", session.id());
            return Response.seeOther(redirect).cookie(sessionCookie(session.id())).build();
        } catch (AppleAuthException e) {
            span.setStatus(StatusCode.ERROR, e.kind().code());
            return failure(e);
        } finally {
            LoggingConfig.clearMDC();
            span.end();
        }
    }

    @POST
    @Path("/callback")
    @Consumes(MediaType.APPLICATION_FORM_URLENCODED)
    @Produces(MediaType.APPLICATION_JSON)
    public Response formPostCallback(MultivaluedMap<String, String> form, @Context UriInfo uriInfo) {
        Span span = tracer.spanBuilder("apple.callback.form_post").startSpan();
        try (Scope ignored = span.makeCurrent()) {
            enrichLogContext("/auth/apple/callback");
            JaxRsRequestContext context = new JaxRsRequestContext("POST", uriInfo.getQueryParameters(), form,
                    InMemorySession.detached(), defaultCallbackUrl(uriInfo));
            return respond(adapter.handleCallback(context), null);
        } catch (AppleAuthException e) {
            span.setStatus(StatusCode.ERROR, e.kind().code());
            return failure(e);
        } finally {
            LoggingConfig.clearMDC();
            span.end();
        }
    }

    @GET
    @Path("/callback")
    @Produces(MediaType.APPLICATION_JSON)
    public Response callback(@CookieParam(SessionStore.COOKIE_NAME) String sessionId, @Context UriInfo uriInfo) {
        Span span = tracer.spanBuilder("apple.callback").startSpan();
        try (Scope ignored = span.makeCurrent()) {
            enrichLogContext("/auth/apple/callback");
            InMemorySession session = sessionStore.open(sessionId);
            JaxRsRequestContext context = new JaxRsRequestContext("GET", uriInfo.getQueryParameters(), null, session,
                    defaultCallbackUrl(uriInfo));
            try {
                return respond(adapter.handleCallback(context), span);
            } finally {
                sessionStore.invalidate(session.id());
            }
        } catch (AppleAuthException e) {
            span.setStatus(StatusCode.ERROR, e.kind().code());
            return failure(e);
        } finally {
            LoggingConfig.clearMDC();
            span.end();
        }
    }

    private Response respond(CallbackOutcome outcome, Span span) {
        if (outcome.isRedirect()) {
            // no session cookie on this leg
            return Response.seeOther(outcome.redirect().orElseThrow().location()).build();
        }
        AppleAuthResult result = outcome.result().orElseThrow();
        if (span != null) {
            span.setAttribute("apple.sub", result.uid());
        }
        return Response.ok(AppleAuthResultType.from(result)).type(MediaType.APPLICATION_JSON).build();
    }

    private Response failure(AppleAuthException e) {
        Response.Status status = e.kind() == FailureKind.CONFIGURATION_ERROR ? Response.Status.INTERNAL_SERVER_ERROR
                : Response.Status.UNAUTHORIZED;
        if (status == Response.Status.INTERNAL_SERVER_ERROR) {
            LOG.errorf(e, "Sign in with Apple is misconfigured");
        } else {
            LOG.debugf(e, "Sign in with Apple request rejected: %s", e.kind().code());
        }
        String claim = e instanceof IdTokenClaimException claimException ? claimException.claim() : null;
        return Response.status(status).type(MediaType.APPLICATION_JSON)
                .entity(new AuthErrorType(e.kind().code(), e.getMessage(), claim)).build();
    }

    private String defaultCallbackUrl(UriInfo uriInfo) {
        return uriInfo.getBaseUriBuilder().path(config.callbackPath()).build().toString();
    }

    private NewCookie sessionCookie(String sessionId) {
        return new NewCookie.Builder(SessionStore.COOKIE_NAME).value(sessionId).path("/")
                .maxAge((int) SessionStore.TTL.toSeconds()).secure(cookieSecure).httpOnly(true)
                .sameSite(NewCookie.SameSite.LAX).build();
    }

    private static void enrichLogContext(String origin) {
        LoggingConfig.enrichWithTraceContext();
        LoggingConfig.setRequestOrigin(origin);
        LoggingConfig.setAuthProvider(PROVIDER);
    }
}
