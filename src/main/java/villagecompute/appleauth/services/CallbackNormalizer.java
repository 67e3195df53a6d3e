/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.appleauth.services;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import villagecompute.appleauth.config.AdapterConfig;

/**
 * Turns Apple's {@code form_post} callback into a canonical GET callback.
 *
 * <p>
 * With {@code response_mode=form_post} Apple delivers {@code code}, {@code state} and the one-time {@code user} JSON
 * as a cross-site form POST. Session cookies are usually withheld on such a request (SameSite), so the POST leg only
 * re-encodes the fields into the query string of the callback URL and redirects the browser there. The session is
 * neither read nor written on this leg.
 *
 * <p>
 * Callback URL resolution: {@code redirect_uri} request parameter, then the configured override, then the
 * deployment's own callback location.
 *
 * <p>
 * <b>Security:</b> a {@code redirect_uri} in the POST body is followed as is, carrying {@code code} and {@code user}
 * to that host. Deployments that do not need per-request callbacks should set {@code apple.redirect-uri} and strip
 * {@code redirect_uri} from inbound requests at the edge. The token exchange still binds the code to the
 * {@code redirect_uri} Apple issued it for.
 */
@ApplicationScoped
public class CallbackNormalizer {

    private static final Logger LOG = Logger.getLogger(CallbackNormalizer.class);

    @Inject
    AdapterConfig config;

    /**
     * @param context
     *            incoming callback request
     * @return a redirect for the POST variant, empty when the request should continue to the code exchange
     */
    public Optional<CallbackRedirect> normalize(RequestContext context) {
        if (!context.isPost()) {
            return Optional.empty();
        }

        StringBuilder url = new StringBuilder(callbackUrl(context));
        Optional<String> code = context.param("code");
        Optional<String> state = context.param("state");
        if (code.isPresent() && state.isPresent()) {
            char separator = url.indexOf("?") >= 0 ? '&' : '?';
            url.append(separator).append("code=").append(encode(code.get()));
            url.append("&state=").append(encode(state.get()));
            context.param("user").ifPresent(user -> url.append("&user=").append(encode(user)));
        } else {
            LOG.warnf("Apple POST callback without code/state, redirecting without parameters");
        }

        LOG.debugf("Normalizing Apple form_post callback to GET %s", stripQuery(url));
        return Optional.of(new CallbackRedirect(URI.create(url.toString()), true));
    }

    /**
     * @param context
     *            current request
     * @return the callback URL Apple redirects to, also sent as {@code redirect_uri} on the token exchange
     */
    public String callbackUrl(RequestContext context) {
        return context.param("redirect_uri").or(() -> Optional.ofNullable(config.redirectUri()))
                .orElseGet(context::defaultCallbackUrl);
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    private static String stripQuery(CharSequence url) {
        String value = url.toString();
        int query = value.indexOf('?');
        return query < 0 ? value : value.substring(0, query);
    }
}
