/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.appleauth.api.rest;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import jakarta.ws.rs.core.MultivaluedMap;

import villagecompute.appleauth.services.RequestContext;
import villagecompute.appleauth.services.Session;

/**
 * {@link RequestContext} over JAX-RS query and form parameters. Form values win over query values of the same name;
 * only the first value of a repeated parameter is kept.
 */
final class JaxRsRequestContext implements RequestContext {

    private final String method;
    private final Map<String, String> params;
    private final Session session;
    private final String defaultCallbackUrl;

    JaxRsRequestContext(String method, MultivaluedMap<String, String> query, MultivaluedMap<String, String> form,
            Session session, String defaultCallbackUrl) {
        this.method = method;
        this.session = session;
        this.defaultCallbackUrl = defaultCallbackUrl;
        Map<String, String> merged = new LinkedHashMap<>();
        copyFirstValues(query, merged);
        copyFirstValues(form, merged);
        this.params = Collections.unmodifiableMap(merged);
    }

    @Override
    public Map<String, String> params() {
        return params;
    }

    @Override
    public String method() {
        return method;
    }

    @Override
    public Session session() {
        return session;
    }

    @Override
    public String defaultCallbackUrl() {
        return defaultCallbackUrl;
    }

    private static void copyFirstValues(MultivaluedMap<String, String> source, Map<String, String> target) {
        if (source == null) {
            return;
        }
        for (Map.Entry<String, List<String>> entry : source.entrySet()) {
            List<String> values = entry.getValue();
            if (values != null && !values.isEmpty() && values.get(0) != null) {
                target.put(entry.getKey(), values.get(0));
            }
        }
    }
}
