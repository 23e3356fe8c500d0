package io.nebula.identity.authentication;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.UriInfo;

import java.net.URI;

/**
 * Public base URL of this service, used to build the OIDC callback, logout and account-mail URLs.
 *
 * Precedence: configured external-base-url, then X-Forwarded-Proto/X-Forwarded-Host
 * (first value of each, when trusted), then the request's own base URI.
 */
@ApplicationScoped
public class BaseUrlResolver {

    static final String FORWARDED_PROTO = "X-Forwarded-Proto";
    static final String FORWARDED_HOST = "X-Forwarded-Host";

    @Inject
    AuthConfig authConfig;

    public String resolve(HttpHeaders headers, UriInfo uriInfo) {
        return resolve(
            headers.getHeaderString(FORWARDED_PROTO),
            headers.getHeaderString(FORWARDED_HOST),
            uriInfo.getBaseUri()
        );
    }

    String resolve(String forwardedProto, String forwardedHost, URI requestBaseUri) {
        if (authConfig.externalBaseUrl().isPresent()) {
            return stripTrailingSlash(authConfig.externalBaseUrl().get());
        }

        String host = firstValue(forwardedHost);
        if (authConfig.trustForwardedHeaders() && host != null) {
            String proto = firstValue(forwardedProto);
            return (proto != null ? proto : requestBaseUri.getScheme()) + "://" + host;
        }

        return stripTrailingSlash(requestBaseUri.getScheme() + "://" + requestBaseUri.getRawAuthority());
    }

    /**
     * Proxies chain values as "a, b"; the first entry is the client-facing one.
     */
    private static String firstValue(String header) {
        if (header == null) {
            return null;
        }
        String first = header.split(",")[0].trim();
        return first.isEmpty() ? null : first;
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
