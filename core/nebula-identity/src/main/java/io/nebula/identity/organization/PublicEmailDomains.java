package io.nebula.identity.organization;

import io.nebula.identity.authentication.AuthConfig;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Consumer webmail domains. Users from these domains get a personal workspace
 * instead of joining a shared organization keyed by domain.
 *
 * The built-in list can be replaced with {@code nebula.auth.public-email-domains}.
 */
@ApplicationScoped
public class PublicEmailDomains {

    static final Set<String> DEFAULT_DOMAINS = Set.of(
        "gmail.com", "googlemail.com",
        "outlook.com", "hotmail.com", "live.com", "msn.com",
        "yahoo.com", "ymail.com",
        "icloud.com", "me.com", "mac.com",
        "aol.com",
        "protonmail.com", "proton.me",
        "gmx.com", "mail.com", "zoho.com"
    );

    @Inject
    AuthConfig authConfig;

    public boolean isPublic(String domain) {
        if (domain == null) {
            return false;
        }
        return domains().contains(domain.toLowerCase(Locale.ROOT));
    }

    private Set<String> domains() {
        return authConfig.publicEmailDomains()
            .map(PublicEmailDomains::normalize)
            .orElse(DEFAULT_DOMAINS);
    }

    private static Set<String> normalize(List<String> configured) {
        return configured.stream()
            .map(d -> d.trim().toLowerCase(Locale.ROOT))
            .filter(d -> !d.isEmpty())
            .collect(Collectors.toUnmodifiableSet());
    }
}
