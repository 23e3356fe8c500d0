package io.nebula.identity.organization;

import io.nebula.identity.shared.SecureTokens;

import java.util.Locale;

/**
 * Slug and name derivation for organizations.
 */
public final class OrganizationSlugs {

    public static final String PERSONAL_PREFIX = "personal-";

    static final int MAX_SLUG_LENGTH = 50;
    private static final int PERSONAL_HASH_CHARS = 12;

    private OrganizationSlugs() {
    }

    /**
     * URL-safe slug from a display name: lower-cased, punctuation dropped,
     * whitespace runs collapsed to single hyphens, at most 50 characters.
     */
    public static String slugify(String name) {
        if (name == null) {
            return "organization";
        }
        String slug = name.toLowerCase(Locale.ROOT)
            .replaceAll("[^a-z0-9\\s-]", "")
            .trim()
            .replaceAll("\\s+", "-")
            .replaceAll("-{2,}", "-");
        if (slug.length() > MAX_SLUG_LENGTH) {
            slug = slug.substring(0, MAX_SLUG_LENGTH);
        }
        slug = slug.replaceAll("^-+|-+$", "");
        return slug.isEmpty() ? "organization" : slug;
    }

    /**
     * Slug candidate for the given attempt: the base itself, then base-1, base-2, ...
     */
    public static String candidate(String base, int attempt) {
        return attempt == 0 ? base : base + "-" + attempt;
    }

    /**
     * Organization name from an email domain: the first label, capitalized.
     * "acme.co.uk" becomes "Acme".
     */
    public static String nameFromDomain(String domain) {
        String label = domain.split("\\.")[0];
        if (label.isEmpty()) {
            return domain;
        }
        return label.substring(0, 1).toUpperCase(Locale.ROOT) + label.substring(1);
    }

    /**
     * Deterministic slug of the personal workspace owned by a federated subject.
     * The same subject always maps to the same slug.
     */
    public static String personalSlug(String federatedSubjectId) {
        return PERSONAL_PREFIX + SecureTokens.sha256Hex(federatedSubjectId).substring(0, PERSONAL_HASH_CHARS);
    }

    public static String personalName(String displayName) {
        return displayName + "'s Workspace";
    }
}
