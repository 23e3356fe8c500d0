package io.nebula.identity.organization;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class OrganizationSlugsTest {

    @Test
    @DisplayName("slugify should lower-case, drop punctuation and hyphenate whitespace")
    void slugify_shouldProduceUrlSafeSlug() {
        assertThat(OrganizationSlugs.slugify("Acme  Corp, Inc.")).isEqualTo("acme-corp-inc");
        assertThat(OrganizationSlugs.slugify("!!!")).isEqualTo("organization");
        assertThat(OrganizationSlugs.slugify("x".repeat(80))).hasSize(50);
    }

    @Test
    @DisplayName("candidate should return the base first, then numbered variants")
    void candidate_shouldNumberAttemptsAfterFirst() {
        assertThat(OrganizationSlugs.candidate("acme", 0)).isEqualTo("acme");
        assertThat(OrganizationSlugs.candidate("acme", 2)).isEqualTo("acme-2");
    }

    @Test
    @DisplayName("nameFromDomain should capitalize the first label")
    void nameFromDomain_shouldCapitalizeFirstLabel() {
        assertThat(OrganizationSlugs.nameFromDomain("acme.co.uk")).isEqualTo("Acme");
    }

    @Test
    @DisplayName("personalSlug should be stable per subject and differ across subjects")
    void personalSlug_shouldBeDeterministic() {
        String slug = OrganizationSlugs.personalSlug("subject-1");

        assertThat(slug).isEqualTo(OrganizationSlugs.personalSlug("subject-1"));
        assertThat(slug).isNotEqualTo(OrganizationSlugs.personalSlug("subject-2"));
        assertThat(slug).matches("personal-[0-9a-f]{12}");
    }
}
