package io.nebula.identity.account;

/**
 * What a single-use account token authorizes.
 */
public enum AccountTokenPurpose {
    EMAIL_VERIFICATION,
    PASSWORD_RESET
}
