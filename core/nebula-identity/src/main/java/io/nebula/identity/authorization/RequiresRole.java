package io.nebula.identity.authorization;

import io.nebula.identity.user.UserRole;
import jakarta.ws.rs.NameBinding;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Guards a JAX-RS resource or method with {@link RoleGuardFilter}.
 *
 * Usage:
 * <pre>
 * {@literal @}GET
 * {@literal @}RequiresRole(UserRole.COMPANY_ADMIN)
 * public Response listUsers() { ... }
 *
 * {@literal @}POST
 * {@literal @}RequiresRole(anyOf = {UserRole.FACILITATOR, UserRole.COMPANY_ADMIN})
 * public Response startSession() { ... }
 * </pre>
 *
 * The default, {@code @RequiresRole}, only requires an authenticated user.
 * A method annotation takes precedence over the class annotation.
 */
@NameBinding
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.TYPE, ElementType.METHOD})
public @interface RequiresRole {

    /**
     * Minimum role.
     */
    UserRole value() default UserRole.USER;

    /**
     * Explicit allow-set, checked in addition to the minimum. Empty means no restriction.
     */
    UserRole[] anyOf() default {};
}
