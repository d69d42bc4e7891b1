package com.cardiorecords.infrastructure.audit;

import com.cardiorecords.domain.model.Role;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Roles allowed to invoke an {@link Audited} operation. Web handlers are
 * checked by the {@link RoleEnforcementInterceptor} before argument binding;
 * other callers are checked inside the audit interceptor. Either way a denial
 * is recorded as {@code ACCESS_DENIED}.
 */
@Documented
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface RequiresRole {
    Role[] value();
}
