package com.cardiorecords.infrastructure.audit;

import com.cardiorecords.domain.model.AuditAction;
import com.cardiorecords.domain.model.ResourceKind;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a protected operation. Every invocation produces exactly one audit
 * entry, whether it returns or throws.
 */
@Documented
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface Audited {

    ResourceKind resource();

    /**
     * Explicit action. Empty means derive it from the HTTP method and path.
     */
    AuditAction[] action() default {};

    /**
     * Name of the method parameter holding the resource id, if any.
     */
    String resourceIdParam() default "";
}
