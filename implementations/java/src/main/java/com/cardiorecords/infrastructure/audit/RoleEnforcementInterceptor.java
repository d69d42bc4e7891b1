package com.cardiorecords.infrastructure.audit;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.HandlerInterceptor;
import org.springframework.web.servlet.HandlerMapping;

import java.util.Map;
import java.util.Set;

/**
 * Enforces {@link RequiresRole} after handler lookup and before argument
 * binding, so path and body validation never run for a caller without the
 * role. A denial is audited through the {@link AuditInterceptor} and surfaces
 * as an {@code AuthorizationException} to the exception handler.
 */
@Component
@RequiredArgsConstructor
public class RoleEnforcementInterceptor implements HandlerInterceptor {

    private final AuditInterceptor auditInterceptor;

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        if (!(handler instanceof HandlerMethod)) {
            return true;
        }
        HandlerMethod method = (HandlerMethod) handler;
        RequiresRole requiresRole = method.getMethodAnnotation(RequiresRole.class);
        if (requiresRole == null) {
            return true;
        }

        Audited audited = method.getMethodAnnotation(Audited.class);
        String path = request.getRequestURI();
        auditInterceptor.enforceRoles(AuditedCall.builder()
            .resourceKind(audited != null ? audited.resource() : AuditInterceptor.resourceKindOf(path))
            .resourceId(audited != null ? pathVariable(request, audited.resourceIdParam())
                : AuditInterceptor.resourceIdOf(path))
            .requiredRoles(Set.of(requiresRole.value()))
            .request(AuditInterceptor.requestMetadata(request))
            .build());
        return true;
    }

    @SuppressWarnings("unchecked")
    private static String pathVariable(HttpServletRequest request, String name) {
        if (name.isEmpty()) {
            return null;
        }
        Object variables = request.getAttribute(HandlerMapping.URI_TEMPLATE_VARIABLES_ATTRIBUTE);
        if (variables instanceof Map) {
            return ((Map<String, String>) variables).get(name);
        }
        return null;
    }
}
