package com.cardiorecords.infrastructure.audit;

import com.cardiorecords.domain.model.RequestMetadata;
import lombok.RequiredArgsConstructor;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;
import org.springframework.core.annotation.AnnotatedElementUtils;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.context.request.RequestAttributes;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

import java.lang.reflect.Method;
import java.util.Set;

/**
 * Applies the {@link AuditInterceptor} to every {@link Audited} method.
 *
 * Runs outermost so the entry also covers failures of inner advice such as
 * transactions.
 */
@Aspect
@Component
@Order(0)
@RequiredArgsConstructor
public class AuditAspect {

    private final AuditInterceptor interceptor;

    @Around("@annotation(audited)")
    public Object audit(ProceedingJoinPoint joinPoint, Audited audited) throws Throwable {
        MethodSignature signature = (MethodSignature) joinPoint.getSignature();
        Method method = signature.getMethod();

        RequiresRole requiresRole = AnnotatedElementUtils.findMergedAnnotation(method, RequiresRole.class);
        ResponseStatus responseStatus = AnnotatedElementUtils.findMergedAnnotation(method, ResponseStatus.class);

        AuditedCall call = AuditedCall.builder()
            .explicitAction(audited.action().length > 0 ? audited.action()[0] : null)
            .resourceKind(audited.resource())
            .resourceId(resourceId(audited.resourceIdParam(), signature.getParameterNames(), joinPoint.getArgs()))
            .requiredRoles(requiresRole == null ? Set.of() : Set.of(requiresRole.value()))
            .request(currentRequest())
            .successStatus(responseStatus != null ? responseStatus.code().value() : 200)
            .build();

        return interceptor.intercept(call, joinPoint::proceed);
    }

    private static String resourceId(String parameterName, String[] names, Object[] args) {
        if (parameterName.isEmpty() || names == null) {
            return null;
        }
        for (int i = 0; i < names.length; i++) {
            if (parameterName.equals(names[i])) {
                return args[i] == null ? null : args[i].toString();
            }
        }
        throw new IllegalStateException("No parameter named '" + parameterName + "' on audited method");
    }

    private static RequestMetadata currentRequest() {
        RequestAttributes attributes = RequestContextHolder.getRequestAttributes();
        if (attributes instanceof ServletRequestAttributes) {
            return AuditInterceptor.requestMetadata(((ServletRequestAttributes) attributes).getRequest());
        }
        return RequestMetadata.none();
    }
}
