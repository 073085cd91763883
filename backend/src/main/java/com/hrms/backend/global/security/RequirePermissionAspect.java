package com.hrms.backend.global.security;

import java.lang.reflect.Method;
import java.util.List;

import com.hrms.backend.modules.auth.application.AuthProblems;
import com.hrms.backend.modules.auth.application.PermissionMatcher;
import com.hrms.backend.modules.auth.application.PermissionResolver;
import com.hrms.backend.modules.auth.application.PermissionSet;

import org.aspectj.lang.JoinPoint;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.annotation.Before;
import org.aspectj.lang.reflect.MethodSignature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.AnnotatedElementUtils;
import org.springframework.stereotype.Component;

/**
 * Enforces {@link RequirePermission} against the resolver's current view of the caller's grants,
 * so a revoked permission takes effect before the access token expires.
 */
@Aspect
@Component
public class RequirePermissionAspect {

    private static final Logger log = LoggerFactory.getLogger(RequirePermissionAspect.class);

    private final PermissionResolver permissionResolver;

    public RequirePermissionAspect(PermissionResolver permissionResolver) {
        this.permissionResolver = permissionResolver;
    }

    @Before("@within(com.hrms.backend.global.security.RequirePermission) "
            + "|| @annotation(com.hrms.backend.global.security.RequirePermission)")
    public void checkPermission(JoinPoint joinPoint) {
        RequirePermission requirement = findRequirement(joinPoint);
        if (requirement == null) {
            return;
        }
        AuthenticatedIdentity identity = SecurityUtils.currentIdentity();
        PermissionSet granted = permissionResolver.resolve(identity.userId());
        List<String> required = List.of(requirement.value());

        boolean allowed = requirement.mode() == RequirePermission.Mode.ALL
                ? PermissionMatcher.hasAll(granted.permissions(), required)
                : PermissionMatcher.hasAny(granted.permissions(), required);
        if (!allowed) {
            log.warn("User {} denied {} (requires {} of {})",
                    identity.userId(), joinPoint.getSignature().toShortString(), requirement.mode(), required);
            throw AuthProblems.permissionDenied();
        }
    }

    private static RequirePermission findRequirement(JoinPoint joinPoint) {
        Method method = ((MethodSignature) joinPoint.getSignature()).getMethod();
        RequirePermission onMethod = AnnotatedElementUtils.findMergedAnnotation(method, RequirePermission.class);
        if (onMethod != null) {
            return onMethod;
        }
        return AnnotatedElementUtils.findMergedAnnotation(joinPoint.getTarget().getClass(), RequirePermission.class);
    }
}
