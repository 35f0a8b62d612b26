package com.jobly.board.auth;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.HandlerInterceptor;
import org.springframework.web.servlet.HandlerMapping;

import java.util.Map;

/** Enforces {@link RequiresCapability} before the handler runs. */
@Component
public class CapabilityInterceptor implements HandlerInterceptor {
    private final AuthorizationPolicy policy;

    public CapabilityInterceptor(AuthorizationPolicy policy) {
        this.policy = policy;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        if (!(handler instanceof HandlerMethod method)) {
            return true;
        }
        RequiresCapability required = method.getMethodAnnotation(RequiresCapability.class);
        if (required == null) {
            return true;
        }
        String routeSubject = null;
        if (required.value() == Capability.ADMIN_OR_SELF) {
            routeSubject = pathVariable(request, required.subjectParam());
        }
        policy.check(required.value(), RequestIdentity.get(request), routeSubject);
        return true;
    }

    private static String pathVariable(HttpServletRequest request, String name) {
        Object variables = request.getAttribute(HandlerMapping.URI_TEMPLATE_VARIABLES_ATTRIBUTE);
        if (variables instanceof Map<?, ?> map) {
            Object value = map.get(name);
            return value == null ? null : value.toString();
        }
        return null;
    }
}
