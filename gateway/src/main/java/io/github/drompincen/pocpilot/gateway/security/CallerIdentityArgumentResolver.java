package io.github.drompincen.pocpilot.gateway.security;

import io.github.drompincen.pocpilot.protocol.api.UserRole;
import io.github.drompincen.pocpilot.runtime.security.CallerIdentity;
import org.springframework.core.MethodParameter;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

/**
 * Builds the {@link CallerIdentity} of a controller method from the headers the
 * authenticating edge sets. Authentication itself happens before the request gets here.
 */
public class CallerIdentityArgumentResolver implements HandlerMethodArgumentResolver {

    public static final String TENANT_HEADER = "X-Tenant-Id";
    public static final String USER_HEADER = "X-User-Id";
    public static final String ROLE_HEADER = "X-User-Role";

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return CallerIdentity.class.equals(parameter.getParameterType());
    }

    @Override
    public CallerIdentity resolveArgument(MethodParameter parameter, ModelAndViewContainer mavContainer,
                                          NativeWebRequest request, WebDataBinderFactory binderFactory) {
        return resolve(request.getHeader(TENANT_HEADER), request.getHeader(USER_HEADER), request.getHeader(ROLE_HEADER));
    }

    static CallerIdentity resolve(String tenantId, String userId, String role) {
        if (userId == null || userId.isBlank()) {
            throw new MissingCallerException("Missing " + USER_HEADER + " header");
        }
        if (role == null || role.isBlank()) {
            throw new MissingCallerException("Missing " + ROLE_HEADER + " header");
        }
        UserRole parsed;
        try {
            parsed = UserRole.parse(role);
        } catch (IllegalArgumentException e) {
            throw new MissingCallerException("Unknown role: " + role);
        }
        String tenant = tenantId == null || tenantId.isBlank() ? null : tenantId.trim();
        return new CallerIdentity(tenant, userId.trim(), parsed);
    }
}
