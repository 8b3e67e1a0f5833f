package com.fairway.revenueservice.infrastructure.web;

import com.fairway.observability.CorrelationContextHolder;
import com.fairway.security.AccessDeniedException;
import com.fairway.security.AuthenticatedUser;
import com.fairway.security.FairwaySecurityContext;
import com.fairway.security.Role;
import com.fairway.security.SecurityContextValidator;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import org.springframework.core.MethodParameter;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

/**
 * Builds the {@link FairwaySecurityContext} of a request from the identity headers set by the
 * authenticating gateway in front of the service.
 *
 * <p>Unknown role names are ignored. A request whose context is incomplete is denied.
 */
public class SecurityContextArgumentResolver implements HandlerMethodArgumentResolver {

    public static final String USER_HEADER = "X-User-ID";
    public static final String TENANT_HEADER = "X-Tenant-ID";
    public static final String ROLES_HEADER = "X-User-Roles";

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return FairwaySecurityContext.class.equals(parameter.getParameterType());
    }

    @Override
    public FairwaySecurityContext resolveArgument(MethodParameter parameter, ModelAndViewContainer mavContainer,
                                                  NativeWebRequest request, WebDataBinderFactory binderFactory) {
        String userId = request.getHeader(USER_HEADER);
        List<Role> roles = Optional.ofNullable(request.getHeader(ROLES_HEADER))
                .map(header -> Arrays.stream(header.split(","))
                        .map(Role::fromString)
                        .flatMap(Optional::stream)
                        .toList())
                .orElse(List.of());
        FairwaySecurityContext context = new FairwaySecurityContext(
                userId == null ? null : new AuthenticatedUser(userId, null, null),
                request.getHeader(TENANT_HEADER),
                roles,
                CorrelationContextHolder.currentCorrelationId());

        List<String> problems = SecurityContextValidator.validate(context);
        if (!problems.isEmpty()) {
            throw new AccessDeniedException("incomplete security context: " + String.join(", ", problems));
        }
        return context;
    }
}
