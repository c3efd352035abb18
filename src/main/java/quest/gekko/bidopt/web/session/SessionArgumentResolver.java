package quest.gekko.bidopt.web.session;

import lombok.RequiredArgsConstructor;
import org.springframework.core.MethodParameter;
import org.springframework.http.HttpHeaders;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;
import quest.gekko.bidopt.config.BidOptimizerProperties;
import quest.gekko.bidopt.domain.PlatformSession;
import quest.gekko.bidopt.exception.AuthException;

/**
 * Builds the {@link PlatformSession} of a request. The ads platform credential comes from
 * {@code Authorization: Bearer}; in multi-tenant mode the tenant comes from {@code X-Tenant-Id},
 * otherwise the configured default tenant (and static token, when no bearer is sent) is used.
 */
@RequiredArgsConstructor
public class SessionArgumentResolver implements HandlerMethodArgumentResolver {
    public static final String TENANT_HEADER = "X-Tenant-Id";
    private static final String BEARER_PREFIX = "Bearer ";

    private final BidOptimizerProperties.Tenancy tenancy;

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return PlatformSession.class.equals(parameter.getParameterType());
    }

    @Override
    public PlatformSession resolveArgument(MethodParameter parameter, ModelAndViewContainer mavContainer,
                                           NativeWebRequest webRequest, WebDataBinderFactory binderFactory) {
        String token = bearer(webRequest.getHeader(HttpHeaders.AUTHORIZATION));

        if (tenancy.multiTenant()) {
            String tenant = webRequest.getHeader(TENANT_HEADER);
            if (tenant == null || tenant.isBlank()) {
                throw new AuthException("Not authenticated");
            }
            return new PlatformSession(tenant.trim(), token);
        }
        return new PlatformSession(tenancy.defaultTenant(), token != null ? token : tenancy.staticAccessToken());
    }

    private static String bearer(String header) {
        if (header == null || !header.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            return null;
        }
        String token = header.substring(BEARER_PREFIX.length()).trim();
        return token.isEmpty() ? null : token;
    }
}
