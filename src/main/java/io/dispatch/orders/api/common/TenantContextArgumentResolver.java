package io.dispatch.orders.api.common;

import io.dispatch.orders.domain.BusinessException;
import io.dispatch.orders.domain.ErrorCode;
import io.dispatch.orders.domain.TenantContext;
import org.springframework.core.MethodParameter;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.context.request.RequestAttributes;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

/**
 * Supplies the {@link TenantContext} of a controller method. The authentication layer stores it
 * as request attribute {@value #ATTRIBUTE}; without one, the {@code X-Company-Id} and
 * {@code X-Unit-Id} headers are used.
 */
public class TenantContextArgumentResolver implements HandlerMethodArgumentResolver {

    public static final String ATTRIBUTE = "TenantContext";
    public static final String COMPANY_HEADER = "X-Company-Id";
    public static final String UNIT_HEADER = "X-Unit-Id";

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return TenantContext.class.equals(parameter.getParameterType());
    }

    @Override
    public TenantContext resolveArgument(MethodParameter parameter, ModelAndViewContainer mavContainer,
                                         NativeWebRequest webRequest, WebDataBinderFactory binderFactory) {
        var attribute = webRequest.getAttribute(ATTRIBUTE, RequestAttributes.SCOPE_REQUEST);
        if (attribute instanceof TenantContext tenant) {
            return tenant;
        }
        Long companyId = parseId(webRequest.getHeader(COMPANY_HEADER));
        if (companyId == null || companyId <= 0) {
            throw new BusinessException(ErrorCode.TENANT_UNRESOLVED);
        }
        return new TenantContext(companyId, parseId(webRequest.getHeader(UNIT_HEADER)));
    }

    private static Long parseId(String header) {
        if (header == null || header.isBlank()) return null;
        try {
            return Long.valueOf(header.trim());
        } catch (NumberFormatException e) {
            throw new BusinessException(ErrorCode.TENANT_UNRESOLVED, "Malformed tenant header: " + header, e);
        }
    }
}
