package io.dispatch.orders.api.common;

import io.dispatch.orders.domain.BusinessException;
import io.dispatch.orders.domain.ErrorCode;
import io.dispatch.orders.domain.TenantContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.web.context.request.ServletWebRequest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TenantContextArgumentResolverTest {

    private final TenantContextArgumentResolver resolver = new TenantContextArgumentResolver();
    private MockHttpServletRequest request;

    @BeforeEach
    void setUp() {
        request = new MockHttpServletRequest();
    }

    @Test
    void shouldPreferContextSetByAuthentication() {
        request.setAttribute(TenantContextArgumentResolver.ATTRIBUTE, new TenantContext(3L, 30L));
        request.addHeader(TenantContextArgumentResolver.COMPANY_HEADER, "9");

        assertThat(resolve()).isEqualTo(new TenantContext(3L, 30L));
    }

    @Test
    void shouldFallBackToHeaders() {
        request.addHeader(TenantContextArgumentResolver.COMPANY_HEADER, "9");
        request.addHeader(TenantContextArgumentResolver.UNIT_HEADER, "90");

        assertThat(resolve()).isEqualTo(new TenantContext(9L, 90L));
    }

    @Test
    void shouldAllowMissingUnit() {
        request.addHeader(TenantContextArgumentResolver.COMPANY_HEADER, "9");

        assertThat(resolve().unitId()).isNull();
    }

    @Test
    void shouldRejectMissingCompany() {
        assertThatThrownBy(this::resolve)
            .isInstanceOfSatisfying(BusinessException.class,
                e -> assertThat(e.errorCode()).isEqualTo(ErrorCode.TENANT_UNRESOLVED));
    }

    @Test
    void shouldRejectMalformedCompany() {
        request.addHeader(TenantContextArgumentResolver.COMPANY_HEADER, "acme");

        assertThatThrownBy(this::resolve)
            .isInstanceOfSatisfying(BusinessException.class,
                e -> assertThat(e.errorCode()).isEqualTo(ErrorCode.TENANT_UNRESOLVED));
    }

    @Test
    void shouldRejectNonPositiveCompany() {
        request.addHeader(TenantContextArgumentResolver.COMPANY_HEADER, "0");

        assertThatThrownBy(this::resolve).isInstanceOf(BusinessException.class);
    }

    private TenantContext resolve() {
        return resolver.resolveArgument(null, null, new ServletWebRequest(request), null);
    }
}
