package io.dispatch.orders.domain;

/**
 * Identity of the caller as produced once per request by the authentication layer.
 *
 * @param companyId tenant the caller acts for
 * @param unitId    company unit (dispatcher or courier) of the caller, if any
 */
public record TenantContext(long companyId, Long unitId) {

    public TenantContext {
        if (companyId <= 0) throw new IllegalArgumentException("companyId must be positive");
    }

    public static TenantContext of(long companyId) {
        return new TenantContext(companyId, null);
    }
}
