package io.dispatch.orders.api.mobile;

import io.dispatch.orders.api.common.ApiResponse;
import io.dispatch.orders.domain.OrderQuery;
import io.dispatch.orders.domain.TenantContext;
import io.dispatch.orders.domain.usecase.FindOrdersUseCase;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * Read-only order endpoints of the courier app. A caller with a unit id sees only orders
 * assigned to that unit.
 */
@RestController
@RequestMapping("/api/mobile-orders")
public class MobileOrderController {

    private final FindOrdersUseCase findOrdersUseCase;

    public MobileOrderController(FindOrdersUseCase findOrdersUseCase) {
        this.findOrdersUseCase = findOrdersUseCase;
    }

    @GetMapping
    public ApiResponse<MobileOrderResponse> listOrders(TenantContext tenant,
                                                       @RequestParam(required = false) String tab) {
        var orders = findOrdersUseCase.list(OrderQuery.forCourier(tenant, tab));
        return ApiResponse.items(orders.stream().map(MobileOrderResponse::from).toList());
    }

    @GetMapping("/{id}")
    public ApiResponse<MobileOrderResponse> getOrder(TenantContext tenant, @PathVariable UUID id) {
        return ApiResponse.item(MobileOrderResponse.from(findOrdersUseCase.getForCourier(tenant, id)));
    }
}
