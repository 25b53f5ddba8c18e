package io.dispatch.orders.api.order;

import io.dispatch.orders.api.common.ApiResponse;
import io.dispatch.orders.domain.Order;
import io.dispatch.orders.domain.OrderQuery;
import io.dispatch.orders.domain.OrderSnapshot;
import io.dispatch.orders.domain.OrderingRules;
import io.dispatch.orders.domain.TenantContext;
import io.dispatch.orders.domain.usecase.ChangeOrderStatusUseCase;
import io.dispatch.orders.domain.usecase.CreateOrderUseCase;
import io.dispatch.orders.domain.usecase.FindOrdersUseCase;
import io.dispatch.orders.domain.usecase.UpdateOrderUseCase;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@RequestMapping("/api/current-orders")
public class CurrentOrderController {

    private final CreateOrderUseCase createOrderUseCase;
    private final UpdateOrderUseCase updateOrderUseCase;
    private final ChangeOrderStatusUseCase changeOrderStatusUseCase;
    private final FindOrdersUseCase findOrdersUseCase;
    private final OrderingRules rules;

    public CurrentOrderController(CreateOrderUseCase createOrderUseCase,
                                  UpdateOrderUseCase updateOrderUseCase,
                                  ChangeOrderStatusUseCase changeOrderStatusUseCase,
                                  FindOrdersUseCase findOrdersUseCase,
                                  OrderingRules rules) {
        this.createOrderUseCase = createOrderUseCase;
        this.updateOrderUseCase = updateOrderUseCase;
        this.changeOrderStatusUseCase = changeOrderStatusUseCase;
        this.findOrdersUseCase = findOrdersUseCase;
        this.rules = rules;
    }

    @PostMapping
    public ResponseEntity<ApiResponse<OrderSnapshot>> createOrder(TenantContext tenant,
                                                                  @RequestBody OrderRequest request) {
        var draft = request.toDraft(rules.zone());
        var order = createOrderUseCase.execute(new CreateOrderUseCase.Input(tenant, draft));
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.item(order.snapshot()));
    }

    @PutMapping("/{id}")
    public ApiResponse<OrderSnapshot> updateOrder(TenantContext tenant,
                                                  @PathVariable UUID id,
                                                  @RequestBody OrderRequest request) {
        var draft = request.toDraft(rules.zone());
        var order = updateOrderUseCase.execute(new UpdateOrderUseCase.Input(tenant, id, draft));
        return ApiResponse.item(order.snapshot());
    }

    @PatchMapping("/{id}/status")
    public ApiResponse<Void> changeStatus(TenantContext tenant,
                                          @PathVariable UUID id,
                                          @RequestBody StatusChangeRequest request) {
        changeOrderStatusUseCase.execute(new ChangeOrderStatusUseCase.Input(tenant, id, request.status()));
        return ApiResponse.success();
    }

    @GetMapping
    public ApiResponse<OrderSnapshot> listOrders(TenantContext tenant,
                                                 @RequestParam(required = false) String tab) {
        var orders = findOrdersUseCase.list(OrderQuery.forPanel(tenant.companyId(), tab));
        return ApiResponse.items(orders.stream().map(Order::snapshot).toList());
    }

    @GetMapping("/{id}")
    public ApiResponse<OrderDetailResponse> getOrder(TenantContext tenant, @PathVariable UUID id) {
        return ApiResponse.item(OrderDetailResponse.from(findOrdersUseCase.get(tenant, id)));
    }
}
