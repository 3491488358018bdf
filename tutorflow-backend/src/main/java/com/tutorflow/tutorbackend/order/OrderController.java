package com.tutorflow.tutorbackend.order;

import com.tutorflow.tutorbackend.order.dto.OrderDto;
import com.tutorflow.tutorbackend.shared.PaginatedResponse;
import com.tutorflow.tutorbackend.user.CurrentUserService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/orders")
@RequiredArgsConstructor
public class OrderController {

    private final OrderService orderService;
    private final CurrentUserService currentUserService;

    @GetMapping
    public PaginatedResponse<OrderDto> myOrders(@RequestParam(defaultValue = "0") int page,
                                                @RequestParam(defaultValue = "20") int size) {
        return PaginatedResponse.of(orderService.getMyOrders(currentUserService.getCurrentUserOrThrow(), page, size));
    }

    @GetMapping("/{orderNumber}")
    public OrderDto get(@PathVariable String orderNumber) {
        return orderService.getOrder(currentUserService.getCurrentUserOrThrow(), orderNumber);
    }
}
