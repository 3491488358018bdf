package com.tutorflow.tutorbackend.cart;

import com.tutorflow.tutorbackend.cart.dto.AddToCartRequest;
import com.tutorflow.tutorbackend.cart.dto.CartSummary;
import com.tutorflow.tutorbackend.user.CurrentUserService;
import com.tutorflow.tutorbackend.user.User;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/cart")
@RequiredArgsConstructor
public class CartController {

    public static final String SESSION_HEADER = "X-Cart-Session";

    private final CartService cartService;
    private final CurrentUserService currentUserService;

    @GetMapping
    public CartSummary get(@RequestHeader(value = SESSION_HEADER, required = false) String sessionId) {
        return cartService.getSummary(currentUserService.getCurrentUserOrNull(), sessionId);
    }

    @PostMapping("/items")
    public CartSummary add(@RequestHeader(value = SESSION_HEADER, required = false) String sessionId,
                           @Valid @RequestBody AddToCartRequest request) {
        User user = currentUserService.getCurrentUserOrNull();
        return cartService.addItem(user, sessionId, request.courseId());
    }

    @DeleteMapping("/items/{courseId}")
    public CartSummary remove(@RequestHeader(value = SESSION_HEADER, required = false) String sessionId,
                              @PathVariable Long courseId) {
        return cartService.removeItem(currentUserService.getCurrentUserOrNull(), sessionId, courseId);
    }

    @DeleteMapping
    public CartSummary clear(@RequestHeader(value = SESSION_HEADER, required = false) String sessionId) {
        return cartService.clear(currentUserService.getCurrentUserOrNull(), sessionId);
    }
}
