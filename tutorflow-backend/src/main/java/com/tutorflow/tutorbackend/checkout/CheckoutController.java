package com.tutorflow.tutorbackend.checkout;

import com.tutorflow.tutorbackend.checkout.dto.CheckoutResult;
import com.tutorflow.tutorbackend.checkout.dto.CheckoutSession;
import com.tutorflow.tutorbackend.user.CurrentUserService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/checkout")
@RequiredArgsConstructor
public class CheckoutController {

    private final CheckoutService checkoutService;
    private final CurrentUserService currentUserService;

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public CheckoutSession checkout() {
        return checkoutService.checkout(currentUserService.getCurrentUserOrThrow());
    }

    @PostMapping("/orders/{orderNumber}/retry")
    public CheckoutSession retry(@PathVariable String orderNumber) {
        return checkoutService.retryPayment(currentUserService.getCurrentUserOrThrow(), orderNumber);
    }

    @PostMapping("/orders/{orderNumber}/confirm")
    public CheckoutResult confirm(@PathVariable String orderNumber) {
        return checkoutService.confirmLocalPayment(currentUserService.getCurrentUserOrThrow(), orderNumber);
    }
}
