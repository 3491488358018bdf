package com.tutorflow.tutorbackend.subscription;

import com.tutorflow.tutorbackend.subscription.dto.ChangePlanRequest;
import com.tutorflow.tutorbackend.subscription.dto.SubscribeRequest;
import com.tutorflow.tutorbackend.subscription.dto.SubscriptionCheckout;
import com.tutorflow.tutorbackend.subscription.dto.SubscriptionDto;
import com.tutorflow.tutorbackend.user.CurrentUserService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/subscriptions")
@RequiredArgsConstructor
public class SubscriptionController {

    private final SubscriptionService subscriptionService;
    private final CurrentUserService currentUserService;

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public SubscriptionCheckout subscribe(@Valid @RequestBody SubscribeRequest request) {
        return subscriptionService.subscribe(currentUserService.getCurrentUserOrThrow(), request.planSlug(), request.interval());
    }

    @GetMapping("/current")
    public ResponseEntity<SubscriptionDto> current() {
        return subscriptionService.getCurrentSubscription(currentUserService.getCurrentUserOrThrow())
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @GetMapping("/mine")
    public List<SubscriptionDto> mine() {
        return subscriptionService.getMySubscriptions(currentUserService.getCurrentUserOrThrow());
    }

    @PostMapping("/cancel")
    public SubscriptionDto cancel() {
        return subscriptionService.cancel(currentUserService.getCurrentUserOrThrow());
    }

    @PostMapping("/resume")
    public SubscriptionDto resume() {
        return subscriptionService.resume(currentUserService.getCurrentUserOrThrow());
    }

    @PostMapping("/change-plan")
    public SubscriptionDto changePlan(@Valid @RequestBody ChangePlanRequest request) {
        return subscriptionService.changePlan(currentUserService.getCurrentUserOrThrow(), request.planSlug());
    }
}
