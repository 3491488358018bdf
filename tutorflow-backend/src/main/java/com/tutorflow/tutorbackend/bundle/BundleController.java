package com.tutorflow.tutorbackend.bundle;

import com.tutorflow.tutorbackend.bundle.dto.BundleDto;
import com.tutorflow.tutorbackend.bundle.dto.BundlePurchaseDto;
import com.tutorflow.tutorbackend.checkout.dto.CheckoutSession;
import com.tutorflow.tutorbackend.shared.PaginatedResponse;
import com.tutorflow.tutorbackend.user.CurrentUserService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/bundles")
@RequiredArgsConstructor
public class BundleController {

    private final BundleService bundleService;
    private final CurrentUserService currentUserService;

    @GetMapping
    public PaginatedResponse<BundleDto> active(@RequestParam(defaultValue = "0") int page,
                                               @RequestParam(defaultValue = "20") int limit) {
        return PaginatedResponse.of(bundleService.getActiveBundles(page, limit));
    }

    @GetMapping("/by-slug/{slug}")
    public BundleDto bySlug(@PathVariable String slug) {
        return bundleService.getBySlug(slug);
    }

    @PostMapping("/{id}/purchase")
    @ResponseStatus(HttpStatus.CREATED)
    public CheckoutSession purchase(@PathVariable Long id) {
        return bundleService.purchaseBundle(currentUserService.getCurrentUserOrThrow(), id);
    }

    @GetMapping("/purchases/mine")
    public List<BundlePurchaseDto> myPurchases() {
        return bundleService.getMyPurchases(currentUserService.getCurrentUserOrThrow());
    }
}
