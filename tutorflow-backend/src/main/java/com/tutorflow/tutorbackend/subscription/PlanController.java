package com.tutorflow.tutorbackend.subscription;

import com.tutorflow.tutorbackend.subscription.dto.PlanDto;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/plans")
@RequiredArgsConstructor
public class PlanController {

    private final SubscriptionPlanService planService;

    @GetMapping
    public List<PlanDto> activePlans() {
        return planService.getActivePlans();
    }

    @GetMapping("/{slug}")
    public PlanDto plan(@PathVariable String slug) {
        return planService.getPlanBySlug(slug);
    }
}
