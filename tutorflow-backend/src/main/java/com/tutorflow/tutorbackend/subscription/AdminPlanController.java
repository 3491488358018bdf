package com.tutorflow.tutorbackend.subscription;

import com.tutorflow.tutorbackend.subscription.dto.PlanDto;
import com.tutorflow.tutorbackend.subscription.dto.PlanRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/admin/plans")
@RequiredArgsConstructor
public class AdminPlanController {

    private final SubscriptionPlanService planService;

    @GetMapping
    public List<PlanDto> all() {
        return planService.getAllPlans();
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public PlanDto create(@Valid @RequestBody PlanRequest request) {
        return planService.createPlan(request);
    }

    @PutMapping("/{slug}")
    public PlanDto update(@PathVariable String slug, @Valid @RequestBody PlanRequest request) {
        return planService.updatePlan(slug, request);
    }
}
