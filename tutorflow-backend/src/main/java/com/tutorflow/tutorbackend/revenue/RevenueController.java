package com.tutorflow.tutorbackend.revenue;

import com.tutorflow.tutorbackend.revenue.dto.EarningDto;
import com.tutorflow.tutorbackend.revenue.dto.InstructorStats;
import com.tutorflow.tutorbackend.revenue.dto.PayoutDto;
import com.tutorflow.tutorbackend.revenue.dto.PayoutRequest;
import com.tutorflow.tutorbackend.shared.PaginatedResponse;
import com.tutorflow.tutorbackend.user.CurrentUserService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/instructor")
@RequiredArgsConstructor
public class RevenueController {

    private final RevenueService revenueService;
    private final CurrentUserService currentUserService;

    @GetMapping("/earnings/stats")
    public InstructorStats stats() {
        return revenueService.getInstructorStats(currentUserService.getCurrentUserOrThrow());
    }

    @GetMapping("/earnings")
    public PaginatedResponse<EarningDto> earnings(@RequestParam(defaultValue = "0") int page,
                                                  @RequestParam(defaultValue = "20") int size) {
        return PaginatedResponse.of(revenueService.getEarnings(currentUserService.getCurrentUserOrThrow(), page, size));
    }

    @GetMapping("/payouts")
    public PaginatedResponse<PayoutDto> payouts(@RequestParam(defaultValue = "0") int page,
                                                @RequestParam(defaultValue = "20") int size) {
        return PaginatedResponse.of(revenueService.getPayouts(currentUserService.getCurrentUserOrThrow(), page, size));
    }

    @PostMapping("/payouts")
    @ResponseStatus(HttpStatus.CREATED)
    public PayoutDto requestPayout(@Valid @RequestBody PayoutRequest request) {
        return revenueService.requestPayout(currentUserService.getCurrentUserOrThrow(), request);
    }
}
