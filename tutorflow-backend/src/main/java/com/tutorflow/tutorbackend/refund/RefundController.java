package com.tutorflow.tutorbackend.refund;

import com.tutorflow.tutorbackend.refund.dto.RefundDto;
import com.tutorflow.tutorbackend.refund.dto.RefundRequest;
import com.tutorflow.tutorbackend.user.CurrentUserService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/refunds")
@RequiredArgsConstructor
public class RefundController {

    private final RefundService refundService;
    private final CurrentUserService currentUserService;

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public RefundDto request(@Valid @RequestBody RefundRequest request) {
        return refundService.requestRefund(currentUserService.getCurrentUserOrThrow(),
                request.orderNumber(), request.reason(), request.description());
    }

    @GetMapping("/mine")
    public List<RefundDto> mine() {
        return refundService.getMyRefunds(currentUserService.getCurrentUserOrThrow());
    }
}
