package com.tutorflow.tutorbackend.revenue;

import com.tutorflow.tutorbackend.error.BillingError;
import com.tutorflow.tutorbackend.error.BillingException;
import com.tutorflow.tutorbackend.notification.NotificationService;
import com.tutorflow.tutorbackend.notification.NotificationType;
import com.tutorflow.tutorbackend.notification.RelatedType;
import com.tutorflow.tutorbackend.order.Order;
import com.tutorflow.tutorbackend.order.OrderItem;
import com.tutorflow.tutorbackend.payment.PaymentProperties;
import com.tutorflow.tutorbackend.pricing.PricingEngine;
import com.tutorflow.tutorbackend.revenue.dto.EarningDto;
import com.tutorflow.tutorbackend.revenue.dto.InstructorStats;
import com.tutorflow.tutorbackend.revenue.dto.PayoutDto;
import com.tutorflow.tutorbackend.revenue.dto.PayoutRequest;
import com.tutorflow.tutorbackend.user.User;
import com.tutorflow.tutorbackend.user.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;

/**
 * Instructor earnings ledger.
 *
 * Earnings start PENDING, become AVAILABLE after the hold period, and are marked PAID as
 * confirmed payouts cover them. The withdrawable balance is
 * (AVAILABLE + PAID earnings) - (PENDING + PAID payouts), so a pending payout reserves its
 * amount without moving any earning.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class RevenueService {

    private static final EnumSet<EarningStatus> BALANCE_EARNINGS = EnumSet.of(EarningStatus.AVAILABLE, EarningStatus.PAID);
    private static final EnumSet<PayoutStatus> RESERVED_PAYOUTS = EnumSet.of(PayoutStatus.PENDING, PayoutStatus.PAID);

    private final InstructorEarningRepository earningRepository;
    private final PayoutRepository payoutRepository;
    private final UserRepository userRepository;
    private final NotificationService notificationService;
    private final RevenueProperties revenueProperties;
    private final PaymentProperties paymentProperties;
    private final Clock clock;

    /**
     * One earning per order item. Runs at most once per order: a second call finds the existing
     * rows and does nothing, and the unique order_item key backs that up under races.
     */
    @Transactional
    public int createEarningsForOrder(Order order) {
        if (earningRepository.existsByOrderItem_Order_Id(order.getId())) {
            log.info("Earnings for order {} already exist, skipping", order.getOrderNumber());
            return 0;
        }
        Instant now = Instant.now(clock);
        Instant availableAt = now.plus(Duration.ofDays(revenueProperties.earningsHoldDays()));

        int created = 0;
        for (OrderItem item : order.getItems()) {
            InstructorEarning e = new InstructorEarning();
            e.setInstructor(item.getCourse().getInstructor());
            e.setOrderItem(item);
            e.setAmount(item.getInstructorShare());
            // split frozen on the item at checkout, so amount + fee always equals the price paid
            e.setPlatformFee(item.getPlatformFee());
            e.setStatus(EarningStatus.PENDING);
            e.setCreatedAt(now);
            e.setAvailableAt(availableAt);
            earningRepository.save(e);
            created++;
        }
        log.info("Created {} earning(s) for order {}", created, order.getOrderNumber());
        return created;
    }

    /** Refund side effect: earnings not yet paid out are cancelled. */
    @Transactional
    public int reverseEarningsForOrder(Order order) {
        int reversed = 0;
        for (InstructorEarning e : earningRepository.findByOrderItem_Order_Id(order.getId())) {
            switch (e.getStatus()) {
                case PENDING, AVAILABLE -> {
                    e.setStatus(EarningStatus.REVERSED);
                    reversed++;
                }
                case PAID -> log.warn("Earning {} for refunded order {} was already paid out; needs manual clawback",
                        e.getId(), order.getOrderNumber());
                case REVERSED -> {
                }
            }
        }
        log.info("Reversed {} earning(s) for order {}", reversed, order.getOrderNumber());
        return reversed;
    }

    @Transactional
    public int releaseMaturedEarnings() {
        List<InstructorEarning> matured = earningRepository
                .findByStatusAndAvailableAtLessThanEqual(EarningStatus.PENDING, Instant.now(clock));
        for (InstructorEarning e : matured) {
            e.setStatus(EarningStatus.AVAILABLE);
        }
        if (!matured.isEmpty()) {
            log.info("Released {} matured earning(s)", matured.size());
        }
        return matured.size();
    }

    public BigDecimal availableBalance(Long instructorId) {
        BigDecimal earned = earningRepository.sumAmount(instructorId, BALANCE_EARNINGS);
        BigDecimal reserved = payoutRepository.sumAmount(instructorId, RESERVED_PAYOUTS);
        return PricingEngine.money(earned.subtract(reserved));
    }

    @Transactional
    public PayoutDto requestPayout(User instructor, PayoutRequest request) {
        BigDecimal amount = request.amount() == null ? null : PricingEngine.money(request.amount());
        if (amount == null || amount.signum() <= 0) {
            throw BillingException.invalid("Payout amount must be positive");
        }

        // one balance check at a time per instructor
        User locked = userRepository.findByIdForUpdate(instructor.getId())
                .orElseThrow(() -> BillingException.notFound("Instructor"));

        BigDecimal available = availableBalance(locked.getId());
        if (amount.compareTo(available) > 0) {
            throw new BillingException(BillingError.INSUFFICIENT_FUNDS,
                    "Requested " + amount + " but only " + available + " is available");
        }
        if (amount.compareTo(revenueProperties.minimumPayout()) < 0) {
            throw new BillingException(BillingError.BELOW_MINIMUM,
                    "Minimum payout is " + PricingEngine.money(revenueProperties.minimumPayout()));
        }

        Payout payout = new Payout();
        payout.setInstructor(locked);
        payout.setAmount(amount);
        payout.setCurrency(paymentProperties.currency());
        payout.setMethod(request.method() == null || request.method().isBlank() ? "bank_transfer" : request.method());
        payout.setStatus(PayoutStatus.PENDING);
        payout.setCreatedAt(Instant.now(clock));
        payout = payoutRepository.save(payout);

        log.info("Payout {} of {} requested by instructor {}", payout.getId(), amount, locked.getId());
        return PayoutDto.from(payout);
    }

    /**
     * Marks a payout as paid out externally and settles AVAILABLE earnings oldest first, as far
     * as the instructor's paid-out total covers them.
     */
    @Transactional
    public PayoutDto confirmPayout(Long payoutId, String transactionId) {
        Payout payout = payoutRepository.findByIdForUpdate(payoutId)
                .orElseThrow(() -> BillingException.notFound("Payout"));
        if (payout.getStatus() != PayoutStatus.PENDING) {
            throw new BillingException(BillingError.NOT_PROCESSABLE, "Payout is " + payout.getStatus());
        }
        Long instructorId = payout.getInstructor().getId();
        // read the totals before this payout flips to PAID
        BigDecimal paidOut = payoutRepository.sumAmount(instructorId, EnumSet.of(PayoutStatus.PAID))
                .add(payout.getAmount());
        BigDecimal alreadySettled = earningRepository.sumAmount(instructorId, EnumSet.of(EarningStatus.PAID));

        Instant now = Instant.now(clock);
        payout.setStatus(PayoutStatus.PAID);
        payout.setTransactionId(transactionId);
        payout.setProcessedAt(now);

        BigDecimal uncovered = paidOut.subtract(alreadySettled);

        int settled = 0;
        for (InstructorEarning e : earningRepository
                .findByInstructor_IdAndStatusOrderByCreatedAtAscIdAsc(instructorId, EarningStatus.AVAILABLE)) {
            if (e.getAmount().compareTo(uncovered) > 0) {
                break;
            }
            e.setStatus(EarningStatus.PAID);
            e.setPaidAt(now);
            e.setPayout(payout);
            uncovered = uncovered.subtract(e.getAmount());
            settled++;
        }

        log.info("Payout {} confirmed (tx={}), {} earning(s) settled", payoutId, transactionId, settled);
        notificationService.notify(payout.getInstructor(), NotificationType.PAYOUT, RelatedType.PAYOUT, payout.getId(),
                "Payout sent", "Your payout of " + payout.getAmount() + " " + payout.getCurrency().toUpperCase() + " has been sent");
        return PayoutDto.from(payout);
    }

    @Transactional
    public PayoutDto failPayout(Long payoutId, String reason) {
        Payout payout = payoutRepository.findByIdForUpdate(payoutId)
                .orElseThrow(() -> BillingException.notFound("Payout"));
        if (payout.getStatus() != PayoutStatus.PENDING) {
            throw new BillingException(BillingError.NOT_PROCESSABLE, "Payout is " + payout.getStatus());
        }
        payout.setStatus(PayoutStatus.FAILED);
        payout.setFailureReason(reason);
        payout.setProcessedAt(Instant.now(clock));
        log.warn("Payout {} failed: {}", payoutId, reason);
        notificationService.notify(payout.getInstructor(), NotificationType.PAYOUT, RelatedType.PAYOUT, payout.getId(),
                "Payout failed", "Your payout of " + payout.getAmount() + " could not be completed and was returned to your balance");
        return PayoutDto.from(payout);
    }

    @Transactional(readOnly = true)
    public InstructorStats getInstructorStats(User instructor) {
        Long id = instructor.getId();
        BigDecimal lifetime = earningRepository.sumAmount(id,
                EnumSet.of(EarningStatus.PENDING, EarningStatus.AVAILABLE, EarningStatus.PAID));
        BigDecimal pending = earningRepository.sumAmount(id, EnumSet.of(EarningStatus.PENDING));
        BigDecimal pendingPayouts = payoutRepository.sumAmount(id, EnumSet.of(PayoutStatus.PENDING));
        BigDecimal withdrawn = payoutRepository.sumAmount(id, EnumSet.of(PayoutStatus.PAID));
        return new InstructorStats(
                PricingEngine.money(lifetime),
                PricingEngine.money(pending),
                availableBalance(id),
                PricingEngine.money(pendingPayouts),
                PricingEngine.money(withdrawn),
                paymentProperties.currency()
        );
    }

    @Transactional(readOnly = true)
    public Page<EarningDto> getEarnings(User instructor, int page, int size) {
        return earningRepository.findByInstructor_IdOrderByCreatedAtDesc(instructor.getId(), PageRequest.of(page, size))
                .map(EarningDto::from);
    }

    @Transactional(readOnly = true)
    public Page<PayoutDto> getPayouts(User instructor, int page, int size) {
        return payoutRepository.findByInstructor_IdOrderByCreatedAtDesc(instructor.getId(), PageRequest.of(page, size))
                .map(PayoutDto::from);
    }

    @Transactional(readOnly = true)
    public Page<PayoutDto> getPayoutsByStatus(PayoutStatus status, int page, int size) {
        return payoutRepository.findByStatusOrderByCreatedAtAsc(status, PageRequest.of(page, size))
                .map(PayoutDto::from);
    }
}
