package com.tutorflow.tutorbackend.subscription;

import com.fasterxml.jackson.databind.JsonNode;
import com.tutorflow.tutorbackend.error.BillingError;
import com.tutorflow.tutorbackend.error.BillingException;
import com.tutorflow.tutorbackend.notification.NotificationService;
import com.tutorflow.tutorbackend.notification.NotificationType;
import com.tutorflow.tutorbackend.notification.RelatedType;
import com.tutorflow.tutorbackend.payment.PaymentEventHandler;
import com.tutorflow.tutorbackend.payment.PaymentGateway;
import com.tutorflow.tutorbackend.payment.PaymentGatewayException;
import com.tutorflow.tutorbackend.payment.PaymentProperties;
import com.tutorflow.tutorbackend.payment.PaymentSession;
import com.tutorflow.tutorbackend.payment.PaymentSessionRequest;
import com.tutorflow.tutorbackend.payment.ProviderEvent;
import com.tutorflow.tutorbackend.pricing.PricingEngine;
import com.tutorflow.tutorbackend.subscription.dto.SubscriptionCheckout;
import com.tutorflow.tutorbackend.subscription.dto.SubscriptionDto;
import com.tutorflow.tutorbackend.user.User;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Subscription lifecycle. A user holds at most one live (non-terminal) subscription; the
 * unique {@code live_user_id} column enforces that even for concurrent subscribe calls.
 *
 * Provider events may arrive late, twice or out of order. Events older than the last applied
 * one are dropped and terminal subscriptions are never revived.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SubscriptionService implements PaymentEventHandler {

    static final String SUB_UPDATED = "customer.subscription.updated";
    static final String SUB_DELETED = "customer.subscription.deleted";
    static final String INVOICE_FAILED = "invoice.payment_failed";
    static final String INVOICE_PAID = "invoice.paid";
    static final String INVOICE_SUCCEEDED = "invoice.payment_succeeded";
    static final String SESSION_COMPLETED = "checkout.session.completed";

    private static final Set<String> EVENT_TYPES = Set.of(
            SUB_UPDATED, SUB_DELETED, INVOICE_FAILED, INVOICE_PAID, INVOICE_SUCCEEDED, SESSION_COMPLETED);

    private final SubscriptionRepository repo;
    private final SubscriptionPlanRepository planRepo;
    private final PaymentGateway paymentGateway;
    private final PaymentProperties paymentProperties;
    private final NotificationService notificationService;
    private final Clock clock;

    @Transactional
    public SubscriptionCheckout subscribe(User user, String planSlug, BillingInterval interval) {
        if (repo.existsByLiveUserId(user.getId())) {
            throw new BillingException(BillingError.ALREADY_SUBSCRIBED, "You already have an active subscription");
        }
        SubscriptionPlan plan = planRepo.findBySlug(planSlug)
                .orElseThrow(() -> BillingException.notFound("Plan"));
        if (!plan.isActive()) {
            throw new BillingException(BillingError.PLAN_UNAVAILABLE, "Plan " + planSlug + " is not available");
        }
        BillingInterval billing = interval == null ? BillingInterval.MONTHLY : interval;
        BigDecimal price = PricingEngine.money(billing.priceOf(plan));

        ZonedDateTime now = ZonedDateTime.now(clock).withZoneSameInstant(ZoneOffset.UTC);

        Subscription sub = new Subscription();
        sub.setUser(user);
        sub.setPlan(plan);
        sub.setBillingInterval(billing);
        sub.setPrice(price);
        sub.setCurrentPeriodStart(now.toInstant());
        sub.setCreatedAt(now.toInstant());
        sub.setLiveUserId(user.getId());

        // --- Compute period end ---
        if (plan.hasTrial()) {
            ZonedDateTime trialEnd = now.plusDays(plan.getTrialDays());
            sub.setStatus(SubscriptionStatus.TRIALING);
            sub.setTrialEnd(trialEnd.toInstant());
            sub.setCurrentPeriodEnd(trialEnd.toInstant());
        } else {
            sub.setStatus(SubscriptionStatus.ACTIVE);
            sub.setCurrentPeriodEnd(billing.advance(now).toInstant());
        }

        try {
            sub = repo.saveAndFlush(sub);
        } catch (DataIntegrityViolationException e) {
            // lost the race against a concurrent subscribe for the same user
            throw new BillingException(BillingError.ALREADY_SUBSCRIBED, "You already have an active subscription", e);
        }

        // --- Collect payment; a provider failure rolls the subscription back ---
        PaymentSession session = null;
        if (price.signum() > 0) {
            session = openSession(user, sub, plan, billing, price);
            sub.setPaymentProvider(session.provider());
            if (paymentGateway.isLocal()) {
                sub.setProviderSubscriptionId("local_sub_" + UUID.randomUUID());
            }
        }

        log.info("User {} subscribed to {} ({}, {}), status {}", user.getId(), plan.getSlug(), billing, price, sub.getStatus());
        notificationService.notify(user, NotificationType.SUBSCRIPTION, RelatedType.SUBSCRIPTION, sub.getId(),
                "Subscription started",
                "Your subscription to " + plan.getName() + " is now " + sub.getStatus().name().toLowerCase());

        SubscriptionDto dto = SubscriptionDto.from(sub);
        return session == null
                ? new SubscriptionCheckout(dto, null, null, null, false)
                : new SubscriptionCheckout(dto, session.provider(), session.sessionId(), session.paymentUrl(), session.requiresRedirect());
    }

    private PaymentSession openSession(User user, Subscription sub, SubscriptionPlan plan, BillingInterval billing, BigDecimal price) {
        long minor = PricingEngine.toMinorUnits(price);
        PaymentSessionRequest request = new PaymentSessionRequest(
                minor,
                paymentProperties.currency(),
                List.of(new PaymentSessionRequest.LineItem(plan.getName() + " (" + billing.name().toLowerCase() + ")", minor, 1)),
                user.getEmail(),
                Map.of("subscription_id", String.valueOf(sub.getId()), "plan", plan.getSlug()),
                billing.providerInterval()
        );
        try {
            return paymentGateway.createCheckoutSession(request);
        } catch (PaymentGatewayException e) {
            log.error("Could not open {} subscription session for user {}: {}", paymentGateway.name(), user.getId(), e.getMessage());
            throw new BillingException(BillingError.PAYMENT_PROVIDER_FAILURE, "Payment provider is unavailable, please retry", e);
        }
    }

    @Transactional
    public SubscriptionDto cancel(User user) {
        Subscription sub = requireLive(user);
        if (sub.getStatus() != SubscriptionStatus.ACTIVE && sub.getStatus() != SubscriptionStatus.TRIALING) {
            throw new BillingException(BillingError.CONFLICT, "A " + sub.getStatus() + " subscription cannot be canceled");
        }
        if (sub.isCancelAtPeriodEnd()) {
            return SubscriptionDto.from(sub);
        }
        sub.setCancelAtPeriodEnd(true);
        sub.setCanceledAt(Instant.now(clock));
        log.info("Subscription {} of user {} will end at {}", sub.getId(), user.getId(), sub.getCurrentPeriodEnd());
        notificationService.notify(user, NotificationType.SUBSCRIPTION, RelatedType.SUBSCRIPTION, sub.getId(),
                "Subscription canceled",
                "Your subscription to " + sub.getPlan().getName() + " stays active until the end of the current period");
        return SubscriptionDto.from(sub);
    }

    @Transactional
    public SubscriptionDto resume(User user) {
        Subscription sub = requireLive(user);
        if (!sub.isCancelAtPeriodEnd()) {
            throw new BillingException(BillingError.NOT_SCHEDULED_FOR_CANCELLATION, "Subscription is not scheduled for cancellation");
        }
        sub.setCancelAtPeriodEnd(false);
        sub.setCanceledAt(null);
        log.info("Subscription {} of user {} resumed", sub.getId(), user.getId());
        return SubscriptionDto.from(sub);
    }

    /**
     * Switches plan immediately. The new price applies from the next period, with no proration.
     */
    @Transactional
    public SubscriptionDto changePlan(User user, String newPlanSlug) {
        Subscription sub = requireLive(user);
        SubscriptionPlan plan = planRepo.findBySlug(newPlanSlug)
                .orElseThrow(() -> BillingException.notFound("Plan"));
        if (!plan.isActive()) {
            throw new BillingException(BillingError.PLAN_UNAVAILABLE, "Plan " + newPlanSlug + " is not available");
        }
        if (plan.getId().equals(sub.getPlan().getId())) {
            throw BillingException.invalid("You are already on the " + plan.getName() + " plan");
        }
        String oldSlug = sub.getPlan().getSlug();
        sub.setPlan(plan);
        sub.setPrice(PricingEngine.money(sub.getBillingInterval().priceOf(plan)));
        log.info("Subscription {} moved from {} to {}", sub.getId(), oldSlug, plan.getSlug());
        return SubscriptionDto.from(sub);
    }

    @Transactional(readOnly = true)
    public Optional<SubscriptionDto> getCurrentSubscription(User user) {
        return repo.findByLiveUserId(user.getId()).map(SubscriptionDto::from);
    }

    @Transactional(readOnly = true)
    public List<SubscriptionDto> getMySubscriptions(User user) {
        return repo.findByUser_IdOrderByCreatedAtDesc(user.getId()).stream().map(SubscriptionDto::from).toList();
    }

    private Subscription requireLive(User user) {
        return repo.findLiveForUpdate(user.getId())
                .orElseThrow(() -> new BillingException(BillingError.NO_ACTIVE_SUBSCRIPTION, "You have no active subscription"));
    }

    // --- Scheduled expiry ---

    @Transactional
    public int expireCanceledAtPeriodEnd() {
        Instant now = Instant.now(clock);
        List<Subscription> due = repo.findByCancelAtPeriodEndTrueAndStatusInAndCurrentPeriodEndLessThanEqual(
                SubscriptionStatus.LIVE, now);
        for (Subscription sub : due) {
            end(sub, SubscriptionStatus.CANCELED, now);
            log.info("Subscription {} of user {} ended at period end", sub.getId(), sub.getUser().getId());
            notificationService.notify(sub.getUser(), NotificationType.SUBSCRIPTION, RelatedType.SUBSCRIPTION, sub.getId(),
                    "Subscription ended",
                    "Your subscription to " + sub.getPlan().getName() + " has ended");
        }
        return due.size();
    }

    // --- Provider events ---

    @Override
    public boolean supports(String eventType) {
        return EVENT_TYPES.contains(eventType);
    }

    @Override
    @Transactional
    public void handle(ProviderEvent event) {
        Optional<Subscription> found = locate(event);
        if (found.isEmpty()) {
            if (!SESSION_COMPLETED.equals(event.type())) {
                log.warn("No subscription matches {} event {}", event.type(), event.id());
            }
            return;
        }
        Subscription sub = found.get();

        if (sub.getStatus().isTerminal()) {
            log.info("Ignoring {} for terminal subscription {} ({})", event.type(), sub.getId(), sub.getStatus());
            return;
        }
        Instant eventTime = event.created();
        if (eventTime != null && sub.getLastProviderEventAt() != null && eventTime.isBefore(sub.getLastProviderEventAt())) {
            log.info("Ignoring stale {} for subscription {} (event {} < last applied {})",
                    event.type(), sub.getId(), eventTime, sub.getLastProviderEventAt());
            return;
        }

        switch (event.type()) {
            case SESSION_COMPLETED -> onSessionCompleted(sub, event);
            case SUB_UPDATED -> onSubscriptionUpdated(sub, event);
            case SUB_DELETED -> end(sub, SubscriptionStatus.EXPIRED, Instant.now(clock));
            case INVOICE_FAILED -> onInvoiceFailed(sub);
            case INVOICE_PAID, INVOICE_SUCCEEDED -> onInvoicePaid(sub, event);
            default -> {
                return;
            }
        }
        if (eventTime != null) {
            sub.setLastProviderEventAt(eventTime);
        }
        log.info("Applied {} to subscription {}, now {}", event.type(), sub.getId(), sub.getStatus());
    }

    private Optional<Subscription> locate(ProviderEvent event) {
        String providerId = switch (event.type()) {
            case SUB_UPDATED, SUB_DELETED -> event.objectId();
            case INVOICE_FAILED, INVOICE_PAID, INVOICE_SUCCEEDED -> event.text("subscription");
            default -> null;
        };
        if (providerId != null) {
            Optional<Subscription> byProvider = repo.findByProviderSubscriptionIdForUpdate(providerId);
            if (byProvider.isPresent()) {
                return byProvider;
            }
        }
        String localId = event.metadata("subscription_id");
        if (localId == null) {
            localId = event.text("subscription_details", "metadata", "subscription_id");
        }
        if (localId == null) {
            return Optional.empty();
        }
        try {
            return repo.findByIdForUpdate(Long.parseLong(localId));
        } catch (NumberFormatException e) {
            log.warn("Event {} carries a malformed subscription_id '{}'", event.id(), localId);
            return Optional.empty();
        }
    }

    private void onSessionCompleted(Subscription sub, ProviderEvent event) {
        String providerId = event.text("subscription");
        if (providerId != null && sub.getProviderSubscriptionId() == null) {
            sub.setProviderSubscriptionId(providerId);
        }
    }

    private void onSubscriptionUpdated(Subscription sub, ProviderEvent event) {
        SubscriptionStatus mapped = mapProviderStatus(event.text("status"));
        Instant start = event.epochSeconds("current_period_start");
        Instant end = event.epochSeconds("current_period_end");
        if (start != null && end != null && end.isAfter(start)) {
            sub.setCurrentPeriodStart(start);
            sub.setCurrentPeriodEnd(end);
        }
        Boolean cancelFlag = event.bool("cancel_at_period_end");
        if (cancelFlag != null && cancelFlag != sub.isCancelAtPeriodEnd()) {
            sub.setCancelAtPeriodEnd(cancelFlag);
            sub.setCanceledAt(cancelFlag ? Instant.now(clock) : null);
        }
        if (mapped == null) {
            return;
        }
        if (mapped.isTerminal()) {
            end(sub, mapped, Instant.now(clock));
        } else {
            sub.setStatus(mapped);
        }
    }

    private void onInvoiceFailed(Subscription sub) {
        if (sub.getStatus() == SubscriptionStatus.ACTIVE || sub.getStatus() == SubscriptionStatus.TRIALING) {
            sub.setStatus(SubscriptionStatus.PAST_DUE);
            notificationService.notify(sub.getUser(), NotificationType.SUBSCRIPTION, RelatedType.SUBSCRIPTION, sub.getId(),
                    "Payment failed",
                    "We could not charge your renewal for " + sub.getPlan().getName() + ". Please update your payment method.");
        }
    }

    /**
     * Moves the period forward. When the invoice names its period end that value is used as is,
     * so replaying the same invoice does not extend the subscription twice.
     */
    private void onInvoicePaid(Subscription sub, ProviderEvent event) {
        JsonNode period = event.path("lines", "data").path(0).path("period");
        Instant invoiceStart = period.path("start").canConvertToLong() && period.path("start").asLong() > 0
                ? Instant.ofEpochSecond(period.path("start").asLong()) : null;
        Instant invoiceEnd = period.path("end").canConvertToLong() && period.path("end").asLong() > 0
                ? Instant.ofEpochSecond(period.path("end").asLong()) : null;

        if (invoiceEnd != null) {
            if (invoiceEnd.isAfter(sub.getCurrentPeriodEnd()) || sub.getStatus() != SubscriptionStatus.ACTIVE) {
                sub.setCurrentPeriodStart(invoiceStart != null && invoiceStart.isBefore(invoiceEnd) ? invoiceStart : sub.getCurrentPeriodEnd());
                sub.setCurrentPeriodEnd(invoiceEnd);
            }
        } else {
            ZonedDateTime from = sub.getCurrentPeriodEnd().atZone(ZoneOffset.UTC);
            sub.setCurrentPeriodStart(from.toInstant());
            sub.setCurrentPeriodEnd(sub.getBillingInterval().advance(from).toInstant());
        }
        sub.setStatus(SubscriptionStatus.ACTIVE);
    }

    private void end(Subscription sub, SubscriptionStatus terminal, Instant now) {
        sub.setStatus(terminal);
        sub.setEndedAt(now);
        sub.setCancelAtPeriodEnd(false);
        sub.setLiveUserId(null);
    }

    static SubscriptionStatus mapProviderStatus(String providerStatus) {
        if (providerStatus == null) return null;
        return switch (providerStatus) {
            case "trialing" -> SubscriptionStatus.TRIALING;
            case "active" -> SubscriptionStatus.ACTIVE;
            case "past_due", "unpaid" -> SubscriptionStatus.PAST_DUE;
            case "canceled" -> SubscriptionStatus.CANCELED;
            case "incomplete_expired" -> SubscriptionStatus.EXPIRED;
            default -> null;
        };
    }
}
