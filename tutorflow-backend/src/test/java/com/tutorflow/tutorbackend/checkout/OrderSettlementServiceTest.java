package com.tutorflow.tutorbackend.checkout;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tutorflow.tutorbackend.bundle.Bundle;
import com.tutorflow.tutorbackend.bundle.BundlePurchase;
import com.tutorflow.tutorbackend.bundle.BundlePurchaseRepository;
import com.tutorflow.tutorbackend.bundle.BundleRepository;
import com.tutorflow.tutorbackend.cart.CartService;
import com.tutorflow.tutorbackend.course.Course;
import com.tutorflow.tutorbackend.enrollment.EnrollmentService;
import com.tutorflow.tutorbackend.notification.NotificationService;
import com.tutorflow.tutorbackend.notification.NotificationType;
import com.tutorflow.tutorbackend.notification.RelatedType;
import com.tutorflow.tutorbackend.order.Order;
import com.tutorflow.tutorbackend.order.OrderRepository;
import com.tutorflow.tutorbackend.order.OrderStatus;
import com.tutorflow.tutorbackend.payment.ProviderEvent;
import com.tutorflow.tutorbackend.revenue.RevenueService;
import com.tutorflow.tutorbackend.user.User;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static com.tutorflow.tutorbackend.util.TestFixtures.course;
import static com.tutorflow.tutorbackend.util.TestFixtures.paidOrder;
import static com.tutorflow.tutorbackend.util.TestFixtures.student;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

public class OrderSettlementServiceTest {

    private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");

    @Mock private OrderRepository orderRepository;
    @Mock private EnrollmentService enrollmentService;
    @Mock private RevenueService revenueService;
    @Mock private CartService cartService;
    @Mock private BundleRepository bundleRepository;
    @Mock private BundlePurchaseRepository bundlePurchaseRepository;
    @Mock private NotificationService notificationService;

    private OrderSettlementService settlement;
    private final ObjectMapper mapper = new ObjectMapper();

    private User buyer;
    private Order order;
    private Course first;
    private Course second;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        settlement = new OrderSettlementService(orderRepository, enrollmentService, revenueService, cartService,
                bundleRepository, bundlePurchaseRepository, notificationService,
                Clock.fixed(NOW, ZoneOffset.UTC));

        buyer = student(1L);
        first = course(1L, "30.00");
        second = course(2L, "20.00");
        order = paidOrder(5L, buyer, NOW, first, second);
        order.setStatus(OrderStatus.PENDING);
        order.setPaidAt(null);
        order.setPaymentReference("cs_test_1");
        when(orderRepository.findByOrderNumberForUpdate(order.getOrderNumber())).thenReturn(Optional.of(order));
    }

    private ProviderEvent event(String json) throws Exception {
        return ProviderEvent.parse(mapper.readTree(json));
    }

    @Test
    void confirmationEnrollsCreditsAndClearsCart() {
        boolean settled = settlement.onPaymentConfirmed(order.getOrderNumber(), "pi_123");

        assertTrue(settled);
        assertEquals(OrderStatus.COMPLETED, order.getStatus());
        assertEquals(NOW, order.getPaidAt());
        assertEquals("pi_123", order.getPaymentReference());
        verify(enrollmentService).enroll(buyer, first, order);
        verify(enrollmentService).enroll(buyer, second, order);
        verify(revenueService).createEarningsForOrder(order);
        verify(cartService).removePurchased(buyer, List.of(1L, 2L));
        verify(notificationService).notify(eq(buyer), eq(NotificationType.PURCHASE), eq(RelatedType.ORDER),
                eq(5L), anyString(), anyString());
    }

    @Test
    void secondConfirmationIsANoOp() {
        settlement.onPaymentConfirmed(order.getOrderNumber(), "pi_123");

        boolean again = settlement.onPaymentConfirmed(order.getOrderNumber(), "pi_123");

        assertFalse(again);
        verify(enrollmentService, times(2)).enroll(any(), any(), any());
        verify(revenueService, times(1)).createEarningsForOrder(order);
    }

    @Test
    void refundedOrderIsNotResettled() {
        order.setStatus(OrderStatus.REFUNDED);

        assertFalse(settlement.onPaymentConfirmed(order.getOrderNumber(), "pi_123"));
        verifyNoInteractions(enrollmentService, revenueService);
    }

    @Test
    void failedOrderCanStillBeConfirmed() {
        order.setStatus(OrderStatus.FAILED);

        assertTrue(settlement.onPaymentConfirmed(order.getOrderNumber(), null));
        assertEquals(OrderStatus.COMPLETED, order.getStatus());
        assertEquals("cs_test_1", order.getPaymentReference());
    }

    @Test
    void bundleSettlementRecordsPurchaseOnce() {
        Bundle bundle = new Bundle();
        bundle.setId(9L);
        bundle.setSlug("starter");
        bundle.setPurchaseCount(2);
        order.setBundle(bundle);
        when(bundlePurchaseRepository.existsByOrder_Id(5L)).thenReturn(false);
        when(bundleRepository.findByIdForUpdate(9L)).thenReturn(Optional.of(bundle));

        settlement.onPaymentConfirmed(order.getOrderNumber(), "pi_1");

        assertEquals(3, bundle.getPurchaseCount());
        ArgumentCaptor<BundlePurchase> purchase = ArgumentCaptor.forClass(BundlePurchase.class);
        verify(bundlePurchaseRepository).save(purchase.capture());
        assertSame(order, purchase.getValue().getOrder());
        assertEquals(order.getTotal(), purchase.getValue().getPricePaid());
    }

    @Test
    void paymentFailureOnlyMovesPendingOrders() {
        assertTrue(settlement.onPaymentFailed(order.getOrderNumber(), "card_declined"));
        assertEquals(OrderStatus.FAILED, order.getStatus());

        order.setStatus(OrderStatus.COMPLETED);
        assertFalse(settlement.onPaymentFailed(order.getOrderNumber(), "late failure"));
        assertEquals(OrderStatus.COMPLETED, order.getStatus());
    }

    @Test
    void sessionCompletedEventSettlesWithPaymentIntent() throws Exception {
        settlement.handle(event("""
                {"id":"evt_1","type":"checkout.session.completed","created":1709287200,
                 "data":{"object":{"id":"cs_test_1","payment_status":"paid","payment_intent":"pi_777",
                   "metadata":{"order_number":"%s"}}}}
                """.formatted(order.getOrderNumber())));

        assertEquals(OrderStatus.COMPLETED, order.getStatus());
        assertEquals("pi_777", order.getPaymentReference());
    }

    @Test
    void unpaidSessionWaitsForIntentEvents() throws Exception {
        settlement.handle(event("""
                {"id":"evt_2","type":"checkout.session.completed",
                 "data":{"object":{"id":"cs_test_1","payment_status":"unpaid",
                   "metadata":{"order_number":"%s"}}}}
                """.formatted(order.getOrderNumber())));

        assertEquals(OrderStatus.PENDING, order.getStatus());
    }

    @Test
    void intentFailedEventMarksOrderFailed() throws Exception {
        settlement.handle(event("""
                {"id":"evt_3","type":"payment_intent.payment_failed",
                 "data":{"object":{"id":"pi_9","last_payment_error":{"message":"Your card was declined."},
                   "metadata":{"order_number":"%s"}}}}
                """.formatted(order.getOrderNumber())));

        assertEquals(OrderStatus.FAILED, order.getStatus());
    }

    @Test
    void eventsWithoutOrderNumberAreIgnored() throws Exception {
        settlement.handle(event("""
                {"id":"evt_4","type":"checkout.session.completed",
                 "data":{"object":{"id":"cs_sub","payment_status":"paid","metadata":{"subscription_id":"4"}}}}
                """));

        verify(orderRepository, never()).findByOrderNumberForUpdate(any());
    }
}
