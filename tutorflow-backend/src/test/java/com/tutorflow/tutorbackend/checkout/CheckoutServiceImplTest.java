package com.tutorflow.tutorbackend.checkout;

import com.tutorflow.tutorbackend.cart.Cart;
import com.tutorflow.tutorbackend.cart.CartItem;
import com.tutorflow.tutorbackend.cart.CartService;
import com.tutorflow.tutorbackend.checkout.dto.CheckoutResult;
import com.tutorflow.tutorbackend.checkout.dto.CheckoutSession;
import com.tutorflow.tutorbackend.course.Course;
import com.tutorflow.tutorbackend.course.CourseStatus;
import com.tutorflow.tutorbackend.enrollment.EnrollmentService;
import com.tutorflow.tutorbackend.error.BillingError;
import com.tutorflow.tutorbackend.error.BillingException;
import com.tutorflow.tutorbackend.order.Order;
import com.tutorflow.tutorbackend.order.OrderItem;
import com.tutorflow.tutorbackend.order.OrderService;
import com.tutorflow.tutorbackend.order.OrderStatus;
import com.tutorflow.tutorbackend.order.PricedLine;
import com.tutorflow.tutorbackend.payment.PaymentGateway;
import com.tutorflow.tutorbackend.user.User;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

import static com.tutorflow.tutorbackend.util.TestFixtures.course;
import static com.tutorflow.tutorbackend.util.TestFixtures.paidOrder;
import static com.tutorflow.tutorbackend.util.TestFixtures.student;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

public class CheckoutServiceImplTest {

    @Mock private CartService cartService;
    @Mock private EnrollmentService enrollmentService;
    @Mock private OrderService orderService;
    @Mock private OrderSettlementService settlementService;
    @Mock private PaymentSessionService paymentSessionService;
    @Mock private PaymentGateway paymentGateway;

    private CheckoutServiceImpl checkoutService;
    private User user;
    private Cart cart;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        TransactionTemplate tx = new TransactionTemplate(mock(PlatformTransactionManager.class));
        checkoutService = new CheckoutServiceImpl(cartService, enrollmentService, orderService,
                settlementService, paymentSessionService, paymentGateway, tx);

        user = student(1L);
        cart = new Cart();
        cart.setUser(user);
        when(cartService.getOrCreate(user, null)).thenReturn(cart);
    }

    private void addToCart(Course c) {
        CartItem item = new CartItem();
        item.setCart(cart);
        item.setCourse(c);
        cart.getItems().add(item);
    }

    private Order pendingOrder(long id, String total) {
        Order o = new Order();
        o.setId(id);
        o.setOrderNumber("ORD-20240301-0000000" + id);
        o.setUser(user);
        o.setStatus(OrderStatus.PENDING);
        o.setTotal(new BigDecimal(total));
        o.setCurrency("usd");
        return o;
    }

    @Test
    void emptyCartIsRejected() {
        BillingException e = assertThrows(BillingException.class, () -> checkoutService.checkout(user));

        assertEquals(BillingError.INVALID_INPUT, e.getError());
        verifyNoInteractions(orderService, paymentSessionService);
    }

    @Test
    void unpublishedCourseBlocksCheckout() {
        Course c = course(5L, "20.00");
        c.setStatus(CourseStatus.DRAFT);
        addToCart(c);

        BillingException e = assertThrows(BillingException.class, () -> checkoutService.checkout(user));

        assertEquals(BillingError.COURSE_NOT_PUBLISHED, e.getError());
        verify(orderService, never()).createPending(any(), any(), any(), any(), any());
    }

    @Test
    void ownedCourseBlocksCheckout() {
        addToCart(course(5L, "20.00"));
        when(enrollmentService.isEnrolled(1L, 5L)).thenReturn(true);

        BillingException e = assertThrows(BillingException.class, () -> checkoutService.checkout(user));

        assertEquals(BillingError.ALREADY_ENROLLED, e.getError());
    }

    @Test
    @SuppressWarnings("unchecked")
    void paidCartCreatesPendingOrderAtEffectivePricesAndOpensSession() {
        addToCart(course(1L, "100.00", "60.00", student(50L)));
        addToCart(course(2L, "40.00"));
        Order order = pendingOrder(7L, "100.00");
        when(orderService.createPending(eq(user), anyList(), any(), any(), isNull())).thenReturn(order);
        CheckoutSession session = new CheckoutSession(order.getOrderNumber(), "test", "local_x", null, false,
                order.getTotal(), "usd", "PENDING");
        when(paymentSessionService.open(7L)).thenReturn(session);

        CheckoutSession result = checkoutService.checkout(user);

        assertSame(session, result);
        ArgumentCaptor<List<PricedLine>> lines = ArgumentCaptor.forClass(List.class);
        verify(orderService).createPending(eq(user), lines.capture(), eq(new BigDecimal("100.00")),
                eq(BigDecimal.ZERO), isNull());
        assertEquals(new BigDecimal("60.00"), lines.getValue().get(0).price());
        assertEquals(new BigDecimal("40.00"), lines.getValue().get(0).discount());
        assertEquals(new BigDecimal("40.00"), lines.getValue().get(1).price());
        verify(settlementService, never()).onPaymentConfirmed(any(), any());
    }

    @Test
    void freeCartSettlesWithoutProvider() {
        addToCart(course(3L, "0.00"));
        Order order = pendingOrder(8L, "0.00");
        when(orderService.createPending(eq(user), anyList(), any(), any(), isNull())).thenReturn(order);
        when(settlementService.onPaymentConfirmed(order.getOrderNumber(), null)).thenAnswer(i -> {
            order.setStatus(OrderStatus.COMPLETED);
            return true;
        });
        CheckoutSession free = new CheckoutSession(order.getOrderNumber(), "free", null, null, false,
                BigDecimal.ZERO, "usd", "COMPLETED");
        when(paymentSessionService.settledWithoutPayment(order)).thenReturn(free);

        CheckoutSession result = checkoutService.checkout(user);

        assertEquals("COMPLETED", result.getStatus());
        verify(paymentSessionService, never()).open(any());
    }

    @Test
    void retryReopensFailedOrder() {
        Order order = pendingOrder(9L, "25.00");
        order.setStatus(OrderStatus.FAILED);
        when(orderService.requireOwned(user, order.getOrderNumber())).thenReturn(order);

        checkoutService.retryPayment(user, order.getOrderNumber());

        assertEquals(OrderStatus.PENDING, order.getStatus());
        verify(paymentSessionService).open(9L);
    }

    @Test
    void retryOfCompletedOrderConflicts() {
        Order order = paidOrder(10L, user, Instant.parse("2024-03-01T10:00:00Z"), course(1L, "10.00"));
        when(orderService.requireOwned(user, order.getOrderNumber())).thenReturn(order);

        BillingException e = assertThrows(BillingException.class,
                () -> checkoutService.retryPayment(user, order.getOrderNumber()));

        assertEquals(BillingError.CONFLICT, e.getError());
        verify(paymentSessionService, never()).open(any());
    }

    @Test
    void localConfirmationNeedsLocalGateway() {
        when(paymentGateway.isLocal()).thenReturn(false);

        BillingException e = assertThrows(BillingException.class,
                () -> checkoutService.confirmLocalPayment(user, "ORD-1"));

        assertEquals(BillingError.INVALID_INPUT, e.getError());
    }

    @Test
    void localConfirmationSettlesThroughSettlementService() {
        when(paymentGateway.isLocal()).thenReturn(true);
        Order order = pendingOrder(11L, "10.00");
        order.setPaymentReference("local_abc");
        Course c = course(4L, "10.00");
        OrderItem item = new OrderItem();
        item.setCourse(c);
        order.addItem(item);
        when(orderService.requireOwned(user, order.getOrderNumber())).thenReturn(order);
        when(settlementService.onPaymentConfirmed(order.getOrderNumber(), "local_abc")).thenReturn(true);

        CheckoutResult result = checkoutService.confirmLocalPayment(user, order.getOrderNumber());

        assertTrue(result.isSuccess());
        assertEquals("Payment confirmed", result.getMessage());
        assertEquals(List.of(4L), result.getEnrolledCourseIds());
    }
}
