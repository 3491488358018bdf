package com.tutorflow.tutorbackend.cart;

import com.tutorflow.tutorbackend.cart.dto.CartSummary;
import com.tutorflow.tutorbackend.course.Course;
import com.tutorflow.tutorbackend.course.CourseRepository;
import com.tutorflow.tutorbackend.course.CourseStatus;
import com.tutorflow.tutorbackend.enrollment.EnrollmentService;
import com.tutorflow.tutorbackend.error.BillingError;
import com.tutorflow.tutorbackend.error.BillingException;
import com.tutorflow.tutorbackend.payment.PaymentProperties;
import com.tutorflow.tutorbackend.user.User;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static com.tutorflow.tutorbackend.util.TestFixtures.course;
import static com.tutorflow.tutorbackend.util.TestFixtures.student;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

public class CartServiceTest {

    @Mock
    private CartRepository cartRepository;

    @Mock
    private CourseRepository courseRepository;

    @Mock
    private EnrollmentService enrollmentService;

    private CartService cartService;

    private User user;
    private Cart cart;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        Clock clock = Clock.fixed(Instant.parse("2024-03-01T10:00:00Z"), ZoneOffset.UTC);
        PaymentProperties payments = new PaymentProperties("test", "usd", null, null, null, null, null);
        cartService = new CartService(cartRepository, courseRepository, enrollmentService, payments, clock);

        user = student(1L);
        cart = new Cart();
        cart.setId(10L);
        cart.setUser(user);
        when(cartRepository.findByUser_Id(1L)).thenReturn(Optional.of(cart));
        when(cartRepository.save(any(Cart.class))).thenAnswer(i -> i.getArgument(0));
    }

    @Test
    void addItemIsIdempotent() {
        Course c = course(5L, "40.00");
        when(courseRepository.findById(5L)).thenReturn(Optional.of(c));

        cartService.addItem(user, null, 5L);
        CartSummary summary = cartService.addItem(user, null, 5L);

        assertEquals(1, summary.itemCount());
        assertEquals(1, cart.getItems().size());
    }

    @Test
    void addItemRejectsUnpublishedCourse() {
        Course c = course(5L, "40.00");
        c.setStatus(CourseStatus.DRAFT);
        when(courseRepository.findById(5L)).thenReturn(Optional.of(c));

        BillingException e = assertThrows(BillingException.class, () -> cartService.addItem(user, null, 5L));

        assertEquals(BillingError.COURSE_NOT_PUBLISHED, e.getError());
        assertTrue(cart.getItems().isEmpty());
    }

    @Test
    void addItemRejectsCourseTheUserIsEnrolledIn() {
        when(courseRepository.findById(5L)).thenReturn(Optional.of(course(5L, "40.00")));
        when(enrollmentService.isEnrolled(1L, 5L)).thenReturn(true);

        BillingException e = assertThrows(BillingException.class, () -> cartService.addItem(user, null, 5L));

        assertEquals(BillingError.ALREADY_ENROLLED, e.getError());
    }

    @Test
    void addItemRejectsUnknownCourse() {
        when(courseRepository.findById(99L)).thenReturn(Optional.empty());

        BillingException e = assertThrows(BillingException.class, () -> cartService.addItem(user, null, 99L));

        assertEquals(BillingError.NOT_FOUND, e.getError());
    }

    @Test
    void summaryUsesEffectivePrices() {
        when(courseRepository.findById(1L)).thenReturn(Optional.of(course(1L, "100.00", "60.00", null)));
        when(courseRepository.findById(2L)).thenReturn(Optional.of(course(2L, "40.00")));
        cartService.addItem(user, null, 1L);

        CartSummary summary = cartService.addItem(user, null, 2L);

        assertEquals(new BigDecimal("140.00"), summary.subtotal());
        assertEquals(new BigDecimal("40.00"), summary.discount());
        assertEquals(new BigDecimal("100.00"), summary.total());
        assertEquals("usd", summary.currency());
    }

    @Test
    void removeMissingItemFails() {
        BillingException e = assertThrows(BillingException.class, () -> cartService.removeItem(user, null, 7L));

        assertEquals(BillingError.NOT_FOUND, e.getError());
    }

    @Test
    void guestCartNeedsSessionId() {
        assertThrows(BillingException.class, () -> cartService.getSummary(null, " "));
    }

    @Test
    void mergeSkipsOwnedAndDuplicateCoursesAndDeletesGuestCart() {
        Course inBoth = course(1L, "10.00");
        Course owned = course(2L, "20.00");
        Course fresh = course(3L, "30.00");
        when(courseRepository.findById(1L)).thenReturn(Optional.of(inBoth));
        cartService.addItem(user, null, 1L);

        Cart guest = new Cart();
        guest.setId(20L);
        guest.setSessionId("guest-abc");
        for (Course c : List.of(inBoth, owned, fresh)) {
            CartItem item = new CartItem();
            item.setCart(guest);
            item.setCourse(c);
            guest.getItems().add(item);
        }
        when(cartRepository.findBySessionId("guest-abc")).thenReturn(Optional.of(guest));
        when(enrollmentService.isEnrolled(1L, 2L)).thenReturn(true);

        CartSummary merged = cartService.mergeGuestCart("guest-abc", user);

        assertEquals(2, merged.itemCount());
        assertTrue(cart.contains(1L));
        assertFalse(cart.contains(2L));
        assertTrue(cart.contains(3L));
        verify(cartRepository).delete(guest);
    }

    @Test
    void removePurchasedOnlyDropsThoseCourses() {
        when(courseRepository.findById(1L)).thenReturn(Optional.of(course(1L, "10.00")));
        when(courseRepository.findById(2L)).thenReturn(Optional.of(course(2L, "20.00")));
        cartService.addItem(user, null, 1L);
        cartService.addItem(user, null, 2L);

        cartService.removePurchased(user, List.of(1L));

        assertFalse(cart.contains(1L));
        assertTrue(cart.contains(2L));
    }
}
