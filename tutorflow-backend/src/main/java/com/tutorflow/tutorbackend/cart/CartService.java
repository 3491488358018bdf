package com.tutorflow.tutorbackend.cart;

import com.tutorflow.tutorbackend.cart.dto.CartLine;
import com.tutorflow.tutorbackend.cart.dto.CartSummary;
import com.tutorflow.tutorbackend.course.Course;
import com.tutorflow.tutorbackend.course.CourseRepository;
import com.tutorflow.tutorbackend.enrollment.EnrollmentService;
import com.tutorflow.tutorbackend.error.BillingError;
import com.tutorflow.tutorbackend.error.BillingException;
import com.tutorflow.tutorbackend.payment.PaymentProperties;
import com.tutorflow.tutorbackend.pricing.PricingEngine;
import com.tutorflow.tutorbackend.user.User;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Carts are resolved from the signed-in user when there is one, otherwise from the
 * anonymous session id the client sends in {@code X-Cart-Session}.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class CartService {

    private final CartRepository cartRepository;
    private final CourseRepository courseRepository;
    private final EnrollmentService enrollmentService;
    private final PaymentProperties paymentProperties;
    private final Clock clock;

    @Transactional
    public Cart getOrCreate(User user, String sessionId) {
        if (user != null) {
            return cartRepository.findByUser_Id(user.getId()).orElseGet(() -> {
                Cart c = new Cart();
                c.setUser(user);
                return cartRepository.save(c);
            });
        }
        if (sessionId == null || sessionId.isBlank()) {
            throw BillingException.invalid("Missing cart session");
        }
        return cartRepository.findBySessionId(sessionId).orElseGet(() -> {
            Cart c = new Cart();
            c.setSessionId(sessionId);
            return cartRepository.save(c);
        });
    }

    @Transactional
    public CartSummary getSummary(User user, String sessionId) {
        return summarize(getOrCreate(user, sessionId));
    }

    /**
     * Idempotent: adding a course that is already in the cart returns the cart unchanged.
     */
    @Transactional
    public CartSummary addItem(User user, String sessionId, Long courseId) {
        Course course = courseRepository.findById(courseId)
                .orElseThrow(() -> BillingException.notFound("Course"));
        if (!course.isPublished()) {
            throw new BillingException(BillingError.COURSE_NOT_PUBLISHED, "Course is not available for purchase");
        }
        if (user != null && enrollmentService.isEnrolled(user.getId(), courseId)) {
            throw new BillingException(BillingError.ALREADY_ENROLLED, "You are already enrolled in this course");
        }

        Cart cart = getOrCreate(user, sessionId);
        if (!cart.contains(courseId)) {
            CartItem item = new CartItem();
            item.setCart(cart);
            item.setCourse(course);
            item.setAddedAt(Instant.now(clock));
            cart.getItems().add(item);
            cartRepository.save(cart);
            log.debug("Added course {} to cart {}", courseId, cart.getId());
        }
        return summarize(cart);
    }

    @Transactional
    public CartSummary removeItem(User user, String sessionId, Long courseId) {
        Cart cart = getOrCreate(user, sessionId);
        boolean removed = cart.getItems().removeIf(i -> i.getCourse().getId().equals(courseId));
        if (!removed) {
            throw BillingException.notFound("Cart item");
        }
        return summarize(cartRepository.save(cart));
    }

    @Transactional
    public CartSummary clear(User user, String sessionId) {
        Cart cart = getOrCreate(user, sessionId);
        cart.getItems().clear();
        return summarize(cartRepository.save(cart));
    }

    /** Drops purchased courses from the buyer's cart once an order settles. */
    @Transactional
    public void removePurchased(User user, Collection<Long> courseIds) {
        cartRepository.findByUser_Id(user.getId()).ifPresent(cart -> {
            if (cart.getItems().removeIf(i -> courseIds.contains(i.getCourse().getId()))) {
                cartRepository.save(cart);
            }
        });
    }

    /**
     * Moves a guest cart into the user's cart after login. Courses already in the user's cart
     * or already owned are skipped; the guest cart is deleted.
     */
    @Transactional
    public CartSummary mergeGuestCart(String sessionId, User user) {
        Cart userCart = getOrCreate(user, null);
        if (sessionId == null || sessionId.isBlank()) {
            return summarize(userCart);
        }
        Cart guest = cartRepository.findBySessionId(sessionId).orElse(null);
        if (guest == null) {
            return summarize(userCart);
        }

        int moved = 0;
        for (CartItem gi : guest.getItems()) {
            Course course = gi.getCourse();
            if (userCart.contains(course.getId()) || enrollmentService.isEnrolled(user.getId(), course.getId())) {
                continue;
            }
            CartItem item = new CartItem();
            item.setCart(userCart);
            item.setCourse(course);
            item.setAddedAt(gi.getAddedAt());
            userCart.getItems().add(item);
            moved++;
        }
        cartRepository.delete(guest);
        cartRepository.save(userCart);
        log.info("Merged {} item(s) from guest cart {} into cart of user {}", moved, sessionId, user.getId());
        return summarize(userCart);
    }

    public CartSummary summarize(Cart cart) {
        List<CartLine> lines = new ArrayList<>();
        BigDecimal subtotal = BigDecimal.ZERO;
        BigDecimal total = BigDecimal.ZERO;
        for (CartItem item : cart.getItems()) {
            Course c = item.getCourse();
            BigDecimal list = PricingEngine.money(c.getPrice());
            BigDecimal effective = PricingEngine.effectivePrice(c);
            lines.add(new CartLine(c.getId(), c.getTitle(), c.getSlug(), list, effective, c.isPublished()));
            subtotal = subtotal.add(list);
            total = total.add(effective);
        }
        return new CartSummary(
                cart.getSessionId(),
                lines,
                lines.size(),
                PricingEngine.money(subtotal),
                PricingEngine.money(subtotal.subtract(total)),
                PricingEngine.money(total),
                paymentProperties.currency()
        );
    }
}
