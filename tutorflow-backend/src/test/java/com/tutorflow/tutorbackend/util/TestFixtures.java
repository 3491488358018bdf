package com.tutorflow.tutorbackend.util;

import com.tutorflow.tutorbackend.course.Course;
import com.tutorflow.tutorbackend.course.CourseStatus;
import com.tutorflow.tutorbackend.order.Order;
import com.tutorflow.tutorbackend.order.OrderItem;
import com.tutorflow.tutorbackend.order.OrderStatus;
import com.tutorflow.tutorbackend.user.Role;
import com.tutorflow.tutorbackend.user.User;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;

/** In-memory entities for unit tests; nothing here touches a database. */
public final class TestFixtures {

    private TestFixtures() {}

    public static User user(long id, Role role) {
        User u = new User();
        u.setId(id);
        u.setEmail("user" + id + "@tutorflow.test");
        u.setDisplayName("User " + id);
        u.setRole(role);
        return u;
    }

    public static User student(long id) {
        return user(id, Role.STUDENT);
    }

    public static Course course(long id, String price, String discountPrice, User instructor) {
        Course c = new Course();
        c.setId(id);
        c.setTitle("Course " + id);
        c.setSlug("course-" + id);
        c.setPrice(new BigDecimal(price));
        c.setDiscountPrice(discountPrice == null ? null : new BigDecimal(discountPrice));
        c.setStatus(CourseStatus.PUBLISHED);
        c.setInstructor(instructor);
        return c;
    }

    public static Course course(long id, String price) {
        return course(id, price, null, user(900 + id, Role.INSTRUCTOR));
    }

    /** A COMPLETED order with one item per course, each charged at its list price. */
    public static Order paidOrder(long id, User buyer, Instant paidAt, Course... courses) {
        Order o = new Order();
        o.setId(id);
        o.setOrderNumber("ORD-20240101-" + String.format("%08d", id));
        o.setUser(buyer);
        o.setCurrency("usd");
        o.setStatus(OrderStatus.COMPLETED);
        o.setCreatedAt(paidAt);
        o.setPaidAt(paidAt);
        o.setPaymentProvider("test");
        o.setPaymentReference("local_pi_" + id);

        BigDecimal total = BigDecimal.ZERO;
        long itemId = id * 100;
        for (Course c : courses) {
            OrderItem item = new OrderItem();
            item.setId(itemId++);
            item.setCourse(c);
            item.setPrice(c.getPrice());
            item.setPlatformFee(c.getPrice().multiply(new BigDecimal("0.30")).setScale(2, RoundingMode.HALF_UP));
            item.setInstructorShare(c.getPrice().subtract(item.getPlatformFee()));
            o.addItem(item);
            total = total.add(c.getPrice());
        }
        o.setSubtotal(total);
        o.setTotal(total);
        return o;
    }
}
