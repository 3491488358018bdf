package com.tutorflow.tutorbackend.checkout;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tutorflow.tutorbackend.course.Course;
import com.tutorflow.tutorbackend.order.Order;
import com.tutorflow.tutorbackend.order.OrderRepository;
import com.tutorflow.tutorbackend.order.OrderStatus;
import com.tutorflow.tutorbackend.user.Role;
import com.tutorflow.tutorbackend.user.User;
import com.tutorflow.tutorbackend.util.TestDataService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Map;

import static com.tutorflow.tutorbackend.util.TestDataService.as;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
public class CheckoutControllerTest {

    @Autowired private MockMvc mockMvc;
    @Autowired private ObjectMapper objectMapper;
    @Autowired private TestDataService testData;
    @Autowired private OrderRepository orderRepository;

    private User student;
    private Course course;

    @BeforeEach
    void setUp() {
        User instructor = testData.createUser(Role.INSTRUCTOR);
        student = testData.createUser(Role.STUDENT);
        course = testData.createPublishedCourse(instructor, "40.00");
    }

    private String checkoutCart() throws Exception {
        mockMvc.perform(post("/api/cart/items")
                        .with(as(student))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("courseId", course.getId()))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.itemCount").value(1));

        String body = mockMvc.perform(post("/api/checkout").with(as(student)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.status").value("PENDING"))
                .andExpect(jsonPath("$.provider").value("test"))
                .andExpect(jsonPath("$.total").value(40.00))
                .andReturn().getResponse().getContentAsString();
        JsonNode session = objectMapper.readTree(body);
        return session.get("orderNumber").asText();
    }

    @Test
    void purchaseConfirmEnrollAndRefund() throws Exception {
        String orderNumber = checkoutCart();

        mockMvc.perform(post("/api/checkout/orders/{n}/confirm", orderNumber).with(as(student)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.message").value("Payment confirmed"))
                .andExpect(jsonPath("$.enrolledCourseIds[0]").value(course.getId()));

        // a second confirmation changes nothing
        mockMvc.perform(post("/api/checkout/orders/{n}/confirm", orderNumber).with(as(student)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Order was already paid"));

        mockMvc.perform(get("/api/enrollments/mine").with(as(student)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].courseId").value(course.getId()))
                .andExpect(jsonPath("$[0].status").value("ACTIVE"));

        mockMvc.perform(get("/api/cart").with(as(student)))
                .andExpect(jsonPath("$.itemCount").value(0));

        String refund = objectMapper.writeValueAsString(Map.of("orderNumber", orderNumber, "reason", "NO_LONGER_NEEDED"));
        mockMvc.perform(post("/api/refunds").with(as(student)).contentType(MediaType.APPLICATION_JSON).content(refund))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.status").value("APPROVED"))
                .andExpect(jsonPath("$.amount").value(40.00));

        mockMvc.perform(post("/api/refunds").with(as(student)).contentType(MediaType.APPLICATION_JSON).content(refund))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.reason").value("duplicate_refund"));

        mockMvc.perform(get("/api/enrollments/mine").with(as(student)))
                .andExpect(jsonPath("$[0].status").value("REVOKED"));

        Order order = orderRepository.findByOrderNumber(orderNumber).orElseThrow();
        assertEquals(OrderStatus.REFUNDED, order.getStatus());
    }

    @Test
    void ownedCourseCannotBeAddedAgain() throws Exception {
        String orderNumber = checkoutCart();
        mockMvc.perform(post("/api/checkout/orders/{n}/confirm", orderNumber).with(as(student)))
                .andExpect(status().isOk());

        mockMvc.perform(post("/api/cart/items")
                        .with(as(student))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("courseId", course.getId()))))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.reason").value("already_enrolled"));
    }

    @Test
    void emptyCartCheckoutIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/checkout").with(as(student)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.reason").value("invalid_input"));
    }

    @Test
    void someoneElsesOrderIsForbidden() throws Exception {
        String orderNumber = checkoutCart();
        User stranger = testData.createUser(Role.STUDENT);

        mockMvc.perform(post("/api/checkout/orders/{n}/confirm", orderNumber).with(as(stranger)))
                .andExpect(status().isForbidden());
    }

    @Test
    void checkoutRequiresAuthentication() throws Exception {
        mockMvc.perform(post("/api/checkout"))
                .andExpect(status().isUnauthorized());
    }
}
