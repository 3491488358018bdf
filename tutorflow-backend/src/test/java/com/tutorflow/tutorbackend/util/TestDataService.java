package com.tutorflow.tutorbackend.util;

import com.tutorflow.tutorbackend.auth.CustomUserDetails;
import com.tutorflow.tutorbackend.course.Course;
import com.tutorflow.tutorbackend.course.CourseRepository;
import com.tutorflow.tutorbackend.course.CourseStatus;
import com.tutorflow.tutorbackend.user.Role;
import com.tutorflow.tutorbackend.user.User;
import com.tutorflow.tutorbackend.user.UserRepository;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors;
import org.springframework.stereotype.Service;
import org.springframework.test.web.servlet.request.RequestPostProcessor;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Persists users and courses for MockMvc tests. Every call uses fresh emails and slugs, so
 * tests sharing the in-memory database never collide.
 */
@Service
public class TestDataService {

    private final UserRepository userRepository;
    private final CourseRepository courseRepository;

    public TestDataService(UserRepository userRepository, CourseRepository courseRepository) {
        this.userRepository = userRepository;
        this.courseRepository = courseRepository;
    }

    public User createUser(Role role) {
        User user = new User();
        String tag = UUID.randomUUID().toString().substring(0, 8);
        user.setEmail(role.name().toLowerCase() + "-" + tag + "@tutorflow.test");
        user.setDisplayName("Test " + role.name().toLowerCase() + " " + tag);
        user.setPassword("secret");
        user.setRole(role);
        return userRepository.save(user);
    }

    public Course createPublishedCourse(User instructor, String price) {
        Course c = new Course();
        String tag = UUID.randomUUID().toString().substring(0, 8);
        c.setTitle("Course " + tag);
        c.setSlug("course-" + tag);
        c.setPrice(new BigDecimal(price));
        c.setStatus(CourseStatus.PUBLISHED);
        c.setInstructor(instructor);
        return courseRepository.save(c);
    }

    public static RequestPostProcessor as(User user) {
        CustomUserDetails principal = new CustomUserDetails(user);
        return SecurityMockMvcRequestPostProcessors.authentication(
                new UsernamePasswordAuthenticationToken(principal, null, principal.getAuthorities()));
    }
}
