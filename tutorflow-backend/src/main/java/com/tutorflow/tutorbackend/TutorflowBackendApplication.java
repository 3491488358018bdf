package com.tutorflow.tutorbackend;

import com.tutorflow.tutorbackend.subscription.SubscriptionPlan;
import com.tutorflow.tutorbackend.subscription.SubscriptionPlanRepository;
import com.tutorflow.tutorbackend.user.Role;
import com.tutorflow.tutorbackend.user.User;
import com.tutorflow.tutorbackend.user.UserRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.Bean;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Slf4j
@EnableScheduling
@ConfigurationPropertiesScan
@SpringBootApplication
public class TutorflowBackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(TutorflowBackendApplication.class, args);
    }

    // Create admin user on startup
    @Bean
    public CommandLineRunner createAdmin(UserRepository userRepository,
                                         PasswordEncoder passwordEncoder,
                                         @Value("${app.seed.admin-email}") String adminEmail,
                                         @Value("${app.seed.admin-password}") String adminPassword) {
        return args -> {
            if (!userRepository.existsByEmail(adminEmail)) {
                User admin = new User();
                admin.setEmail(adminEmail);
                admin.setPassword(passwordEncoder.encode(adminPassword));
                admin.setRole(Role.ADMIN);
                admin.setDisplayName("Admin");

                userRepository.save(admin);
                log.info("Admin user created: {}", adminEmail);
            } else {
                log.info("Admin user already exists");
            }
        };
    }

    // Default plan catalog for an empty database
    @Bean
    public CommandLineRunner seedPlans(SubscriptionPlanRepository planRepository, Clock clock) {
        return args -> {
            if (planRepository.count() > 0) {
                return;
            }
            planRepository.save(plan("Basic", "basic", "Unlimited access to the basic catalog",
                    "9.99", "99.00", List.of("Basic catalog", "Progress tracking"), 10, null, 1, clock));
            planRepository.save(plan("Pro", "pro", "Everything, with certificates",
                    "19.99", "199.00", List.of("Full catalog", "Certificates", "Priority support"), null, 7, 2, clock));
            log.info("Seeded default subscription plans");
        };
    }

    private static SubscriptionPlan plan(String name, String slug, String description, String monthly, String yearly,
                                         List<String> features, Integer maxCourses, Integer trialDays, int priority,
                                         Clock clock) {
        SubscriptionPlan p = new SubscriptionPlan();
        p.setName(name);
        p.setSlug(slug);
        p.setDescription(description);
        p.setMonthlyPrice(new BigDecimal(monthly));
        p.setYearlyPrice(new BigDecimal(yearly));
        p.setFeatures(new ArrayList<>(features));
        p.setMaxCourses(maxCourses);
        p.setTrialDays(trialDays);
        p.setPriority(priority);
        p.setCreatedAt(Instant.now(clock));
        return p;
    }
}
