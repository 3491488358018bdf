package com.tutorflow.tutorbackend.bundle;

import com.tutorflow.tutorbackend.bundle.dto.BundleCreateRequest;
import com.tutorflow.tutorbackend.bundle.dto.BundleDto;
import com.tutorflow.tutorbackend.bundle.dto.BundlePurchaseDto;
import com.tutorflow.tutorbackend.bundle.dto.BundleUpdateRequest;
import com.tutorflow.tutorbackend.checkout.OrderSettlementService;
import com.tutorflow.tutorbackend.checkout.PaymentSessionService;
import com.tutorflow.tutorbackend.checkout.dto.CheckoutSession;
import com.tutorflow.tutorbackend.course.Course;
import com.tutorflow.tutorbackend.course.CourseRepository;
import com.tutorflow.tutorbackend.error.BillingError;
import com.tutorflow.tutorbackend.error.BillingException;
import com.tutorflow.tutorbackend.order.Order;
import com.tutorflow.tutorbackend.order.OrderService;
import com.tutorflow.tutorbackend.order.OrderStatus;
import com.tutorflow.tutorbackend.order.PricedLine;
import com.tutorflow.tutorbackend.pricing.BundlePrice;
import com.tutorflow.tutorbackend.pricing.PricingEngine;
import com.tutorflow.tutorbackend.shared.SlugUtil;
import com.tutorflow.tutorbackend.user.User;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
@Slf4j
@RequiredArgsConstructor
public class BundleService {

    private final BundleRepository bundleRepository;
    private final BundlePurchaseRepository purchaseRepository;
    private final CourseRepository courseRepository;
    private final OrderService orderService;
    private final OrderSettlementService settlementService;
    private final PaymentSessionService paymentSessionService;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    @Transactional
    public BundleDto createBundle(BundleCreateRequest req, User admin) {
        List<Long> ids = req.courseIds();
        if (ids == null || ids.isEmpty()) {
            throw new BillingException(BillingError.EMPTY_BUNDLE, "A bundle needs at least one course");
        }
        if (new HashSet<>(ids).size() != ids.size()) {
            throw BillingException.invalid("A course can only appear once in a bundle");
        }
        PricingEngine.validateDiscount(req.discountPercent());
        validateWindow(req.startDate(), req.endDate());

        Map<Long, Course> byId = courseRepository.findAllById(ids).stream()
                .collect(Collectors.toMap(Course::getId, Function.identity()));
        List<Course> courses = new ArrayList<>(ids.size());
        for (Long id : ids) {
            Course c = byId.get(id);
            if (c == null) {
                throw BillingException.notFound("Course " + id);
            }
            courses.add(c);
        }

        BundlePrice price = PricingEngine.bundlePrice(courses, req.discountPercent());

        Bundle b = new Bundle();
        b.setTitle(req.title().trim());
        b.setSlug(SlugUtil.uniqueSlug(req.title(), bundleRepository::existsBySlug));
        b.setDescription(req.description());
        b.setDiscountPercent(req.discountPercent());
        b.setOriginalPrice(price.originalPrice());
        b.setBundlePrice(price.bundlePrice());
        b.setStartDate(req.startDate());
        b.setEndDate(req.endDate());
        b.setMaxPurchases(req.maxPurchases());
        b.setCreatedBy(admin);

        int position = 1;
        for (Course c : courses) {
            b.getCourses().add(link(b, c, position++));
        }

        b = bundleRepository.save(b);
        log.info("Created bundle {} with {} course(s): {} -> {}", b.getSlug(), courses.size(),
                b.getOriginalPrice(), b.getBundlePrice());
        return BundleDto.from(b, Instant.now(clock));
    }

    @Transactional
    public BundleDto updateBundle(Long id, BundleUpdateRequest req) {
        Bundle b = requireBundle(id);

        if (req.getTitle() != null && !req.getTitle().isBlank()) b.setTitle(req.getTitle().trim());
        if (req.getDescription() != null) b.setDescription(req.getDescription().trim());
        if (req.getActive() != null) b.setActive(req.getActive());
        if (req.getMaxPurchases() != null) b.setMaxPurchases(req.getMaxPurchases() > 0 ? req.getMaxPurchases() : null);
        if (req.getStartDate() != null) b.setStartDate(req.getStartDate());
        if (req.getEndDate() != null) b.setEndDate(req.getEndDate());
        validateWindow(b.getStartDate(), b.getEndDate());
        if (req.getDiscountPercent() != null) {
            PricingEngine.validateDiscount(req.getDiscountPercent());
            b.setDiscountPercent(req.getDiscountPercent());
        }
        b.recomputeBundlePrice();

        log.info("Updated bundle {}", b.getSlug());
        return BundleDto.from(b, Instant.now(clock));
    }

    @Transactional
    public BundleDto addCourse(Long bundleId, Long courseId) {
        Bundle b = requireBundle(bundleId);
        if (b.containsCourse(courseId)) {
            throw new BillingException(BillingError.ALREADY_IN_BUNDLE, "Course is already in this bundle");
        }
        Course c = courseRepository.findById(courseId)
                .orElseThrow(() -> BillingException.notFound("Course"));

        b.getCourses().add(link(b, c, b.nextPosition()));
        b.setOriginalPrice(PricingEngine.money(b.getOriginalPrice().add(PricingEngine.effectivePrice(c))));
        b.recomputeBundlePrice();
        log.info("Added course {} to bundle {}, now {} -> {}", courseId, b.getSlug(), b.getOriginalPrice(), b.getBundlePrice());
        return BundleDto.from(b, Instant.now(clock));
    }

    @Transactional
    public BundleDto removeCourse(Long bundleId, Long courseId) {
        Bundle b = requireBundle(bundleId);
        BundleCourse link = b.getCourses().stream()
                .filter(bc -> bc.getCourse().getId().equals(courseId))
                .findFirst()
                .orElseThrow(() -> BillingException.notFound("Course in bundle"));

        b.getCourses().remove(link);
        BigDecimal reduced = b.getOriginalPrice().subtract(PricingEngine.effectivePrice(link.getCourse()));
        b.setOriginalPrice(PricingEngine.money(reduced.max(BigDecimal.ZERO)));
        b.recomputeBundlePrice();
        log.info("Removed course {} from bundle {}, now {} -> {}", courseId, b.getSlug(), b.getOriginalPrice(), b.getBundlePrice());
        return BundleDto.from(b, Instant.now(clock));
    }

    public boolean isAvailable(Bundle bundle, Instant now) {
        return bundle.isAvailable(now) && !bundle.getCourses().isEmpty();
    }

    /**
     * Creates a PENDING order for the bundle and opens a payment session for it. The bundle
     * price is spread over one item per course, weighted by each course's effective price, so
     * every instructor is credited for their own course. A zero-priced bundle settles at once.
     * <p>
     * The bundle row stays locked until the order is committed, and PENDING bundle orders count
     * against {@code maxPurchases} together with settled ones, so a capped bundle cannot be sold
     * past its cap. A FAILED order gives its place back.
     */
    public CheckoutSession purchaseBundle(User user, Long bundleId) {
        Order order = transactionTemplate.execute(status -> {
            Bundle b = bundleRepository.findByIdForUpdate(bundleId)
                    .orElseThrow(() -> BillingException.notFound("Bundle"));
            Instant now = Instant.now(clock);
            if (!isAvailable(b, now)) {
                throw new BillingException(BillingError.BUNDLE_UNAVAILABLE, "Bundle '" + b.getTitle() + "' is not available");
            }
            if (b.getMaxPurchases() != null) {
                long reserved = b.getPurchaseCount() + orderService.countPendingForBundle(b.getId());
                if (reserved >= b.getMaxPurchases()) {
                    throw new BillingException(BillingError.BUNDLE_UNAVAILABLE,
                            "Bundle '" + b.getTitle() + "' is sold out (" + reserved + " of " + b.getMaxPurchases() + " taken)");
                }
            }

            List<Course> courses = b.getCourses().stream().map(BundleCourse::getCourse).toList();
            if (courses.stream().anyMatch(c -> !c.isPublished())) {
                throw new BillingException(BillingError.BUNDLE_UNAVAILABLE, "Bundle '" + b.getTitle() + "' contains unavailable courses");
            }

            List<BigDecimal> weights = courses.stream().map(PricingEngine::effectivePrice).toList();
            List<BigDecimal> shares = PricingEngine.allocate(weights, b.getBundlePrice());
            List<PricedLine> lines = new ArrayList<>(courses.size());
            for (int i = 0; i < courses.size(); i++) {
                BigDecimal markdown = weights.get(i).subtract(shares.get(i)).max(BigDecimal.ZERO);
                lines.add(new PricedLine(courses.get(i), shares.get(i), markdown));
            }

            Order created = orderService.createPending(user, lines, b.getOriginalPrice(), b.getSavings(), b);
            if (created.isFree()) {
                settlementService.onPaymentConfirmed(created.getOrderNumber(), null);
            }
            return created;
        });

        if (order.getStatus() == OrderStatus.COMPLETED) {
            return paymentSessionService.settledWithoutPayment(order);
        }
        return paymentSessionService.open(order.getId());
    }

    @Transactional(readOnly = true)
    public Page<BundleDto> getActiveBundles(int page, int size) {
        Instant now = Instant.now(clock);
        return bundleRepository.findByActiveTrueOrderByCreatedAtDesc(PageRequest.of(page, size))
                .map(b -> BundleDto.from(b, now));
    }

    @Transactional(readOnly = true)
    public BundleDto getBySlug(String slug) {
        Bundle b = bundleRepository.findBySlug(slug).orElseThrow(() -> BillingException.notFound("Bundle"));
        return BundleDto.from(b, Instant.now(clock));
    }

    @Transactional(readOnly = true)
    public List<BundlePurchaseDto> getMyPurchases(User user) {
        return purchaseRepository.findByUserOrderByCreatedAtDesc(user).stream().map(BundlePurchaseDto::from).toList();
    }

    private Bundle requireBundle(Long id) {
        return bundleRepository.findById(id).orElseThrow(() -> BillingException.notFound("Bundle"));
    }

    private static BundleCourse link(Bundle b, Course c, int position) {
        BundleCourse bc = new BundleCourse();
        bc.setBundle(b);
        bc.setCourse(c);
        bc.setPosition(position);
        return bc;
    }

    private static void validateWindow(Instant start, Instant end) {
        if (start != null && end != null && !end.isAfter(start)) {
            throw BillingException.invalid("Bundle end date must be after its start date");
        }
    }
}
