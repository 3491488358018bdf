package com.tutorflow.tutorbackend.bundle;

import com.tutorflow.tutorbackend.user.User;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface BundlePurchaseRepository extends JpaRepository<BundlePurchase, Long> {

    boolean existsByOrder_Id(Long orderId);

    List<BundlePurchase> findByUserOrderByCreatedAtDesc(User user);
}
