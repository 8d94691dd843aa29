package com.example.orderdesk.infrastructure.persistence.repository;

import com.example.orderdesk.domain.model.PaymentState;
import com.example.orderdesk.infrastructure.persistence.entity.PaymentEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface PaymentRepository extends JpaRepository<PaymentEntity, String> {

    List<PaymentEntity> findByOrderIdOrderByCreatedAtAsc(String orderId);

    boolean existsByOrderIdAndStateAndVerifiedPercentage(String orderId, PaymentState state, Integer verifiedPercentage);
}
