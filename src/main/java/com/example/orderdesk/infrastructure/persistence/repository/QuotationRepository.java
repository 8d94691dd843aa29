package com.example.orderdesk.infrastructure.persistence.repository;

import com.example.orderdesk.infrastructure.persistence.entity.QuotationEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface QuotationRepository extends JpaRepository<QuotationEntity, String> {

    Optional<QuotationEntity> findByOrderId(String orderId);
}
