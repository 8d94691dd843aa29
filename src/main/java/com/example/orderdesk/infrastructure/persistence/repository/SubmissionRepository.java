package com.example.orderdesk.infrastructure.persistence.repository;

import com.example.orderdesk.infrastructure.persistence.entity.SubmissionEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface SubmissionRepository extends JpaRepository<SubmissionEntity, String> {

    Optional<SubmissionEntity> findFirstByOrderIdOrderBySequenceNumberDesc(String orderId);

    List<SubmissionEntity> findByOrderIdOrderBySequenceNumberAsc(String orderId);
}
