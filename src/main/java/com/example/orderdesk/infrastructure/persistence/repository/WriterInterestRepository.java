package com.example.orderdesk.infrastructure.persistence.repository;

import com.example.orderdesk.domain.model.WriterInterestState;
import com.example.orderdesk.infrastructure.persistence.entity.WriterInterestEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface WriterInterestRepository extends JpaRepository<WriterInterestEntity, String> {

    Optional<WriterInterestEntity> findByOrderIdAndWriterId(String orderId, String writerId);

    List<WriterInterestEntity> findByOrderIdAndState(String orderId, WriterInterestState state);

    List<WriterInterestEntity> findByOrderIdOrderByCreatedAtAsc(String orderId);

    long countByOrderIdAndState(String orderId, WriterInterestState state);
}
