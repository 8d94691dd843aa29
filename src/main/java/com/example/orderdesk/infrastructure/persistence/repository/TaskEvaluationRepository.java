package com.example.orderdesk.infrastructure.persistence.repository;

import com.example.orderdesk.domain.model.TaskEvaluationState;
import com.example.orderdesk.infrastructure.persistence.entity.TaskEvaluationEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface TaskEvaluationRepository extends JpaRepository<TaskEvaluationEntity, String> {

    Optional<TaskEvaluationEntity> findByOrderIdAndWriterId(String orderId, String writerId);

    List<TaskEvaluationEntity> findByOrderId(String orderId);

    List<TaskEvaluationEntity> findByOrderIdAndStateNot(String orderId, TaskEvaluationState state);
}
