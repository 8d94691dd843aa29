package com.example.orderdesk.application.port.in;

import com.example.orderdesk.application.dto.OrderView;
import com.example.orderdesk.application.dto.SubmissionView;
import com.example.orderdesk.application.dto.SubmitWorkCommand;

import java.util.List;
import java.util.Optional;

public interface QualityControlUseCase {

    SubmissionView submitWork(SubmitWorkCommand command);

    SubmissionView approveSubmission(String submissionId, String adminId, String feedback);

    SubmissionView requestRevision(String submissionId, String adminId, String feedback);

    OrderView deliverOrder(String orderId, String adminId, String notes);

    /**
     * Terminal step. Nothing on the order can change afterwards.
     */
    OrderView completeOrder(String orderId, String adminId);

    Optional<SubmissionView> latestSubmission(String orderId);

    List<SubmissionView> submissions(String orderId);
}
