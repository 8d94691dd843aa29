package com.example.orderdesk.application.port.in;

import com.example.orderdesk.application.dto.InviteResult;
import com.example.orderdesk.application.dto.OrderView;
import com.example.orderdesk.application.dto.TaskEvaluationView;
import com.example.orderdesk.application.dto.WriterInterestView;

import java.util.List;
import java.util.Optional;

/**
 * Inbound port of the writer recruitment engine.
 */
public interface WriterRecruitmentUseCase {

    InviteResult invite(String orderId, String adminId, List<String> writerIds);

    WriterInterestView showInterest(String orderId, String writerId, String comment);

    WriterInterestView decline(String orderId, String writerId, String reason);

    /**
     * Assigns a writer, releasing whoever held the order before.
     *
     * @param expectedVersion order version the admin decided on, or null to use the current one
     */
    OrderView assign(String orderId, String adminId, String writerId, Long expectedVersion);

    OrderView revoke(String orderId, String adminId, String reason);

    OrderView reassign(String orderId, String adminId, String newWriterId, String reason);

    TaskEvaluationView evaluateTask(String orderId, String writerId, boolean doable, String comment);

    Optional<String> currentAssignee(String orderId);

    List<WriterInterestView> interests(String orderId);
}
