package com.example.orderdesk.unit.infrastructure;

import com.example.orderdesk.application.dto.WorkflowEvent;
import com.example.orderdesk.application.port.out.NotificationDeliveryPort;
import com.example.orderdesk.application.port.out.UserDirectoryPort;
import com.example.orderdesk.application.port.out.UserDirectoryPort.UserAccount;
import com.example.orderdesk.domain.model.Actor;
import com.example.orderdesk.domain.model.NotificationSeverity;
import com.example.orderdesk.domain.model.Role;
import com.example.orderdesk.infrastructure.notification.NotificationFanOut;
import com.example.orderdesk.infrastructure.notification.NotificationFanOut.AddressedNotification;
import com.example.orderdesk.infrastructure.persistence.entity.NotificationEntity;
import com.example.orderdesk.infrastructure.persistence.repository.NotificationRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("Notification Fan-Out Tests")
class NotificationFanOutTest {

    @Mock
    private NotificationRepository notificationRepository;

    @Mock
    private UserDirectoryPort userDirectory;

    @Mock
    private NotificationDeliveryPort deliveryPort;

    private NotificationFanOut fanOut;

    @BeforeEach
    void setUp() {
        fanOut = new NotificationFanOut(notificationRepository, userDirectory, deliveryPort);
    }

    @Test
    @DisplayName("should_address_role_members_once_and_skip_the_actor")
    void should_address_role_members_once_and_skip_the_actor() {
        // Given
        when(userDirectory.findActiveUsers(Role.ADMIN)).thenReturn(List.of(
                new UserAccount("admin-1", Role.ADMIN, true),
                new UserAccount("admin-2", Role.ADMIN, true)));
        WorkflowEvent event = WorkflowEvent.builder("PAYMENT_SUBMITTED", new Actor("admin-1", Role.ADMIN))
                .order("o1")
                .notify("client-1", NotificationSeverity.INFO, "Payment received", "We got your receipt")
                .notifyRole(Role.ADMIN, NotificationSeverity.WARNING, "Payment to verify", "Check the receipt")
                .notify("admin-2", NotificationSeverity.INFO, "Duplicate", "Already told")
                .build();

        // When
        List<AddressedNotification> addressed = fanOut.address(event);

        // Then
        assertThat(addressed).extracting(AddressedNotification::recipientId)
                .containsExactly("client-1", "admin-2");
        assertThat(addressed.get(1).message().title()).isEqualTo("Payment to verify");
    }

    @Test
    @DisplayName("should_persist_without_calling_the_identity_service")
    void should_persist_without_calling_the_identity_service() {
        // Given
        WorkflowEvent event = WorkflowEvent.builder("ORDER_CANCELLED", new Actor("admin-1", Role.ADMIN))
                .order("o1")
                .notify("client-1", NotificationSeverity.CRITICAL, "Order cancelled", "Your order was cancelled")
                .build();
        AddressedNotification target = new AddressedNotification("client-1", event.notifications().get(0));
        when(notificationRepository.existsByEventIdAndRecipientId("evt-1", "client-1")).thenReturn(false);
        when(notificationRepository.save(any(NotificationEntity.class))).thenAnswer(call -> call.getArgument(0));

        // When
        List<NotificationEntity> written = fanOut.persist("evt-1", "o1", List.of(target));

        // Then
        assertThat(written).singleElement().satisfies(row -> {
            assertThat(row.getRecipientId()).isEqualTo("client-1");
            assertThat(row.getEventId()).isEqualTo("evt-1");
            assertThat(row.getLinkUrl()).isEqualTo("/orders/o1");
        });
        verifyNoInteractions(userDirectory);
    }

    @Test
    @DisplayName("should_skip_rows_already_written_for_the_event")
    void should_skip_rows_already_written_for_the_event() {
        // Given
        WorkflowEvent event = WorkflowEvent.builder("ORDER_CANCELLED", new Actor("admin-1", Role.ADMIN))
                .order("o1")
                .notify("client-1", NotificationSeverity.CRITICAL, "Order cancelled", "Your order was cancelled")
                .build();
        when(notificationRepository.existsByEventIdAndRecipientId("evt-1", "client-1")).thenReturn(true);

        // When
        List<NotificationEntity> written = fanOut.persist("evt-1", "o1",
                List.of(new AddressedNotification("client-1", event.notifications().get(0))));

        // Then
        assertThat(written).isEmpty();
        verify(notificationRepository, never()).save(any(NotificationEntity.class));
    }
}
