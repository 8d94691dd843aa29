package com.example.orderdesk.application.port.out;

import com.example.orderdesk.domain.model.Role;

import java.util.List;
import java.util.Optional;

/**
 * Outbound port to the identity service, the only trusted source of role and active flag.
 */
public interface UserDirectoryPort {

    /**
     * Looks up a user.
     *
     * @param userId the user id
     * @return the account, or empty if the identity service does not know the user
     */
    Optional<UserAccount> findUser(String userId);

    /**
     * Lists active users holding a role, used to address role-wide notifications.
     */
    List<UserAccount> findActiveUsers(Role role);

    record UserAccount(
            String id,
            Role role,
            boolean active
    ) {}
}
