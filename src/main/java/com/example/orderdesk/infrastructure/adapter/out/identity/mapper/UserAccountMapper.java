package com.example.orderdesk.infrastructure.adapter.out.identity.mapper;

import com.example.orderdesk.application.port.out.UserDirectoryPort.UserAccount;
import com.example.orderdesk.domain.model.Role;
import com.example.orderdesk.infrastructure.adapter.out.identity.dto.UserResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
public class UserAccountMapper {

    private static final Logger log = LoggerFactory.getLogger(UserAccountMapper.class);

    /**
     * Maps a user. Users whose role this service does not know are left out.
     */
    public Optional<UserAccount> toAccount(UserResponse response) {
        if (response == null || response.id() == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(new UserAccount(response.id(), Role.fromValue(response.role()), response.active()));
        } catch (IllegalArgumentException e) {
            log.warn("User {} has unsupported role '{}'", response.id(), response.role());
            return Optional.empty();
        }
    }
}
