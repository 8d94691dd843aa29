package com.example.orderdesk.application.service;

import com.example.orderdesk.application.port.out.UserDirectoryPort;
import com.example.orderdesk.application.port.out.UserDirectoryPort.UserAccount;
import com.example.orderdesk.domain.exception.InvalidTransitionException;
import com.example.orderdesk.domain.exception.NotFoundException;
import com.example.orderdesk.domain.exception.ValidationException;
import com.example.orderdesk.domain.model.Actor;
import com.example.orderdesk.domain.model.Role;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Turns a caller id into an {@link Actor}. Role and active flag come only from the identity service.
 */
@Component
public class ActorResolver {

    private static final Logger log = LoggerFactory.getLogger(ActorResolver.class);

    private final UserDirectoryPort userDirectory;

    public ActorResolver(UserDirectoryPort userDirectory) {
        this.userDirectory = userDirectory;
    }

    /**
     * Resolves the caller and checks it holds one of the allowed roles.
     *
     * @param action used in the denial message, e.g. "verify payments"
     * @throws NotFoundException          if the identity service does not know the user
     * @throws InvalidTransitionException if the user is inactive or holds another role
     */
    public Actor resolve(String userId, String action, Role... allowed) {
        if (userId == null || userId.isBlank()) {
            throw new ValidationException("Acting user id is required");
        }
        UserAccount account = userDirectory.findUser(userId)
                .orElseThrow(() -> new NotFoundException("User", userId));
        if (!account.active()) {
            log.warn("Inactive user {} tried to {}", userId, action);
            throw new InvalidTransitionException("User " + userId + " is inactive and cannot " + action);
        }
        if (allowed.length > 0 && !Arrays.asList(allowed).contains(account.role())) {
            String required = Arrays.stream(allowed).map(Role::name).collect(Collectors.joining(" or "));
            log.warn("User {} with role {} tried to {}", userId, account.role(), action);
            throw new InvalidTransitionException(account.role() + " cannot " + action + "; required role: " + required);
        }
        return new Actor(account.id(), account.role());
    }

    /**
     * Checks every id names an active writer.
     *
     * @return the ids without duplicates, in the order given
     */
    public List<String> requireActiveWriters(List<String> writerIds) {
        if (writerIds == null || writerIds.isEmpty()) {
            throw new ValidationException("At least one writer id is required");
        }
        if (writerIds.stream().anyMatch(id -> id == null || id.isBlank())) {
            throw new ValidationException("Writer ids cannot be blank");
        }
        Set<String> unique = new LinkedHashSet<>(writerIds);
        List<String> invalid = unique.stream()
                .filter(id -> userDirectory.findUser(id)
                        .filter(account -> account.active() && account.role() == Role.WRITER)
                        .isEmpty())
                .toList();
        if (!invalid.isEmpty()) {
            throw new ValidationException("Some writers not found or are not active writers: " + invalid);
        }
        return List.copyOf(unique);
    }
}
