package com.fieldops.dismantle.user;

import com.fieldops.dismantle.exception.ForbiddenException;
import com.fieldops.dismantle.exception.NotFoundException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Read-only view of the user directory used by the chat subsystem.
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class IdentityDirectory {

    private final UserRepository users;

    public User findByUsernameAndRole(String username, UserRole role) {
        return users.findByUsernameAndRole(username, role)
                .orElseThrow(() -> new NotFoundException(
                        "No " + role.wireName() + " with username '" + username + "'"));
    }

    /**
     * Area match wins over region match. Inactive entries are never returned.
     */
    public User findByAreaOrRegion(UserRole role, String area, String region) {
        Optional<User> byArea = area == null
                ? Optional.empty()
                : users.findFirstByRoleAndAreaAndActiveTrueOrderByIdAsc(role, area);
        return byArea
                .or(() -> region == null
                        ? Optional.empty()
                        : users.findFirstByRoleAndRegionAndActiveTrueOrderByIdAsc(role, region))
                .orElseThrow(() -> new NotFoundException(
                        "No " + role.wireName() + " for area '" + area + "' or region '" + region + "'"));
    }

    /** Resolves the caller of the query surface; unknown or inactive callers are rejected. */
    public User requireCaller(String username) {
        return users.findByUsername(username)
                .filter(User::isActive)
                .orElseThrow(() -> new ForbiddenException("Unknown or inactive user '" + username + "'"));
    }
}
