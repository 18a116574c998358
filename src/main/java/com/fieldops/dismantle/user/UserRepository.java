package com.fieldops.dismantle.user;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface UserRepository extends JpaRepository<User, Long> {

    Optional<User> findByUsername(String username);

    Optional<User> findByUsernameAndRole(String username, UserRole role);

    Optional<User> findFirstByRoleAndAreaAndActiveTrueOrderByIdAsc(UserRole role, String area);

    Optional<User> findFirstByRoleAndRegionAndActiveTrueOrderByIdAsc(UserRole role, String region);
}
