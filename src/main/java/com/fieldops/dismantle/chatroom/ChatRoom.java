package com.fieldops.dismantle.chatroom;

import com.fieldops.dismantle.user.UserRole;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Pairing of one technician with one coordinator. At most one row per pair.
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
@Builder
@Entity
@Table(name = "chat_rooms",
        uniqueConstraints = @UniqueConstraint(
                name = "uq_chat_room_pair",
                columnNames = {"technician_username", "coordinator_username"}),
        indexes = {
                @Index(name = "ix_chat_room_technician", columnList = "technician_username"),
                @Index(name = "ix_chat_room_coordinator", columnList = "coordinator_username")
        })
public class ChatRoom {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "technician_username", nullable = false)
    private String technicianUsername;

    @Column(name = "coordinator_username", nullable = false)
    private String coordinatorUsername;

    @Column(nullable = false)
    private String region;

    @Column(columnDefinition = "text")
    private String lastMessage;

    private LocalDateTime lastMessageAt;

    @Builder.Default
    @Column(nullable = false)
    private int unreadCountTechnician = 0;

    @Builder.Default
    @Column(nullable = false)
    private int unreadCountCoordinator = 0;

    @Column(nullable = false, updatable = false)
    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    @PrePersist
    void prePersist() {
        if (createdAt == null) createdAt = LocalDateTime.now();
        if (updatedAt == null) updatedAt = createdAt;
    }

    public boolean hasMember(String username) {
        return technicianUsername.equals(username) || coordinatorUsername.equals(username);
    }

    /** Slot the given user occupies, or {@code null} when not a member. */
    public UserRole roleOf(String username) {
        if (technicianUsername.equals(username)) return UserRole.TECHNICIAN;
        if (coordinatorUsername.equals(username)) return UserRole.COORDINATOR;
        return null;
    }

    public int unreadCountFor(UserRole role) {
        return role == UserRole.TECHNICIAN ? unreadCountTechnician : unreadCountCoordinator;
    }
}
