package com.fieldops.dismantle.chatroom;

import com.fieldops.dismantle.exception.ForbiddenException;
import com.fieldops.dismantle.exception.NotFoundException;
import com.fieldops.dismantle.user.IdentityDirectory;
import com.fieldops.dismantle.user.User;
import com.fieldops.dismantle.user.UserRepository;
import com.fieldops.dismantle.user.UserRole;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
@Import({ChatRoomService.class, IdentityDirectory.class})
class ChatRoomServiceTest {

    @Autowired
    private UserRepository users;

    @Autowired
    private ChatRoomRepository rooms;

    @Autowired
    private ChatRoomService service;

    private User tek1;
    private User reg1;
    private User admin;

    @BeforeEach
    void setUp() {
        tek1 = user("tek1", UserRole.TECHNICIAN, "Jakarta", "WEST");
        reg1 = user("reg1", UserRole.COORDINATOR, "Jakarta", "WEST");
        admin = user("root", UserRole.ADMIN, null, null);
    }

    private User user(String username, UserRole role, String area, String region) {
        return users.save(User.builder().username(username).role(role).area(area).region(region).build());
    }

    @Test
    void createsRoomWithTechniciansRegion() {
        ChatRoom room = service.resolveOrCreate("tek1");

        assertThat(room.getId()).isNotNull();
        assertThat(room.getTechnicianUsername()).isEqualTo("tek1");
        assertThat(room.getCoordinatorUsername()).isEqualTo("reg1");
        assertThat(room.getRegion()).isEqualTo("WEST");
        assertThat(room.getUnreadCountTechnician()).isZero();
        assertThat(room.getUnreadCountCoordinator()).isZero();
    }

    @Test
    void resolutionIsIdempotent() {
        Long first = service.resolveOrCreate("tek1").getId();
        Long second = service.resolveOrCreate("tek1").getId();

        assertThat(second).isEqualTo(first);
        assertThat(rooms.count()).isEqualTo(1);
    }

    @Test
    void regionCoordinatorIsUsedWhenNoAreaMatch() {
        user("tek2", UserRole.TECHNICIAN, "Bogor", "WEST");

        assertThat(service.resolveOrCreate("tek2").getCoordinatorUsername()).isEqualTo("reg1");
    }

    @Test
    void failsWhenNoCoordinatorMatches() {
        user("tek3", UserRole.TECHNICIAN, "Makassar", "EAST");

        assertThatThrownBy(() -> service.resolveOrCreate("tek3")).isInstanceOf(NotFoundException.class);
        assertThat(rooms.count()).isZero();
    }

    @Test
    void failsForUnknownTechnician() {
        assertThatThrownBy(() -> service.resolveOrCreate("ghost")).isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> service.resolveOrCreate("reg1")).isInstanceOf(NotFoundException.class);
    }

    @Test
    void technicianMayOnlyOpenOwnRoom() {
        user("tek2", UserRole.TECHNICIAN, "Jakarta", "WEST");

        assertThat(service.createOrFetch(tek1, "tek1").getTechnicianUsername()).isEqualTo("tek1");
        assertThatThrownBy(() -> service.createOrFetch(tek1, "tek2")).isInstanceOf(ForbiddenException.class);
    }

    @Test
    void coordinatorMayOnlyOpenAssignedTechnicians() {
        User regEast = user("regEast", UserRole.COORDINATOR, "Makassar", "EAST");

        assertThat(service.createOrFetch(reg1, "tek1").getCoordinatorUsername()).isEqualTo("reg1");
        assertThatThrownBy(() -> service.createOrFetch(regEast, "tek1")).isInstanceOf(ForbiddenException.class);
        assertThat(service.createOrFetch(admin, "tek1").getCoordinatorUsername()).isEqualTo("reg1");
    }

    @Test
    void refusedCoordinatorLeavesNoRoomBehind() {
        User regSurabaya = user("reg9", UserRole.COORDINATOR, "Surabaya", "EAST");

        assertThatThrownBy(() -> service.createOrFetch(regSurabaya, "tek1")).isInstanceOf(ForbiddenException.class);
        assertThat(rooms.count()).isZero();
    }

    @Test
    void listingShowsCallersOwnUnreadCounter() {
        ChatRoom room = service.resolveOrCreate("tek1");
        room.setUnreadCountTechnician(2);
        room.setUnreadCountCoordinator(5);
        rooms.saveAndFlush(room);
        User tek2 = user("tek2", UserRole.TECHNICIAN, "Jakarta", "WEST");
        service.resolveOrCreate("tek2");

        List<ChatRoomView> forTechnician = service.listRoomsFor(tek1);
        List<ChatRoomView> forCoordinator = service.listRoomsFor(reg1);
        List<ChatRoomView> forAdmin = service.listRoomsFor(admin);

        assertThat(forTechnician).singleElement()
                .satisfies(v -> assertThat(v.unreadCount()).isEqualTo(2));
        assertThat(forCoordinator).hasSize(2);
        assertThat(forCoordinator.get(0).unreadCount()).isEqualTo(5);
        assertThat(forAdmin).hasSize(2);
        assertThat(service.listRoomsFor(tek2)).singleElement()
                .satisfies(v -> assertThat(v.technicianUsername()).isEqualTo("tek2"));
    }

    @Test
    void onlyMembersAndAdminsMayReadRoom() {
        Long roomId = service.resolveOrCreate("tek1").getId();
        User outsider = user("tek9", UserRole.TECHNICIAN, "Jakarta", "WEST");

        assertThat(service.requireReadable(tek1, roomId).getId()).isEqualTo(roomId);
        assertThat(service.requireReadable(reg1, roomId).getId()).isEqualTo(roomId);
        assertThat(service.requireReadable(admin, roomId).getId()).isEqualTo(roomId);
        assertThatThrownBy(() -> service.requireReadable(outsider, roomId)).isInstanceOf(ForbiddenException.class);
        assertThatThrownBy(() -> service.requireReadable(admin, 999L)).isInstanceOf(NotFoundException.class);
    }
}
