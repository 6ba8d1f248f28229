package me.go_gradually.ceddy.application.room.port;

import me.go_gradually.ceddy.application.room.model.ParticipantInfo;
import me.go_gradually.ceddy.application.room.model.RoomInfo;

import java.util.List;

/**
 * Remote room service. Implementations report transport and provider errors as
 * {@link me.go_gradually.ceddy.application.room.model.RoomProviderException}.
 */
public interface RoomGateway {
    RoomInfo createRoom(String roomName, int emptyTimeoutSeconds);

    List<RoomInfo> listRooms();

    void deleteRoom(String roomName);

    List<ParticipantInfo> listParticipants(String roomName);
}
