package com.cashflow.repository;

import com.cashflow.model.room.Room;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for Room entities. Finders used by the API fetch the seats eagerly.
 */
@Repository
public interface RoomRepository extends JpaRepository<Room, String> {

    @EntityGraph(attributePaths = "players")
    Optional<Room> findWithPlayersById(String id);

    @EntityGraph(attributePaths = "players")
    @Query("SELECT r FROM Room r WHERE r.status = 'WAITING_FOR_PLAYERS' AND SIZE(r.players) < r.maxPlayers")
    List<Room> findJoinableRooms();

    @EntityGraph(attributePaths = "players")
    @Query("SELECT r FROM Room r")
    List<Room> findAllWithPlayers();
}
