package com.cashflow.repository;

import com.cashflow.model.room.RoomPlayer;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository for RoomPlayer entities.
 */
@Repository
public interface RoomPlayerRepository extends JpaRepository<RoomPlayer, String> {

    Optional<RoomPlayer> findByRoomIdAndSessionId(String roomId, String sessionId);

    boolean existsByRoomIdAndName(String roomId, String name);
}
