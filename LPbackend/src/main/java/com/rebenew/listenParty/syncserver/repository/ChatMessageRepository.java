package com.rebenew.listenParty.syncserver.repository;

import com.rebenew.listenParty.syncserver.model.ChatMessageEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ChatMessageRepository extends JpaRepository<ChatMessageEntity, Long> {

    // Los más recientes primero; el servicio los devuelve en orden ascendente
    List<ChatMessageEntity> findByRoomIdOrderByIdDesc(String roomId, Pageable pageable);
}
