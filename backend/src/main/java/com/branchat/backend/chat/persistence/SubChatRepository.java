package com.branchat.backend.chat.persistence;

import com.branchat.backend.chat.domain.SubChat;
import jakarta.persistence.LockModeType;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface SubChatRepository extends JpaRepository<SubChat, UUID> {

  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query("select s from SubChat s where s.id = :id")
  Optional<SubChat> findByIdForUpdate(@Param("id") UUID id);
}
