package com.branchat.backend.chat.persistence;

import com.branchat.backend.chat.domain.ChatUser;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ChatUserRepository extends JpaRepository<ChatUser, String> {}
