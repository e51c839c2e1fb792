package com.universaltasker.orchestrator.repository;

import com.universaltasker.orchestrator.model.PostMortem;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;
import java.util.UUID;

public interface PostMortemRepository extends JpaRepository<PostMortem, UUID> {

    Optional<PostMortem> findBySessionId(UUID sessionId);
}
