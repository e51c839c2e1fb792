package com.universaltasker.orchestrator.repository;

import com.universaltasker.orchestrator.model.Session;
import com.universaltasker.orchestrator.model.SessionStatus;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

/**
 * CRUD + history queries for the sessions table.
 */
public interface SessionRepository extends JpaRepository<Session, UUID> {

    /** History listing: newest first. */
    List<Session> findTop50ByOrderByCreatedAtDesc();

    List<Session> findByStatus(SessionStatus status);
}
