package com.example.quorum.repository;

import com.example.quorum.domain.AgentRun;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface AgentRunRepository extends JpaRepository<AgentRun, String> {

    List<AgentRun> findByAgentNameOrderByStartedAtDesc(String agentName, Pageable pageable);

    List<AgentRun> findAllByOrderByStartedAtDesc(Pageable pageable);

    Optional<AgentRun> findFirstByAgentNameOrderByStartedAtDesc(String agentName);
}
