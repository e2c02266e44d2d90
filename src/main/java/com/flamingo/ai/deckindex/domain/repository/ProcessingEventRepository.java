package com.flamingo.ai.deckindex.domain.repository;

import com.flamingo.ai.deckindex.domain.entity.ProcessingEvent;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for the ledger audit trail. */
@Repository
public interface ProcessingEventRepository extends JpaRepository<ProcessingEvent, Long> {

  List<ProcessingEvent> findByRemoteIdOrderByIdAsc(String remoteId);
}
