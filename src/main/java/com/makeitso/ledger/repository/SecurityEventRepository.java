package com.makeitso.ledger.repository;

import com.makeitso.ledger.domain.SecurityEventEntry;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface SecurityEventRepository extends JpaRepository<SecurityEventEntry, Long> {

    Page<SecurityEventEntry> findAllByOrderByOccurredAtDescIdDesc(Pageable pageable);

    List<SecurityEventEntry> findBySessionIdOrderByIdAsc(String sessionId);
}
