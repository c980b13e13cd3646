package com.example.autolist.repository;

import com.example.autolist.domain.PublishLedgerEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface PublishLedgerRepository extends JpaRepository<PublishLedgerEntry, Long> {

    Optional<PublishLedgerEntry> findByIdempotencyKey(String idempotencyKey);
}
