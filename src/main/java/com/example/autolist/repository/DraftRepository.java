package com.example.autolist.repository;

import com.example.autolist.domain.Draft;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface DraftRepository extends JpaRepository<Draft, String> {

    /**
     * 중복 병합 후보 조회 (브랜드/카테고리는 대소문자 무시)
     */
    List<Draft> findByOwnerIdAndBrandIgnoreCaseAndCategoryIgnoreCaseAndStatusIn(
            String ownerId, String brand, String category, Collection<Draft.DraftStatus> statuses);

    Page<Draft> findByOwnerId(String ownerId, Pageable pageable);

    Page<Draft> findByOwnerIdAndStatus(String ownerId, Draft.DraftStatus status, Pageable pageable);

    Optional<Draft> findByIdAndOwnerId(String id, String ownerId);

    long countByOwnerId(String ownerId);
}
