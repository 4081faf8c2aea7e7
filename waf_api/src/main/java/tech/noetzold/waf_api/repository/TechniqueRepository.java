package tech.noetzold.waf_api.repository;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;
import tech.noetzold.waf_api.model.Technique;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

public interface TechniqueRepository extends JpaRepository<Technique, Long> {

    boolean existsByTechniqueNameIgnoreCase(String techniqueName);

    // tier 1: never tested, newest first
    List<Technique> findByTestedAtIsNullOrderByDiscoveredAtDesc();

    // tier 2: confirmed bypasses, oldest test first
    List<Technique> findByBlockedFalseAndTestedAtIsNotNullOrderByTestedAtAsc();

    // tier 3: patched and holding
    List<Technique> findByPatchedAtIsNotNullAndBlockedTrueOrderByPatchedAtDesc(Pageable pageable);

    List<Technique> findTop5ByBlockedFalseAndTestedAtIsNotNullOrderByTestedAtDesc();

    List<Technique> findAllByOrderByDiscoveredAtDesc();

    long countByBlockedTrue();

    // status writes touch only their own columns

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Transactional
    @Query("update Technique t set t.testedAt = :testedAt, t.blocked = :blocked where t.id = :id")
    int updateTestOutcome(@Param("id") Long id, @Param("blocked") boolean blocked, @Param("testedAt") Instant testedAt);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Transactional
    @Query("update Technique t set t.patchedAt = :patchedAt where t.id in :ids")
    int updatePatchedAt(@Param("ids") Collection<Long> ids, @Param("patchedAt") Instant patchedAt);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Transactional
    @Query("update Technique t set t.patchedAt = :patchedAt, t.blocked = true where t.id in :ids")
    int updateBlockedAndPatched(@Param("ids") Collection<Long> ids, @Param("patchedAt") Instant patchedAt);
}
