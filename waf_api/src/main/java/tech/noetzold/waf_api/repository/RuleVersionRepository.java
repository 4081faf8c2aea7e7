package tech.noetzold.waf_api.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import tech.noetzold.waf_api.model.RuleVersion;

import java.util.List;
import java.util.Optional;

public interface RuleVersionRepository extends JpaRepository<RuleVersion, Long> {

    Optional<RuleVersion> findTopByOrderByVersionDesc();

    List<RuleVersion> findAllByOrderByVersionDesc();
}
