package dev.quorum.repository;

import dev.quorum.domain.entity.Installation;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface InstallationRepository extends JpaRepository<Installation, UUID> {
    Optional<Installation> findByExternalInstallationId(Long externalInstallationId);
}
