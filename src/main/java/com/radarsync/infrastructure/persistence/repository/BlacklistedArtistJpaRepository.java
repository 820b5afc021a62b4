package com.radarsync.infrastructure.persistence.repository;

import com.radarsync.infrastructure.persistence.dao.BlacklistedArtistDao;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Spring Data JPA repository for blacklisted artists.
 */
@Repository
public interface BlacklistedArtistJpaRepository extends JpaRepository<BlacklistedArtistDao, Long> {

    boolean existsByArtistId(String artistId);

    boolean existsByNormalizedName(String normalizedName);
}
