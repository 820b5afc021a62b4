package com.radarsync.infrastructure.persistence.adapter;

import com.radarsync.application.port.BlacklistStore;
import com.radarsync.core.fingerprint.ArtistNameNormalizer;
import com.radarsync.core.model.ArtistRef;
import com.radarsync.infrastructure.persistence.repository.BlacklistedArtistJpaRepository;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Adapter implementing BlacklistStore using Spring Data JPA.
 * An artist with a catalog id is matched by id first, then by folded name.
 */
@Component
public class BlacklistStoreAdapter implements BlacklistStore {

    private final BlacklistedArtistJpaRepository jpaRepository;

    public BlacklistStoreAdapter(BlacklistedArtistJpaRepository jpaRepository) {
        this.jpaRepository = jpaRepository;
    }

    @Override
    @Transactional(readOnly = true)
    public boolean contains(ArtistRef artist) {
        if (artist == null) {
            return false;
        }
        if (artist.hasId() && jpaRepository.existsByArtistId(artist.id())) {
            return true;
        }
        String normalized = ArtistNameNormalizer.normalize(artist.name());
        return !normalized.isEmpty() && jpaRepository.existsByNormalizedName(normalized);
    }
}
