package com.radarsync.infrastructure.persistence.dao;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;

/**
 * JPA data access object for a blacklisted artist.
 * The artist id is optional; rows without one match by normalized name only.
 */
@Entity
@Table(
        name = "blacklisted_artists",
        indexes = {
                @Index(name = "idx_blacklist_artist_id", columnList = "artist_id"),
                @Index(name = "idx_blacklist_normalized_name", columnList = "normalized_name")
        }
)
public class BlacklistedArtistDao {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "artist_id", length = 64)
    private String artistId;

    @Column(name = "name", nullable = false, length = 500)
    private String name;

    @Column(name = "normalized_name", nullable = false, length = 500)
    private String normalizedName;

    public BlacklistedArtistDao() {
    }

    public BlacklistedArtistDao(String artistId, String name, String normalizedName) {
        this.artistId = artistId;
        this.name = name;
        this.normalizedName = normalizedName;
    }

    public Long getId() {
        return id;
    }

    public String getArtistId() {
        return artistId;
    }

    public void setArtistId(String artistId) {
        this.artistId = artistId;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getNormalizedName() {
        return normalizedName;
    }

    public void setNormalizedName(String normalizedName) {
        this.normalizedName = normalizedName;
    }
}
