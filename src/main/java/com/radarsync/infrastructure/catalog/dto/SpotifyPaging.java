package com.radarsync.infrastructure.catalog.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Paging object wrapping every list the catalog API returns.
 * {@code next} is the absolute URL of the following page, or null on the last page.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SpotifyPaging<T>(
        List<T> items,
        String next,
        Integer total
) {}
