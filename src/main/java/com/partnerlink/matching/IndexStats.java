package com.partnerlink.matching;

/**
 * Counts describing the snapshot a {@link PartnerIndex} was built from.
 *
 * @param totalPartners     partners kept in the index
 * @param withIdentifier    kept partners carrying a corporate number
 * @param withoutIdentifier kept partners without one
 * @param excluded          records left out (no usable name or duplicate id)
 */
public record IndexStats(int totalPartners, int withIdentifier, int withoutIdentifier, int excluded) {
}
