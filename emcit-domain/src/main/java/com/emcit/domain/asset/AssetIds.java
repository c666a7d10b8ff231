package com.emcit.domain.asset;

import java.time.Year;

public final class AssetIds {

    private AssetIds() {}

    /**
     * {@code AST-<year>-<nnnn>} where the sequence is the existing asset count plus one.
     */
    public static String next(Year year, long existingCount) {
        if (existingCount < 0) throw new IllegalArgumentException("existingCount < 0");
        return String.format("AST-%d-%04d", year.getValue(), existingCount + 1);
    }
}
