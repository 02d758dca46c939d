package com.luanvv.listings.extract;

import com.luanvv.listings.model.Furnished;
import com.luanvv.listings.model.PropertyType;
import java.math.BigDecimal;

/**
 * Positions of the description-derived fields inside the ordered description list. For villas
 * for sale the list shifts by one when a "Year Built" item is present at position 5, so that
 * item alone picks between the two sale layouts.
 */
public enum DescriptionLayout {
    SALE_WITH_YEAR_BUILT(5, 3, new int[] {6}, 7, Furnished.UNKNOWN),
    SALE_WITHOUT_YEAR_BUILT(-1, 3, new int[] {5}, 6, Furnished.UNKNOWN),
    // building size is at 4, or at 5 when an extra item precedes it
    RENTAL(-1, 3, new int[] {4, 5}, -1, Furnished.UNKNOWN),
    LAND(-1, 3, new int[0], -1, Furnished.UNFURNISHED);

    public static final int YEAR_BUILT_PROBE = 5;

    private final int yearBuiltIndex;
    private final int landSizeIndex;
    private final int[] buildingSizeIndexes;
    private final int furnishedIndex;
    private final Furnished defaultFurnished;

    DescriptionLayout(int yearBuiltIndex, int landSizeIndex, int[] buildingSizeIndexes, int furnishedIndex,
                      Furnished defaultFurnished) {
        this.yearBuiltIndex = yearBuiltIndex;
        this.landSizeIndex = landSizeIndex;
        this.buildingSizeIndexes = buildingSizeIndexes;
        this.furnishedIndex = furnishedIndex;
        this.defaultFurnished = defaultFurnished;
    }

    public static DescriptionLayout select(PropertyType type, DetailView view) {
        return switch (type) {
            case VILLA_SALE -> ExtractionRules.hasYearBuilt(view, YEAR_BUILT_PROBE)
                ? SALE_WITH_YEAR_BUILT : SALE_WITHOUT_YEAR_BUILT;
            case VILLA_RENT -> RENTAL;
            case LAND -> LAND;
        };
    }

    public boolean hasYearBuilt() {
        return yearBuiltIndex >= 0;
    }

    public boolean hasBuildingSize() {
        return buildingSizeIndexes.length > 0;
    }

    public boolean hasFurnished() {
        return furnishedIndex >= 0;
    }

    public FieldValue<String> yearBuilt(DetailView view) {
        return hasYearBuilt() ? ExtractionRules.yearBuilt(view, yearBuiltIndex) : FieldValue.of(null);
    }

    public FieldValue<BigDecimal> landSize(DetailView view) {
        return ExtractionRules.size(view, landSizeIndex, "land size");
    }

    /** First candidate position holding a number wins. */
    public FieldValue<BigDecimal> buildingSize(DetailView view) {
        FieldValue<BigDecimal> result = FieldValue.of(null);
        for (int index : buildingSizeIndexes) {
            result = ExtractionRules.size(view, index, "building size");
            if (result.isPresent()) {
                return result;
            }
        }
        return result;
    }

    public FieldValue<Furnished> furnished(DetailView view) {
        return hasFurnished() ? ExtractionRules.furnished(view, furnishedIndex) : FieldValue.of(defaultFurnished);
    }
}
