package com.luanvv.listings.core;

/** CSS selectors of the listing site markup. */
public final class Selectors {
    public static final String PAGINATION_ITEM = "#pagination li.page-item";
    public static final String LISTING_ITEM = "#box .box.property-item";
    public static final String LISTING_LINK = "a[href]";

    public static final String TITLE = ".name";
    public static final String CODE = ".code";
    public static final String PRICE = ".regular-price";
    public static final String LABELLED_BLOCK = ".colswidth20";
    public static final String DESCRIPTION_ITEM = ".property-description-row.flexbox p";
    public static final String AVAILABLE = ".available";
    public static final String FACILITY = ".flexbox-wrap p";
    public static final String FACILITY_ICON = "i";

    private Selectors() {
    }
}
