package com.luanvv.listings.extract;

import com.luanvv.listings.model.Furnished;
import com.luanvv.listings.model.SaleType;
import java.math.BigDecimal;
import java.util.function.Function;

/**
 * Named rules reading one field each from a {@link DetailView}. Offsets mirror the detail page
 * markup; fields whose offset depends on the markup variant live in {@link DescriptionLayout}.
 */
public final class ExtractionRules {
    public static final String UNKNOWN = "Unknown";
    private static final String YEAR_BUILT_TOKEN = "Year Built";
    private static final String POOL_FACILITY = "pool";

    public static final Function<DetailView, FieldValue<String>> TITLE =
        view -> present(view.getTitle(), "no title element");

    public static final Function<DetailView, FieldValue<String>> CODE =
        view -> present(view.getCode(), "no code element");

    /** Last line of the first labelled block; a dash there is the site's placeholder. */
    public static final Function<DetailView, FieldValue<String>> LOCATION =
        view -> block(view, 0).flatMap(block -> line(block, -1))
            .flatMap(location -> FieldValue.of(location.isBlank() || location.matches("[-–—]+")
                ? UNKNOWN : location));

    /** First word of line 2 of the second labelled block: {@code lease}, {@code free}. */
    public static final Function<DetailView, FieldValue<SaleType>> SALE_TYPE =
        view -> block(view, 1).flatMap(block -> line(block, 2))
            .flatMap(line -> {
                SaleType type = SaleType.fromKeyword(line.split("\\s+")[0]);
                return type == SaleType.UNKNOWN
                    ? FieldValue.invalid(line, "unrecognized sale type keyword")
                    : FieldValue.of(type);
            });

    /** Line 3 of the second labelled block, e.g. {@code until 2049 / 25 years}. */
    public static final Function<DetailView, FieldValue<Integer>> LEASE_YEARS =
        view -> block(view, 1).flatMap(block -> line(block, 3))
            .flatMap(line -> {
                int slash = line.indexOf("/ ");
                if (slash < 0) {
                    return FieldValue.invalid(line, "no '/ ' before the lease term");
                }
                String term = line.substring(slash + 2);
                int unit = term.indexOf(" y");
                return integer(unit >= 0 ? term.substring(0, unit) : term, "lease years");
            });

    public static final Function<DetailView, FieldValue<Integer>> BEDROOMS =
        view -> token(view, 3).flatMap(token -> line(token, 1)).flatMap(line -> integer(line, "bedrooms"));

    public static final Function<DetailView, FieldValue<Integer>> BATHROOMS =
        view -> token(view, 5).flatMap(token -> integer(token, "bathrooms"));

    public static final Function<DetailView, FieldValue<Boolean>> POOL =
        view -> FieldValue.of(view.getAvailableFacilities().stream()
            .anyMatch(POOL_FACILITY::equalsIgnoreCase));

    private ExtractionRules() {
    }

    /** The discriminator between the two sale markup variants. */
    public static boolean hasYearBuilt(DetailView view, int index) {
        return view.descriptionItem(index).map(item -> item.contains(YEAR_BUILT_TOKEN)).orElse(false);
    }

    /** {@code Year Built: 2019} */
    public static FieldValue<String> yearBuilt(DetailView view, int index) {
        return description(view, index).flatMap(item -> {
            int colon = item.indexOf(": ");
            if (colon < 0) {
                return FieldValue.invalid(item, "no ': ' after the year built label");
            }
            String year = item.substring(colon + 2).strip();
            return year.isEmpty() ? FieldValue.invalid(item, "empty year built") : FieldValue.of(year);
        });
    }

    /** Size on line 1 of a description item, e.g. {@code Land Size\n4.5}. */
    public static FieldValue<BigDecimal> size(DetailView view, int index, String field) {
        return description(view, index).flatMap(item -> line(item, 1))
            .flatMap(line -> Amounts.parseMeasure(line)
                .<FieldValue<BigDecimal>>map(FieldValue::of)
                .orElseGet(() -> FieldValue.invalid(line, field + " is not a number")));
    }

    public static FieldValue<Furnished> furnished(DetailView view, int index) {
        return description(view, index).flatMap(item -> line(item, 1))
            .flatMap(line -> {
                Furnished furnished = Furnished.normalize(line);
                return furnished == Furnished.UNKNOWN
                    ? FieldValue.invalid(line, "unrecognized furnished level")
                    : FieldValue.of(furnished);
            });
    }

    private static FieldValue<String> present(String value, String problem) {
        return value == null || value.isBlank() ? FieldValue.missing(problem) : FieldValue.of(value);
    }

    private static FieldValue<String> block(DetailView view, int index) {
        return view.labelledBlock(index)
            .map(FieldValue::of)
            .orElseGet(() -> FieldValue.missing("no labelled block " + index));
    }

    private static FieldValue<String> description(DetailView view, int index) {
        return view.descriptionItem(index)
            .map(FieldValue::of)
            .orElseGet(() -> FieldValue.missing("no description item " + index
                + " (" + view.getDescriptionItems().size() + " present)"));
    }

    private static FieldValue<String> token(DetailView view, int index) {
        return view.availableToken(index)
            .map(FieldValue::of)
            .orElseGet(() -> FieldValue.missing("no available token " + index
                + " (" + view.getAvailableTokens().size() + " present)"));
    }

    private static FieldValue<String> line(String block, int index) {
        return DetailView.line(block, index)
            .map(FieldValue::of)
            .orElseGet(() -> FieldValue.invalid(block, "no line " + index));
    }

    private static FieldValue<Integer> integer(String text, String field) {
        return Amounts.parseInteger(text)
            .map(FieldValue::of)
            .orElseGet(() -> FieldValue.invalid(text, field + " is not a number"));
    }
}
