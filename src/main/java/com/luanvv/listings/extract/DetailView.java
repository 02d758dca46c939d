package com.luanvv.listings.extract;

import com.luanvv.listings.core.Selectors;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import lombok.Getter;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;

/**
 * Text blocks of one rendered detail page, read once from the DOM. Texts keep their line
 * breaks since several fields sit on a given line of a block.
 */
@Getter
public class DetailView {
    private final String url;
    private final String title;
    private final String code;
    private final String priceText;
    private final List<String> labelledBlocks;
    private final List<String> descriptionItems;
    private final List<String> availableTokens;
    private final List<String> availableFacilities;

    DetailView(String url, String title, String code, String priceText, List<String> labelledBlocks,
               List<String> descriptionItems, List<String> availableTokens, List<String> availableFacilities) {
        this.url = url;
        this.title = title;
        this.code = code;
        this.priceText = priceText;
        this.labelledBlocks = Collections.unmodifiableList(labelledBlocks);
        this.descriptionItems = Collections.unmodifiableList(descriptionItems);
        this.availableTokens = Collections.unmodifiableList(availableTokens);
        this.availableFacilities = Collections.unmodifiableList(availableFacilities);
    }

    public static DetailView parse(String html, String url) {
        return of(Jsoup.parse(html, url == null ? "" : url), url);
    }

    public static DetailView of(Document doc, String url) {
        List<String> labelled = new ArrayList<>();
        for (Element block : doc.select(Selectors.LABELLED_BLOCK)) {
            labelled.add(text(block));
        }
        List<String> description = new ArrayList<>();
        for (Element p : doc.select(Selectors.DESCRIPTION_ITEM)) {
            description.add(text(p));
        }
        // every child node counts, whitespace between tags included: room counts sit at fixed offsets
        List<String> tokens = new ArrayList<>();
        for (Element available : doc.select(Selectors.AVAILABLE)) {
            for (Node child : available.childNodes()) {
                if (child instanceof TextNode textNode) {
                    tokens.add(textNode.getWholeText().strip());
                } else if (child instanceof Element element) {
                    tokens.add(text(element));
                }
            }
        }
        // a facility is named by its icon, e.g. <i>pool</i>Private Pool; the label is free text
        List<String> facilities = new ArrayList<>();
        for (Element p : doc.select(Selectors.FACILITY)) {
            if (p.hasClass("available") || p.selectFirst(Selectors.AVAILABLE) != null) {
                Element icon = p.selectFirst(Selectors.FACILITY_ICON);
                facilities.add(icon != null ? text(icon) : text(p));
            }
        }
        return new DetailView(url, firstText(doc, Selectors.TITLE), firstText(doc, Selectors.CODE),
            firstText(doc, Selectors.PRICE), labelled, description, tokens, facilities);
    }

    public Optional<String> labelledBlock(int index) {
        return item(labelledBlocks, index);
    }

    public Optional<String> descriptionItem(int index) {
        return item(descriptionItems, index);
    }

    public Optional<String> availableToken(int index) {
        return item(availableTokens, index);
    }

    /** Line {@code index} of a block, stripped; negative indexes count from the end. */
    public static Optional<String> line(String block, int index) {
        if (block == null) {
            return Optional.empty();
        }
        String[] lines = block.split("\\R");
        int i = index < 0 ? lines.length + index : index;
        if (i < 0 || i >= lines.length) {
            return Optional.empty();
        }
        return Optional.of(lines[i].strip());
    }

    private static Optional<String> item(List<String> items, int index) {
        return index >= 0 && index < items.size() ? Optional.of(items.get(index)) : Optional.empty();
    }

    private static String firstText(Document doc, String selector) {
        Element element = doc.selectFirst(selector);
        return element == null ? null : text(element);
    }

    private static String text(Element element) {
        return element.wholeText().strip();
    }
}
