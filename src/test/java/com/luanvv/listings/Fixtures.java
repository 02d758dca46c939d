package com.luanvv.listings;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

public final class Fixtures {

    private Fixtures() {
    }

    public static String html(String name) {
        try (InputStream in = Fixtures.class.getResourceAsStream("/fixtures/" + name)) {
            if (in == null) {
                throw new IllegalArgumentException("No fixture " + name);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /** The same page rendered with another price block, as after a currency switch. */
    public static String withPrice(String html, String price) {
        return html.replaceFirst("(?s)<div class=\"regular-price\">.*?</div>",
            "<div class=\"regular-price\">" + price + "</div>");
    }
}
