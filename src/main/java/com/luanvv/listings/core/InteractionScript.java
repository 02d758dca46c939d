package com.luanvv.listings.core;

import java.util.List;
import lombok.Value;

/** Ordered UI actions replayed on a page after navigation and before its HTML is captured. */
@Value
public class InteractionScript {

    public enum Action { CLICK }

    @Value
    public static class Step {
        String selector;
        Action action;
        int nth;
    }

    List<Step> steps;

    /** Opens the currency menu and picks the option labelled {@code optionText} at {@code position}. */
    public static InteractionScript currencySelection(String toggleSelector, String optionText, int position) {
        return new InteractionScript(List.of(
            new Step(toggleSelector, Action.CLICK, 0),
            new Step("text=" + optionText, Action.CLICK, position)
        ));
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Step step : steps) {
            if (sb.length() > 0) sb.append(" -> ");
            sb.append(step.getAction()).append(' ').append(step.getSelector()).append('[').append(step.getNth()).append(']');
        }
        return sb.toString();
    }
}
