package io.facetrelay.facet;

import io.facetrelay.codec.CallData;
import io.facetrelay.error.RelayError;
import io.facetrelay.error.RelayException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Selector to facet routing. The table is closed: only facets cut in here are reachable,
 * and a selector maps to exactly one facet.
 */
public final class DispatchTable {
    private final Map<String, Route> routes = new LinkedHashMap<>();

    public synchronized void register(Facet facet) {
        cut(FacetCutAction.ADD, facet);
    }

    public synchronized List<String> cut(FacetCutAction action, Facet facet) {
        List<String> selectors = new ArrayList<>();
        for (String signature : facet.signatures()) {
            selectors.add(CallData.selector(signature));
        }
        switch (action) {
            case ADD -> {
                for (String selector : selectors) {
                    Route existing = routes.get(selector);
                    if (existing != null) {
                        throw RelayException.of(RelayError.SELECTOR_CONFLICT,
                                selector + " already routed to " + existing.facet().id());
                    }
                }
                putAll(facet, selectors);
            }
            case REPLACE -> {
                for (String selector : selectors) {
                    Route existing = routes.get(selector);
                    if (existing == null) {
                        throw RelayException.of(RelayError.UNKNOWN_SELECTOR, selector + " has no route to replace");
                    }
                    if (existing.facet() == facet) {
                        throw RelayException.of(RelayError.SELECTOR_CONFLICT,
                                selector + " already routed to the same facet instance");
                    }
                }
                putAll(facet, selectors);
            }
            case REMOVE -> {
                for (String selector : selectors) {
                    if (!routes.containsKey(selector)) {
                        throw RelayException.of(RelayError.UNKNOWN_SELECTOR, selector + " has no route to remove");
                    }
                }
                for (String selector : selectors) {
                    routes.remove(selector);
                }
            }
        }
        return selectors;
    }

    public synchronized Optional<Route> find(String selector) {
        return Optional.ofNullable(routes.get(selector));
    }

    public synchronized Collection<String> selectors() {
        return List.copyOf(routes.keySet());
    }

    public synchronized Set<Facet> facets() {
        Set<Facet> out = new LinkedHashSet<>();
        for (Route route : routes.values()) {
            out.add(route.facet());
        }
        return out;
    }

    public synchronized List<Route> routes() {
        return List.copyOf(routes.values());
    }

    private void putAll(Facet facet, List<String> selectors) {
        List<String> signatures = facet.signatures();
        for (int i = 0; i < selectors.size(); i++) {
            routes.put(selectors.get(i), new Route(selectors.get(i), signatures.get(i), facet));
        }
    }

    public record Route(String selector, String signature, Facet facet) {
    }
}
