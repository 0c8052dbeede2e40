package io.facetrelay.facet;

public record DispatchResult(
        boolean success,
        String output,
        String error
) {
    public static DispatchResult ok(String output) {
        return new DispatchResult(true, output, null);
    }

    public static DispatchResult fail(String error) {
        return new DispatchResult(false, null, error == null || error.isBlank() ? "unspecified failure" : error);
    }
}
