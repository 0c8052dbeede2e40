package io.facetrelay;

import io.facetrelay.cli.FacetRelayCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new FacetRelayCommand()).execute(args);
        System.exit(code);
    }
}
