package com.behandlingflow.core.renderer;

import java.util.List;
import java.util.Objects;

/**
 * The diagrams produced by one generate run, one file per entry point.
 *
 * @param files diagram files in entry point order
 */
public record GeneratedOutput(List<GeneratedFile> files) {

    public GeneratedOutput {
        Objects.requireNonNull(files, "files must not be null");
        files = List.copyOf(files);
    }
}
