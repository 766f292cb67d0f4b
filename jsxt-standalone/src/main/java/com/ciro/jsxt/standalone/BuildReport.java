package com.ciro.jsxt.standalone;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.List;

/** Lo que escribe {@code --report}: un resultado por archivo más los totales. */
public record BuildReport(List<FileResult> files, int total, int succeeded, int failed) {

    public BuildReport {
        files = List.copyOf(files);
    }

    public static BuildReport of(List<FileResult> files) {
        int ok = (int) files.stream().filter(FileResult::succeeded).count();
        return new BuildReport(files, files.size(), ok, files.size() - ok);
    }

    @JsonIgnore
    public boolean hasFailures() {
        return failed > 0;
    }
}
