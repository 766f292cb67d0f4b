package com.ciro.jsxt.standalone;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.Objects;
import java.util.Optional;

/** Resultado de un archivo dentro del reporte de build. */
public record FileResult(
        String path,
        Status status,
        @JsonInclude(JsonInclude.Include.NON_ABSENT) Optional<String> error) {

    public enum Status { OK, FAILED }

    public FileResult {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(status, "status");
        error = error == null ? Optional.empty() : error;
    }

    public static FileResult ok(String path) {
        return new FileResult(path, Status.OK, Optional.empty());
    }

    public static FileResult failed(String path, String error) {
        return new FileResult(path, Status.FAILED, Optional.of(error));
    }

    public boolean succeeded() {
        return status == Status.OK;
    }
}
