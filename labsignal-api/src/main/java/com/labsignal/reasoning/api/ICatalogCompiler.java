/*
 * Copyright (c) 2025 Labsignal
 * Licensed under the Apache License, Version 2.0
 */
package com.labsignal.reasoning.api;

import com.labsignal.reasoning.runtime.model.ClinicalCatalog;

import io.opentelemetry.api.trace.Tracer;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;

/**
 * Contract for turning a catalog JSON document into an immutable
 * {@link ClinicalCatalog} snapshot.
 *
 * <p>Implementations are discovered with {@link java.util.ServiceLoader}.
 * Any configuration error surfaces as a
 * {@link com.labsignal.reasoning.api.exceptions.CompilationException}; a
 * partially loaded catalog is never returned.
 */
public interface ICatalogCompiler {

    /**
     * Compiles the catalog stored in a JSON file.
     *
     * @param catalogPath path to the catalog JSON file
     * @return compiled catalog snapshot
     * @throws IOException if the file cannot be read
     */
    ClinicalCatalog compile(Path catalogPath) throws IOException;

    /**
     * Compiles a catalog read from a stream. The stream is not closed.
     *
     * @param json   catalog JSON
     * @param origin label used in log messages and stats metadata (e.g. a classpath resource name)
     */
    ClinicalCatalog compile(InputStream json, String origin) throws IOException;

    default void setTracer(Tracer tracer) {
    }

    /**
     * @param listener the compilation listener (null to disable)
     */
    default void setCompilationListener(CompilationListener listener) {
    }
}
