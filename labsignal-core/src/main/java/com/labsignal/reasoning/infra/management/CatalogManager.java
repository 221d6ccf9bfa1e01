package com.labsignal.reasoning.infra.management;

import com.labsignal.reasoning.api.CompilationListener;
import com.labsignal.reasoning.api.ICatalogCompiler;
import com.labsignal.reasoning.api.ICatalogManager;
import com.labsignal.reasoning.api.exceptions.CompilationException;
import com.labsignal.reasoning.runtime.model.ClinicalCatalog;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Owns the active {@link ClinicalCatalog} snapshot and swaps in a freshly
 * compiled one when the catalog file changes.
 * <p>
 * The initial load happens in the constructor and fails fast: a manager never
 * exists without a valid catalog. Later reloads that fail leave the previous
 * snapshot in place.
 */
public class CatalogManager implements ICatalogManager {
    private static final Logger logger = Logger.getLogger(CatalogManager.class.getName());

    public static final long DEFAULT_CHECK_INTERVAL_SECONDS = 10;

    private final Path catalogPath;
    private final ICatalogCompiler compiler;
    private final Tracer tracer;
    private final long checkIntervalSeconds;

    /**
     * Readers take one snapshot per evaluation; a swap never affects an
     * evaluation already in progress.
     */
    private final AtomicReference<ClinicalCatalog> activeCatalog = new AtomicReference<>();
    private final ScheduledExecutorService monitoringExecutor;

    private volatile long lastModifiedTime = -1;

    public CatalogManager(Path catalogPath, Tracer tracer, ICatalogCompiler compiler) throws IOException {
        this(catalogPath, tracer, compiler, DEFAULT_CHECK_INTERVAL_SECONDS);
    }

    public CatalogManager(Path catalogPath, Tracer tracer, ICatalogCompiler compiler, long checkIntervalSeconds)
            throws IOException {
        if (checkIntervalSeconds <= 0) {
            throw new IllegalArgumentException("checkIntervalSeconds must be positive, got " + checkIntervalSeconds);
        }
        this.catalogPath = Objects.requireNonNull(catalogPath, "catalogPath must not be null");
        this.tracer = Objects.requireNonNull(tracer, "tracer must not be null");
        this.compiler = Objects.requireNonNull(compiler, "compiler must not be null");
        this.checkIntervalSeconds = checkIntervalSeconds;
        this.compiler.setTracer(tracer);
        this.monitoringExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "Catalog-File-Monitor");
            t.setDaemon(true);
            return t;
        });

        reloadInternal("load-catalog"); // fail fast
    }

    @Override
    public ClinicalCatalog getCatalog() {
        return activeCatalog.get();
    }

    public Path getCatalogPath() {
        return catalogPath;
    }

    public void start() {
        monitoringExecutor.scheduleAtFixedRate(this::checkForUpdates,
                checkIntervalSeconds, checkIntervalSeconds, TimeUnit.SECONDS);
        logger.info(String.format("Watching %s for changes every %ds", catalogPath, checkIntervalSeconds));
    }

    public void shutdown() {
        monitoringExecutor.shutdown();
    }

    /**
     * Forces a recompilation, reporting each stage to {@code listener}.
     *
     * @return the newly active snapshot
     * @throws CompilationException if the catalog is invalid; the old snapshot stays active
     * @throws IOException if the catalog file cannot be read
     */
    public synchronized ClinicalCatalog recompile(CompilationListener listener) throws IOException {
        compiler.setCompilationListener(listener);
        try {
            return reloadInternal("manual-recompile");
        } finally {
            compiler.setCompilationListener(null);
        }
    }

    private void checkForUpdates() {
        Span span = tracer.spanBuilder("check-for-catalog-updates").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("catalogFile", catalogPath.toString());
            long currentModifiedTime = Files.getLastModifiedTime(catalogPath).toMillis();
            if (currentModifiedTime > lastModifiedTime) {
                span.addEvent("Change detected. Triggering reload.");
                logger.info("Change detected in catalog file. Attempting to reload...");
                reload();
            }
        } catch (IOException e) {
            span.recordException(e);
            logger.log(Level.WARNING, "Could not check catalog file for modifications.", e);
        } catch (RuntimeException e) {
            span.recordException(e);
            logger.log(Level.SEVERE, "An unexpected error occurred during catalog reload check.", e);
        } finally {
            span.end();
        }
    }

    private synchronized void reload() {
        try {
            reloadInternal("reload-catalog");
        } catch (IOException | RuntimeException e) {
            logger.log(Level.SEVERE, "Failed to compile new catalog. Old catalog remains active.", e);
        }
    }

    private ClinicalCatalog reloadInternal(String spanName) throws IOException {
        Span span = tracer.spanBuilder(spanName).startSpan();
        try (Scope scope = span.makeCurrent()) {
            long modifiedTime = Files.getLastModifiedTime(catalogPath).toMillis();
            ClinicalCatalog catalog = compiler.compile(catalogPath);
            activeCatalog.set(catalog);
            this.lastModifiedTime = modifiedTime;
            span.setAttribute("catalog.ruleCount", catalog.getNumRules());
            logger.info(String.format("Activated catalog from %s with %d rules", catalogPath, catalog.getNumRules()));
            return catalog;
        } catch (IOException | RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }
}
