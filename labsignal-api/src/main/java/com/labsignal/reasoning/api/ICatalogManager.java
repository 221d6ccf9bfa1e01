package com.labsignal.reasoning.api;

import com.labsignal.reasoning.runtime.model.ClinicalCatalog;

/**
 * Source of the currently active catalog snapshot. Each call may return a
 * newer snapshot after a reload; callers should read it once per evaluation.
 */
public interface ICatalogManager {

    ClinicalCatalog getCatalog();
}
