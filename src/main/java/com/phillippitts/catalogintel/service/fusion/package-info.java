/**
 * Reconciliation of per-attribute candidates from the text and vision sources.
 */
package com.phillippitts.catalogintel.service.fusion;
