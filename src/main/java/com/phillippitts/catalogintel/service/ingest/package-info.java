/**
 * Ingest stage: image reference resolution and local caching.
 */
package com.phillippitts.catalogintel.service.ingest;
