/**
 * Enrich and vision stage extractors. Both are deterministic and offline.
 */
package com.phillippitts.catalogintel.service.extract;
