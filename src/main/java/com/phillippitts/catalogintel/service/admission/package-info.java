/**
 * Request admission: size guardrails and the process-wide token bucket.
 */
package com.phillippitts.catalogintel.service.admission;
