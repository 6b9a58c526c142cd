/**
 * Batch fan-out over the record pipeline.
 */
package com.phillippitts.catalogintel.service.batch;
