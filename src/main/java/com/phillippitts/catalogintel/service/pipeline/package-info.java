/**
 * Per-record pipeline with a single deadline threaded through every stage.
 */
package com.phillippitts.catalogintel.service.pipeline;
