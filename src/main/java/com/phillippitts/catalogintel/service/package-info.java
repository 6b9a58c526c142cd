/**
 * Business services: admission, ingest, extraction, the record pipeline, fusion, batching,
 * output sinks, metrics and health.
 */
package com.phillippitts.catalogintel.service;
