/**
 * Application-wide configuration beans and properties.
 *
 * <ul>
 *   <li>{@link com.phillippitts.catalogintel.config.ThreadPoolConfig} - record, stage and event executors</li>
 *   <li>{@link com.phillippitts.catalogintel.config.PipelineConfig} - admission, extractors, fusion and pipeline wiring</li>
 *   <li>{@link com.phillippitts.catalogintel.config.SinkConfig} - optional output sinks</li>
 * </ul>
 *
 * <p>Typed properties live in {@code config.properties}; the request logging filter in
 * {@code config.logging}.
 */
package com.phillippitts.catalogintel.config;
