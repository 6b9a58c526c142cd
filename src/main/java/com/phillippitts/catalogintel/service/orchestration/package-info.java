/**
 * Request-level orchestration tying admission, the record pipeline, batching and sinks together.
 */
package com.phillippitts.catalogintel.service.orchestration;
