/**
 * Fire-and-forget output sinks: event publishing and warehouse rows.
 */
package com.phillippitts.catalogintel.service.sink;
