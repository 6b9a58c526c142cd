/**
 * Typed configuration properties bound from {@code application.properties}.
 */
package com.phillippitts.catalogintel.config.properties;
