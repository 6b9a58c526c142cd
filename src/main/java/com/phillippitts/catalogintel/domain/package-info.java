/**
 * Immutable domain model for product records, attribute candidates and fused predictions.
 *
 * <p>Types here carry no Spring or serialization concerns. Enum {@code toString()} returns
 * the lower-case wire name so the presentation layer can serialize them directly.
 */
package com.phillippitts.catalogintel.domain;
