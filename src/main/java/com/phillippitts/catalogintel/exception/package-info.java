/**
 * Runtime exception hierarchy rooted at {@link com.phillippitts.catalogintel.exception.CatalogIntelException}.
 *
 * <p>Admission errors reject a request or mark one batch item; stage errors mark only the
 * offending record. Collaborator exceptions carry their own {@link
 * com.phillippitts.catalogintel.exception.StageErrorType} and are converted to
 * {@link com.phillippitts.catalogintel.exception.StageException} by the record pipeline.
 */
package com.phillippitts.catalogintel.exception;
