/**
 * Query and update preparation for the SPARQL protocol.
 *
 * <p>This package turns query or update text plus per-call options into
 * the form body and headers of a protocol request. Nothing here performs
 * I/O.</p>
 *
 * <p>Key components:</p>
 * <ul>
 *   <li>{@link com.sparqlx.jena.query.QueryClassifier} - Finds the query
 *       form with the Jena SPARQL parser</li>
 *   <li>{@link com.sparqlx.jena.query.ResponseFormats} - Maps format names
 *       to MIME types</li>
 *   <li>{@link com.sparqlx.jena.query.ProtocolParameters} - Form-encoded
 *       request body</li>
 *   <li>{@link com.sparqlx.jena.query.QueryOperationParameters} and
 *       {@link com.sparqlx.jena.query.UpdateOperationParameters} - Complete
 *       request parameters for one operation</li>
 * </ul>
 */
package com.sparqlx.jena.query;
