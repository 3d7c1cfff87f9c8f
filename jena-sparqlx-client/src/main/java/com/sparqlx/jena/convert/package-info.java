/**
 * Conversion of SPARQL responses into Java values.
 *
 * <p>SELECT results become rows of {@link com.sparqlx.jena.convert.BindingValue}s,
 * ASK results a boolean, CONSTRUCT and DESCRIBE results a Jena
 * {@link org.apache.jena.graph.Graph}.</p>
 */
package com.sparqlx.jena.convert;
