/**
 * PA2 Codec (Line-Level Implementation)
 * =============================================================================
 *
 * <p>Concrete decoder that turns one raw PA2 line into a
 * {@link com.questrail.span.pa2.model.DecodedRecord}.</p>
 *
 * <h2>Architectural Placement</h2>
 * <pre>
 *   String line
 *        → tag = line[0, 2)
 *        → RecordRegistry.lookup(tag)
 *        → FieldSpec.decode(line) for every field of the layout
 *        → DecodedRecord
 * </pre>
 *
 * <p>This layer is stateless apart from the immutable registry it was built
 * with. Any failure results in the line being rejected as a whole; a
 * partially decoded record is never returned.</p>
 */
package com.questrail.span.pa2.codec.impl;
