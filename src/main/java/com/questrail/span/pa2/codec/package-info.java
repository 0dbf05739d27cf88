/**
 * PA2 Codec
 * =============================================================================
 *
 * <p>This package defines the <strong>codec layer</strong> for SPAN risk
 * parameter files in the fixed-width PA2 format. Each physical line is one
 * flat record whose layout is selected by its first two characters.</p>
 *
 * <h2>Architectural Placement</h2>
 *
 * <pre>
 *   String line
 *        → RecordDecoder         (tag lookup in a RecordRegistry)
 *            → RecordSchema      (ordered FieldSpec bindings)
 *                → FieldAccessors  (one primitive decode per field)
 *                    → DecodedRecord
 * </pre>
 *
 * <h2>Failure Signals</h2>
 * <p>Decoding a line yields exactly one of:</p>
 * <ul>
 *   <li>a {@link com.questrail.span.pa2.model.DecodedRecord}</li>
 *   <li>{@link com.questrail.span.pa2.codec.UnknownRecordTagException}</li>
 *   <li>{@link com.questrail.span.pa2.codec.FieldDecodeException}</li>
 * </ul>
 *
 * <p>Absent integers, unparsable scaled values and blank times are
 * <em>not</em> failures; they decode to their kind's missing-value marker
 * (see {@link com.questrail.span.pa2.field.FieldKind}).</p>
 *
 * <h2>Out of Scope</h2>
 * <ul>
 *   <li>File I/O and line splitting</li>
 *   <li>Encoding records back to the wire format</li>
 *   <li>Cross-record validation</li>
 * </ul>
 */
package com.questrail.span.pa2.codec;
