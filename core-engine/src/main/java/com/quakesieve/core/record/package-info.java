/**
 * Record layer: raw input rows to {@link com.quakesieve.core.model.Event}s
 * ({@link com.quakesieve.core.record.EventRecordParser}) and classified
 * events back to output rows
 * ({@link com.quakesieve.core.record.ResultAssembler}).
 *
 * @since 1.0.0
 */
package com.quakesieve.core.record;
