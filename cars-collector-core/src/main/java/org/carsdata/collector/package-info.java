/**
 * Cars collector core package: the work pipeline, listing API clients, the record store
 * and CSV export.
 *
 * <p>
 * This package is null-marked, meaning all reference types are non-null by default unless
 * explicitly annotated with @Nullable.
 */
@NullMarked
package org.carsdata.collector;

import org.jspecify.annotations.NullMarked;
