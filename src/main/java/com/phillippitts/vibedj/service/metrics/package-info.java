/**
 * Micrometer instrumentation under the {@code vibedj.} prefix.
 */
package com.phillippitts.vibedj.service.metrics;
