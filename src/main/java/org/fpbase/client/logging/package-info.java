/**
 * <strong>Purpose:</strong> Logging helpers: runtime verbosity for the CLI and bounded payload excerpts.
 * <p><strong>Observability:</strong> Coordinates with SLF4J/Logback; no custom metrics.
 *
 * @since 0.1.0
 */
package org.fpbase.client.logging;
