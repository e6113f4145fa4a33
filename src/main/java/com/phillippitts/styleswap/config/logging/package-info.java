/**
 * Request-scoped logging context.
 *
 * <p>Log Format:
 * <pre>
 * 2025-10-17 15:42:32.529 [thread-name] [requestId] LEVEL logger.name - message
 * </pre>
 *
 * @see com.phillippitts.styleswap.config.logging.TransferMdcFilter
 */
package com.phillippitts.styleswap.config.logging;
