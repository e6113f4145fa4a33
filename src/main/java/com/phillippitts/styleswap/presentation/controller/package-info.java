/**
 * REST API controllers.
 *
 * <p>Current endpoints:
 * <ul>
 *   <li>{@code POST /api/v1/style-transfer} - multipart {@code content} + {@code style}, returns PNG</li>
 * </ul>
 *
 * <p>Controllers stay thin: they move uploads to temporary files, delegate to
 * {@link com.phillippitts.styleswap.service.transfer.StyleTransferService} and leave errors to
 * {@link com.phillippitts.styleswap.presentation.exception.GlobalExceptionHandler}.
 */
package com.phillippitts.styleswap.presentation.controller;
