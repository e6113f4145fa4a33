/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.styleswap.exception.StyleSwapException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.styleswap.exception.ImageDecodeException} - An input image is
 *       missing, unreadable or in an unsupported format</li>
 *   <li>{@link com.phillippitts.styleswap.exception.ShapeMismatchException} - Content and style
 *       tensors disagree in shape</li>
 *   <li>{@link com.phillippitts.styleswap.exception.ExternalModelException} - The feature
 *       extractor or inverse network failed</li>
 *   <li>{@link com.phillippitts.styleswap.exception.ResourceException} - The transient output
 *       file could not be created or written</li>
 *   <li>{@link com.phillippitts.styleswap.exception.ModelNotFoundException} - Model files are
 *       missing at startup</li>
 * </ul>
 *
 * <p>All exceptions are unchecked and fatal to the single transfer in progress. Nothing is
 * retried internally; the HTTP mapping lives in
 * {@code com.phillippitts.styleswap.presentation.exception.GlobalExceptionHandler}.
 *
 * @since 1.0
 */
package com.phillippitts.styleswap.exception;
