/**
 * Global exception handling for REST API responses.
 *
 * <p>Exception Mapping:
 * <ul>
 *   <li>{@link com.phillippitts.styleswap.exception.ImageDecodeException} → 400 Bad Request</li>
 *   <li>{@link com.phillippitts.styleswap.exception.ShapeMismatchException} → 422 Unprocessable Entity</li>
 *   <li>{@link com.phillippitts.styleswap.exception.ExternalModelException} → 503 Service Unavailable (retry)</li>
 *   <li>{@link com.phillippitts.styleswap.exception.ModelNotFoundException} → 503 Service Unavailable</li>
 *   <li>{@link com.phillippitts.styleswap.exception.ResourceException} → 500 Internal Server Error</li>
 *   <li>{@code Exception} (catch-all) → 500 Internal Server Error</li>
 * </ul>
 *
 * <p>Response Format:
 * <pre>
 * {
 *   "errorCode": "ImageDecodeException",
 *   "message": "Unreadable image",
 *   "details": "Upload a PNG, JPEG, BMP or GIF image",
 *   "timestamp": "2025-10-17T15:42:32.529Z"
 * }
 * </pre>
 */
package com.phillippitts.styleswap.presentation.exception;
