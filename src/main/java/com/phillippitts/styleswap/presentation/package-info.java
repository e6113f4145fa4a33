/**
 * Presentation layer (REST API controllers and exception handling).
 *
 * <p>Presentation depends on service, never the reverse. Controllers are thin adapters and
 * never throw HTTP-specific exceptions; domain exceptions are mapped to status codes in
 * {@code presentation.exception}.
 */
package com.phillippitts.styleswap.presentation;
