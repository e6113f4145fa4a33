/**
 * Service layer: image handling, the patch-swap engine, network adapters, post-processing,
 * orchestration and the transfer service used by the presentation layer.
 */
package com.phillippitts.styleswap.service;
