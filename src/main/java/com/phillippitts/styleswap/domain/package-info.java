/**
 * Tensor value types shared by the patch-swap engine and the network adapters.
 */
package com.phillippitts.styleswap.domain;
