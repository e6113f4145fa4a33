/**
 * Network adapters: the feature extractor and the inverse network as plain forward passes.
 *
 * <p>ONNX Runtime implementations share the session lifecycle in
 * {@link com.phillippitts.styleswap.service.model.AbstractOnnxNetwork}.
 */
package com.phillippitts.styleswap.service.model;
